package com.example.magazinetoc.parser;

import com.example.magazinetoc.model.Brand;
import com.example.magazinetoc.model.PageText;
import com.example.magazinetoc.model.ParseResult;
import com.example.magazinetoc.model.TocOptions;

/**
 * Turns the page text of one brand's issue into ordered ToC entries.
 * Implementations keep no state between calls.
 */
public interface BrandParser {

    Brand getBrand();

    ParseResult parse(PageText pageText, TocOptions options);
}
