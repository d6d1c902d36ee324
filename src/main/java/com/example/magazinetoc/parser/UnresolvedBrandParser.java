package com.example.magazinetoc.parser;

import com.example.magazinetoc.model.Brand;
import com.example.magazinetoc.model.PageText;
import com.example.magazinetoc.model.ParseDiagnostics;
import com.example.magazinetoc.model.ParseResult;
import com.example.magazinetoc.model.TocOptions;
import org.springframework.stereotype.Component;

/**
 * Terminal parser for documents whose brand could not be determined: no entries,
 * flagged so the run can count the document as failed.
 */
@Component
public class UnresolvedBrandParser implements BrandParser {

    @Override
    public Brand getBrand() {
        return Brand.UNKNOWN;
    }

    @Override
    public ParseResult parse(PageText pageText, TocOptions options) {
        ParseDiagnostics diagnostics = ParseDiagnostics.builder(Brand.UNKNOWN)
                .brandUnresolved(true)
                .extractionModes(pageText.modesByPage())
                .build();
        return ParseResult.empty(diagnostics);
    }
}
