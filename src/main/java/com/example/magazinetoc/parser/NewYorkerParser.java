package com.example.magazinetoc.parser;

import com.example.magazinetoc.model.Brand;
import com.example.magazinetoc.model.PageText;
import com.example.magazinetoc.model.ParseResult;
import com.example.magazinetoc.model.TocOptions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class NewYorkerParser implements BrandParser {

    private final TocLineEngine engine = new TocLineEngine();
    private final BrandLayout layout;

    public NewYorkerParser() {
        List<String> markers = new ArrayList<>(CommonNoise.MARKERS);
        markers.add("THE NEW YORKER,");
        this.layout = BrandLayout.builder(Brand.NEW_YORKER)
                .sections(BrandVocabulary.NEW_YORKER_SECTIONS)
                .itemPatterns(
                        ItemPatterns.TITLE_BY_AUTHOR_PAGE,
                        ItemPatterns.TITLE_LEADERS_PAGE_AUTHOR,
                        ItemPatterns.TITLE_AUTHOR_LEADERS_PAGE,
                        ItemPatterns.PAGE_TITLE_BY_AUTHOR,
                        ItemPatterns.AUTHOR_TITLE_PAGE,
                        ItemPatterns.AUTHOR_PAGE_TITLE,
                        ItemPatterns.TITLE_LEADERS_PAGE,
                        ItemPatterns.TITLE_SPACES_PAGE,
                        ItemPatterns.PAGE_TITLE,
                        ItemPatterns.TITLE_TRAILING_PAGE)
                .noiseMarkers(markers)
                .noisePatterns(CommonNoise.PATTERNS)
                .rule(new QuotedPoemsRule())
                .build();
    }

    @Override
    public Brand getBrand() {
        return Brand.NEW_YORKER;
    }

    @Override
    public ParseResult parse(PageText pageText, TocOptions options) {
        return engine.parseRegion(layout, pageText, options);
    }
}
