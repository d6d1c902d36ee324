package com.example.magazinetoc.parser;

import com.example.magazinetoc.model.Brand;
import com.example.magazinetoc.model.PageText;
import com.example.magazinetoc.model.ParseResult;
import com.example.magazinetoc.model.TocOptions;
import org.springframework.stereotype.Component;

@Component
public class AtlanticParser implements BrandParser {

    private final TocLineEngine engine = new TocLineEngine();
    private final BrandLayout layout;

    public AtlanticParser() {
        this.layout = BrandLayout.builder(Brand.ATLANTIC)
                .sections(BrandVocabulary.ATLANTIC_SECTIONS)
                .itemPatterns(
                        ItemPatterns.TITLE_BY_AUTHOR_PAGE,
                        ItemPatterns.TITLE_LEADERS_PAGE_AUTHOR,
                        ItemPatterns.TITLE_AUTHOR_LEADERS_PAGE,
                        ItemPatterns.AUTHOR_TITLE_PAGE,
                        ItemPatterns.TITLE_LEADERS_PAGE,
                        ItemPatterns.TITLE_SPACES_PAGE,
                        ItemPatterns.PAGE_TITLE,
                        ItemPatterns.TITLE_TRAILING_PAGE)
                .noiseMarkers(CommonNoise.MARKERS)
                .noisePatterns(CommonNoise.PATTERNS)
                .rule(new BylineRule())
                .build();
    }

    @Override
    public Brand getBrand() {
        return Brand.ATLANTIC;
    }

    @Override
    public ParseResult parse(PageText pageText, TocOptions options) {
        return engine.parseRegion(layout, pageText, options);
    }
}
