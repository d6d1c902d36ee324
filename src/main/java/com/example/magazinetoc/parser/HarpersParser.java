package com.example.magazinetoc.parser;

import com.example.magazinetoc.model.Brand;
import com.example.magazinetoc.model.PageRecord;
import com.example.magazinetoc.model.PageText;
import com.example.magazinetoc.model.ParseResult;
import com.example.magazinetoc.model.TocOptions;
import com.example.magazinetoc.util.TocTextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Harper's prints its contents on one spread, with Harper's Index and Findings close
 * behind. The located page and the next are parsed in both layout and raw order and
 * the two passes merged; nothing past an unpaged Index/Findings heading is read.
 */
@Component
public class HarpersParser implements BrandParser {

    private static final Logger logger = LoggerFactory.getLogger(HarpersParser.class);

    private static final Pattern INDEX_LINE = Pattern.compile("(?i)\\bHARPER'?S\\s+INDEX\\b");
    private static final Pattern FINDINGS_LINE = Pattern.compile("(?i)^\\s*FINDINGS\\b");
    private static final Pattern SPACED_INDEX = Pattern.compile("(?i)H\\s+A\\s+R\\s+P\\s+E\\s+R\\s*'?\\s*S\\s+I\\s+N\\s+D\\s+E\\s+X");
    private static final Pattern SPACED_FINDINGS = Pattern.compile("(?i)^\\s*F\\s+I\\s+N\\s+D\\s+I\\s+N\\s+G\\s+S\\b");
    /** Bare heading of the Index or Findings page, as a whole line. */
    private static final Pattern INDEX_HEADING = Pattern.compile(
            "(?i)(?:HARPER'?S\\s+)?INDEX|FINDINGS"
                    + "|H\\s*A\\s*R\\s*P\\s*E\\s*R\\s*'?\\s*S\\s*I\\s*N\\s*D\\s*E\\s*X"
                    + "|F\\s*I\\s*N\\s*D\\s*I\\s*N\\s*G\\s*S");

    private final TocLineEngine engine = new TocLineEngine();
    private final HarpersTocLocator locator = new HarpersTocLocator();
    private final BrandLayout layout;

    public HarpersParser() {
        List<Pattern> noise = new ArrayList<>(CommonNoise.PATTERNS);
        noise.add(CommonNoise.FOOTER);
        noise.add(INDEX_LINE);
        noise.add(FINDINGS_LINE);
        noise.add(SPACED_INDEX);
        noise.add(SPACED_FINDINGS);
        this.layout = BrandLayout.builder(Brand.HARPERS)
                .sections(BrandVocabulary.HARPERS_SECTIONS)
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
                .noiseMarkers(CommonNoise.MARKERS)
                .noisePatterns(noise)
                .stopPattern(INDEX_HEADING)
                .excludedHeading(Pattern.compile("\\bINDEX\\b|\\bFINDINGS\\b"))
                .build();
    }

    @Override
    public Brand getBrand() {
        return Brand.HARPERS;
    }

    @Override
    public ParseResult parse(PageText pageText, TocOptions options) {
        int tocPage = locator.locate(pageText);
        List<PageRecord> spread = new ArrayList<>();
        pageText.getPage(tocPage).ifPresent(spread::add);
        pageText.getPage(tocPage + 1).ifPresent(spread::add);
        logger.debug("[harpers] using contents pages {}, {} (layout+raw)", tocPage, tocPage + 1);

        ParseContext ctx = engine.newContext();
        engine.parseBlock(block(spread, false), layout, options, ctx);
        String variant = TocLineEngine.primaryVariant(spread);
        if (spread.stream().anyMatch(PageRecord::hasAlternateText)) {
            engine.parseBlock(block(spread, true), layout, options, ctx);
            variant = variant + "+raw";
        }

        String issueTitle = engine.findIssueTitle(TocTextUtils.clean(pageText.joinedText()));
        return engine.toResult(ctx, layout, pageText, options, issueTitle, variant);
    }

    private static String block(List<PageRecord> pages, boolean alternate) {
        return TocTextUtils.clean(pages.stream()
                .map(p -> alternate ? Optional.ofNullable(p.getAlternateText()).orElse("") : p.getText())
                .collect(Collectors.joining("\n")));
    }
}
