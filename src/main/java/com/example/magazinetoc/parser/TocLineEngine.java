package com.example.magazinetoc.parser;

import com.example.magazinetoc.model.PageRecord;
import com.example.magazinetoc.model.PageText;
import com.example.magazinetoc.model.ParseDiagnostics;
import com.example.magazinetoc.model.ParseResult;
import com.example.magazinetoc.model.TocEntry;
import com.example.magazinetoc.model.TocOptions;
import com.example.magazinetoc.util.TocTextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Line classifier and section cursor shared by the brand parsers. Holds no state;
 * everything mutable lives in the {@link ParseContext} passed in.
 */
public class TocLineEngine {

    private static final Logger logger = LoggerFactory.getLogger(TocLineEngine.class);

    /** Fewer items than this from the layout text triggers a retry on the raw text. */
    public static final int MIN_ITEMS_BEFORE_RAW_FALLBACK = 4;

    private static final int ISSUE_TITLE_SCAN_LINES = 120;
    private static final int MAX_TITLE_LENGTH = 200;
    private static final Pattern ISSUE_TITLE = Pattern.compile(
            "(?i)(The New Yorker|The Atlantic|Harper'?s Magazine).+\\d{4}");
    private static final Pattern TRAILING_LEADERS = Pattern.compile("[\\s.\\u2026\\u00B7\\u2022,;:\\-]+$");
    private static final Pattern LEADING_BULLET = Pattern.compile("^[\\u2022\\u00B7*\\-]+\\s*");
    private static final Pattern LEADING_BY = Pattern.compile("(?i)^by\\s+");
    private static final String WRAP_ENDINGS = ",:;-&";

    public static boolean isValidPage(int page) {
        return page >= 1 && page <= 999;
    }

    public ParseContext newContext() {
        return new ParseContext();
    }

    /**
     * Classifies and consumes every line of {@code text} into {@code ctx}.
     * The section cursor is reset at the start of the block.
     */
    public void parseBlock(String text, BrandLayout layout, TocOptions options, ParseContext ctx) {
        List<String> lines = Arrays.stream(text.split("\n"))
                .map(String::strip)
                .filter(l -> !l.isEmpty())
                .collect(Collectors.toList());
        String brand = layout.getBrand().getCode();
        ctx.startBlock();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String next = i + 1 < lines.size() ? lines.get(i + 1) : null;

            if (layout.isStop(line)) {
                if (next != null && TocTextUtils.isPageNumberOnly(next)) {
                    // listed in the contents with its page; only the unpaged heading starts the index itself
                    ctx.noise(2);
                    i++;
                    continue;
                }
                logger.debug("[{}] end of contents at: {}", brand, line);
                ctx.noise(1);
                break;
            }

            if (layout.isNoise(line) || TocTextUtils.isGarbageLine(line)) {
                ctx.noise(1);
                continue;
            }

            Optional<HeadingMatch> heading = layout.matchHeading(line);
            if (heading.isPresent()) {
                HeadingMatch h = heading.get();
                if (h.getPage() == null && options.isJoinWrappedLines()
                        && next != null && TocTextUtils.isPageNumberOnly(next)) {
                    h = h.withPage(Integer.parseInt(next.trim()));
                    ctx.joined();
                    i++;
                    logger.debug("[{}] joined heading with page line: {} / {}", brand, line, next);
                }
                ctx.heading(h.getName(), h.getPage());
                logger.debug("[{}] section: {}{}", brand, h.getName(), h.getPage() != null ? " (p. " + h.getPage() + ")" : "");
                continue;
            }

            if (TocTextUtils.isPageNumberOnly(line)) {
                ctx.noise(1);
                ctx.lineWithoutItem();
                continue;
            }

            ctx.candidate();
            String logical = line;
            if (options.isJoinWrappedLines() && next != null && !TocTextUtils.endsWithPageNumber(line)) {
                if (TocTextUtils.isPageNumberOnly(next)) {
                    logical = line + "  " + next.trim();
                    ctx.joined();
                    i++;
                    logger.debug("[{}] joined title with page line: {} / {}", brand, line, next);
                } else if (looksWrapped(line, next) && isItemContinuation(next, layout)) {
                    String fused = line + " " + next;
                    if (matchItem(fused, layout).isPresent()) {
                        logical = fused;
                        ctx.joined();
                        i++;
                        logger.debug("[{}] joined wrapped title: {} / {}", brand, line, next);
                    }
                }
            }

            if (applyRules(logical, layout, ctx)) {
                ctx.matched();
                continue;
            }

            Optional<ItemMatch> match = matchItem(logical, layout);
            if (match.isEmpty()) {
                ctx.unmatched();
                ctx.lineWithoutItem();
                logger.debug("[{}] unmatched: {}", brand, logical);
                continue;
            }

            ItemMatch m = match.get();
            if (m.getPattern() == ItemPatterns.AUTHOR_PAGE_TITLE && options.isJoinWrappedLines()
                    && !"POEMS".equals(ctx.getCurrentSection())
                    && i + 1 < lines.size() && isSubtitle(lines.get(i + 1), layout)) {
                m = m.withTitle(m.getTitle() + " - " + lines.get(i + 1));
                ctx.joined();
                logger.debug("[{}] joined subtitle: {} / {}", brand, logical, lines.get(i + 1));
                i++;
            }
            ctx.matched();
            ctx.addItem(cleanTitle(m.getTitle()), cleanAuthor(m.getAuthor()), m.getPage());
        }
    }

    /**
     * First pattern (most specific first) whose captures pass validation: page 1..999,
     * a title with letters that is not itself a section name.
     */
    public Optional<ItemMatch> matchItem(String line, BrandLayout layout) {
        for (ItemPattern pattern : layout.getItemPatterns()) {
            Optional<ItemMatch> m = pattern.match(line);
            if (m.isEmpty()) continue;
            ItemMatch match = m.get();
            String title = cleanTitle(match.getTitle());
            if (!isValidPage(match.getPage())) continue;
            if (!TocTextUtils.hasLetter(title) || title.length() > MAX_TITLE_LENGTH) continue;
            if (layout.isKnownSection(title.toUpperCase(Locale.ROOT))) continue;
            if (match.getAuthor() != null && !TocTextUtils.hasLetter(match.getAuthor())) continue;
            return Optional.of(match);
        }
        return Optional.empty();
    }

    /**
     * Parses the contents region of the primary text; when that yields fewer than
     * {@value #MIN_ITEMS_BEFORE_RAW_FALLBACK} items, the alternate (raw) text is parsed
     * too and wins if it produces more.
     */
    public ParseResult parseRegion(BrandLayout layout, PageText pageText, TocOptions options) {
        String primaryText = TocTextUtils.clean(pageText.joinedText());
        ParseContext ctx = newContext();
        parseBlock(sliceRegion(primaryText, layout), layout, options, ctx);
        String variant = primaryVariant(pageText.getPages());

        if (ctx.getItemCount() < MIN_ITEMS_BEFORE_RAW_FALLBACK && pageText.hasAlternateText()) {
            ParseContext alt = newContext();
            parseBlock(sliceRegion(TocTextUtils.clean(pageText.joinedAlternateText()), layout), layout, options, alt);
            logger.debug("[{}] raw fallback: {} items vs {} from {}", layout.getBrand().getCode(),
                    alt.getItemCount(), ctx.getItemCount(), variant);
            if (alt.getItemCount() > ctx.getItemCount()) {
                ctx = alt;
                variant = "raw";
            }
        }
        return toResult(ctx, layout, pageText, options, findIssueTitle(primaryText), variant);
    }

    /**
     * From the first short line mentioning "contents" to the first running footer
     * after a section heading. Text without a contents line is used from the top.
     */
    public String sliceRegion(String text, BrandLayout layout) {
        String[] lines = text.split("\n");
        int start = 0;
        for (int i = 0; i < lines.length; i++) {
            String t = lines[i].trim();
            if (t.length() <= 60 && t.toLowerCase(Locale.ROOT).contains("contents")) {
                start = i;
                break;
            }
        }
        List<String> out = new ArrayList<>();
        boolean sawHeading = false;
        for (int i = start; i < lines.length; i++) {
            String line = lines[i];
            if (sawHeading && CommonNoise.FOOTER.matcher(line).find()) break;
            if (!sawHeading && layout.matchHeading(line.strip()).isPresent()) sawHeading = true;
            out.add(line);
        }
        return String.join("\n", out);
    }

    public String findIssueTitle(String text) {
        String[] lines = text.split("\n");
        for (int i = 0; i < Math.min(lines.length, ISSUE_TITLE_SCAN_LINES); i++) {
            if (ISSUE_TITLE.matcher(lines[i]).find()) {
                return TocTextUtils.squash(lines[i]);
            }
        }
        return null;
    }

    /**
     * Applies the include-mail / include-contributors filter and packages the entries
     * with diagnostics. Counters reflect what was detected before filtering.
     */
    public ParseResult toResult(ParseContext ctx, BrandLayout layout, PageText pageText, TocOptions options,
                                String issueTitle, String variant) {
        List<TocEntry> all = ctx.getEntries();
        List<TocEntry> kept = TocFilter.apply(all, options);
        ParseDiagnostics diagnostics = ParseDiagnostics.builder(layout.getBrand())
                .extractionModes(pageText.modesByPage())
                .textVariant(variant)
                .candidateLines(ctx.getCandidateLines())
                .matchedLines(ctx.getMatchedLines())
                .unmatchedLines(ctx.getUnmatchedLines())
                .noiseLines(ctx.getNoiseLines())
                .joinedLines(ctx.getJoinedLines())
                .filteredEntries(all.size() - kept.size())
                .build();
        return new ParseResult(kept, issueTitle, diagnostics);
    }

    public static String primaryVariant(List<PageRecord> pages) {
        List<String> modes = pages.stream().map(p -> p.getMode().getCode()).distinct().collect(Collectors.toList());
        if (modes.isEmpty()) return "none";
        return modes.size() == 1 ? modes.get(0) : "mixed";
    }

    static String cleanTitle(String title) {
        String t = TocTextUtils.squash(title);
        t = LEADING_BULLET.matcher(t).replaceFirst("");
        return TRAILING_LEADERS.matcher(t).replaceFirst("");
    }

    static String cleanAuthor(String author) {
        if (author == null) return null;
        String a = TocTextUtils.squash(author);
        a = LEADING_BY.matcher(a).replaceFirst("");
        a = TRAILING_LEADERS.matcher(a).replaceFirst("");
        return a.isEmpty() ? null : a;
    }

    private boolean applyRules(String line, BrandLayout layout, ParseContext ctx) {
        for (LineRule rule : layout.getRules()) {
            if (rule.apply(line, ctx)) return true;
        }
        return false;
    }

    /** A title fragment that continues on the next line. */
    private static boolean looksWrapped(String line, String next) {
        if (line.length() > 120 || !TocTextUtils.hasLetter(line)) return false;
        char last = line.charAt(line.length() - 1);
        return WRAP_ENDINGS.indexOf(last) >= 0 || Character.isLowerCase(next.charAt(0));
    }

    private static boolean isItemContinuation(String next, BrandLayout layout) {
        return TocTextUtils.endsWithPageNumber(next)
                && !layout.isNoise(next)
                && !layout.isStop(next)
                && layout.matchHeading(next).isEmpty();
    }

    private static boolean isSubtitle(String next, BrandLayout layout) {
        return next.length() >= 10 && next.length() <= MAX_TITLE_LENGTH
                && TocTextUtils.hasLetter(next)
                && !TocTextUtils.endsWithPageNumber(next)
                && !TocTextUtils.isPageNumberOnly(next)
                && !layout.isNoise(next)
                && !layout.isStop(next)
                && layout.matchHeading(next).isEmpty();
    }
}
