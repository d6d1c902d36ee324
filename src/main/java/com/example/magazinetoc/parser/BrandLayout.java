package com.example.magazinetoc.parser;

import com.example.magazinetoc.model.Brand;
import com.example.magazinetoc.util.TocTextUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Everything that differs between brands at the line level: the section vocabulary,
 * the ordered item patterns, the denylist and the brand rules.
 */
public class BrandLayout {

    private static final int MAX_HEADING_LENGTH = 60;
    private static final Pattern PAGE_THEN_SECTION = Pattern.compile("^(\\d{1,3})\\s+(.+?)$");
    private static final Pattern SECTION_THEN_PAGE = Pattern.compile(
            "^(?<section>[A-Z][A-Z0-9 '&/.,\\-]*?)(?:" + ItemPatterns.LEADER_GAP + "|\\s+)(?<page>\\d{1,3})$");

    private final Brand brand;
    private final List<String> sections;
    private final List<ItemPattern> itemPatterns;
    private final List<String> noiseMarkers;
    private final List<Pattern> noisePatterns;
    private final List<Pattern> stopPatterns;
    private final List<Pattern> excludedHeadings;
    private final List<LineRule> rules;

    private BrandLayout(Builder b) {
        this.brand = b.brand;
        this.sections = List.copyOf(b.sections);
        List<ItemPattern> patterns = new ArrayList<>(b.itemPatterns);
        // stable sort: equally specific patterns keep their declared order
        patterns.sort(Comparator.comparingInt(ItemPattern::getSpecificity).reversed());
        this.itemPatterns = Collections.unmodifiableList(patterns);
        this.noiseMarkers = List.copyOf(b.noiseMarkers);
        this.noisePatterns = List.copyOf(b.noisePatterns);
        this.stopPatterns = List.copyOf(b.stopPatterns);
        this.excludedHeadings = List.copyOf(b.excludedHeadings);
        this.rules = List.copyOf(b.rules);
    }

    public static Builder builder(Brand brand) {
        return new Builder(brand);
    }

    public Brand getBrand() {
        return brand;
    }

    public List<ItemPattern> getItemPatterns() {
        return itemPatterns;
    }

    public List<LineRule> getRules() {
        return rules;
    }

    public boolean isKnownSection(String name) {
        if (name == null) return false;
        String u = TocTextUtils.squash(name).toUpperCase(Locale.ROOT);
        if (u.isEmpty() || u.length() > MAX_HEADING_LENGTH) return false;
        for (Pattern excluded : excludedHeadings) {
            if (excluded.matcher(u).find()) return false;
        }
        for (String key : sections) {
            if (u.equals(key) || u.startsWith(key + " ")) return true;
        }
        return false;
    }

    /**
     * Recognises {@code NAME}, {@code NAME  PAGE}, {@code NAME .... PAGE} and
     * {@code PAGE NAME}. Headings are printed in capitals, so any lowercase
     * letter disqualifies the line.
     */
    public Optional<HeadingMatch> matchHeading(String line) {
        if (line == null || TocTextUtils.hasLowercase(line) || !TocTextUtils.hasLetter(line)) {
            return Optional.empty();
        }
        String trimmed = line.trim();

        Matcher m = PAGE_THEN_SECTION.matcher(trimmed);
        if (m.matches() && isKnownSection(m.group(2))) {
            int page = Integer.parseInt(m.group(1));
            if (TocLineEngine.isValidPage(page)) {
                return Optional.of(new HeadingMatch(headingName(m.group(2)), page));
            }
        }

        Matcher m2 = SECTION_THEN_PAGE.matcher(trimmed);
        if (m2.matches() && isKnownSection(m2.group("section"))) {
            int page = Integer.parseInt(m2.group("page"));
            if (TocLineEngine.isValidPage(page)) {
                return Optional.of(new HeadingMatch(headingName(m2.group("section")), page));
            }
        }

        if (isKnownSection(trimmed)) {
            return Optional.of(new HeadingMatch(headingName(trimmed), null));
        }
        return Optional.empty();
    }

    public boolean isNoise(String line) {
        String u = line.toUpperCase(Locale.ROOT);
        for (String marker : noiseMarkers) {
            if (u.contains(marker)) return true;
        }
        for (Pattern p : noisePatterns) {
            if (p.matcher(line).find()) return true;
        }
        return false;
    }

    /** A stop marker ends the current text block (the rest is not ToC). */
    public boolean isStop(String line) {
        for (Pattern p : stopPatterns) {
            if (p.matcher(line.trim()).matches()) return true;
        }
        return false;
    }

    private static String headingName(String raw) {
        return TocTextUtils.squash(raw).replaceAll("[\\s.,:\\-]+$", "").toUpperCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Brand brand;
        private final List<String> sections = new ArrayList<>();
        private final List<ItemPattern> itemPatterns = new ArrayList<>();
        private final List<String> noiseMarkers = new ArrayList<>();
        private final List<Pattern> noisePatterns = new ArrayList<>();
        private final List<Pattern> stopPatterns = new ArrayList<>();
        private final List<Pattern> excludedHeadings = new ArrayList<>();
        private final List<LineRule> rules = new ArrayList<>();

        private Builder(Brand brand) {
            this.brand = brand;
        }

        public Builder sections(List<String> names) {
            sections.addAll(names);
            return this;
        }

        public Builder itemPatterns(ItemPattern... patterns) {
            Collections.addAll(itemPatterns, patterns);
            return this;
        }

        public Builder noiseMarkers(List<String> markers) {
            markers.forEach(mk -> noiseMarkers.add(mk.toUpperCase(Locale.ROOT)));
            return this;
        }

        public Builder noisePatterns(List<Pattern> patterns) {
            noisePatterns.addAll(patterns);
            return this;
        }

        public Builder stopPattern(Pattern pattern) {
            stopPatterns.add(pattern);
            return this;
        }

        public Builder excludedHeading(Pattern pattern) {
            excludedHeadings.add(pattern);
            return this;
        }

        public Builder rule(LineRule rule) {
            rules.add(rule);
            return this;
        }

        public BrandLayout build() {
            return new BrandLayout(this);
        }
    }
}
