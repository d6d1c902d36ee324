package com.example.magazinetoc.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Counters and flags describing how a document was parsed. Carried next to the
 * entries, never rendered into the report itself.
 */
public class ParseDiagnostics {
    private final Brand brand;
    private final boolean brandUnresolved;
    private final Map<Integer, ExtractionMode> extractionModes;
    private final String textVariant;
    private final int candidateLines;
    private final int matchedLines;
    private final int unmatchedLines;
    private final int noiseLines;
    private final int joinedLines;
    private final int filteredEntries;

    private ParseDiagnostics(Builder b) {
        this.brand = b.brand;
        this.brandUnresolved = b.brandUnresolved;
        this.extractionModes = Collections.unmodifiableMap(new LinkedHashMap<>(b.extractionModes));
        this.textVariant = b.textVariant;
        this.candidateLines = b.candidateLines;
        this.matchedLines = b.matchedLines;
        this.unmatchedLines = b.unmatchedLines;
        this.noiseLines = b.noiseLines;
        this.joinedLines = b.joinedLines;
        this.filteredEntries = b.filteredEntries;
    }

    public static Builder builder(Brand brand) {
        return new Builder(brand);
    }

    public Brand getBrand() {
        return brand;
    }

    public boolean isBrandUnresolved() {
        return brandUnresolved;
    }

    public Map<Integer, ExtractionMode> getExtractionModes() {
        return extractionModes;
    }

    public String getTextVariant() {
        return textVariant;
    }

    public int getCandidateLines() {
        return candidateLines;
    }

    public int getMatchedLines() {
        return matchedLines;
    }

    public int getUnmatchedLines() {
        return unmatchedLines;
    }

    public int getNoiseLines() {
        return noiseLines;
    }

    public int getJoinedLines() {
        return joinedLines;
    }

    public int getFilteredEntries() {
        return filteredEntries;
    }

    /** Single-line {@code key=value} form for the diagnostics log. */
    public String summary() {
        String modes = extractionModes.entrySet().stream()
                .map(e -> e.getKey() + ":" + e.getValue().getCode())
                .collect(Collectors.joining(","));
        return "brand=" + brand.getCode()
                + " brand_unresolved=" + brandUnresolved
                + " text_variant=" + textVariant
                + " extraction_mode=[" + modes + "]"
                + " candidates=" + candidateLines
                + " matched=" + matchedLines
                + " unmatched=" + unmatchedLines
                + " noise=" + noiseLines
                + " joined=" + joinedLines
                + " filtered=" + filteredEntries;
    }

    @Override
    public String toString() {
        return summary();
    }

    public static final class Builder {
        private final Brand brand;
        private boolean brandUnresolved;
        private final Map<Integer, ExtractionMode> extractionModes = new LinkedHashMap<>();
        private String textVariant = "none";
        private int candidateLines;
        private int matchedLines;
        private int unmatchedLines;
        private int noiseLines;
        private int joinedLines;
        private int filteredEntries;

        private Builder(Brand brand) {
            this.brand = brand;
        }

        public Builder brandUnresolved(boolean unresolved) {
            this.brandUnresolved = unresolved;
            return this;
        }

        public Builder extractionModes(Map<Integer, ExtractionMode> modes) {
            this.extractionModes.clear();
            this.extractionModes.putAll(modes);
            return this;
        }

        public Builder textVariant(String variant) {
            this.textVariant = variant;
            return this;
        }

        public Builder candidateLines(int n) {
            this.candidateLines = n;
            return this;
        }

        public Builder matchedLines(int n) {
            this.matchedLines = n;
            return this;
        }

        public Builder unmatchedLines(int n) {
            this.unmatchedLines = n;
            return this;
        }

        public Builder noiseLines(int n) {
            this.noiseLines = n;
            return this;
        }

        public Builder joinedLines(int n) {
            this.joinedLines = n;
            return this;
        }

        public Builder filteredEntries(int n) {
            this.filteredEntries = n;
            return this;
        }

        public ParseDiagnostics build() {
            return new ParseDiagnostics(this);
        }
    }
}
