package com.example.magazinetoc.model;

/**
 * Toggles shared by the parsers and the renderer.
 */
public class TocOptions {
    private final boolean includeMail;
    private final boolean includeContributors;
    private final boolean suppressEmpty;
    private final boolean joinWrappedLines;
    private final int maxItemsPerSection;

    private TocOptions(Builder b) {
        this.includeMail = b.includeMail;
        this.includeContributors = b.includeContributors;
        this.suppressEmpty = b.suppressEmpty;
        this.joinWrappedLines = b.joinWrappedLines;
        this.maxItemsPerSection = b.maxItemsPerSection;
    }

    public static TocOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .includeMail(includeMail)
                .includeContributors(includeContributors)
                .suppressEmpty(suppressEmpty)
                .joinWrappedLines(joinWrappedLines)
                .maxItemsPerSection(maxItemsPerSection);
    }

    public boolean isIncludeMail() {
        return includeMail;
    }

    public boolean isIncludeContributors() {
        return includeContributors;
    }

    public boolean isSuppressEmpty() {
        return suppressEmpty;
    }

    public boolean isJoinWrappedLines() {
        return joinWrappedLines;
    }

    /** 0 means no limit. */
    public int getMaxItemsPerSection() {
        return maxItemsPerSection;
    }

    public static final class Builder {
        private boolean includeMail = false;
        private boolean includeContributors = false;
        private boolean suppressEmpty = false;
        private boolean joinWrappedLines = true;
        private int maxItemsPerSection = 0;

        public Builder includeMail(boolean v) {
            this.includeMail = v;
            return this;
        }

        public Builder includeContributors(boolean v) {
            this.includeContributors = v;
            return this;
        }

        public Builder suppressEmpty(boolean v) {
            this.suppressEmpty = v;
            return this;
        }

        public Builder joinWrappedLines(boolean v) {
            this.joinWrappedLines = v;
            return this;
        }

        public Builder maxItemsPerSection(int v) {
            if (v < 0) {
                throw new IllegalArgumentException("maxItemsPerSection must be >= 0, was " + v);
            }
            this.maxItemsPerSection = v;
            return this;
        }

        public TocOptions build() {
            return new TocOptions(this);
        }
    }
}
