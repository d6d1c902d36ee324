package com.example.magazinetoc.model;

import java.util.Objects;

/**
 * One line of the extracted table of contents: either a section heading or an item under one.
 */
public class TocEntry {

    /** Section that items belong to when no heading preceded them. */
    public static final String DEFAULT_SECTION = "CONTENTS";

    private final EntryKind kind;
    private final String section;
    private final String title;
    private final String author;
    private final Integer page;

    private TocEntry(EntryKind kind, String section, String title, String author, Integer page) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.section = Objects.requireNonNull(section, "section");
        this.title = title;
        this.author = author;
        this.page = page;
    }

    public static TocEntry heading(String section, Integer page) {
        return new TocEntry(EntryKind.SECTION_HEADING, section, null, null, page);
    }

    public static TocEntry item(String section, String title, String author, Integer page) {
        return new TocEntry(EntryKind.ITEM, section, Objects.requireNonNull(title, "title"), author, page);
    }

    public EntryKind getKind() {
        return kind;
    }

    public boolean isHeading() {
        return kind == EntryKind.SECTION_HEADING;
    }

    public boolean isItem() {
        return kind == EntryKind.ITEM;
    }

    public String getSection() {
        return section;
    }

    public String getTitle() {
        return title;
    }

    public String getAuthor() {
        return author;
    }

    public Integer getPage() {
        return page;
    }

    public TocEntry withPage(Integer newPage) {
        return new TocEntry(kind, section, title, author, newPage);
    }

    public TocEntry withAuthor(String newAuthor) {
        return new TocEntry(kind, section, title, newAuthor, page);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TocEntry)) return false;
        TocEntry other = (TocEntry) o;
        return kind == other.kind
                && section.equals(other.section)
                && Objects.equals(title, other.title)
                && Objects.equals(author, other.author)
                && Objects.equals(page, other.page);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, section, title, author, page);
    }

    @Override
    public String toString() {
        if (isHeading()) {
            return "Heading{" + section + (page != null ? ", p." + page : "") + "}";
        }
        return "Item{" + section + " / " + title
                + (author != null ? " / " + author : "")
                + (page != null ? ", p." + page : "") + "}";
    }
}
