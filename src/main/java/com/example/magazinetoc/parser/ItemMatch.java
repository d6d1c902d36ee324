package com.example.magazinetoc.parser;

/**
 * Fields captured from one item line.
 */
public class ItemMatch {
    private final String title;
    private final String author;
    private final int page;
    private final ItemPattern pattern;

    public ItemMatch(String title, String author, int page, ItemPattern pattern) {
        this.title = title;
        this.author = author;
        this.page = page;
        this.pattern = pattern;
    }

    public String getTitle() {
        return title;
    }

    public String getAuthor() {
        return author;
    }

    public int getPage() {
        return page;
    }

    public ItemPattern getPattern() {
        return pattern;
    }

    public ItemMatch withTitle(String newTitle) {
        return new ItemMatch(newTitle, author, page, pattern);
    }
}
