package com.example.magazinetoc.parser;

/**
 * Catalogue of item-line patterns. Lines are normalized first, so every dash is
 * {@code -} and every quote is straight.
 */
public final class ItemPatterns {

    /** Dot leaders (with or without spaces) or any leader run set off by spaces. */
    public static final String LEADER_GAP = "(?:\\s*[.\\u2026\\u00B7\\u2022]{2,}\\s*|\\s+[.\\u2026\\u00B7\\u2022\\-]+\\s+)";
    /** One to four capitalised words: a byline. */
    public static final String NAME = "[A-Z][\\w.'\\-]+(?: [A-Z][\\w.'\\-]+){0,3}";
    private static final String PAGE = "(?<page>\\d{1,3})";

    /** {@code Transitions, by James Marcus ... 20} */
    public static final ItemPattern TITLE_BY_AUTHOR_PAGE = new ItemPattern("title-by-author-page",
            "^(?<title>.+?),\\s+(?i:by)\\s+(?<author>[A-Z].*?)(?:" + LEADER_GAP + "|\\s+)" + PAGE + "$", 4);

    /** {@code Title .... 23 - Author} */
    public static final ItemPattern TITLE_LEADERS_PAGE_AUTHOR = new ItemPattern("title-leaders-page-author",
            "^(?<title>.+?)" + LEADER_GAP + PAGE + "\\s*-\\s*(?<author>[A-Za-z][^0-9]*?)$", 4);

    /** {@code Title - Author .... 23} */
    public static final ItemPattern TITLE_AUTHOR_LEADERS_PAGE = new ItemPattern("title-author-leaders-page",
            "^(?<title>.+?)\\s+-\\s+(?<author>[A-Z][^\\-]*?)" + LEADER_GAP + PAGE + "$", 4);

    /** {@code 20  Transitions, by James Marcus} */
    public static final ItemPattern PAGE_TITLE_BY_AUTHOR = new ItemPattern("page-title-by-author",
            "^" + PAGE + "\\s+(?<title>.*[A-Za-z].*?),\\s+(?i:by)\\s+(?<author>[A-Z].*?)$", 3);

    /** {@code Jill Lepore    The Deadline    34} */
    public static final ItemPattern AUTHOR_TITLE_PAGE = new ItemPattern("author-title-page",
            "^(?<author>" + NAME + ")\\s{2,}(?<title>.+?)\\s{2,}" + PAGE + "$", 3);

    /** {@code Jill Lepore    34    The Deadline} */
    public static final ItemPattern AUTHOR_PAGE_TITLE = new ItemPattern("author-page-title",
            "^(?<author>" + NAME + ")\\s{2,}" + PAGE + "\\s{2,}(?<title>.+?)$", 3);

    /** {@code Title ........ 23} */
    public static final ItemPattern TITLE_LEADERS_PAGE = new ItemPattern("title-leaders-page",
            "^(?<title>.+?)" + LEADER_GAP + PAGE + "$", 2);

    /** {@code 23  Title}; a line that also ends in a set-off page number is left to the trailing patterns. */
    public static final ItemPattern PAGE_TITLE = new ItemPattern("page-title",
            "^" + PAGE + "\\s+(?!.*\\s{2,}\\d{1,3}$)(?<title>.*[A-Za-z].*?)$", 2);

    /** {@code Title      23} */
    public static final ItemPattern TITLE_SPACES_PAGE = new ItemPattern("title-spaces-page",
            "^(?<title>.+?)\\s{2,}" + PAGE + "$", 2);

    /** {@code Title 23} */
    public static final ItemPattern TITLE_TRAILING_PAGE = new ItemPattern("title-trailing-page",
            "^(?<title>.+?)\\s" + PAGE + "$", 1);

    private ItemPatterns() {
    }
}
