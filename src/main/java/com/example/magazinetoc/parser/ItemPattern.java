package com.example.magazinetoc.parser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named item-line pattern with {@code title}, {@code page} and optionally
 * {@code author} groups. {@code specificity} counts the anchored tokens; lists of
 * patterns are tried most specific first.
 */
public class ItemPattern {
    private final String name;
    private final Pattern pattern;
    private final int specificity;
    private final boolean hasAuthor;

    public ItemPattern(String name, String regex, int specificity) {
        this.name = name;
        this.pattern = Pattern.compile(regex);
        this.specificity = specificity;
        this.hasAuthor = regex.contains("(?<author>");
    }

    public String getName() {
        return name;
    }

    public int getSpecificity() {
        return specificity;
    }

    public Optional<ItemMatch> match(String line) {
        Matcher m = pattern.matcher(line);
        if (!m.matches()) {
            return Optional.empty();
        }
        int page;
        try {
            page = Integer.parseInt(m.group("page"));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        String author = hasAuthor ? m.group("author") : null;
        return Optional.of(new ItemMatch(m.group("title"), author, page, this));
    }

    @Override
    public String toString() {
        return name;
    }
}
