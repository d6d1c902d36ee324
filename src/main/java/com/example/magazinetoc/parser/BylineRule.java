package com.example.magazinetoc.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A standalone {@code By Author} line credits the item printed just above it.
 */
class BylineRule implements LineRule {

    private static final Pattern BYLINE = Pattern.compile("^(?i:by)\\s+(" + ItemPatterns.NAME
            + "(?:\\s*(?:,|and|&)\\s*" + ItemPatterns.NAME + ")*)\\.?$");

    @Override
    public boolean apply(String line, ParseContext context) {
        Matcher m = BYLINE.matcher(line.trim());
        if (!m.matches()) {
            return false;
        }
        return context.getAdjacentItem()
                .filter(item -> item.getAuthor() == null)
                .map(item -> {
                    context.setAdjacentItemAuthor(TocLineEngine.cleanAuthor(m.group(1)));
                    return true;
                })
                .orElse(false);
    }
}
