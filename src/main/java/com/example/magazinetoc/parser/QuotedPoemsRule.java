package com.example.magazinetoc.parser;

import com.example.magazinetoc.util.TocTextUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * POEMS lists several quoted poems per line: {@code "Title" - Author (p. 12)  "Other" - Someone 40}.
 */
class QuotedPoemsRule implements LineRule {

    static final String POEMS = "POEMS";

    private static final Pattern QUOTED_POEM = Pattern.compile(
            "\"([^\"]+)\"\\s*(?:-\\s*)?([^0-9\"(]+?)?\\s*(?:\\(p\\.\\s*)?(\\d{1,3})\\)?");
    private static final Pattern ANY_DIGIT = Pattern.compile("\\d{1,3}");

    @Override
    public boolean apply(String line, ParseContext context) {
        if (!POEMS.equals(context.getCurrentSection()) || line.indexOf('"') < 0 || !ANY_DIGIT.matcher(line).find()) {
            return false;
        }
        Matcher m = QUOTED_POEM.matcher(line);
        boolean found = false;
        while (m.find()) {
            int page = Integer.parseInt(m.group(3));
            if (!TocLineEngine.isValidPage(page)) continue;
            String title = TocTextUtils.squash(m.group(1));
            if (!TocTextUtils.hasLetter(title)) continue;
            context.addItem(title, TocLineEngine.cleanAuthor(m.group(2)), page);
            found = true;
        }
        return found;
    }
}
