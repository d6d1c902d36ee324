package com.example.magazinetoc.parser;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Denylist entries every brand shares.
 */
final class CommonNoise {

    static final List<String> MARKERS = List.of(
            "PRICE $", "ILLUSTRATIONS BY", "WINTER PREVIEW", "THE WEEKEND ESSAY", "SUBSCRIBE",
            "LOVE BOOKS, LOVE FOLIO");

    static final Pattern DATE = Pattern.compile(
            "(?i)\\b(?:JAN|FEB|MAR|APR|MAY|JUN|JUL|AUG|SEP|OCT|NOV|DEC)[a-z]*\\.?,?\\s+\\d{1,2},\\s+\\d{4}");

    /** Running footer such as {@code THE NEW YORKER, OCTOBER 20, 2025}. */
    static final Pattern FOOTER = Pattern.compile(
            "(?i)(the new yorker|the atlantic|harper'?s magazine).*,\\s+\\w+\\s+\\d{1,2},\\s+\\d{4}");

    static final Pattern CONTENTS_LABEL = Pattern.compile("(?i)^\\s*(?:table of )?contents\\.?\\s*$");

    static final Pattern WEB_ADDRESS = Pattern.compile("(?i)(?:www\\.|https?://|\\.com\\b)");

    static final List<Pattern> PATTERNS = List.of(DATE, CONTENTS_LABEL, WEB_ADDRESS);

    private CommonNoise() {
    }
}
