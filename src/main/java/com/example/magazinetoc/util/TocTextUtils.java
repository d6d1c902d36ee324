package com.example.magazinetoc.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text cleanup and counting helpers shared by the provider and the parsers.
 */
public final class TocTextUtils {

    private static final Pattern BROKEN_WORD = Pattern.compile("(?<=[A-Za-z])-[ \\t]*\\r?\\n[ \\t]*(?=[a-z])");
    private static final Pattern PAGE_NUMBER_ONLY = Pattern.compile("^\\s*\\d{1,3}\\s*$");
    private static final Pattern STANDALONE_NUMBER = Pattern.compile("\\b\\d{1,3}\\b");
    private static final Pattern TRAILING_PAGE = Pattern.compile("\\D\\s*\\d{1,3}\\s*$");
    private static final Pattern LEADER_RUN = Pattern.compile("[.\\u2026\\u00B7\\u2022]{2,}");

    private TocTextUtils() {
    }

    /**
     * Folds typographic characters to their ASCII forms: dashes to {@code -},
     * curly quotes to straight ones, exotic spaces to plain spaces, ligatures
     * to letter pairs. Line structure is kept.
     */
    public static String normalize(String text) {
        if (text == null) return "";
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\u2014':
                case '\u2013':
                case '\u2012':
                case '\u2212':
                    sb.append('-');
                    break;
                case '\u2018':
                case '\u2019':
                case '\u02bc':
                    sb.append('\'');
                    break;
                case '\u201c':
                case '\u201d':
                    sb.append('"');
                    break;
                case '\u00a0':
                case '\u2007':
                case '\u2009':
                case '\u200a':
                case '\u202f':
                    sb.append(' ');
                    break;
                case '\t':
                    sb.append("  ");
                    break;
                case '\r':
                case '\f':
                    break;
                case '\ufb01':
                    sb.append("fi");
                    break;
                case '\ufb02':
                    sb.append("fl");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Rejoins words hyphenated across a line break ("maga-\nzine" becomes "magazine"). */
    public static String dehyphenate(String text) {
        if (text == null) return "";
        return BROKEN_WORD.matcher(text).replaceAll("");
    }

    public static String clean(String text) {
        return normalize(dehyphenate(text));
    }

    /** Letters and digits only; whitespace, punctuation and control noise do not count. */
    public static int countSignificantChars(String text) {
        if (text == null) return 0;
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLetterOrDigit(text.charAt(i))) count++;
        }
        return count;
    }

    public static boolean isPageNumberOnly(String line) {
        return line != null && PAGE_NUMBER_ONLY.matcher(line).matches();
    }

    public static boolean endsWithPageNumber(String line) {
        return line != null && TRAILING_PAGE.matcher(line).find();
    }

    public static int countStandaloneNumbers(String text) {
        if (text == null) return 0;
        int count = 0;
        Matcher m = STANDALONE_NUMBER.matcher(text);
        while (m.find()) count++;
        return count;
    }

    /**
     * More than half symbols on a longer line: OCR debris or rules. Dot leaders are
     * dropped before counting, so {@code Title ........ 34} is not garbage.
     */
    public static boolean isGarbageLine(String line) {
        String t = LEADER_RUN.matcher(line).replaceAll(" ").trim();
        if (t.length() > 10) {
            long symbolCount = t.chars().filter(ch -> !Character.isLetterOrDigit(ch) && !Character.isWhitespace(ch)).count();
            return (double) symbolCount / t.length() > 0.5;
        }
        return false;
    }

    public static boolean hasLetter(String text) {
        if (text == null) return false;
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLetter(text.charAt(i))) return true;
        }
        return false;
    }

    public static boolean hasLowercase(String text) {
        if (text == null) return false;
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLowerCase(text.charAt(i))) return true;
        }
        return false;
    }

    /** Trims and collapses inner whitespace runs to single spaces. */
    public static String squash(String text) {
        return text == null ? null : text.trim().replaceAll("\\s+", " ");
    }
}
