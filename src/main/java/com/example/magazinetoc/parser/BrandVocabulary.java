package com.example.magazinetoc.parser;

import com.example.magazinetoc.model.Brand;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Brand signal tokens and section vocabularies. These lists are tuned against
 * real issues; extend them here rather than in the parsers.
 */
public final class BrandVocabulary {

    public static final List<String> NEW_YORKER_SECTIONS = List.of(
            "THE TALK OF THE TOWN", "GOINGS ON ABOUT TOWN", "GOINGS ON", "PERSONAL HISTORY", "TAKES",
            "SHOUTS & MURMURS", "ANNALS OF", "A REPORTER AT LARGE", "LETTER FROM", "DEPT. OF",
            "OUR LOCAL CORRESPONDENTS", "ONWARD AND UPWARD", "THE POLITICAL SCENE", "U.S. JOURNAL",
            "PROFILES", "FICTION", "THE CRITICS", "BOOKS", "BRIEFLY NOTED", "THE ART WORLD",
            "THE CURRENT CINEMA", "THE THEATRE", "MUSICAL EVENTS", "POP MUSIC", "ON TELEVISION",
            "DANCING", "POEMS", "COVER", "CONTRIBUTORS", "TABLES FOR TWO", "ON AND OFF THE MENU",
            "PUZZLES & GAMES DEPT.", "SKETCHBOOK", "THE MAIL");

    public static final List<String> ATLANTIC_SECTIONS = List.of(
            "FEATURES", "DISPATCHES", "IDEAS", "CULTURE", "CULTURE & CRITICISM", "POLITICS", "SCIENCE",
            "TECHNOLOGY", "BUSINESS", "BOOKS", "REVIEW", "ESSAYS", "VOICES", "CORRESPONDENCE",
            "THE COMMONS", "POETRY", "FICTION", "THE BIG STORY", "COVER STORY", "DEPARTMENTS");

    public static final List<String> HARPERS_SECTIONS = List.of(
            "READINGS", "ESSAY", "REPORT", "NOTEBOOK", "EASY CHAIR", "LETTER", "LETTERS", "REVIEWS",
            "REVIEW", "POEM", "POETRY", "FICTION", "ART", "ARTS & LETTERS", "ANNOTATIONS", "DEPARTMENTS",
            "MEMOIR", "STORY", "CRITICISM", "NEW BOOKS", "FEATURES");

    /** Editorial slots that the include-mail / include-contributors options control. */
    public static final Set<String> MAIL_SECTIONS = Set.of("THE MAIL", "LETTERS", "CORRESPONDENCE");
    public static final Set<String> CONTRIBUTOR_SECTIONS = Set.of("CONTRIBUTORS");

    private static final Map<Brand, List<String>> FILENAME_TOKENS = new EnumMap<>(Brand.class);
    private static final Map<Brand, List<String>> MASTHEADS = new EnumMap<>(Brand.class);
    private static final Map<Brand, List<String>> EXCLUSIVE_HEADINGS = new EnumMap<>(Brand.class);

    static {
        FILENAME_TOKENS.put(Brand.NEW_YORKER, List.of("new yorker", "newyorker", "new_yorker", "new-yorker", "new.yorker"));
        FILENAME_TOKENS.put(Brand.ATLANTIC, List.of("atlantic"));
        FILENAME_TOKENS.put(Brand.HARPERS, List.of("harper"));

        MASTHEADS.put(Brand.NEW_YORKER, List.of("the new yorker"));
        MASTHEADS.put(Brand.ATLANTIC, List.of("the atlantic"));
        MASTHEADS.put(Brand.HARPERS, List.of("harper's magazine", "harpers magazine", "harper's index"));

        EXCLUSIVE_HEADINGS.put(Brand.NEW_YORKER, List.of(
                "THE TALK OF THE TOWN", "SHOUTS & MURMURS", "GOINGS ON", "A REPORTER AT LARGE",
                "THE CURRENT CINEMA", "PERSONAL HISTORY", "THE CRITICS", "TABLES FOR TWO", "THE MAIL",
                "ANNALS OF", "BRIEFLY NOTED", "MUSICAL EVENTS"));
        EXCLUSIVE_HEADINGS.put(Brand.ATLANTIC, List.of(
                "DISPATCHES", "CORRESPONDENCE", "THE COMMONS", "CULTURE & CRITICISM", "COVER STORY", "VOICES"));
        EXCLUSIVE_HEADINGS.put(Brand.HARPERS, List.of(
                "READINGS", "EASY CHAIR", "NOTEBOOK", "ANNOTATIONS", "ARTS & LETTERS", "FINDINGS"));
    }

    private BrandVocabulary() {
    }

    public static List<String> filenameTokens(Brand brand) {
        return FILENAME_TOKENS.getOrDefault(brand, Collections.emptyList());
    }

    public static List<String> mastheads(Brand brand) {
        return MASTHEADS.getOrDefault(brand, Collections.emptyList());
    }

    public static List<String> exclusiveHeadings(Brand brand) {
        return EXCLUSIVE_HEADINGS.getOrDefault(brand, Collections.emptyList());
    }

    public static boolean isMailSection(String section) {
        return section != null && MAIL_SECTIONS.contains(section.toUpperCase(Locale.ROOT));
    }

    public static boolean isContributorSection(String section) {
        return section != null && CONTRIBUTOR_SECTIONS.contains(section.toUpperCase(Locale.ROOT));
    }
}
