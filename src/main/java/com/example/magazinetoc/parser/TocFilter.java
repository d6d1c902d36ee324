package com.example.magazinetoc.parser;

import com.example.magazinetoc.model.TocEntry;
import com.example.magazinetoc.model.TocOptions;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Drops the mail and contributors slots when the options exclude them.
 * Applying it twice changes nothing.
 */
public final class TocFilter {

    private TocFilter() {
    }

    public static List<TocEntry> apply(List<TocEntry> entries, TocOptions options) {
        return entries.stream()
                .filter(e -> retains(e.getSection(), options))
                .collect(Collectors.toList());
    }

    public static boolean retains(String section, TocOptions options) {
        if (!options.isIncludeMail() && BrandVocabulary.isMailSection(section)) return false;
        if (!options.isIncludeContributors() && BrandVocabulary.isContributorSection(section)) return false;
        return true;
    }
}
