package com.example.magazinetoc.parser;

import com.example.magazinetoc.model.TocEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Working state of a single parse call: the entries emitted so far, the current
 * section cursor and the diagnostic counters. Never shared between calls.
 */
public class ParseContext {
    private final List<TocEntry> entries = new ArrayList<>();
    private final Map<String, Integer> headingIndex = new HashMap<>();
    private final Set<String> itemKeys = new HashSet<>();
    private String currentSection;
    private int lastItemIndex = -1;
    private boolean previousLineWasItem;

    private int candidateLines;
    private int matchedLines;
    private int unmatchedLines;
    private int noiseLines;
    private int joinedLines;

    /** Starts a new text block: items before its first heading go to the default section. */
    public void startBlock() {
        currentSection = null;
        lastItemIndex = -1;
        previousLineWasItem = false;
    }

    public String getCurrentSection() {
        return currentSection;
    }

    public String getEffectiveSection() {
        return currentSection != null ? currentSection : TocEntry.DEFAULT_SECTION;
    }

    /**
     * Moves the cursor to {@code name}, emitting a heading the first time the section
     * is seen. A repeat occurrence only fills in a missing page.
     */
    public void heading(String name, Integer page) {
        Integer existing = headingIndex.get(name);
        if (existing == null) {
            headingIndex.put(name, entries.size());
            entries.add(TocEntry.heading(name, page));
        } else if (entries.get(existing).getPage() == null && page != null) {
            entries.set(existing, entries.get(existing).withPage(page));
        }
        currentSection = name;
        previousLineWasItem = false;
        lastItemIndex = -1;
    }

    /**
     * Adds an item under the current section, right after the last entry already in
     * that section, so a second pass over the same page keeps source order.
     *
     * @return {@code false} if the same item was already emitted (e.g. from the layout copy of a page)
     */
    public boolean addItem(String title, String author, Integer page) {
        String section = getEffectiveSection();
        String key = section + "|" + title.toLowerCase(Locale.ROOT) + "|" + page;
        previousLineWasItem = true;
        if (!itemKeys.add(key)) {
            lastItemIndex = -1;
            return false;
        }
        int at = insertionPoint(section);
        if (at < entries.size()) {
            headingIndex.replaceAll((name, index) -> index >= at ? index + 1 : index);
        }
        entries.add(at, TocEntry.item(section, title, author, page));
        lastItemIndex = at;
        return true;
    }

    private int insertionPoint(String section) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (section.equals(entries.get(i).getSection())) return i + 1;
        }
        return entries.size();
    }

    /** The item emitted by the immediately preceding logical line, if any. */
    public Optional<TocEntry> getAdjacentItem() {
        if (!previousLineWasItem || lastItemIndex < 0) return Optional.empty();
        return Optional.of(entries.get(lastItemIndex));
    }

    public void setAdjacentItemAuthor(String author) {
        if (previousLineWasItem && lastItemIndex >= 0) {
            entries.set(lastItemIndex, entries.get(lastItemIndex).withAuthor(author));
        }
    }

    public void lineWithoutItem() {
        previousLineWasItem = false;
    }

    public List<TocEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public int getItemCount() {
        return (int) entries.stream().filter(TocEntry::isItem).count();
    }

    void candidate() {
        candidateLines++;
    }

    void matched() {
        matchedLines++;
    }

    void unmatched() {
        unmatchedLines++;
    }

    void noise(int lines) {
        noiseLines += lines;
    }

    void joined() {
        joinedLines++;
    }

    public int getCandidateLines() {
        return candidateLines;
    }

    public int getMatchedLines() {
        return matchedLines;
    }

    public int getUnmatchedLines() {
        return unmatchedLines;
    }

    public int getNoiseLines() {
        return noiseLines;
    }

    public int getJoinedLines() {
        return joinedLines;
    }
}
