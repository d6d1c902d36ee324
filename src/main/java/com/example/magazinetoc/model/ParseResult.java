package com.example.magazinetoc.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public class ParseResult {
    private final List<TocEntry> entries;
    private final String issueTitle;
    private final ParseDiagnostics diagnostics;

    public ParseResult(List<TocEntry> entries, String issueTitle, ParseDiagnostics diagnostics) {
        this.entries = List.copyOf(entries);
        this.issueTitle = issueTitle;
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public static ParseResult empty(ParseDiagnostics diagnostics) {
        return new ParseResult(Collections.emptyList(), null, diagnostics);
    }

    public List<TocEntry> getEntries() {
        return entries;
    }

    public List<TocEntry> getHeadings() {
        return entries.stream().filter(TocEntry::isHeading).collect(Collectors.toList());
    }

    public List<TocEntry> getItems() {
        return entries.stream().filter(TocEntry::isItem).collect(Collectors.toList());
    }

    public String getIssueTitle() {
        return issueTitle;
    }

    public ParseDiagnostics getDiagnostics() {
        return diagnostics;
    }

    public Brand getBrand() {
        return diagnostics.getBrand();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
