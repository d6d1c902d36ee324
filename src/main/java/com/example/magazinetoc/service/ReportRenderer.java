package com.example.magazinetoc.service;

import com.example.magazinetoc.exception.RenderingException;
import com.example.magazinetoc.model.ParseResult;
import com.example.magazinetoc.model.RenderedReport;
import com.example.magazinetoc.model.ReportFormat;
import com.example.magazinetoc.model.TocEntry;
import com.example.magazinetoc.model.TocOptions;
import com.example.magazinetoc.parser.TocFilter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Formats a parse result as the plain-text report or as a flat JSON array.
 * Output depends only on the arguments.
 */
@Service
public class ReportRenderer {

    private static final String BULLET = "• ";
    private static final String AUTHOR_SEPARATOR = " — ";

    private final ObjectMapper objectMapper;

    public ReportRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RenderedReport render(ParseResult result, ReportFormat format, TocOptions options) {
        checkOrdering(result.getEntries());
        List<TocEntry> entries = retained(result.getEntries(), options);
        String content = format == ReportFormat.STRUCTURED
                ? renderStructured(entries)
                : renderText(result.getIssueTitle(), entries, options);
        return new RenderedReport(format, content);
    }

    /**
     * Every item must follow the heading of its section, except items in the default section.
     *
     * @throws RenderingException on the first item without a preceding heading
     */
    void checkOrdering(List<TocEntry> entries) {
        Set<String> seen = new HashSet<>();
        for (TocEntry e : entries) {
            if (e.isHeading()) {
                seen.add(e.getSection());
            } else if (!TocEntry.DEFAULT_SECTION.equals(e.getSection()) && !seen.contains(e.getSection())) {
                throw new RenderingException("Item '" + e.getTitle() + "' appears before the heading of section "
                        + e.getSection());
            }
        }
    }

    private List<TocEntry> retained(List<TocEntry> entries, TocOptions options) {
        List<TocEntry> kept = TocFilter.apply(entries, options);
        if (!options.isSuppressEmpty()) {
            return kept;
        }
        Set<String> withItems = kept.stream()
                .filter(TocEntry::isItem)
                .map(TocEntry::getSection)
                .collect(Collectors.toSet());
        return kept.stream()
                .filter(e -> e.isItem() || withItems.contains(e.getSection()))
                .collect(Collectors.toList());
    }

    private String renderText(String issueTitle, List<TocEntry> entries, TocOptions options) {
        List<String> lines = new ArrayList<>();
        if (issueTitle != null && !issueTitle.isBlank()) {
            lines.add(issueTitle.trim());
            lines.add("");
        }

        boolean overview = false;
        for (TocEntry e : entries) {
            if (e.isHeading()) {
                lines.add(e.getPage() != null ? e.getSection() + " (p. " + e.getPage() + ")" : e.getSection());
                overview = true;
            }
        }
        if (overview) {
            lines.add("");
        }

        Map<String, List<TocEntry>> bySection = new LinkedHashMap<>();
        for (TocEntry e : entries) {
            if (e.isItem()) {
                bySection.computeIfAbsent(e.getSection(), k -> new ArrayList<>()).add(e);
            }
        }
        int limit = options.getMaxItemsPerSection();
        for (Map.Entry<String, List<TocEntry>> section : bySection.entrySet()) {
            lines.add(section.getKey());
            List<TocEntry> items = section.getValue();
            int shown = limit > 0 ? Math.min(limit, items.size()) : items.size();
            for (TocEntry item : items.subList(0, shown)) {
                lines.add(bullet(item));
            }
            lines.add("");
        }

        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines.isEmpty() ? "" : String.join("\n", lines) + "\n";
    }

    private static String bullet(TocEntry item) {
        StringBuilder sb = new StringBuilder(BULLET).append(item.getTitle());
        if (item.getPage() != null) {
            sb.append(" (p. ").append(item.getPage()).append(')');
        }
        if (item.getAuthor() != null && !item.getAuthor().isBlank()) {
            sb.append(AUTHOR_SEPARATOR).append(item.getAuthor());
        }
        return sb.toString();
    }

    private String renderStructured(List<TocEntry> entries) {
        ArrayNode array = objectMapper.createArrayNode();
        for (TocEntry e : entries) {
            ObjectNode node = array.addObject();
            node.put("kind", e.getKind().name().toLowerCase(Locale.ROOT));
            node.put("section", e.getSection());
            node.put("title", e.getTitle());
            node.put("author", e.getAuthor());
            if (e.getPage() != null) {
                node.put("page", e.getPage().intValue());
            } else {
                node.putNull("page");
            }
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(array) + "\n";
        } catch (JsonProcessingException e) {
            throw new RenderingException("Could not serialize entries", e);
        }
    }
}
