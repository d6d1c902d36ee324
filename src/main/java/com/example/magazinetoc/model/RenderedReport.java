package com.example.magazinetoc.model;

import java.util.Objects;

public class RenderedReport {
    private final ReportFormat format;
    private final String content;

    public RenderedReport(ReportFormat format, String content) {
        this.format = Objects.requireNonNull(format, "format");
        this.content = Objects.requireNonNull(content, "content");
    }

    public ReportFormat getFormat() {
        return format;
    }

    public String getContent() {
        return content;
    }

    public int length() {
        return content.length();
    }
}
