package com.example.magazinetoc.model;

import java.nio.file.Path;
import java.util.Objects;

public class SourceDocument {
    private final Path path;
    private final int maxPages;
    private final int ocrFirstPages;

    public SourceDocument(Path path, int maxPages, int ocrFirstPages) {
        this.path = Objects.requireNonNull(path, "path");
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages must be >= 1, was " + maxPages);
        }
        if (ocrFirstPages < 0) {
            throw new IllegalArgumentException("ocrFirstPages must be >= 0, was " + ocrFirstPages);
        }
        this.maxPages = maxPages;
        this.ocrFirstPages = ocrFirstPages;
    }

    public Path getPath() {
        return path;
    }

    public String getFileName() {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }

    public int getMaxPages() {
        return maxPages;
    }

    public int getOcrFirstPages() {
        return ocrFirstPages;
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
