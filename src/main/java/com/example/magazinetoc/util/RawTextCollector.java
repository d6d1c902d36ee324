package com.example.magazinetoc.util;

import com.itextpdf.kernel.pdf.canvas.parser.EventType;
import com.itextpdf.kernel.pdf.canvas.parser.data.IEventData;
import com.itextpdf.kernel.pdf.canvas.parser.data.TextRenderInfo;
import com.itextpdf.kernel.pdf.canvas.parser.listener.IEventListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Collects page text in content-stream order, one line per baseline change.
 * Unlike the layout stripper it never reorders chunks by position, which
 * recovers lines that layout mode interleaves across columns.
 */
public class RawTextCollector implements IEventListener {
    private final List<String> lines = new ArrayList<>();
    private final StringBuilder currentLine = new StringBuilder();
    private float currentY = Float.NaN;
    private float lastEndX = Float.NaN;

    @Override
    public void eventOccurred(IEventData data, EventType type) {
        if (type != EventType.RENDER_TEXT) return;
        TextRenderInfo info = (TextRenderInfo) data;
        String text = info.getText();
        if (text == null || text.isEmpty()) return;

        float y = info.getBaseline().getStartPoint().get(1);
        float startX = info.getBaseline().getStartPoint().get(0);
        float endX = info.getBaseline().getEndPoint().get(0);

        // New line detection (Y coordinate change > threshold)
        if (!Float.isNaN(currentY) && Math.abs(y - currentY) > 2.0) {
            flushLine();
        }
        if (currentLine.length() == 0) {
            currentY = y;
        } else if (!Float.isNaN(lastEndX)) {
            float space = info.getSingleSpaceWidth();
            if (space <= 0) space = 2.5f;
            float gap = startX - lastEndX;
            boolean alreadySpaced = Character.isWhitespace(currentLine.charAt(currentLine.length() - 1))
                    || Character.isWhitespace(text.charAt(0));
            if (gap > space * 3) {
                currentLine.append("  ");
            } else if (gap > space * 0.5f && !alreadySpaced) {
                currentLine.append(' ');
            }
        }
        currentLine.append(text);
        lastEndX = endX;
    }

    private void flushLine() {
        if (currentLine.length() > 0) {
            lines.add(currentLine.toString());
            currentLine.setLength(0);
        }
        lastEndX = Float.NaN;
    }

    public void finish() {
        flushLine();
    }

    public String getText() {
        return String.join("\n", lines);
    }

    @Override
    public Set<EventType> getSupportedEvents() {
        return Collections.singleton(EventType.RENDER_TEXT);
    }
}
