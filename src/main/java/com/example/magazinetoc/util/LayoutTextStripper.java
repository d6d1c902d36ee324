package com.example.magazinetoc.util;

import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.List;

/**
 * {@link PDFTextStripper} that keeps wide horizontal gaps as runs of spaces, so a
 * heading and its page number printed in separate columns come out as
 * {@code "PERSONAL HISTORY      20"} instead of {@code "PERSONAL HISTORY 20"}.
 */
public class LayoutTextStripper extends PDFTextStripper {

    /** Gaps wider than this many space widths are treated as column gaps. */
    private static final float COLUMN_GAP_SPACES = 2.5f;
    private static final int MAX_PADDING = 40;

    private float lastEndX = -1;

    public LayoutTextStripper() throws IOException {
        super();
        setSortByPosition(true);
    }

    @Override
    protected void startPage(PDPage page) throws IOException {
        lastEndX = -1;
        super.startPage(page);
    }

    @Override
    protected void writeLineSeparator() throws IOException {
        lastEndX = -1;
        super.writeLineSeparator();
    }

    @Override
    protected void writeWordSeparator() {
        // spacing is written in writeString, where the positions are known
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (!textPositions.isEmpty()) {
            TextPosition first = textPositions.get(0);
            TextPosition last = textPositions.get(textPositions.size() - 1);
            if (lastEndX >= 0) {
                output.write(gap(first));
            }
            lastEndX = last.getXDirAdj() + last.getWidthDirAdj();
        } else if (lastEndX >= 0) {
            output.write(getWordSeparator());
        }
        super.writeString(text, textPositions);
    }

    private String gap(TextPosition next) {
        float spaceWidth = next.getWidthOfSpace();
        if (!(spaceWidth > 0) || Float.isInfinite(spaceWidth)) {
            spaceWidth = next.getFontSizeInPt() * 0.25f;
        }
        float gap = next.getXDirAdj() - lastEndX;
        if (spaceWidth <= 0 || gap <= spaceWidth * COLUMN_GAP_SPACES) {
            return " ";
        }
        int spaces = Math.min(MAX_PADDING, Math.max(2, Math.round(gap / spaceWidth)));
        return " ".repeat(spaces);
    }
}
