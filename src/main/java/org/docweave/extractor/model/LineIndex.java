package org.docweave.extractor.model;

import java.util.Arrays;

/**
 * Maps character offsets of one source text to 1-based line/column positions.
 */
public final class LineIndex {

    private final int[] lineStarts;
    private final int length;

    /**
     * Builds the index for the given text.
     * @param source The full source text.
     */
    public LineIndex(String source) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
        this.length = source.length();
    }

    /**
     * @param offset A character offset, {@code 0 <= offset <= length}.
     * @return The 1-based line containing the offset.
     */
    public int lineOf(int offset) {
        int index = Arrays.binarySearch(lineStarts, clamp(offset));
        return index >= 0 ? index + 1 : -index - 1;
    }

    /**
     * @param offset A character offset, {@code 0 <= offset <= length}.
     * @return The 1-based column of the offset within its line.
     */
    public int columnOf(int offset) {
        int clamped = clamp(offset);
        return clamped - lineStarts[lineOf(clamped) - 1] + 1;
    }

    /**
     * @param line A 1-based line number.
     * @return The offset of the first character of the line.
     */
    public int lineStart(int line) {
        return lineStarts[line - 1];
    }

    /**
     * @return The number of lines (a text without newline has one line).
     */
    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Creates a span with positions resolved through this index.
     * @param startOffset The inclusive start offset.
     * @param endOffset The exclusive end offset.
     * @return The resolved span.
     */
    public SourceSpan span(int startOffset, int endOffset) {
        return new SourceSpan(startOffset, endOffset,
                lineOf(startOffset), columnOf(startOffset),
                lineOf(endOffset), columnOf(endOffset));
    }

    private int clamp(int offset) {
        return Math.max(0, Math.min(offset, length));
    }
}
