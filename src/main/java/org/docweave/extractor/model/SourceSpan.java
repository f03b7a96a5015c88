package org.docweave.extractor.model;

/**
 * A contiguous region of one source file.
 * <p>
 * Offsets are character indices into the scanned text; {@code endOffset} is exclusive.
 * Lines and columns are 1-based, and the end position is the position of {@code endOffset}.
 *
 * @param startOffset The index of the first character.
 * @param endOffset The index after the last character.
 * @param startLine The line of the first character.
 * @param startColumn The column of the first character.
 * @param endLine The line of {@code endOffset}.
 * @param endColumn The column of {@code endOffset}.
 */
public record SourceSpan(
        int startOffset,
        int endOffset,
        int startLine,
        int startColumn,
        int endLine,
        int endColumn
) {

    public SourceSpan {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("Invalid span offsets: " + startOffset + ".." + endOffset);
        }
    }

    /**
     * @return the number of characters covered.
     */
    public int length() {
        return endOffset - startOffset;
    }

    /**
     * Checks whether the other span lies completely inside this one.
     * @param other The span to test.
     * @return {@code true} if {@code other} is contained.
     */
    public boolean contains(SourceSpan other) {
        return startOffset <= other.startOffset && other.endOffset <= endOffset;
    }

    /**
     * Checks whether the two spans share at least one character.
     * @param other The span to test.
     * @return {@code true} if the spans overlap.
     */
    public boolean overlaps(SourceSpan other) {
        return startOffset < other.endOffset && other.startOffset < endOffset;
    }

    /**
     * Format as readable string, e.g. {@code 3:5-7:2}.
     */
    public String format() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
