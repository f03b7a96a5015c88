package org.docweave.extractor.grammar;

/**
 * An opening/closing delimiter pair of a block comment, e.g. {@code /*} and {@code *}{@code /}.
 *
 * @param open The opening delimiter.
 * @param close The closing delimiter.
 */
public record BlockCommentDelimiter(String open, String close) {

    public BlockCommentDelimiter {
        if (open == null || open.isEmpty() || close == null || close.isEmpty()) {
            throw new IllegalArgumentException("Block comment delimiters must not be empty");
        }
    }
}
