package org.docweave.extractor.frontend.lexer;

/**
 * Defines the different kinds of tokens that the {@link Lexer} produces.
 * Every character of a source text belongs to exactly one token.
 */
public enum TokenKind {
    /** Anything that is neither a comment nor a literal, including whitespace. */
    CODE,
    /** A comment running from its prefix to the end of the line (newline excluded). */
    LINE_COMMENT,
    /** A comment enclosed in block delimiters. */
    BLOCK_COMMENT,
    /** A string literal including its delimiters. */
    STRING_LITERAL,
    /** A character literal including its delimiters. */
    CHAR_LITERAL;

    /**
     * @return {@code true} for the two comment kinds.
     */
    public boolean isComment() {
        return this == LINE_COMMENT || this == BLOCK_COMMENT;
    }

    /**
     * @return {@code true} for the two literal kinds.
     */
    public boolean isLiteral() {
        return this == STRING_LITERAL || this == CHAR_LITERAL;
    }
}
