package org.docweave.extractor.frontend.parser;

/**
 * Defines the coarse word classes the entity parser works with.
 */
public enum LexemeType {
    IDENTIFIER,
    /** A whole string or character literal token, or a number. */
    LITERAL,
    /** {@code (}, {@code [} or <code>{</code>. */
    OPEN,
    /** {@code )}, {@code ]} or <code>}</code>. */
    CLOSE,
    SEMICOLON,
    COMMA,
    COLON,
    /** A lone {@code =}, not part of {@code ==}, {@code =>}, {@code <=} or similar. */
    ASSIGN,
    OPERATOR,
    /** The prefix of an attribute syntax, e.g. {@code #[} or {@code @}. */
    ATTRIBUTE,
    /** A complete preprocessor directive line including continuations. */
    DIRECTIVE,
    /** A line break, only produced for grammars where it can end a statement. */
    NEWLINE,
    OTHER
}
