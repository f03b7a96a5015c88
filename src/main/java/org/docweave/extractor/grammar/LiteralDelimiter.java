package org.docweave.extractor.grammar;

/**
 * Delimiters of a string or character literal.
 * <p>
 * A fenced delimiter accepts any number of fence strings between the last character of
 * {@code open} and the characters before it, and its closer must be followed by the same number
 * of fences. Rust raw strings use {@code open = r"} with the fence {@code #}, so {@code r"..."},
 * {@code r#"..."#} and {@code r##"..."##} are all one delimiter.
 *
 * @param open The opening delimiter without fences, e.g. {@code "} or {@code r"}.
 * @param close The closing delimiter without fences.
 * @param kind Whether the literal is a string or a single character.
 * @param escapes Whether the grammar's escape character applies inside the literal.
 * @param fence The repeatable fence, or an empty string if the delimiter has none.
 */
public record LiteralDelimiter(String open, String close, Kind kind, boolean escapes, String fence) {

    /**
     * The kind of literal a delimiter opens.
     */
    public enum Kind {
        /** A string of any length, possibly spanning lines. */
        STRING,
        /** Exactly one character or one escape sequence. */
        CHAR
    }

    public LiteralDelimiter {
        if (open == null || open.isEmpty() || close == null || close.isEmpty()) {
            throw new IllegalArgumentException("Literal delimiters must not be empty");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Literal kind is required for delimiter " + open);
        }
        if (fence == null) {
            fence = "";
        }
        if (!fence.isEmpty() && (kind != Kind.STRING || open.length() < 2)) {
            throw new IllegalArgumentException(
                    "Only string delimiters with a prefix before the quote can be fenced: " + open);
        }
    }

    /**
     * Creates a delimiter without a fence.
     */
    public LiteralDelimiter(String open, String close, Kind kind, boolean escapes) {
        this(open, close, kind, escapes, "");
    }

    /**
     * @return {@code true} if the delimiter accepts fences.
     */
    public boolean isFenced() {
        return !fence.isEmpty();
    }

    /**
     * Matches this delimiter's opener, fences included, at a position of the source.
     * @param source The text being scanned.
     * @param position The offset to match at.
     * @return The length of the opener, or -1 if it does not start at {@code position}.
     */
    public int openingLength(String source, int position) {
        if (!isFenced()) {
            return source.startsWith(open, position) ? open.length() : -1;
        }
        String prefix = open.substring(0, open.length() - 1);
        if (!source.startsWith(prefix, position)) {
            return -1;
        }
        int cursor = position + prefix.length();
        while (source.startsWith(fence, cursor)) {
            cursor += fence.length();
        }
        return source.startsWith(open.substring(prefix.length()), cursor)
                ? cursor + 1 - position
                : -1;
    }

    /**
     * @param openingLength The length of the opener returned by {@link #openingLength}.
     * @return The closer that ends a literal opened with that many characters.
     */
    public String closer(int openingLength) {
        if (!isFenced()) {
            return close;
        }
        int fences = (openingLength - open.length()) / fence.length();
        return close + fence.repeat(fences);
    }
}
