package org.docweave.extractor.frontend.parser;

/**
 * A word of code as seen by the entity parser.
 *
 * @param type The word class.
 * @param text The text of the word.
 * @param start The offset of the first character in the source.
 * @param end The offset after the last character.
 */
public record Lexeme(LexemeType type, String text, int start, int end) {

    /**
     * @param type The type to test.
     * @param text The text to test.
     * @return {@code true} if this lexeme has exactly this type and text.
     */
    public boolean is(LexemeType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
