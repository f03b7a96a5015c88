package org.docweave.extractor.grammar;

/**
 * Thrown when a grammar definition in the configuration is missing a key or has an invalid value.
 */
public class GrammarConfigException extends RuntimeException {

    /**
     * Constructs a new exception naming the offending grammar.
     * @param grammar The name of the grammar being read.
     * @param message The detail message.
     * @param cause The underlying configuration or validation error.
     */
    public GrammarConfigException(String grammar, String message, Throwable cause) {
        super(String.format("Invalid grammar '%s': %s", grammar, message), cause);
    }
}
