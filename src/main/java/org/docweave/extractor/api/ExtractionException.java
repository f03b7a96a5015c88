package org.docweave.extractor.api;

/**
 * Thrown when a file cannot be scanned at all, e.g. because no grammar is known for it.
 * <p>
 * Malformed comments or literals never cause this exception; they are reported as diagnostics
 * in the returned model.
 */
public class ExtractionException extends Exception {

    /**
     * Constructs a new extraction exception with the specified detail message.
     * @param message The detail message.
     */
    public ExtractionException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new extraction exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
