package org.docweave.extractor.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs while scanning one source file.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The machine-readable code of the problem.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue (1-based).
 * @param columnNumber The column number of the issue (1-based).
 */
public record Diagnostic(
        Type type,
        DiagnosticCode code,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A recoverable error; the scan still produced a best-effort model. */
        ERROR,
        /** A warning that does not affect the produced model. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s (%s)", type, fileName, lineNumber, columnNumber, message, code);
    }
}
