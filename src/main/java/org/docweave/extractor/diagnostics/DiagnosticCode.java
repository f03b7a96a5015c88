package org.docweave.extractor.diagnostics;

/**
 * Defines unique, testable codes for the problems a scan can report.
 * This decouples the test logic from the wording of the messages.
 */
public enum DiagnosticCode {
    /** A block comment was opened but never closed before the end of the file. */
    MALFORMED_COMMENT,
    /** A string or character literal was opened but never closed before the end of the file. */
    MALFORMED_LITERAL,
    /** A declaration body was still open at the end of the file, or a closing brace had no opener. */
    UNBALANCED_BRACES
}
