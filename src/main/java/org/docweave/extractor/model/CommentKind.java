package org.docweave.extractor.model;

/**
 * The refined kind of a comment, as decided by the comment classifier.
 */
public enum CommentKind {
    /** An ordinary line comment, e.g. {@code // text}. */
    PLAIN_LINE,
    /** An ordinary block comment, e.g. {@code /* text *}{@code /}. */
    PLAIN_BLOCK,
    /** A documentation line comment, e.g. {@code /// text}. */
    DOC_LINE,
    /** A documentation block comment, e.g. {@code /** text *}{@code /}. */
    DOC_BLOCK,
    /** Documentation of the enclosing module, e.g. {@code //! text}. */
    MODULE_DOC;

    /**
     * @return {@code true} for the kinds produced by a documentation marker.
     */
    public boolean isDoc() {
        return this == DOC_LINE || this == DOC_BLOCK || this == MODULE_DOC;
    }
}
