package org.docweave.extractor.grammar;

/**
 * Describes how the body of a declaration is scanned for child declarations.
 */
public enum BodyStyle {
    /** The body is not searched for children (function bodies, initializers). */
    OPAQUE,
    /** The body holds declarations terminated by {@code ;} or by their own body. */
    MEMBERS,
    /** The body holds fields or variants separated by {@code ,} or {@code ;}. */
    FIELDS
}
