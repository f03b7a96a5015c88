package org.docweave.extractor.model;

/**
 * The kinds of declarations the entity parser recognizes.
 */
public enum EntityKind {
    /** A module; the root of every tree, or a nested module/namespace. */
    MODULE,
    /** A function or method. */
    FUNCTION,
    /** A type declaration: struct, class, enum, record or type alias. */
    STRUCT,
    /** A field of a type, or an enum variant. */
    FIELD,
    /** A trait or interface definition. */
    TRAIT,
    /** An implementation block. */
    IMPL,
    /** A constant or static item. */
    CONST,
    /** A function marked as a test. */
    TEST,
    /** A code region that could not be classified. */
    UNKNOWN
}
