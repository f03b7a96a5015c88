package org.docweave.extractor.grammar;

/**
 * Where the name of a field sits in its declaration.
 */
public enum FieldNaming {
    /** {@code name: Type} (Rust, TypeScript). Falls back to the first identifier. */
    BEFORE_COLON,
    /** {@code Type name = value} (Java, C, C++): the last identifier before {@code =}. */
    LAST_IDENTIFIER,
    /** {@code name Type} (Go). */
    FIRST_IDENTIFIER
}
