package org.docweave.extractor.grammar;

import org.docweave.extractor.model.EntityKind;

/**
 * A keyword that introduces a declaration.
 *
 * @param keyword The keyword as written, e.g. {@code fn}.
 * @param kind The entity kind the keyword introduces.
 * @param body How the declaration's body is scanned for children.
 */
public record DeclarationKeyword(String keyword, EntityKind kind, BodyStyle body) {

    public DeclarationKeyword {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("Declaration keyword must not be blank");
        }
        if (kind == null || body == null) {
            throw new IllegalArgumentException("Declaration keyword '" + keyword + "' needs a kind and a body style");
        }
    }
}
