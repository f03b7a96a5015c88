package org.docweave.extractor.frontend.parser;

import java.util.List;

/**
 * The result of the entity parser: the declaration tree without documentation and the
 * attribute markers found while reading it.
 *
 * @param root The root module spanning the whole file.
 * @param attributes All attribute markers in source order.
 */
public record ParsedSkeleton(EntityNode root, List<AttributeMarker> attributes) {

    public ParsedSkeleton {
        attributes = List.copyOf(attributes);
    }
}
