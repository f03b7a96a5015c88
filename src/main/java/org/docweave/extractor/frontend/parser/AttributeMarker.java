package org.docweave.extractor.frontend.parser;

import org.docweave.extractor.model.SourceSpan;

/**
 * An attribute or annotation in front of a declaration, e.g. {@code #[derive(Debug)]} or {@code @Override}.
 * Markers are neither comments nor part of the declaration they precede.
 *
 * @param text The marker text as written.
 * @param span The location of the marker.
 */
public record AttributeMarker(String text, SourceSpan span) {
}
