package org.docweave.extractor.grammar;

/**
 * How an attribute/annotation marker is spelled.
 *
 * @param prefix The text that starts the marker, e.g. {@code #[} or {@code @}.
 * @param bracketed {@code true} if the prefix opens a bracket that the marker closes
 *                  ({@code #[derive(Debug)]}); {@code false} if the marker is a name with
 *                  optional arguments ({@code @Deprecated(since = "2")}).
 */
public record AttributeSyntax(String prefix, boolean bracketed) {

    public AttributeSyntax {
        if (prefix == null || prefix.isEmpty()) {
            throw new IllegalArgumentException("Attribute prefix must not be empty");
        }
    }
}
