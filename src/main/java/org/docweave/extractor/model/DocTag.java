package org.docweave.extractor.model;

/**
 * A structured tag inside documentation text.
 * <p>
 * {@code @param a First number} yields {@code (param, a, First number)};
 * a {@code # Arguments} heading yields {@code (arguments, "", null)};
 * {@code Returns:} yields {@code (returns, "", null)}.
 *
 * @param name The lower-cased tag name.
 * @param value The first word after the tag, or an empty string.
 * @param description The remaining text, or {@code null}.
 */
public record DocTag(String name, String value, String description) {
}
