package org.docweave.extractor.model;

import java.util.Optional;

/**
 * The keywords that mark an actionable note inside a comment.
 * Keywords configured by the application are reported as {@link #CUSTOM}.
 */
public enum AnnotationTag {
    TODO,
    FIXME,
    HACK,
    NOTE,
    XXX,
    BUG,
    /** A keyword from the {@code docweave.tags.custom} configuration. */
    CUSTOM;

    /**
     * Resolves a built-in keyword. Matching is exact and case-sensitive.
     * @param keyword The keyword as written in the comment.
     * @return The tag, or empty if the word is not a built-in keyword.
     */
    public static Optional<AnnotationTag> ofKeyword(String keyword) {
        for (AnnotationTag tag : values()) {
            if (tag != CUSTOM && tag.name().equals(keyword)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }
}
