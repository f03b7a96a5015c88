package org.docweave.extractor.model;

/**
 * A tagged note found on one physical line of a comment, e.g. {@code // TODO: Implement validation}.
 *
 * @param tag The recognized tag.
 * @param label The keyword as written; equals {@code tag.name()} unless the tag is {@link AnnotationTag#CUSTOM}.
 * @param assignee The name in {@code TODO(name):}, or {@code null}.
 * @param message The text after the keyword, trimmed.
 * @param line The 1-based line of the keyword.
 * @param column The 1-based column of the keyword.
 * @param commentId The id of the {@link CommentRecord} the note belongs to.
 * @param entityId The id of the entity owning or containing that comment.
 */
public record Annotation(
        AnnotationTag tag,
        String label,
        String assignee,
        String message,
        int line,
        int column,
        int commentId,
        int entityId
) {

    /**
     * Format as readable string, e.g. {@code 12:5 TODO Implement validation}.
     */
    public String format() {
        return line + ":" + column + " " + label + (assignee != null ? "(" + assignee + ")" : "") + " " + message;
    }
}
