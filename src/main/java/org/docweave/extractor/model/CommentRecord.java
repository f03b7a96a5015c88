package org.docweave.extractor.model;

import java.util.List;

/**
 * A comment, or a merged run of line comments, of one scanned file.
 *
 * @param id The index of the comment in source order.
 * @param kind The classified kind.
 * @param span The location, from the first marker to the end of the last line or the closer.
 * @param rawText The source text verbatim, markers included.
 * @param text The text with comment markers stripped.
 * @param ownerId The entity this comment documents, or {@link #NO_ENTITY} if it is an orphan.
 * @param containerId The entity whose inline list holds this comment, or {@link #NO_ENTITY} if it is a doc.
 * @param annotations The tagged notes found in the comment.
 * @param docTags The structured documentation tags, only extracted for documentation.
 */
public record CommentRecord(
        int id,
        CommentKind kind,
        SourceSpan span,
        String rawText,
        String text,
        int ownerId,
        int containerId,
        List<Annotation> annotations,
        List<DocTag> docTags
) {

    public static final int NO_ENTITY = -1;

    public CommentRecord {
        annotations = List.copyOf(annotations);
        docTags = List.copyOf(docTags);
    }

    /**
     * @return {@code true} if the comment documents no entity.
     */
    public boolean isOrphan() {
        return ownerId == NO_ENTITY;
    }
}
