package org.docweave.extractor.frontend.classifier;

import org.docweave.extractor.frontend.lexer.TokenKind;
import org.docweave.extractor.model.Annotation;
import org.docweave.extractor.model.CommentKind;
import org.docweave.extractor.model.CommentRecord;
import org.docweave.extractor.model.DocTag;
import org.docweave.extractor.model.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * A classified comment (or merged run of line comments) during one scan.
 * <p>
 * The association and tagging phases fill in the owner, container, annotations and doc tags;
 * the model builder then freezes the draft into a {@link org.docweave.extractor.model.CommentRecord}.
 */
public final class CommentDraft {

    /** Marks an unset entity reference. */
    public static final int NO_ENTITY = CommentRecord.NO_ENTITY;

    private final int id;
    private final CommentKind kind;
    private final TokenKind tokenKind;
    private final SourceSpan span;
    private final String rawText;
    private final String text;
    private int ownerId = NO_ENTITY;
    private int containerId = NO_ENTITY;
    private final List<Annotation> annotations = new ArrayList<>();
    private final List<DocTag> docTags = new ArrayList<>();

    public CommentDraft(int id, CommentKind kind, TokenKind tokenKind, SourceSpan span, String rawText, String text) {
        this.id = id;
        this.kind = kind;
        this.tokenKind = tokenKind;
        this.span = span;
        this.rawText = rawText;
        this.text = text;
    }

    public int id() {
        return id;
    }

    public CommentKind kind() {
        return kind;
    }

    /**
     * @return {@link TokenKind#LINE_COMMENT} or {@link TokenKind#BLOCK_COMMENT}.
     */
    public TokenKind tokenKind() {
        return tokenKind;
    }

    public SourceSpan span() {
        return span;
    }

    public String rawText() {
        return rawText;
    }

    public String text() {
        return text;
    }

    public int ownerId() {
        return ownerId;
    }

    public int containerId() {
        return containerId;
    }

    /**
     * Attaches this comment as the documentation of an entity.
     * @param entityId The documented entity.
     */
    public void attachTo(int entityId) {
        this.ownerId = entityId;
        this.containerId = NO_ENTITY;
    }

    /**
     * Files this comment in the inline list of an entity.
     * @param entityId The enclosing entity.
     */
    public void fileUnder(int entityId) {
        this.ownerId = NO_ENTITY;
        this.containerId = entityId;
    }

    /**
     * @return The owner if attached, otherwise the container.
     */
    public int entityId() {
        return ownerId != NO_ENTITY ? ownerId : containerId;
    }

    public List<Annotation> annotations() {
        return annotations;
    }

    public List<DocTag> docTags() {
        return docTags;
    }

    @Override
    public String toString() {
        return kind + "#" + id + "@" + span.format();
    }
}
