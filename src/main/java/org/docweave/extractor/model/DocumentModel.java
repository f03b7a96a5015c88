package org.docweave.extractor.model;

import org.docweave.extractor.diagnostics.Diagnostic;
import org.docweave.extractor.frontend.lexer.Token;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * The result of scanning one file: the entity tree, its comments and annotations, and the
 * diagnostics collected on the way. The model is immutable and can be shared between threads.
 *
 * @param fileName The file name given to the scan.
 * @param language The name of the grammar used.
 * @param root The root module spanning the whole file.
 * @param comments All comments in source order; a comment's id is its index.
 * @param annotations All annotations in source order.
 * @param tokens The tokens of the file.
 * @param diagnostics Problems found while scanning.
 */
public record DocumentModel(
        String fileName,
        String language,
        Entity root,
        List<CommentRecord> comments,
        List<Annotation> annotations,
        List<Token> tokens,
        List<Diagnostic> diagnostics
) {

    public DocumentModel {
        comments = List.copyOf(comments);
        annotations = List.copyOf(annotations);
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return All entities, depth-first in pre-order; the index of an entity equals its id.
     */
    public List<Entity> entities() {
        return root.stream().toList();
    }

    public Stream<Entity> stream() {
        return root.stream();
    }

    /**
     * @param id An entity id.
     * @return The entity, if the id exists.
     */
    public Optional<Entity> entity(int id) {
        return id < 0 ? Optional.empty() : root.stream().filter(e -> e.id() == id).findFirst();
    }

    /**
     * @param name A declared name.
     * @return All entities declaring this name, in pre-order.
     */
    public List<Entity> findEntities(String name) {
        return root.stream().filter(e -> name.equals(e.name())).toList();
    }

    /**
     * Lists the declarations that lack documentation. The root module and unrecognized
     * constructs are never reported.
     *
     * @return The undocumented entities in pre-order.
     */
    public List<Entity> undocumentedEntities() {
        return undocumentedEntities(EnumSet.complementOf(EnumSet.of(EntityKind.UNKNOWN)));
    }

    /**
     * @param kinds The kinds to report, e.g. {@code FUNCTION} and {@code STRUCT}.
     * @return The undocumented, non-root entities of these kinds in pre-order.
     */
    public List<Entity> undocumentedEntities(Set<EntityKind> kinds) {
        return root.stream()
                .filter(e -> e != root && !e.hasDoc() && kinds.contains(e.kind()))
                .toList();
    }

    /**
     * @param kinds The kinds to report.
     * @return The undocumented, non-root entities of these kinds in pre-order.
     */
    public List<Entity> undocumentedEntities(EntityKind... kinds) {
        return undocumentedEntities(kinds.length == 0 ? EnumSet.noneOf(EntityKind.class) : EnumSet.copyOf(Arrays.asList(kinds)));
    }

    public List<Annotation> annotations(AnnotationTag tag) {
        return annotations.stream().filter(a -> a.tag() == tag).toList();
    }

    /**
     * @param label A keyword as written, e.g. {@code TODO} or a custom keyword.
     * @return The annotations with this label.
     */
    public List<Annotation> annotationsLabeled(String label) {
        return annotations.stream().filter(a -> a.label().equals(label)).toList();
    }

    /**
     * @return The comments that document no entity, in source order.
     */
    public List<CommentRecord> orphanComments() {
        return comments.stream().filter(CommentRecord::isOrphan).toList();
    }

    /**
     * @param comment A comment of this model.
     * @return The entity the comment documents, if any.
     */
    public Optional<Entity> owner(CommentRecord comment) {
        return entity(comment.ownerId());
    }

    /**
     * @param comment A comment of this model.
     * @return The entity whose inline list holds the comment, if it is an orphan.
     */
    public Optional<Entity> container(CommentRecord comment) {
        return entity(comment.containerId());
    }

    /**
     * @return {@code true} if the scan reported at least one error.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }
}
