package org.docweave.extractor.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A recognized declaration and its documentation.
 *
 * @param id The depth-first pre-order index; the root module is 0.
 * @param kind The declaration kind.
 * @param name The declared name, or {@code null} when none was recognized.
 * @param signature The declaration header with comments removed and whitespace collapsed.
 * @param span The location, attributes excluded.
 * @param doc The attached documentation, or {@code null}.
 * @param children The nested declarations ordered by start offset.
 * @param comments The comments inside this entity that belong to no child, in source order.
 * @param attributes The attribute markers in front of the declaration, e.g. {@code #[test]}.
 * @param modifiers The modifier words of the declaration, e.g. {@code pub}.
 */
public record Entity(
        int id,
        EntityKind kind,
        String name,
        String signature,
        SourceSpan span,
        CommentRecord doc,
        List<Entity> children,
        List<CommentRecord> comments,
        List<String> attributes,
        List<String> modifiers
) {

    public Entity {
        children = List.copyOf(children);
        comments = List.copyOf(comments);
        attributes = List.copyOf(attributes);
        modifiers = List.copyOf(modifiers);
    }

    public Optional<CommentRecord> docComment() {
        return Optional.ofNullable(doc);
    }

    public boolean hasDoc() {
        return doc != null;
    }

    /**
     * @return This entity followed by all descendants, depth-first in pre-order.
     */
    public Stream<Entity> stream() {
        return Stream.concat(Stream.of(this), children.stream().flatMap(Entity::stream));
    }

    @Override
    public String toString() {
        return kind + (name != null ? " " + name : "") + " @" + span.format();
    }
}
