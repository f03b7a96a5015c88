package org.docweave.extractor.frontend.parser;

import org.docweave.extractor.model.EntityKind;
import org.docweave.extractor.model.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * A declaration recognized by the {@link EntityParser}, before documentation is attached.
 */
public final class EntityNode {

    private int id = -1;
    private final EntityKind kind;
    private final String name;
    private final String signature;
    private final SourceSpan span;
    private final List<EntityNode> children = new ArrayList<>();
    private final List<String> attributes;
    private final List<String> modifiers;

    public EntityNode(EntityKind kind, String name, String signature, SourceSpan span,
                      List<String> attributes, List<String> modifiers) {
        this.kind = kind;
        this.name = name;
        this.signature = signature;
        this.span = span;
        this.attributes = List.copyOf(attributes);
        this.modifiers = List.copyOf(modifiers);
    }

    /**
     * @return The pre-order index, or -1 before {@link #assignIds()} ran on the root.
     */
    public int id() {
        return id;
    }

    public EntityKind kind() {
        return kind;
    }

    /**
     * @return The declared name, or {@code null}.
     */
    public String name() {
        return name;
    }

    public String signature() {
        return signature;
    }

    public SourceSpan span() {
        return span;
    }

    public List<EntityNode> children() {
        return children;
    }

    public List<String> attributes() {
        return attributes;
    }

    public List<String> modifiers() {
        return modifiers;
    }

    void addChild(EntityNode child) {
        children.add(child);
    }

    /**
     * Numbers this node and its descendants in depth-first pre-order, starting at 0.
     * @return The number of nodes in the tree.
     */
    int assignIds() {
        int[] next = {0};
        visit(node -> node.id = next[0]++);
        return next[0];
    }

    /**
     * Visits this node and its descendants in depth-first pre-order.
     * @param visitor The callback.
     */
    public void visit(Consumer<EntityNode> visitor) {
        visitor.accept(this);
        for (EntityNode child : children) {
            child.visit(visitor);
        }
    }

    @Override
    public String toString() {
        return kind + (name != null ? " " + name : "") + " @" + span.format();
    }
}
