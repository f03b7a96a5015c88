package org.docweave.extractor.frontend.association;

import org.docweave.extractor.frontend.classifier.CommentDraft;
import org.docweave.extractor.frontend.parser.AttributeMarker;
import org.docweave.extractor.frontend.parser.EntityNode;
import org.docweave.extractor.frontend.parser.ParsedSkeleton;
import org.docweave.extractor.grammar.GrammarDescriptor;
import org.docweave.extractor.model.CommentKind;
import org.docweave.extractor.model.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Binds classified comments to the entity skeleton.
 * <p>
 * A documentation comment attaches to the first declaration of its container that starts after it,
 * when the comment starts its own line and only whitespace and attribute markers, without a blank
 * line, separate the two. Every other comment is filed in the inline list of the deepest entity
 * containing it. Module documentation always belongs to the root.
 */
public class Associator {

    private static final Logger LOG = LoggerFactory.getLogger(Associator.class);
    private static final Pattern BLANK_LINE = Pattern.compile("\\n[ \\t\\r\\f]*\\n");
    private static final char ATTRIBUTE_MASK = '\0';

    private final String source;
    private final GrammarDescriptor grammar;

    /**
     * @param source The source text the comments and entities were read from.
     * @param grammar The grammar, deciding whether plain comments may document a declaration.
     */
    public Associator(String source, GrammarDescriptor grammar) {
        this.source = source;
        this.grammar = grammar;
    }

    /**
     * Sets the owner or container of every draft.
     *
     * @param comments The classified comments of the file, in source order.
     * @param skeleton The parsed entity skeleton of the same file.
     */
    public void associate(List<CommentDraft> comments, ParsedSkeleton skeleton) {
        EntityNode root = skeleton.root();
        String masked = maskAttributes(skeleton.attributes());
        Set<Integer> documented = new HashSet<>();
        int attached = 0;

        for (CommentDraft comment : comments) {
            if (comment.kind() == CommentKind.MODULE_DOC) {
                if (documented.add(root.id())) {
                    comment.attachTo(root.id());
                    attached++;
                } else {
                    comment.fileUnder(root.id());
                }
                continue;
            }
            EntityNode container = container(root, comment.span());
            EntityNode target = isDocCandidate(comment) ? target(container, comment.span(), masked) : null;
            if (target != null && documented.add(target.id())) {
                comment.attachTo(target.id());
                attached++;
            } else {
                comment.fileUnder(container.id());
            }
        }
        LOG.debug("Attached {} of {} comments as documentation", attached, comments.size());
    }

    private boolean isDocCandidate(CommentDraft comment) {
        return comment.kind().isDoc() || grammar.plainCommentsCountAsDoc();
    }

    /**
     * @return The deepest entity whose span contains the comment.
     */
    static EntityNode container(EntityNode node, SourceSpan span) {
        for (EntityNode child : node.children()) {
            if (child.span().startOffset() > span.startOffset()) {
                break;
            }
            if (child.span().contains(span)) {
                return container(child, span);
            }
        }
        return node;
    }

    private EntityNode target(EntityNode container, SourceSpan comment, String masked) {
        if (!startsLine(comment.startOffset())) {
            return null;
        }
        for (EntityNode child : container.children()) {
            if (child.span().startOffset() >= comment.endOffset()) {
                return isContiguous(masked.substring(comment.endOffset(), child.span().startOffset())) ? child : null;
            }
        }
        return null;
    }

    /**
     * The gap may hold whitespace and attribute markers only, and no blank line.
     */
    private static boolean isContiguous(String gap) {
        for (int i = 0; i < gap.length(); i++) {
            char c = gap.charAt(i);
            if (c != ATTRIBUTE_MASK && !Character.isWhitespace(c)) {
                return false;
            }
        }
        return !BLANK_LINE.matcher(gap).find();
    }

    private boolean startsLine(int offset) {
        for (int i = offset - 1; i >= 0 && source.charAt(i) != '\n'; i--) {
            if (!Character.isWhitespace(source.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private String maskAttributes(List<AttributeMarker> attributes) {
        StringBuilder masked = new StringBuilder(source);
        for (AttributeMarker attribute : attributes) {
            for (int i = attribute.span().startOffset(); i < attribute.span().endOffset(); i++) {
                if (masked.charAt(i) != '\n') {
                    masked.setCharAt(i, ATTRIBUTE_MASK);
                }
            }
        }
        return masked.toString();
    }
}
