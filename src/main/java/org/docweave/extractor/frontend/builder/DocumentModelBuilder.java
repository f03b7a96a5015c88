package org.docweave.extractor.frontend.builder;

import org.docweave.extractor.diagnostics.Diagnostic;
import org.docweave.extractor.frontend.classifier.CommentDraft;
import org.docweave.extractor.frontend.lexer.Token;
import org.docweave.extractor.frontend.parser.EntityNode;
import org.docweave.extractor.model.Annotation;
import org.docweave.extractor.model.CommentRecord;
import org.docweave.extractor.model.DocumentModel;
import org.docweave.extractor.model.Entity;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Freezes the drafts and the entity skeleton of one scan into an immutable {@link DocumentModel}.
 */
public class DocumentModelBuilder {

    private final String fileName;
    private final String language;

    public DocumentModelBuilder(String fileName, String language) {
        this.fileName = fileName;
        this.language = language;
    }

    /**
     * Assembles the model.
     *
     * @param root The associated entity skeleton.
     * @param drafts The tagged comment drafts, in source order.
     * @param tokens The tokens of the file.
     * @param diagnostics The diagnostics of the scan.
     * @return The document model.
     */
    public DocumentModel build(EntityNode root, List<CommentDraft> drafts, List<Token> tokens, List<Diagnostic> diagnostics) {
        List<CommentRecord> comments = new ArrayList<>(drafts.size());
        List<Annotation> annotations = new ArrayList<>();
        Map<Integer, CommentRecord> docs = new HashMap<>();
        Map<Integer, List<CommentRecord>> inline = new HashMap<>();

        for (CommentDraft draft : drafts) {
            CommentRecord record = new CommentRecord(draft.id(), draft.kind(), draft.span(), draft.rawText(), draft.text(),
                    draft.ownerId(), draft.containerId(), draft.annotations(), draft.docTags());
            comments.add(record);
            annotations.addAll(record.annotations());
            if (!record.isOrphan()) {
                docs.put(record.ownerId(), record);
            } else {
                inline.computeIfAbsent(record.containerId(), id -> new ArrayList<>()).add(record);
            }
        }
        return new DocumentModel(fileName, language, freeze(root, docs, inline), comments, annotations, tokens, diagnostics);
    }

    private static Entity freeze(EntityNode node, Map<Integer, CommentRecord> docs, Map<Integer, List<CommentRecord>> inline) {
        List<Entity> children = new ArrayList<>(node.children().size());
        for (EntityNode child : node.children()) {
            children.add(freeze(child, docs, inline));
        }
        return new Entity(node.id(), node.kind(), node.name(), node.signature(), node.span(), docs.get(node.id()),
                children, inline.getOrDefault(node.id(), List.of()), node.attributes(), node.modifiers());
    }
}
