package org.docweave.extractor.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.docweave.extractor.config.ExtractorOptions;
import org.docweave.extractor.diagnostics.Diagnostic;
import org.docweave.extractor.frontend.lexer.Token;
import org.docweave.extractor.model.Annotation;
import org.docweave.extractor.model.CommentRecord;
import org.docweave.extractor.model.DocTag;
import org.docweave.extractor.model.DocumentModel;
import org.docweave.extractor.model.Entity;
import org.docweave.extractor.model.SourceSpan;

import java.io.IOException;
import java.io.Writer;

/**
 * Serializes a {@link DocumentModel} to a nested JSON tree.
 * <p>
 * The tree keeps entity kinds, names, line/column spans, stripped and raw doc text, child order,
 * annotations with their positions, and diagnostics. Tokens are only written when enabled.
 */
public class DocumentModelJsonWriter {

    private final ObjectMapper objectMapper;
    private final boolean includeTokens;

    public DocumentModelJsonWriter(ExtractorOptions options) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(SerializationFeature.INDENT_OUTPUT, options.prettyJson());
        this.includeTokens = options.includeTokens();
    }

    /**
     * @param model The model to convert.
     * @return The JSON tree of the model.
     */
    public ObjectNode toTree(DocumentModel model) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("file", model.fileName());
        json.put("language", model.language());
        json.set("root", entity(model.root()));

        ArrayNode annotations = json.putArray("annotations");
        model.annotations().forEach(a -> annotations.add(annotation(a)));
        ArrayNode diagnostics = json.putArray("diagnostics");
        model.diagnostics().forEach(d -> diagnostics.add(diagnostic(d)));
        if (includeTokens) {
            ArrayNode tokens = json.putArray("tokens");
            model.tokens().forEach(t -> tokens.add(token(t)));
        }
        return json;
    }

    /**
     * @param model The model to serialize.
     * @return The JSON text.
     * @throws JsonProcessingException if serialization fails.
     */
    public String toJson(DocumentModel model) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toTree(model));
    }

    /**
     * @param model The model to serialize.
     * @param writer The destination; it is not closed.
     * @throws IOException if writing fails.
     */
    public void write(DocumentModel model, Writer writer) throws IOException {
        objectMapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValue(writer, toTree(model));
    }

    private ObjectNode entity(Entity entity) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("id", entity.id());
        json.put("kind", entity.kind().name());
        if (entity.name() != null) {
            json.put("name", entity.name());
        }
        json.put("signature", entity.signature());
        json.set("span", span(entity.span()));
        if (!entity.modifiers().isEmpty()) {
            ArrayNode modifiers = json.putArray("modifiers");
            entity.modifiers().forEach(modifiers::add);
        }
        if (!entity.attributes().isEmpty()) {
            ArrayNode attributes = json.putArray("attributes");
            entity.attributes().forEach(attributes::add);
        }
        entity.docComment().ifPresent(doc -> json.set("doc", comment(doc)));
        if (!entity.comments().isEmpty()) {
            ArrayNode comments = json.putArray("comments");
            entity.comments().forEach(c -> comments.add(comment(c)));
        }
        ArrayNode children = json.putArray("children");
        entity.children().forEach(child -> children.add(entity(child)));
        return json;
    }

    private ObjectNode comment(CommentRecord comment) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("id", comment.id());
        json.put("kind", comment.kind().name());
        json.set("span", span(comment.span()));
        json.put("text", comment.text());
        json.put("raw", comment.rawText());
        if (!comment.docTags().isEmpty()) {
            ArrayNode tags = json.putArray("tags");
            for (DocTag tag : comment.docTags()) {
                ObjectNode node = tags.addObject();
                node.put("name", tag.name());
                node.put("value", tag.value());
                if (tag.description() != null) {
                    node.put("description", tag.description());
                }
            }
        }
        return json;
    }

    private ObjectNode annotation(Annotation annotation) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("tag", annotation.tag().name());
        json.put("label", annotation.label());
        if (annotation.assignee() != null) {
            json.put("assignee", annotation.assignee());
        }
        json.put("message", annotation.message());
        json.put("line", annotation.line());
        json.put("column", annotation.column());
        json.put("comment", annotation.commentId());
        json.put("entity", annotation.entityId());
        return json;
    }

    private ObjectNode diagnostic(Diagnostic diagnostic) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("type", diagnostic.type().name());
        json.put("code", diagnostic.code().name());
        json.put("message", diagnostic.message());
        json.put("line", diagnostic.lineNumber());
        json.put("column", diagnostic.columnNumber());
        return json;
    }

    private ObjectNode token(Token token) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("kind", token.kind().name());
        json.set("span", span(token.span()));
        return json;
    }

    private ObjectNode span(SourceSpan span) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("startLine", span.startLine());
        json.put("startColumn", span.startColumn());
        json.put("endLine", span.endLine());
        json.put("endColumn", span.endColumn());
        return json;
    }
}
