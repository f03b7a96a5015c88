package org.docweave.extractor;

import com.typesafe.config.ConfigFactory;
import org.docweave.extractor.api.ExtractionException;
import org.docweave.extractor.config.ExtractorOptions;
import org.docweave.extractor.diagnostics.Diagnostic;
import org.docweave.extractor.diagnostics.DiagnosticCode;
import org.docweave.extractor.frontend.lexer.Token;
import org.docweave.extractor.frontend.lexer.TokenKind;
import org.docweave.extractor.model.Annotation;
import org.docweave.extractor.model.AnnotationTag;
import org.docweave.extractor.model.CommentKind;
import org.docweave.extractor.model.CommentRecord;
import org.docweave.extractor.model.DocTag;
import org.docweave.extractor.model.DocumentModel;
import org.docweave.extractor.model.Entity;
import org.docweave.extractor.model.EntityKind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains end-to-end tests for the {@link DocExtractor}.
 * These tests scan complete source files of every built-in language and verify the resulting model.
 */
public class DocExtractorTest {

    private final DocExtractor extractor = new DocExtractor(BuiltInGrammars.registry(), ExtractorOptions.DEFAULTS);

    private DocumentModel scan(String fixture) throws ExtractionException {
        return extractor.extract(BuiltInGrammars.fixture(fixture), fixture);
    }

    private static Entity only(DocumentModel model, String name) {
        List<Entity> found = model.findEntities(name);
        assertThat(found).as("entities named %s", name).hasSize(1);
        return found.get(0);
    }

    private static List<String> names(List<Entity> entities) {
        return entities.stream().map(Entity::name).toList();
    }

    /**
     * Verifies documentation, inline comments and annotations of the Rust sample.
     */
    @Test
    @Tag("unit")
    void testRustSample() throws ExtractionException {
        // Act
        DocumentModel model = scan("sample.rs");

        // Assert
        assertThat(model.language()).isEqualTo("rust");
        assertThat(model.diagnostics()).isEmpty();

        Entity add = only(model, "add");
        assertThat(add.kind()).isEqualTo(EntityKind.FUNCTION);
        assertThat(add.doc().kind()).isEqualTo(CommentKind.DOC_LINE);
        assertThat(add.doc().text()).startsWith("Doc comment for add function\n\n# Arguments");
        assertThat(add.doc().docTags()).extracting(DocTag::name).containsExactly("arguments", "returns");
        assertThat(add.comments()).extracting(CommentRecord::text)
                .containsExactly("Inline comment", "End of line comment");

        assertThat(model.findEntities("User")).extracting(Entity::kind)
                .containsExactly(EntityKind.STRUCT, EntityKind.IMPL);
        assertThat(model.findEntities("User").get(0).hasDoc()).isFalse();
        assertThat(only(model, "name").doc().text()).isEqualTo("Property comment");
        assertThat(only(model, "MAX_RETRIES").kind()).isEqualTo(EntityKind.CONST);
        assertThat(only(model, "MAX_RETRIES").doc().text()).isEqualTo("Maximum retry attempts");
        assertThat(only(model, "fetch_data").modifiers()).containsExactly("pub", "async");

        assertThat(model.annotations()).extracting(Annotation::tag).containsExactly(AnnotationTag.TODO,
                AnnotationTag.FIXME, AnnotationTag.NOTE, AnnotationTag.HACK, AnnotationTag.XXX, AnnotationTag.BUG);
        Annotation fixme = model.annotations(AnnotationTag.FIXME).get(0);
        assertThat(fixme.entityId()).isEqualTo(only(model, "validate").id());
        assertThat(fixme.message()).isEqualTo("This is a placeholder implementation");
        assertThat(fixme.line()).isEqualTo(36);

        assertThat(names(model.undocumentedEntities())).containsExactly("User", "User", "validate", "process");
        assertThat(names(model.undocumentedEntities(EntityKind.FUNCTION))).containsExactly("validate", "process");
    }

    /**
     * Verifies that Javadoc attaches to classes, fields and constructors, and plain comments do not.
     */
    @Test
    @Tag("unit")
    void testJavaSample() throws ExtractionException {
        // Act
        DocumentModel model = scan("Sample.java");

        // Assert
        List<Entity> sample = model.findEntities("Sample");
        assertThat(sample).extracting(Entity::kind)
                .containsExactly(EntityKind.MODULE, EntityKind.STRUCT, EntityKind.FUNCTION);
        assertThat(sample.get(0)).isEqualTo(model.root());
        assertThat(sample.get(1).doc().text())
                .isEqualTo("JavaDoc comment for User class\nThis class represents a user");
        assertThat(sample.get(2).doc().docTags()).containsExactly(new DocTag("param", "name", "User name"));
        assertThat(only(model, "name").kind()).isEqualTo(EntityKind.FIELD);
        assertThat(only(model, "add").doc().docTags()).extracting(DocTag::name)
                .containsExactly("param", "param", "return");
        assertThat(only(model, "add").modifiers()).containsExactly("public", "static");

        assertThat(names(model.undocumentedEntities())).containsExactly("validate", "process", "MAX_RETRIES");
        assertThat(model.orphanComments().get(0).text()).isEqualTo("Single line comment before class");
        assertThat(model.annotations()).hasSize(6);
    }

    /**
     * Verifies that plain Go comments directly above declarations are documentation.
     */
    @Test
    @Tag("unit")
    void testGoSample() throws ExtractionException {
        // Act
        DocumentModel model = scan("sample.go");

        // Assert
        Entity add = only(model, "Add");
        assertThat(add.doc().kind()).isEqualTo(CommentKind.PLAIN_LINE);
        assertThat(add.doc().text()).isEqualTo("Add performs addition of two integers\nReturns the sum of a and b");
        assertThat(only(model, "User").doc().text()).isEqualTo("Multi-line block comment\ndescribing the User struct");
        assertThat(only(model, "MaxRetries").kind()).isEqualTo(EntityKind.CONST);

        Entity name = only(model, "Name");
        assertThat(name.hasDoc()).isFalse();
        assertThat(name.kind()).isEqualTo(EntityKind.FIELD);
        assertThat(only(model, "User").comments()).extracting(CommentRecord::text).containsExactly("Field comment");

        Annotation todo = model.annotations(AnnotationTag.TODO).get(0);
        assertThat(model.owner(model.comments().get(todo.commentId()))).contains(only(model, "Validate"));
        assertThat(names(model.undocumentedEntities())).containsExactly("Name");
    }

    /**
     * Verifies JSDoc tags and class members in the TypeScript sample.
     */
    @Test
    @Tag("unit")
    void testTypeScriptSample() throws ExtractionException {
        // Act
        DocumentModel model = scan("sample.ts");

        // Assert
        assertThat(only(model, "add").doc().docTags()).containsExactly(
                new DocTag("param", "a", "First number"),
                new DocTag("param", "b", "Second number"),
                new DocTag("returns", "", "Sum of a and b"));
        assertThat(only(model, "fetchData").doc().docTags()).containsExactly(
                new DocTag("async", "", null),
                new DocTag("throws", "{Error}", "When network request fails"));
        assertThat(only(model, "User").children()).extracting(Entity::name)
                .containsExactly("name", "constructor", "validate", "process");
        assertThat(names(model.undocumentedEntities())).containsExactly("User", "validate", "process");
    }

    /**
     * Verifies access sections, constructors with initializer lists and doc lines in the C++ sample.
     */
    @Test
    @Tag("unit")
    void testCppSample() throws ExtractionException {
        // Act
        DocumentModel model = scan("sample.cpp");

        // Assert
        List<Entity> user = model.findEntities("User");
        assertThat(user).extracting(Entity::kind).containsExactly(EntityKind.STRUCT, EntityKind.FUNCTION);
        assertThat(user.get(1).doc().text()).isEqualTo("@brief Constructor comment\n@param name User name");
        assertThat(only(model, "MAX_RETRIES").doc().kind()).isEqualTo(CommentKind.DOC_LINE);
        assertThat(names(model.undocumentedEntities())).containsExactly("User", "validate", "process");
    }

    /**
     * Verifies that an unterminated block comment yields a model with one error and a final comment token.
     */
    @Test
    @Tag("unit")
    void testUnterminatedBlockCommentAtEndOfFile() {
        // Arrange
        String source = "fn a() {}\n/* never closed\nfn b() {}\n";

        // Act
        DocumentModel model = extractor.extract(source, "broken.rs", BuiltInGrammars.get("rust"));

        // Assert
        assertThat(model.diagnostics()).extracting(Diagnostic::code).containsExactly(DiagnosticCode.MALFORMED_COMMENT);
        assertThat(model.hasErrors()).isTrue();
        Token last = model.tokens().get(model.tokens().size() - 1);
        assertThat(last.kind()).isEqualTo(TokenKind.BLOCK_COMMENT);
        assertThat(last.span().endOffset()).isEqualTo(source.length());
        assertThat(names(model.entities())).containsExactly("broken", "a");
        assertThat(model.orphanComments()).hasSize(1);
    }

    /**
     * Verifies that a comment opener inside a fenced raw string neither hides the next doc
     * nor stretches the constant over the following function.
     */
    @Test
    @Tag("unit")
    void testDocAfterFencedRawString() {
        // Arrange
        String source = "const S: &str = r##\"a \"# // c\"##;\n/// doc\nfn h() {}\n";

        // Act
        DocumentModel model = extractor.extract(source, "raw.rs", BuiltInGrammars.get("rust"));

        // Assert
        assertThat(model.diagnostics()).isEmpty();
        assertThat(only(model, "S").hasDoc()).isFalse();
        assertThat(only(model, "S").span().endOffset()).isLessThan(source.indexOf("/// doc"));
        assertThat(only(model, "h").doc().text()).isEqualTo("doc");
        assertThat(model.comments()).singleElement().extracting(CommentRecord::kind).isEqualTo(CommentKind.DOC_LINE);
    }

    /**
     * Verifies that the language can be chosen by tag, by file extension or from bytes.
     */
    @Test
    @Tag("unit")
    void testLanguageSelection() throws ExtractionException {
        // Arrange
        String source = "/** Doc. */\nclass A {}\n";

        // Act
        DocumentModel byTag = extractor.extract(source, "A.txt", "Java");
        DocumentModel byExtension = extractor.extract(source, "src/A.java");
        DocumentModel fromBytes = extractor.extract(source.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8,
                "A.java", BuiltInGrammars.get("java"));

        // Assert
        assertThat(byTag.language()).isEqualTo("java");
        assertThat(byExtension.root()).isEqualTo(byTag.root());
        assertThat(fromBytes.comments()).isEqualTo(byExtension.comments());
    }

    /**
     * Verifies that unknown languages and extensions are rejected with a checked exception.
     */
    @Test
    @Tag("unit")
    void testUnknownLanguageIsRejected() {
        assertThatThrownBy(() -> extractor.extract("x", "a.txt", "cobol"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("cobol")
                .hasMessageContaining("rust");
        assertThatThrownBy(() -> extractor.extract("x", "notes.txt"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("notes.txt");
    }

    /**
     * Verifies that custom keywords from the configuration reach the tagger.
     */
    @Test
    @Tag("unit")
    void testCustomTagsFromConfig() {
        // Arrange
        DocExtractor configured = new DocExtractor(ConfigFactory.parseString("docweave.tags.custom = [SAFETY]")
                .withFallback(ConfigFactory.defaultReference()).resolve());

        // Act
        DocumentModel model = configured.extract("// SAFETY: checked above\nfn a() {}\n", "a.rs",
                configured.grammars().find("rust").orElseThrow());

        // Assert
        assertThat(model.annotationsLabeled("SAFETY")).singleElement()
                .extracting(Annotation::tag).isEqualTo(AnnotationTag.CUSTOM);
    }
}
