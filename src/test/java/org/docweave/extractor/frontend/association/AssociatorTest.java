package org.docweave.extractor.frontend.association;

import org.docweave.extractor.BuiltInGrammars;
import org.docweave.extractor.diagnostics.DiagnosticsEngine;
import org.docweave.extractor.frontend.classifier.CommentClassifier;
import org.docweave.extractor.frontend.classifier.CommentDraft;
import org.docweave.extractor.frontend.lexer.Lexer;
import org.docweave.extractor.frontend.lexer.Token;
import org.docweave.extractor.frontend.parser.EntityNode;
import org.docweave.extractor.frontend.parser.EntityParser;
import org.docweave.extractor.frontend.parser.ParsedSkeleton;
import org.docweave.extractor.grammar.GrammarDescriptor;
import org.docweave.extractor.model.CommentKind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Associator}.
 * These tests verify the contiguity rule that binds documentation to declarations and the
 * filing of all other comments under their innermost enclosing entity.
 */
public class AssociatorTest {

    private record Associated(EntityNode root, List<CommentDraft> comments) {

        int idOf(String name) {
            List<EntityNode> matches = new ArrayList<>();
            root.visit(node -> {
                if (name.equals(node.name())) {
                    matches.add(node);
                }
            });
            assertThat(matches).as("entities named %s", name).hasSize(1);
            return matches.get(0).id();
        }
    }

    private static Associated associate(String source, String language) {
        GrammarDescriptor grammar = BuiltInGrammars.get(language);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, grammar, diagnostics).scanTokens();
        List<CommentDraft> comments = new CommentClassifier(grammar).collect(tokens);
        ParsedSkeleton skeleton = new EntityParser(source, grammar, diagnostics, "test").parse(tokens);
        new Associator(source, grammar).associate(comments, skeleton);
        return new Associated(skeleton.root(), comments);
    }

    /**
     * Verifies that a doc line run directly above a function becomes its documentation.
     */
    @Test
    @Tag("unit")
    void testDocRunAttachesToFollowingFunction() {
        // Act
        Associated result = associate("/// Doc comment\n/// more\npub fn add(a: i32, b: i32) -> i32 { a + b }\n", "rust");

        // Assert
        CommentDraft doc = result.comments().get(0);
        assertThat(doc.ownerId()).isEqualTo(result.idOf("add"));
        assertThat(doc.containerId()).isEqualTo(CommentDraft.NO_ENTITY);
        assertThat(doc.text()).isEqualTo("Doc comment\nmore");
    }

    /**
     * Verifies that a plain block comment documents a declaration only in a grammar that counts
     * plain comments as documentation.
     */
    @Test
    @Tag("unit")
    void testPlainBlockAttachesOnlyWhereGrammarAllowsIt() {
        // Arrange
        String comment = "/*\n * Multi-line block comment\n * describing the User struct\n */\n";

        // Act
        Associated go = associate(comment + "type User struct {\n\tName string\n}\n", "go");
        Associated rust = associate(comment + "pub struct User { name: String }\n", "rust");

        // Assert
        assertThat(go.comments().get(0).kind()).isEqualTo(CommentKind.PLAIN_BLOCK);
        assertThat(go.comments().get(0).ownerId()).isEqualTo(go.idOf("User"));
        assertThat(rust.comments().get(0).kind()).isEqualTo(CommentKind.PLAIN_BLOCK);
        assertThat(rust.comments().get(0).ownerId()).isEqualTo(CommentDraft.NO_ENTITY);
        assertThat(rust.comments().get(0).containerId()).isZero();
    }

    /**
     * Verifies that a comment inside a method body is filed under that method.
     */
    @Test
    @Tag("unit")
    void testInlineCommentIsFiledUnderEnclosingMethod() {
        // Arrange
        String source = """
                impl User {
                    pub fn validate(&self) -> bool {
                        // TODO: Implement validation
                        true
                    }
                }
                """;

        // Act
        Associated result = associate(source, "rust");

        // Assert
        CommentDraft todo = result.comments().get(0);
        assertThat(todo.ownerId()).isEqualTo(CommentDraft.NO_ENTITY);
        assertThat(todo.containerId()).isEqualTo(result.idOf("validate"));
    }

    /**
     * Verifies that attribute lines between documentation and declaration do not break the run.
     */
    @Test
    @Tag("unit")
    void testAttributeLinesAreSkipped() {
        // Arrange
        String rust = "#[derive(Debug)]\n/// A point\n#[repr(C)]\npub struct Point { x: i32 }\n";
        String java = "class A {\n    /** Renders it. */\n    @Override\n    public String toString() { return \"\"; }\n}\n";

        // Act
        Associated rustResult = associate(rust, "rust");
        Associated javaResult = associate(java, "java");

        // Assert
        assertThat(rustResult.comments().get(0).ownerId()).isEqualTo(rustResult.idOf("Point"));
        assertThat(javaResult.comments().get(0).ownerId()).isEqualTo(javaResult.idOf("toString"));
    }

    /**
     * Verifies that a blank line between documentation and declaration prevents attachment,
     * and that only the nearest run attaches.
     */
    @Test
    @Tag("unit")
    void testBlankLineBreaksContiguity() {
        // Act
        Associated separated = associate("/// doc\n\nfn a() {}\n", "rust");
        Associated twoRuns = associate("/// first\n\n/// second\nfn a() {}\n", "rust");

        // Assert
        assertThat(separated.comments().get(0).ownerId()).isEqualTo(CommentDraft.NO_ENTITY);
        assertThat(separated.comments().get(0).containerId()).isZero();
        assertThat(twoRuns.comments()).extracting(CommentDraft::ownerId)
                .containsExactly(CommentDraft.NO_ENTITY, twoRuns.idOf("a"));
    }

    /**
     * Verifies that another comment between documentation and declaration prevents attachment.
     */
    @Test
    @Tag("unit")
    void testInterveningCommentBreaksContiguity() {
        // Act
        Associated result = associate("/// doc\n// plain\nfn a() {}\n", "rust");

        // Assert
        assertThat(result.comments()).extracting(CommentDraft::ownerId)
                .containsOnly(CommentDraft.NO_ENTITY);
        assertThat(result.comments()).extracting(CommentDraft::containerId).containsOnly(0);
    }

    /**
     * Verifies that the first module documentation belongs to the root and later ones are filed under it.
     */
    @Test
    @Tag("unit")
    void testModuleDocBelongsToRoot() {
        // Act
        Associated result = associate("//! Crate doc\n//! more\n\n/// fn doc\nfn a() {}\n/*! late */\n", "rust");

        // Assert
        assertThat(result.comments()).extracting(CommentDraft::kind)
                .containsExactly(CommentKind.MODULE_DOC, CommentKind.DOC_LINE, CommentKind.MODULE_DOC);
        assertThat(result.comments().get(0).ownerId()).isZero();
        assertThat(result.comments().get(1).ownerId()).isEqualTo(result.idOf("a"));
        assertThat(result.comments().get(2).ownerId()).isEqualTo(CommentDraft.NO_ENTITY);
        assertThat(result.comments().get(2).containerId()).isZero();
    }

    /**
     * Verifies that documentation at the end of the file with nothing to document stays an orphan.
     */
    @Test
    @Tag("unit")
    void testDanglingDocAtEndOfFile() {
        // Act
        Associated result = associate("fn a() {}\n/// dangling\n", "rust");

        // Assert
        assertThat(result.comments().get(0).ownerId()).isEqualTo(CommentDraft.NO_ENTITY);
        assertThat(result.comments().get(0).containerId()).isZero();
    }

    /**
     * Verifies that documentation inside a struct attaches to the following field.
     */
    @Test
    @Tag("unit")
    void testFieldDocumentation() {
        // Act
        Associated result = associate("pub struct User {\n    /// Property comment\n    pub name: String,\n}\n", "rust");

        // Assert
        assertThat(result.comments().get(0).ownerId()).isEqualTo(result.idOf("name"));
    }

    /**
     * Verifies that a comment trailing code on the same line never documents the next declaration.
     */
    @Test
    @Tag("unit")
    void testTrailingCommentIsNotDocumentation() {
        // Act
        Associated go = associate("package main\n\nvar x = 1 // counter\nfunc Next() {}\n", "go");

        // Assert
        assertThat(go.comments().get(0).ownerId()).isEqualTo(CommentDraft.NO_ENTITY);
    }

    /**
     * Verifies that a plain Go comment directly above a function documents it.
     */
    @Test
    @Tag("unit")
    void testGoPlainLineCommentIsDocumentation() {
        // Act
        Associated result = associate("package main\n\n// Greet says hi.\nfunc Greet() {}\n", "go");

        // Assert
        assertThat(result.comments().get(0).kind()).isEqualTo(CommentKind.PLAIN_LINE);
        assertThat(result.comments().get(0).ownerId()).isEqualTo(result.idOf("Greet"));
    }
}
