package org.docweave.extractor.frontend.classifier;

import org.docweave.extractor.BuiltInGrammars;
import org.docweave.extractor.diagnostics.DiagnosticsEngine;
import org.docweave.extractor.frontend.lexer.Lexer;
import org.docweave.extractor.frontend.lexer.Token;
import org.docweave.extractor.frontend.lexer.TokenKind;
import org.docweave.extractor.model.CommentKind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link CommentClassifier}.
 * These tests verify the marker rules, the merging of line comment runs and marker stripping.
 */
public class CommentClassifierTest {

    private static List<Token> tokens(String source, String language) {
        return new Lexer(source, BuiltInGrammars.get(language), new DiagnosticsEngine()).scanTokens();
    }

    private static CommentKind classify(String comment, String language) {
        Token token = tokens(comment, language).get(0);
        return new CommentClassifier(BuiltInGrammars.get(language)).classify(token);
    }

    private static List<CommentDraft> collect(String source, String language) {
        return new CommentClassifier(BuiltInGrammars.get(language)).collect(tokens(source, language));
    }

    /**
     * Verifies the rule order for Rust markers, including the repeated-character exceptions.
     */
    @Test
    @Tag("unit")
    void testRustMarkers() {
        assertThat(classify("// plain", "rust")).isEqualTo(CommentKind.PLAIN_LINE);
        assertThat(classify("/// doc", "rust")).isEqualTo(CommentKind.DOC_LINE);
        assertThat(classify("//// separator", "rust")).isEqualTo(CommentKind.PLAIN_LINE);
        assertThat(classify("//! crate doc", "rust")).isEqualTo(CommentKind.MODULE_DOC);
        assertThat(classify("/* plain */", "rust")).isEqualTo(CommentKind.PLAIN_BLOCK);
        assertThat(classify("/** doc */", "rust")).isEqualTo(CommentKind.DOC_BLOCK);
        assertThat(classify("/*** banner */", "rust")).isEqualTo(CommentKind.PLAIN_BLOCK);
        assertThat(classify("/**/", "rust")).isEqualTo(CommentKind.PLAIN_BLOCK);
        assertThat(classify("/*! crate doc */", "rust")).isEqualTo(CommentKind.MODULE_DOC);
    }

    /**
     * Verifies that a grammar without doc line markers keeps {@code ///} plain.
     */
    @Test
    @Tag("unit")
    void testJavaHasNoDocLineMarker() {
        assertThat(classify("/// not javadoc", "java")).isEqualTo(CommentKind.PLAIN_LINE);
        assertThat(classify("/** javadoc */", "java")).isEqualTo(CommentKind.DOC_BLOCK);
    }

    /**
     * Verifies that classifying a code token is rejected.
     */
    @Test
    @Tag("unit")
    void testClassifyRejectsNonComments() {
        // Arrange
        Token code = tokens("fn a() {}", "rust").get(0);
        CommentClassifier classifier = new CommentClassifier(BuiltInGrammars.get("rust"));

        // Act & Assert
        assertThatThrownBy(() -> classifier.classify(code)).isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Verifies that consecutive doc lines are merged into one draft with stripped text.
     */
    @Test
    @Tag("unit")
    void testDocLineRunIsMerged() {
        // Arrange
        String source = "    /// Doc comment\n    /// more\n    pub fn add() {}";

        // Act
        List<CommentDraft> drafts = collect(source, "rust");

        // Assert
        assertThat(drafts).hasSize(1);
        CommentDraft draft = drafts.get(0);
        assertThat(draft.kind()).isEqualTo(CommentKind.DOC_LINE);
        assertThat(draft.text()).isEqualTo("Doc comment\nmore");
        assertThat(draft.rawText()).isEqualTo("/// Doc comment\n    /// more");
        assertThat(draft.span().startLine()).isEqualTo(1);
        assertThat(draft.span().endLine()).isEqualTo(2);
    }

    /**
     * Verifies that a blank line or a change of kind starts a new run.
     */
    @Test
    @Tag("unit")
    void testRunsSplitOnBlankLineAndKindChange() {
        // Arrange
        String source = "/// a\n\n/// b\n// c\n// d\n";

        // Act
        List<CommentDraft> drafts = collect(source, "rust");

        // Assert
        assertThat(drafts).extracting(CommentDraft::kind)
                .containsExactly(CommentKind.DOC_LINE, CommentKind.DOC_LINE, CommentKind.PLAIN_LINE);
        assertThat(drafts).extracting(CommentDraft::text).containsExactly("a", "b", "c\nd");
        assertThat(drafts).extracting(CommentDraft::id).containsExactly(0, 1, 2);
    }

    /**
     * Verifies that a comment trailing code is not merged with a comment on the next line
     * when code separates them.
     */
    @Test
    @Tag("unit")
    void testLineCommentsSeparatedByCodeAreNotMerged() {
        // Act
        List<CommentDraft> drafts = collect("// a\nint x; // b\n", "c");

        // Assert
        assertThat(drafts).extracting(CommentDraft::text).containsExactly("a", "b");
    }

    /**
     * Verifies the stripping of a starred Javadoc block.
     */
    @Test
    @Tag("unit")
    void testStarredBlockIsStripped() {
        // Arrange
        String source = "/**\n * First line\n *   indented\n *\n * Last line\n */";

        // Act
        CommentDraft draft = collect(source, "java").get(0);

        // Assert
        assertThat(draft.kind()).isEqualTo(CommentKind.DOC_BLOCK);
        assertThat(draft.text()).isEqualTo("First line\n  indented\n\nLast line");
        assertThat(draft.rawText()).isEqualTo(source);
    }

    /**
     * Verifies the stripping of a block without decoration and of a one-line block.
     */
    @Test
    @Tag("unit")
    void testUndecoratedAndOneLineBlocks() {
        // Act
        CommentDraft go = collect("/*\nMulti-line block comment\ndescribing the User struct\n*/", "go").get(0);
        CommentDraft single = collect("/* Implementation here */", "go").get(0);
        CommentDraft empty = collect("/**/", "java").get(0);

        // Assert
        assertThat(go.text()).isEqualTo("Multi-line block comment\ndescribing the User struct");
        assertThat(single.text()).isEqualTo("Implementation here");
        assertThat(empty.text()).isEmpty();
    }

    /**
     * Verifies that the physical lines report where their content starts in the raw text.
     */
    @Test
    @Tag("unit")
    void testPhysicalLineOffsets() {
        // Arrange
        CommentText text = new CommentText(BuiltInGrammars.get("rust"));

        // Act
        List<CommentText.Line> lines = text.lines("// NOTE: a\n  // HACK: b", TokenKind.LINE_COMMENT);

        // Assert
        assertThat(lines).extracting(CommentText.Line::content).containsExactly(" NOTE: a", " HACK: b");
        assertThat(lines).extracting(CommentText.Line::offset).containsExactly(2, 15);
    }
}
