package org.docweave.extractor.grammar;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.docweave.extractor.BuiltInGrammars;
import org.docweave.extractor.model.EntityKind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link GrammarRegistry} and the {@link GrammarConfigReader}.
 * These tests verify the built-in grammars, lookups and the validation of configured grammars.
 */
public class GrammarRegistryTest {

    /**
     * Verifies that all built-in languages are registered.
     */
    @Test
    @Tag("unit")
    void testBuiltInGrammars() {
        // Act
        GrammarRegistry registry = BuiltInGrammars.registry();

        // Assert
        assertThat(registry.names())
                .containsExactlyInAnyOrder("c", "cpp", "go", "java", "javascript", "rust", "typescript");
        GrammarDescriptor rust = registry.find("rust").orElseThrow();
        assertThat(rust.nestedBlockComments()).isTrue();
        assertThat(rust.docLineMarkers()).containsExactly("///");
        assertThat(rust.declaration("fn")).map(DeclarationKeyword::kind).contains(EntityKind.FUNCTION);
        assertThat(registry.find("go").orElseThrow().plainCommentsCountAsDoc()).isTrue();
        assertThat(registry.find("java").orElseThrow().plainCommentsCountAsDoc()).isFalse();
    }

    /**
     * Verifies that lookups by tag ignore case and lookups by file name use the extension.
     */
    @Test
    @Tag("unit")
    void testLookups() {
        // Arrange
        GrammarRegistry registry = BuiltInGrammars.registry();

        // Act & Assert
        assertThat(registry.find("TypeScript")).map(GrammarDescriptor::name).contains("typescript");
        assertThat(registry.find("python")).isEmpty();
        assertThat(registry.forFileName("src/net/Client.JAVA")).map(GrammarDescriptor::name).contains("java");
        assertThat(registry.forFileName("include\\point.h")).map(GrammarDescriptor::name).contains("c");
        assertThat(registry.forFileName("Makefile")).isEmpty();
        assertThat(registry.forFileName(".rs")).isEmpty();
        assertThat(registry.forFileName("notes.")).isEmpty();
    }

    /**
     * Verifies that a language added in configuration is read with defaults for omitted keys.
     */
    @Test
    @Tag("unit")
    void testCustomGrammarFromConfig() {
        // Arrange
        Config config = ConfigFactory.parseString("""
                docweave.grammars.lua {
                  extensions = [lua]
                  line-comments = ["--"]
                  block-comments = [{ open = "--[[", close = "]]" }]
                  doc-line-markers = ["---"]
                  declarations = [{ keyword = function, kind = function }]
                }
                """);

        // Act
        GrammarRegistry registry = GrammarRegistry.fromConfig(config);

        // Assert
        GrammarDescriptor lua = registry.forFileName("init.lua").orElseThrow();
        assertThat(lua.name()).isEqualTo("lua");
        assertThat(lua.escapeChar()).isEqualTo(GrammarDescriptor.NO_ESCAPE);
        assertThat(lua.fieldNaming()).isEqualTo(FieldNaming.FIRST_IDENTIFIER);
        assertThat(lua.declaration("function")).map(DeclarationKeyword::body).contains(BodyStyle.OPAQUE);
        assertThat(lua.hasDocMarkers()).isTrue();
    }

    /**
     * Verifies that invalid definitions are rejected with the grammar's name in the message.
     */
    @Test
    @Tag("unit")
    void testInvalidGrammarsAreRejected() {
        assertThatThrownBy(() -> GrammarRegistry.fromConfig(ConfigFactory.parseString(
                "docweave.grammars.empty { extensions = [x] }")))
                .isInstanceOf(GrammarConfigException.class)
                .hasMessageContaining("'empty'");
        assertThatThrownBy(() -> GrammarRegistry.fromConfig(ConfigFactory.parseString(
                "docweave.grammars.bad { line-comments = [\"#\"], doc-line-markers = [\"//\"] }")))
                .isInstanceOf(GrammarConfigException.class)
                .hasMessageContaining("must extend");
        assertThatThrownBy(() -> GrammarRegistry.fromConfig(ConfigFactory.parseString(
                "docweave.grammars.kind { line-comments = [\"#\"], declarations = [{ keyword = def, kind = METHOD }] }")))
                .isInstanceOf(GrammarConfigException.class)
                .hasMessageContaining("'kind'");
        assertThatThrownBy(() -> GrammarRegistry.fromConfig(ConfigFactory.parseString(
                "docweave.grammars.esc { line-comments = [\"#\"], escape-char = \"ab\" }")))
                .isInstanceOf(GrammarConfigException.class)
                .hasMessageContaining("escape-char");
    }

    /**
     * Verifies that a configuration without grammars yields an empty registry.
     */
    @Test
    @Tag("unit")
    void testMissingGrammarsSection() {
        assertThat(GrammarRegistry.fromConfig(ConfigFactory.empty()).names()).isEmpty();
    }
}
