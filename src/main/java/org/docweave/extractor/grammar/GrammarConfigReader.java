package org.docweave.extractor.grammar;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.docweave.extractor.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Reads {@link GrammarDescriptor}s from HOCON configuration.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * rust {
 *   extensions = [rs]
 *   line-comments = ["//"]
 *   block-comments = [{ open = "/*", close = "*&#47;" }]
 *   nested-block-comments = true
 *   doc-line-markers = ["///"]
 *   doc-block-markers = ["/**"]
 *   module-doc-markers = ["//!", "/*!"]
 *   escape-char = "\\"
 *   literals = [
 *     { open = "r\"", close = "\"", kind = STRING, escapes = false, fence = "#" }
 *     { open = "\"", close = "\"", kind = STRING, escapes = true }
 *   ]
 *   attributes = [{ prefix = "#[", bracketed = true }]
 *   declarations = [{ keyword = fn, kind = FUNCTION, body = OPAQUE }]
 *   modifiers = [pub, async]
 *   test-attributes = ["#[test]"]
 *   test-name-prefixes = []
 *   section-labels = []
 *   directive-prefix = ""
 *   functions-by-parenthesis = false
 *   newline-terminates-statements = false
 *   field-naming = BEFORE_COLON
 *   plain-comments-count-as-doc = false
 * }
 * </pre>
 * Only {@code line-comments} or {@code block-comments} is required; every other key defaults
 * to empty/off.
 */
public final class GrammarConfigReader {

    private static final Logger LOG = LoggerFactory.getLogger(GrammarConfigReader.class);

    private GrammarConfigReader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Reads one grammar definition.
     *
     * @param name The language tag (the key the definition is stored under).
     * @param config The definition block.
     * @return The descriptor.
     * @throws GrammarConfigException if a value has the wrong type, an enum name is unknown,
     *                                or the descriptor fails validation.
     */
    public static GrammarDescriptor read(String name, Config config) {
        try {
            if (!config.hasPath("line-comments") && !config.hasPath("block-comments")) {
                throw new GrammarConfigException(name, "at least one of 'line-comments' or 'block-comments' is required", null);
            }
            GrammarDescriptor descriptor = GrammarDescriptor.builder(name)
                    .withExtensions(strings(config, "extensions"))
                    .withLineCommentPrefixes(strings(config, "line-comments"))
                    .withBlockComments(objects(config, "block-comments",
                            c -> new BlockCommentDelimiter(c.getString("open"), c.getString("close"))))
                    .withNestedBlockComments(flag(config, "nested-block-comments"))
                    .withDocLineMarkers(strings(config, "doc-line-markers"))
                    .withDocBlockMarkers(strings(config, "doc-block-markers"))
                    .withModuleDocMarkers(strings(config, "module-doc-markers"))
                    .withLiterals(objects(config, "literals", GrammarConfigReader::literal))
                    .withEscapeChar(escapeChar(name, config))
                    .withAttributes(objects(config, "attributes",
                            c -> new AttributeSyntax(c.getString("prefix"), flag(c, "bracketed"))))
                    .withDeclarations(objects(config, "declarations", GrammarConfigReader::declaration))
                    .withModifiers(new HashSet<>(strings(config, "modifiers")))
                    .withTestAttributes(strings(config, "test-attributes"))
                    .withTestNamePrefixes(strings(config, "test-name-prefixes"))
                    .withSectionLabels(new HashSet<>(strings(config, "section-labels")))
                    .withDirectivePrefix(config.hasPath("directive-prefix") ? config.getString("directive-prefix") : "")
                    .withFunctionsByParenthesis(flag(config, "functions-by-parenthesis"))
                    .withNewlineTerminatesStatements(flag(config, "newline-terminates-statements"))
                    .withFieldNaming(config.hasPath("field-naming")
                            ? config.getEnum(FieldNaming.class, "field-naming")
                            : FieldNaming.FIRST_IDENTIFIER)
                    .withPlainCommentsCountAsDoc(flag(config, "plain-comments-count-as-doc"))
                    .build();
            if (!descriptor.hasDocMarkers() && !descriptor.plainCommentsCountAsDoc()) {
                LOG.warn("Grammar '{}' has no documentation markers and does not count plain comments as doc; "
                        + "no comment will ever attach as documentation.", name);
            }
            LOG.debug("Read grammar '{}' with {} declaration keywords", name, descriptor.declarations().size());
            return descriptor;
        } catch (ConfigException | IllegalArgumentException e) {
            throw new GrammarConfigException(name, e.getMessage(), e);
        }
    }

    private static LiteralDelimiter literal(Config c) {
        LiteralDelimiter.Kind kind = c.hasPath("kind")
                ? c.getEnum(LiteralDelimiter.Kind.class, "kind")
                : LiteralDelimiter.Kind.STRING;
        String open = c.getString("open");
        String close = c.hasPath("close") ? c.getString("close") : open;
        String fence = c.hasPath("fence") ? c.getString("fence") : "";
        return new LiteralDelimiter(open, close, kind, !c.hasPath("escapes") || c.getBoolean("escapes"), fence);
    }

    private static DeclarationKeyword declaration(Config c) {
        EntityKind kind = EntityKind.valueOf(c.getString("kind").toUpperCase(Locale.ROOT));
        BodyStyle body = c.hasPath("body")
                ? BodyStyle.valueOf(c.getString("body").toUpperCase(Locale.ROOT))
                : BodyStyle.OPAQUE;
        return new DeclarationKeyword(c.getString("keyword"), kind, body);
    }

    private static char escapeChar(String name, Config config) {
        if (!config.hasPath("escape-char")) {
            return GrammarDescriptor.NO_ESCAPE;
        }
        String value = config.getString("escape-char");
        if (value.isEmpty()) {
            return GrammarDescriptor.NO_ESCAPE;
        }
        if (value.length() != 1) {
            throw new GrammarConfigException(name, "'escape-char' must be a single character but was '" + value + "'", null);
        }
        return value.charAt(0);
    }

    private static List<String> strings(Config config, String path) {
        return config.hasPath(path) ? config.getStringList(path) : List.of();
    }

    private static boolean flag(Config config, String path) {
        return config.hasPath(path) && config.getBoolean(path);
    }

    private static <T> List<T> objects(Config config, String path, Function<Config, T> mapper) {
        if (!config.hasPath(path)) {
            return List.of();
        }
        return config.getConfigList(path).stream().map(mapper).toList();
    }
}
