package org.docweave.extractor.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.util.List;
import java.util.Set;

/**
 * Engine options read from the {@code docweave} configuration block.
 *
 * @param customTags Extra annotation keywords reported as {@code CUSTOM}.
 * @param prettyJson Whether JSON export is indented.
 * @param includeTokens Whether JSON export lists the tokens.
 */
public record ExtractorOptions(Set<String> customTags, boolean prettyJson, boolean includeTokens) {

    /** Options with no custom tags, indented JSON and no tokens. */
    public static final ExtractorOptions DEFAULTS = new ExtractorOptions(Set.of(), true, false);

    public ExtractorOptions {
        customTags = Set.copyOf(customTags);
    }

    /**
     * Reads the options. Missing keys fall back to {@link #DEFAULTS}.
     *
     * @param config The resolved application configuration.
     * @return The options.
     * @throws ConfigException.WrongType if a key holds a value of the wrong type.
     */
    public static ExtractorOptions fromConfig(Config config) {
        List<String> custom = config.hasPath("docweave.tags.custom")
                ? config.getStringList("docweave.tags.custom")
                : List.of();
        boolean pretty = config.hasPath("docweave.export.pretty")
                ? config.getBoolean("docweave.export.pretty")
                : DEFAULTS.prettyJson();
        boolean tokens = config.hasPath("docweave.export.include-tokens")
                ? config.getBoolean("docweave.export.include-tokens")
                : DEFAULTS.includeTokens();
        return new ExtractorOptions(Set.copyOf(custom), pretty, tokens);
    }
}
