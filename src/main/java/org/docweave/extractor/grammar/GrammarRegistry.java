package org.docweave.extractor.grammar;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Selects a {@link GrammarDescriptor} by language tag or by file name.
 * <p>
 * The registry is immutable after construction and can be shared between threads.
 */
public final class GrammarRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(GrammarRegistry.class);

    /** The configuration path holding the grammar definitions, keyed by language tag. */
    public static final String GRAMMARS_PATH = "docweave.grammars";

    private final Map<String, GrammarDescriptor> byName;
    private final Map<String, GrammarDescriptor> byExtension;

    /**
     * Creates a registry from explicit descriptors. Later descriptors win on name or extension clashes.
     * @param grammars The descriptors to register.
     */
    public GrammarRegistry(Collection<GrammarDescriptor> grammars) {
        Map<String, GrammarDescriptor> names = new LinkedHashMap<>();
        Map<String, GrammarDescriptor> extensions = new LinkedHashMap<>();
        for (GrammarDescriptor grammar : grammars) {
            names.put(normalize(grammar.name()), grammar);
            for (String extension : grammar.extensions()) {
                GrammarDescriptor previous = extensions.put(normalize(extension), grammar);
                if (previous != null && !previous.name().equals(grammar.name())) {
                    LOG.debug("Extension '{}' moved from grammar '{}' to '{}'", extension, previous.name(), grammar.name());
                }
            }
        }
        this.byName = Collections.unmodifiableMap(names);
        this.byExtension = Collections.unmodifiableMap(extensions);
    }

    /**
     * Loads the grammars defined under {@value #GRAMMARS_PATH} of the given configuration.
     *
     * @param config The resolved application configuration.
     * @return The registry.
     * @throws GrammarConfigException if a grammar definition is invalid.
     */
    public static GrammarRegistry fromConfig(Config config) {
        if (!config.hasPath(GRAMMARS_PATH)) {
            LOG.warn("No grammars configured under '{}'", GRAMMARS_PATH);
            return new GrammarRegistry(Set.of());
        }
        Config grammars = config.getConfig(GRAMMARS_PATH);
        return new GrammarRegistry(grammars.root().keySet().stream()
                .sorted()
                .map(name -> GrammarConfigReader.read(name, grammars.getConfig(quote(name))))
                .toList());
    }

    /**
     * Loads the built-in grammars from the classpath defaults ({@code reference.conf}).
     *
     * @return The registry of built-in grammars.
     */
    public static GrammarRegistry builtIn() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Looks up a grammar by its language tag, ignoring case.
     * @param languageTag The tag, e.g. {@code rust}.
     * @return The grammar, if registered.
     */
    public Optional<GrammarDescriptor> find(String languageTag) {
        return languageTag == null ? Optional.empty() : Optional.ofNullable(byName.get(normalize(languageTag)));
    }

    /**
     * Looks up a grammar by the extension of a file name or path.
     * @param fileName The file name, e.g. {@code src/lib.rs}.
     * @return The grammar, if one claims the extension.
     */
    public Optional<GrammarDescriptor> forFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        int dot = fileName.lastIndexOf('.');
        if (dot <= slash + 1 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        return Optional.ofNullable(byExtension.get(normalize(fileName.substring(dot + 1))));
    }

    /**
     * @return The registered language tags in registration order.
     */
    public Set<String> names() {
        return byName.keySet();
    }

    private static String normalize(String key) {
        return key.toLowerCase(Locale.ROOT);
    }

    private static String quote(String key) {
        return ConfigUtil.quoteString(key);
    }
}
