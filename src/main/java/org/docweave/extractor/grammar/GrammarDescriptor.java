package org.docweave.extractor.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Describes how one language spells comments, literals, attributes and declarations.
 * <p>
 * A descriptor is a pure value: the scanner, classifier and entity parser are written once and
 * consume it uniformly, so adding a language means adding a descriptor. The built-in descriptors
 * live in {@code reference.conf} and are read by {@link GrammarConfigReader}.
 *
 * @param name The language tag, e.g. {@code rust}.
 * @param extensions File extensions without the dot, e.g. {@code rs}.
 * @param lineCommentPrefixes Prefixes of plain line comments, e.g. {@code //}.
 * @param blockComments Block comment delimiter pairs.
 * @param nestedBlockComments Whether block comments nest.
 * @param docLineMarkers Prefixes of documentation line comments, e.g. {@code ///}.
 * @param docBlockMarkers Openers of documentation block comments, e.g. {@code /**}.
 * @param moduleDocMarkers Prefixes/openers of module documentation, e.g. {@code //!}.
 * @param literals String and character literal delimiters.
 * @param escapeChar The escape character inside literals, or {@code '\0'} for none.
 * @param attributes Attribute/annotation marker syntaxes.
 * @param declarations Declaration-introducing keywords.
 * @param modifiers Words that may precede a declaration keyword, e.g. {@code pub}.
 * @param testAttributes Attributes that turn a function into a test, e.g. {@code #[test]}.
 * @param testNamePrefixes Function name prefixes that mark tests, e.g. {@code Test}.
 * @param sectionLabels Access labels followed by a colon that are skipped, e.g. {@code public}.
 * @param directivePrefix The line prefix of preprocessor directives, or an empty string.
 * @param functionsByParenthesis Whether {@code name(...)} declares a function without a keyword.
 * @param newlineTerminatesStatements Whether a line break can end a declaration.
 * @param fieldNaming Where a field's name sits in its declaration.
 * @param plainCommentsCountAsDoc Whether plain comments may attach as documentation.
 */
public record GrammarDescriptor(
        String name,
        List<String> extensions,
        List<String> lineCommentPrefixes,
        List<BlockCommentDelimiter> blockComments,
        boolean nestedBlockComments,
        List<String> docLineMarkers,
        List<String> docBlockMarkers,
        List<String> moduleDocMarkers,
        List<LiteralDelimiter> literals,
        char escapeChar,
        List<AttributeSyntax> attributes,
        List<DeclarationKeyword> declarations,
        Set<String> modifiers,
        List<String> testAttributes,
        List<String> testNamePrefixes,
        Set<String> sectionLabels,
        String directivePrefix,
        boolean functionsByParenthesis,
        boolean newlineTerminatesStatements,
        FieldNaming fieldNaming,
        boolean plainCommentsCountAsDoc
) {

    /** Marks the absence of an escape character. */
    public static final char NO_ESCAPE = '\0';

    public GrammarDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Grammar name must not be blank");
        }
        extensions = List.copyOf(extensions);
        lineCommentPrefixes = List.copyOf(lineCommentPrefixes);
        blockComments = List.copyOf(blockComments);
        docLineMarkers = List.copyOf(docLineMarkers);
        docBlockMarkers = List.copyOf(docBlockMarkers);
        moduleDocMarkers = List.copyOf(moduleDocMarkers);
        literals = List.copyOf(literals);
        attributes = List.copyOf(attributes);
        declarations = List.copyOf(declarations);
        modifiers = Set.copyOf(modifiers);
        testAttributes = List.copyOf(testAttributes);
        testNamePrefixes = List.copyOf(testNamePrefixes);
        sectionLabels = Set.copyOf(sectionLabels);
        directivePrefix = directivePrefix == null ? "" : directivePrefix;
        fieldNaming = fieldNaming == null ? FieldNaming.FIRST_IDENTIFIER : fieldNaming;

        List<String> blockOpeners = blockComments.stream().map(BlockCommentDelimiter::open).toList();
        for (String marker : docLineMarkers) {
            requireRefinement(name, marker, lineCommentPrefixes);
        }
        for (String marker : docBlockMarkers) {
            requireRefinement(name, marker, blockOpeners);
        }
        List<String> anyOpener = new ArrayList<>(lineCommentPrefixes);
        anyOpener.addAll(blockOpeners);
        for (String marker : moduleDocMarkers) {
            requireRefinement(name, marker, anyOpener);
        }
    }

    private static void requireRefinement(String grammar, String marker, List<String> bases) {
        boolean refines = bases.stream().anyMatch(base -> marker.startsWith(base) && marker.length() > base.length());
        if (!refines) {
            throw new IllegalArgumentException("Grammar '" + grammar + "': documentation marker '" + marker
                    + "' must extend one of the comment delimiters " + bases);
        }
    }

    /**
     * Looks up a declaration keyword.
     * @param word An identifier from the source.
     * @return The keyword definition, if {@code word} introduces a declaration.
     */
    public Optional<DeclarationKeyword> declaration(String word) {
        for (DeclarationKeyword keyword : declarations) {
            if (keyword.keyword().equals(word)) {
                return Optional.of(keyword);
            }
        }
        return Optional.empty();
    }

    /**
     * @param word An identifier from the source.
     * @return {@code true} if the word is a declaration modifier.
     */
    public boolean isModifier(String word) {
        return modifiers.contains(word);
    }

    /**
     * @return {@code true} if the grammar declares at least one documentation marker.
     */
    public boolean hasDocMarkers() {
        return !docLineMarkers.isEmpty() || !docBlockMarkers.isEmpty() || !moduleDocMarkers.isEmpty();
    }

    /**
     * Creates a new builder with empty lists and all flags off.
     *
     * @param name The language tag.
     * @return new builder instance
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Builder for {@link GrammarDescriptor}, used by the configuration reader and by tests.
     */
    public static class Builder {
        private final String name;
        private List<String> extensions = List.of();
        private List<String> lineCommentPrefixes = List.of();
        private List<BlockCommentDelimiter> blockComments = List.of();
        private boolean nestedBlockComments;
        private List<String> docLineMarkers = List.of();
        private List<String> docBlockMarkers = List.of();
        private List<String> moduleDocMarkers = List.of();
        private List<LiteralDelimiter> literals = List.of();
        private char escapeChar = NO_ESCAPE;
        private List<AttributeSyntax> attributes = List.of();
        private List<DeclarationKeyword> declarations = List.of();
        private Set<String> modifiers = Set.of();
        private List<String> testAttributes = List.of();
        private List<String> testNamePrefixes = List.of();
        private Set<String> sectionLabels = Set.of();
        private String directivePrefix = "";
        private boolean functionsByParenthesis;
        private boolean newlineTerminatesStatements;
        private FieldNaming fieldNaming = FieldNaming.FIRST_IDENTIFIER;
        private boolean plainCommentsCountAsDoc;

        private Builder(String name) {
            this.name = name;
        }

        public Builder withExtensions(List<String> v) { this.extensions = v; return this; }
        public Builder withLineCommentPrefixes(List<String> v) { this.lineCommentPrefixes = v; return this; }
        public Builder withBlockComments(List<BlockCommentDelimiter> v) { this.blockComments = v; return this; }
        public Builder withNestedBlockComments(boolean v) { this.nestedBlockComments = v; return this; }
        public Builder withDocLineMarkers(List<String> v) { this.docLineMarkers = v; return this; }
        public Builder withDocBlockMarkers(List<String> v) { this.docBlockMarkers = v; return this; }
        public Builder withModuleDocMarkers(List<String> v) { this.moduleDocMarkers = v; return this; }
        public Builder withLiterals(List<LiteralDelimiter> v) { this.literals = v; return this; }
        public Builder withEscapeChar(char v) { this.escapeChar = v; return this; }
        public Builder withAttributes(List<AttributeSyntax> v) { this.attributes = v; return this; }
        public Builder withDeclarations(List<DeclarationKeyword> v) { this.declarations = v; return this; }
        public Builder withModifiers(Set<String> v) { this.modifiers = v; return this; }
        public Builder withTestAttributes(List<String> v) { this.testAttributes = v; return this; }
        public Builder withTestNamePrefixes(List<String> v) { this.testNamePrefixes = v; return this; }
        public Builder withSectionLabels(Set<String> v) { this.sectionLabels = v; return this; }
        public Builder withDirectivePrefix(String v) { this.directivePrefix = v; return this; }
        public Builder withFunctionsByParenthesis(boolean v) { this.functionsByParenthesis = v; return this; }
        public Builder withNewlineTerminatesStatements(boolean v) { this.newlineTerminatesStatements = v; return this; }
        public Builder withFieldNaming(FieldNaming v) { this.fieldNaming = v; return this; }
        public Builder withPlainCommentsCountAsDoc(boolean v) { this.plainCommentsCountAsDoc = v; return this; }

        /**
         * Builds the descriptor.
         *
         * @return new GrammarDescriptor instance
         * @throws IllegalArgumentException if a documentation marker does not refine a comment delimiter
         */
        public GrammarDescriptor build() {
            return new GrammarDescriptor(name, extensions, lineCommentPrefixes, blockComments, nestedBlockComments,
                    docLineMarkers, docBlockMarkers, moduleDocMarkers, literals, escapeChar, attributes,
                    declarations, modifiers, testAttributes, testNamePrefixes, sectionLabels, directivePrefix,
                    functionsByParenthesis, newlineTerminatesStatements, fieldNaming, plainCommentsCountAsDoc);
        }
    }
}
