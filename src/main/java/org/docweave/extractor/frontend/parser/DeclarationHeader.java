package org.docweave.extractor.frontend.parser;

import org.docweave.extractor.grammar.BodyStyle;
import org.docweave.extractor.grammar.DeclarationKeyword;
import org.docweave.extractor.grammar.GrammarDescriptor;
import org.docweave.extractor.model.EntityKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The lexemes in front of a declaration's body or terminator, and the rules that derive the
 * declaration's kind, name and modifiers from them.
 */
final class DeclarationHeader {

    /** Words that are followed by a parenthesis without naming a function. */
    static final Set<String> CONTROL_WORDS = Set.of(
            "if", "else", "for", "while", "do", "switch", "case", "catch", "return", "sizeof",
            "typeof", "new", "throw", "try", "await", "yield", "match", "loop", "assert", "defer", "go");

    /**
     * The resolved shape of a declaration.
     *
     * @param kind The entity kind.
     * @param body How the body, if any, is read.
     * @param name The declared name, or {@code null}.
     * @param modifiers The modifier words, in order of appearance.
     */
    record Shape(EntityKind kind, BodyStyle body, String name, List<String> modifiers) {
    }

    private final List<Lexeme> lexemes;
    private final int[] depth;
    private final int assignAt;
    private final GrammarDescriptor grammar;

    DeclarationHeader(List<Lexeme> lexemes, GrammarDescriptor grammar) {
        this.lexemes = List.copyOf(lexemes);
        this.grammar = grammar;
        this.depth = new int[lexemes.size()];
        int level = 0;
        int angle = 0;
        int assign = lexemes.size();
        for (int i = 0; i < lexemes.size(); i++) {
            Lexeme lexeme = lexemes.get(i);
            if (lexeme.type() == LexemeType.CLOSE) {
                level = Math.max(0, level - 1);
            }
            depth[i] = level;
            if (lexeme.type() == LexemeType.OPEN || isBracketedAttribute(lexeme)) {
                level++;
            } else if (level == 0 && assign == lexemes.size()) {
                if (lexeme.is(LexemeType.OPERATOR, "<")) {
                    angle++;
                } else if (lexeme.is(LexemeType.OPERATOR, ">")) {
                    angle = Math.max(0, angle - 1);
                } else if (lexeme.type() == LexemeType.ASSIGN && angle == 0) {
                    assign = i;
                }
            }
        }
        this.assignAt = assign;
    }

    boolean isEmpty() {
        return lexemes.isEmpty();
    }

    Lexeme first() {
        return lexemes.get(0);
    }

    Lexeme last() {
        return lexemes.get(lexemes.size() - 1);
    }

    /**
     * Derives kind, name and modifiers.
     *
     * @param container The kind of the enclosing entity.
     * @param context The body style of the enclosing entity.
     * @param hasBody Whether a body follows the header.
     * @return The shape of the declaration.
     */
    Shape resolve(EntityKind container, BodyStyle context, boolean hasBody) {
        List<String> modifiers = modifiers();
        if (context == BodyStyle.FIELDS) {
            return new Shape(EntityKind.FIELD, BodyStyle.OPAQUE, fieldName(0), modifiers);
        }
        int keywordAt = -1;
        int nameAt = -1;
        for (int i = 0; i < assignAt; i++) {
            if (isKeyword(i)) {
                keywordAt = i;
                break;
            }
        }
        if (keywordAt >= 0) {
            // const fn, type T struct: the later keyword decides
            boolean refined = true;
            while (refined) {
                refined = false;
                int next = skipModifiers(keywordAt + 1);
                if (next < assignAt && isKeyword(next)) {
                    keywordAt = next;
                    refined = true;
                } else if (next + 1 < assignAt && isIdentifier(next) && isKeyword(next + 1)) {
                    nameAt = next;
                    keywordAt = next + 1;
                }
            }
            DeclarationKeyword keyword = grammar.declaration(lexemes.get(keywordAt).text()).orElseThrow();
            String name = nameAt >= 0 ? lexemes.get(nameAt).text() : nameAfterKeyword(keyword.kind(), keywordAt);
            int call = callAt(keywordAt + 1);
            if (grammar.functionsByParenthesis() && call >= 0
                    && (keyword.kind() == EntityKind.CONST || keyword.kind() == EntityKind.STRUCT)
                    && !lexemes.get(call).text().equals(name)) {
                return function(lexemes.get(call).text(), modifiers);
            }
            return new Shape(keyword.kind(), keyword.body(), name, modifiers);
        }
        int call = callAt(0);
        if (grammar.functionsByParenthesis() && call >= 0
                && (call > 0 || hasBody || container == EntityKind.TRAIT)) {
            return function(lexemes.get(call).text(), modifiers);
        }
        if (!hasBody && (container == EntityKind.STRUCT || container == EntityKind.TRAIT)) {
            return new Shape(EntityKind.FIELD, BodyStyle.OPAQUE, fieldName(0), modifiers);
        }
        return new Shape(EntityKind.UNKNOWN, BodyStyle.OPAQUE, null, modifiers);
    }

    private static Shape function(String name, List<String> modifiers) {
        return new Shape(EntityKind.FUNCTION, BodyStyle.OPAQUE, name, modifiers);
    }

    /**
     * Go style test names: the prefix must not be followed by a lower-case letter, so
     * {@code TestParse} matches {@code Test} but {@code Testify} does not.
     */
    static boolean hasTestPrefix(String name, List<String> testNamePrefixes) {
        if (name == null) {
            return false;
        }
        for (String prefix : testNamePrefixes) {
            if (name.startsWith(prefix)) {
                String rest = name.substring(prefix.length());
                if (rest.isEmpty() || !Character.isLowerCase(rest.charAt(0))) {
                    return true;
                }
            }
        }
        return false;
    }

    private String nameAfterKeyword(EntityKind kind, int keywordAt) {
        if (kind == EntityKind.CONST) {
            return fieldName(keywordAt + 1);
        }
        int i = keywordAt + 1;
        if (i < assignAt && lexemes.get(i).is(LexemeType.OPEN, "(")) {
            i = afterGroup(i);
        }
        i = skipGenerics(i);
        if (kind == EntityKind.IMPL) {
            return implTarget(i);
        }
        for (; i < assignAt; i++) {
            if (isIdentifier(i) && !grammar.isModifier(lexemes.get(i).text())) {
                return lexemes.get(i).text();
            }
            if (lexemes.get(i).is(LexemeType.OPEN, "(") || lexemes.get(i).is(LexemeType.OPEN, "{")) {
                break;
            }
        }
        return null;
    }

    /**
     * The name of an implementation block is its target, e.g. {@code Display for Foo<T>}.
     */
    private String implTarget(int from) {
        StringBuilder target = new StringBuilder();
        Lexeme previous = null;
        for (int i = from; i < lexemes.size(); i++) {
            Lexeme lexeme = lexemes.get(i);
            if (depth[i] == 0 && lexeme.is(LexemeType.IDENTIFIER, "where")) {
                break;
            }
            if (previous != null && lexeme.start() > previous.end()) {
                target.append(' ');
            }
            target.append(lexeme.text());
            previous = lexeme;
        }
        return target.length() == 0 ? null : target.toString();
    }

    /**
     * Finds the name of a field or constant between {@code from} and the assignment (or a parameter list).
     */
    private String fieldName(int from) {
        int to = assignAt;
        for (int i = from; i < assignAt; i++) {
            if (depth[i] == 0 && lexemes.get(i).is(LexemeType.OPEN, "(")) {
                to = i;
                break;
            }
        }
        List<String> names = new ArrayList<>();
        int colon = -1;
        for (int i = from; i < to; i++) {
            if (depth[i] != 0) {
                continue;
            }
            if (lexemes.get(i).type() == LexemeType.COLON && colon < 0) {
                colon = names.size();
            } else if (isIdentifier(i) && !grammar.isModifier(lexemes.get(i).text())) {
                names.add(lexemes.get(i).text());
            }
        }
        if (names.isEmpty()) {
            return null;
        }
        return switch (grammar.fieldNaming()) {
            case FIRST_IDENTIFIER -> names.get(0);
            case BEFORE_COLON -> colon > 0 ? names.get(colon - 1) : names.get(names.size() - 1);
            case LAST_IDENTIFIER -> names.get(names.size() - 1);
        };
    }

    /**
     * @return The index of the first identifier directly followed by {@code (} before any assignment, or -1.
     */
    private int callAt(int from) {
        for (int i = from; i + 1 < assignAt; i++) {
            if (depth[i] == 0 && isIdentifier(i) && lexemes.get(i + 1).is(LexemeType.OPEN, "(")
                    && !CONTROL_WORDS.contains(lexemes.get(i).text())) {
                return i;
            }
        }
        return -1;
    }

    private List<String> modifiers() {
        Set<String> found = new LinkedHashSet<>();
        for (int i = 0; i < assignAt; i++) {
            if (depth[i] == 0 && isIdentifier(i) && grammar.isModifier(lexemes.get(i).text())) {
                found.add(lexemes.get(i).text());
            }
        }
        return List.copyOf(found);
    }

    /**
     * Checks the attributes of a function against the grammar's test attributes.
     * {@code #[tokio::test(flavor = "multi_thread")]} matches {@code #[tokio::test]}.
     */
    static boolean isTestAttribute(String attribute, List<String> testAttributes) {
        String normalized = attribute.replaceAll("\\s+", "");
        for (String pattern : testAttributes) {
            if (normalized.equals(pattern) || normalized.startsWith(pattern + "(")) {
                return true;
            }
            if (pattern.endsWith("]") && normalized.startsWith(pattern.substring(0, pattern.length() - 1) + "(")) {
                return true;
            }
        }
        return false;
    }

    private int skipModifiers(int from) {
        int i = from;
        while (i < assignAt && isIdentifier(i) && grammar.isModifier(lexemes.get(i).text())) {
            i++;
        }
        return i;
    }

    private int skipGenerics(int from) {
        if (from >= assignAt || !lexemes.get(from).is(LexemeType.OPERATOR, "<")) {
            return from;
        }
        int angle = 0;
        for (int i = from; i < assignAt; i++) {
            if (lexemes.get(i).is(LexemeType.OPERATOR, "<")) {
                angle++;
            } else if (lexemes.get(i).is(LexemeType.OPERATOR, ">") && --angle == 0) {
                return i + 1;
            }
        }
        return assignAt;
    }

    private int afterGroup(int open) {
        for (int i = open + 1; i < lexemes.size(); i++) {
            if (depth[i] == depth[open] && lexemes.get(i).type() == LexemeType.CLOSE) {
                return i + 1;
            }
        }
        return lexemes.size();
    }

    private boolean isKeyword(int i) {
        return depth[i] == 0 && isIdentifier(i) && grammar.declaration(lexemes.get(i).text()).isPresent();
    }

    private boolean isIdentifier(int i) {
        return lexemes.get(i).type() == LexemeType.IDENTIFIER;
    }

    private boolean isBracketedAttribute(Lexeme lexeme) {
        return lexeme.type() == LexemeType.ATTRIBUTE && bracketed(lexeme.text(), grammar);
    }

    static boolean bracketed(String prefix, GrammarDescriptor grammar) {
        Optional<Boolean> match = grammar.attributes().stream()
                .filter(syntax -> syntax.prefix().equals(prefix))
                .map(syntax -> syntax.bracketed())
                .findFirst();
        return match.orElse(false);
    }
}
