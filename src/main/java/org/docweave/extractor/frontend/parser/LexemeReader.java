package org.docweave.extractor.frontend.parser;

import org.docweave.extractor.frontend.lexer.Token;
import org.docweave.extractor.frontend.lexer.TokenKind;
import org.docweave.extractor.grammar.AttributeSyntax;
import org.docweave.extractor.grammar.GrammarDescriptor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits the code tokens of a scan into {@link Lexeme}s. Comment tokens are dropped and every
 * literal token becomes a single {@link LexemeType#LITERAL}.
 */
class LexemeReader {

    private static final String OPERATOR_CHARS = "+-*/%=!&|^~?.#@\\";
    private static final String ASSIGN_NEIGHBOURS_BEFORE = "<>!=+-*/%&|^:~?";
    private static final String ASSIGN_NEIGHBOURS_AFTER = "=>";

    private final String source;
    private final GrammarDescriptor grammar;
    private final List<String> attributePrefixes;
    private final List<Lexeme> lexemes = new ArrayList<>();
    private int skipUntil = 0;

    LexemeReader(String source, GrammarDescriptor grammar) {
        this.source = source;
        this.grammar = grammar;
        this.attributePrefixes = grammar.attributes().stream()
                .map(AttributeSyntax::prefix)
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
    }

    List<Lexeme> read(List<Token> tokens) {
        for (Token token : tokens) {
            int start = token.span().startOffset();
            int end = token.span().endOffset();
            if (end <= skipUntil) {
                continue;
            }
            if (token.kind() == TokenKind.CODE) {
                readCode(Math.max(start, skipUntil), end);
            } else if (start < skipUntil) {
                // a literal or comment that starts inside a directive line extends it
                skipUntil = Math.max(skipUntil, end);
            } else if (token.kind().isLiteral()) {
                lexemes.add(new Lexeme(LexemeType.LITERAL, token.text(), start, end));
            }
        }
        return lexemes;
    }

    private void readCode(int from, int end) {
        int i = from;
        while (i < end) {
            char c = source.charAt(i);
            if (c == '\n') {
                if (grammar.newlineTerminatesStatements()) {
                    lexemes.add(new Lexeme(LexemeType.NEWLINE, "\n", i, i + 1));
                }
                i++;
            } else if (Character.isWhitespace(c)) {
                i++;
            } else if (isDirectiveStart(i)) {
                int directiveEnd = directiveEnd(i);
                lexemes.add(new Lexeme(LexemeType.DIRECTIVE, source.substring(i, directiveEnd).trim(), i, directiveEnd));
                skipUntil = directiveEnd;
                if (directiveEnd >= end) {
                    return;
                }
                i = directiveEnd;
            } else if (Character.isJavaIdentifierStart(c)) {
                i = word(LexemeType.IDENTIFIER, i, end);
            } else if (Character.isDigit(c)) {
                i = word(LexemeType.LITERAL, i, end);
            } else if ("([{".indexOf(c) >= 0) {
                i = single(LexemeType.OPEN, i);
            } else if (")]}".indexOf(c) >= 0) {
                i = single(LexemeType.CLOSE, i);
            } else if (c == ';') {
                i = single(LexemeType.SEMICOLON, i);
            } else if (c == ',') {
                i = single(LexemeType.COMMA, i);
            } else if (c == ':' && i + 1 < end && source.charAt(i + 1) == ':') {
                lexemes.add(new Lexeme(LexemeType.OPERATOR, "::", i, i + 2));
                i += 2;
            } else if (c == ':') {
                i = single(LexemeType.COLON, i);
            } else if (attributePrefix(i) != null) {
                String prefix = attributePrefix(i);
                lexemes.add(new Lexeme(LexemeType.ATTRIBUTE, prefix, i, i + prefix.length()));
                i += prefix.length();
            } else if (c == '<' || c == '>') {
                i = single(LexemeType.OPERATOR, i);
            } else if (c == '=' && isAssignment(i)) {
                i = single(LexemeType.ASSIGN, i);
            } else if (OPERATOR_CHARS.indexOf(c) >= 0) {
                int j = i + 1;
                while (j < end && OPERATOR_CHARS.indexOf(source.charAt(j)) >= 0 && attributePrefix(j) == null
                        && !(source.charAt(j) == '=' && isAssignment(j))) {
                    j++;
                }
                lexemes.add(new Lexeme(LexemeType.OPERATOR, source.substring(i, j), i, j));
                i = j;
            } else {
                i = single(LexemeType.OTHER, i);
            }
        }
    }

    private int word(LexemeType type, int start, int end) {
        int j = start + 1;
        while (j < end && (Character.isJavaIdentifierPart(source.charAt(j))
                || type == LexemeType.LITERAL && source.charAt(j) == '.')) {
            j++;
        }
        lexemes.add(new Lexeme(type, source.substring(start, j), start, j));
        return j;
    }

    private int single(LexemeType type, int position) {
        lexemes.add(new Lexeme(type, String.valueOf(source.charAt(position)), position, position + 1));
        return position + 1;
    }

    private String attributePrefix(int position) {
        for (String prefix : attributePrefixes) {
            if (source.startsWith(prefix, position)) {
                return prefix;
            }
        }
        return null;
    }

    private boolean isAssignment(int position) {
        boolean cleanBefore = position == 0 || ASSIGN_NEIGHBOURS_BEFORE.indexOf(source.charAt(position - 1)) < 0;
        boolean cleanAfter = position + 1 >= source.length() || ASSIGN_NEIGHBOURS_AFTER.indexOf(source.charAt(position + 1)) < 0;
        return cleanBefore && cleanAfter;
    }

    private boolean isDirectiveStart(int position) {
        if (grammar.directivePrefix().isEmpty() || !source.startsWith(grammar.directivePrefix(), position)) {
            return false;
        }
        for (int i = position - 1; i >= 0 && source.charAt(i) != '\n'; i--) {
            if (!Character.isWhitespace(source.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * A directive runs to the end of its line; a backslash before the line break continues it.
     */
    private int directiveEnd(int position) {
        int i = position;
        while (i < source.length()) {
            if (source.charAt(i) == '\n') {
                int before = i - 1;
                if (before >= 0 && source.charAt(before) == '\r') {
                    before--;
                }
                if (before < position || source.charAt(before) != '\\') {
                    return i;
                }
            }
            i++;
        }
        return source.length();
    }
}
