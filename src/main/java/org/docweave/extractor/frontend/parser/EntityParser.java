package org.docweave.extractor.frontend.parser;

import org.docweave.extractor.diagnostics.DiagnosticCode;
import org.docweave.extractor.diagnostics.DiagnosticsEngine;
import org.docweave.extractor.frontend.lexer.Token;
import org.docweave.extractor.grammar.BodyStyle;
import org.docweave.extractor.grammar.GrammarDescriptor;
import org.docweave.extractor.model.EntityKind;
import org.docweave.extractor.model.LineIndex;
import org.docweave.extractor.model.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Recognizes declaration boundaries in the token list of one file and builds the entity skeleton.
 * <p>
 * This is a boundary recognizer, not a full parser. Comments are skipped and literals are opaque.
 * A declaration is read up to its terminator or its body; bodies are read for children according
 * to the {@link BodyStyle} of the declaration keyword. Constructs it cannot classify become
 * {@link EntityKind#UNKNOWN} entities with their best-effort span.
 */
public class EntityParser {

    private static final Logger LOG = LoggerFactory.getLogger(EntityParser.class);

    private final String source;
    private final GrammarDescriptor grammar;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private final LineIndex lines;
    private final List<AttributeMarker> markers = new ArrayList<>();
    private List<Lexeme> lexemes = List.of();
    private String codeOnly = "";
    private int current = 0;

    /**
     * Creates a new parser for one file.
     * @param source The complete source text the tokens were produced from.
     * @param grammar The grammar of the file.
     * @param diagnostics The engine for reporting unbalanced braces.
     * @param logicalFileName The file name, used for diagnostics and as the root module's name.
     */
    public EntityParser(String source, GrammarDescriptor grammar, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.grammar = grammar;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
        this.lines = new LineIndex(source);
    }

    /**
     * Parses the declarations of the file.
     * @param tokens The complete token list produced by the lexer for the same source.
     * @return The skeleton, with entity ids assigned in depth-first pre-order.
     */
    public ParsedSkeleton parse(List<Token> tokens) {
        this.lexemes = new LexemeReader(source, grammar).read(tokens);
        this.codeOnly = blankComments(tokens);
        this.current = 0;
        markers.clear();

        EntityNode root = new EntityNode(EntityKind.MODULE, moduleName(logicalFileName), "",
                lines.span(0, source.length()), List.of(), List.of());
        while (!isAtEnd()) {
            parseItems(root, BodyStyle.MEMBERS);
            if (!isAtEnd()) {
                Lexeme stray = advance();
                reportUnbalanced("Unmatched '" + stray.text() + "'", stray.start());
            }
        }
        int count = root.assignIds();
        LOG.debug("Parsed {} entities and {} attribute markers in '{}'", count, markers.size(), logicalFileName);
        return new ParsedSkeleton(root, markers);
    }

    /**
     * Reads items until the end of input or a closing bracket, which is left for the caller.
     */
    private void parseItems(EntityNode parent, BodyStyle style) {
        List<AttributeMarker> pending = new ArrayList<>();
        while (!isAtEnd()) {
            Lexeme lexeme = peek();
            switch (lexeme.type()) {
                case CLOSE:
                    return;
                case SEMICOLON:
                case COMMA:
                case NEWLINE:
                    advance();
                    continue;
                case DIRECTIVE:
                    advance();
                    parent.addChild(new EntityNode(EntityKind.UNKNOWN, null, collapse(lexeme.text()),
                            lines.span(lexeme.start(), lexeme.end()), List.of(), List.of()));
                    continue;
                case ATTRIBUTE:
                    AttributeMarker marker = attribute();
                    if (marker != null) {
                        markers.add(marker);
                        pending.add(marker);
                        continue;
                    }
                    break;
                case IDENTIFIER:
                    if (grammar.sectionLabels().contains(lexeme.text()) && checkNext(LexemeType.COLON)) {
                        current += 2;
                        continue;
                    }
                    break;
                default:
                    break;
            }
            EntityNode item = item(parent.kind(), style, pending);
            if (item != null) {
                parent.addChild(item);
            }
            pending = new ArrayList<>();
        }
    }

    private EntityNode item(EntityKind container, BodyStyle style, List<AttributeMarker> attributes) {
        int start = current;
        List<Lexeme> header = new ArrayList<>();
        int depth = 0;
        int angle = 0;
        boolean assigned = false;
        boolean keyword = false;
        boolean callable = false;
        boolean terminated = false;
        int bodyOpen = -1;

        while (!isAtEnd()) {
            Lexeme lexeme = peek();
            if (depth == 0) {
                if (lexeme.type() == LexemeType.SEMICOLON) {
                    advance();
                    terminated = true;
                    break;
                }
                if (lexeme.type() == LexemeType.CLOSE) {
                    break;
                }
                // int a, b; and enum constants: a comma outside generics separates declarations
                if (lexeme.type() == LexemeType.COMMA
                        && (style == BodyStyle.FIELDS || !assigned && angle == 0 && !keyword)) {
                    break;
                }
                if (lexeme.type() == LexemeType.NEWLINE) {
                    if (!header.isEmpty() && endsStatement(header.get(header.size() - 1))) {
                        break;
                    }
                    advance();
                    continue;
                }
                if (lexeme.is(LexemeType.OPEN, "{") && !assigned && style != BodyStyle.FIELDS
                        && (keyword || callable || !grammar.newlineTerminatesStatements())) {
                    bodyOpen = current;
                    break;
                }
                if (!assigned) {
                    if (lexeme.is(LexemeType.OPERATOR, "<")) {
                        angle++;
                    } else if (lexeme.is(LexemeType.OPERATOR, ">")) {
                        angle = Math.max(0, angle - 1);
                    } else if (lexeme.type() == LexemeType.ASSIGN && angle == 0) {
                        assigned = true;
                    } else if (lexeme.type() == LexemeType.IDENTIFIER) {
                        keyword |= grammar.declaration(lexeme.text()).isPresent();
                        callable |= checkNext(LexemeType.OPEN, "(")
                                && !DeclarationHeader.CONTROL_WORDS.contains(lexeme.text());
                    }
                }
            }
            if (lexeme.type() == LexemeType.NEWLINE) {
                advance();
                continue;
            }
            if (lexeme.type() == LexemeType.OPEN
                    || lexeme.type() == LexemeType.ATTRIBUTE && DeclarationHeader.bracketed(lexeme.text(), grammar)) {
                depth++;
            } else if (lexeme.type() == LexemeType.CLOSE) {
                depth--;
            }
            header.add(advance());
        }

        if (header.isEmpty() && bodyOpen < 0) {
            if (current == start && !isAtEnd() && peek().type() != LexemeType.CLOSE) {
                advance();
            }
            return null;
        }
        if (depth > 0) {
            reportUnbalanced("Unclosed bracket in declaration", header.get(0).start());
        }

        DeclarationHeader declaration = new DeclarationHeader(header, grammar);
        DeclarationHeader.Shape shape = declaration.resolve(container, style, bodyOpen >= 0);
        EntityKind kind = shape.kind();
        List<String> attributeTexts = attributes.stream().map(AttributeMarker::text).toList();
        if (kind == EntityKind.FUNCTION && (isTest(attributeTexts)
                || DeclarationHeader.hasTestPrefix(shape.name(), grammar.testNamePrefixes()))) {
            kind = EntityKind.TEST;
        }

        int startOffset = header.isEmpty() ? lexemes.get(bodyOpen).start() : declaration.first().start();
        String signature = header.isEmpty() ? "" : collapse(codeOnly.substring(startOffset, declaration.last().end()));
        List<EntityNode> children = new ArrayList<>();
        int endOffset;
        if (bodyOpen >= 0) {
            advance();
            endOffset = body(shape, children, bodyOpen);
        } else {
            endOffset = terminated ? previous().end() : declaration.last().end();
        }

        EntityNode node = new EntityNode(kind, shape.name(), signature, lines.span(startOffset, endOffset),
                attributeTexts, shape.modifiers());
        children.forEach(node::addChild);
        return node;
    }

    /**
     * Reads a body whose opening brace was just consumed.
     * @return The end offset of the body, or the end of the source if it is never closed.
     */
    private int body(DeclarationHeader.Shape shape, List<EntityNode> children, int bodyOpen) {
        if (shape.body() == BodyStyle.OPAQUE) {
            int depth = 1;
            while (!isAtEnd()) {
                Lexeme lexeme = advance();
                if (lexeme.type() == LexemeType.OPEN
                        || lexeme.type() == LexemeType.ATTRIBUTE && DeclarationHeader.bracketed(lexeme.text(), grammar)) {
                    depth++;
                } else if (lexeme.type() == LexemeType.CLOSE && --depth == 0) {
                    return lexeme.end();
                }
            }
        } else {
            EntityNode holder = new EntityNode(shape.kind(), shape.name(), "", lines.span(0, 0), List.of(), List.of());
            parseItems(holder, shape.body());
            children.addAll(holder.children());
            if (!isAtEnd()) {
                return advance().end();
            }
        }
        reportUnbalanced("Unclosed body" + (shape.name() != null ? " of '" + shape.name() + "'" : ""),
                lexemes.get(bodyOpen).start());
        return source.length();
    }

    /**
     * Reads an attribute marker starting at the current attribute prefix.
     * @return The marker, or {@code null} (with the position unchanged) if no attribute starts here.
     */
    private AttributeMarker attribute() {
        int start = current;
        Lexeme prefix = advance();
        if (DeclarationHeader.bracketed(prefix.text(), grammar)) {
            int depth = 1;
            while (!isAtEnd() && depth > 0) {
                Lexeme lexeme = advance();
                if (lexeme.type() == LexemeType.OPEN) {
                    depth++;
                } else if (lexeme.type() == LexemeType.CLOSE) {
                    depth--;
                }
            }
        } else {
            if (!check(LexemeType.IDENTIFIER) || grammar.declaration(peek().text()).isPresent()) {
                current = start;
                return null;
            }
            advance();
            while (check(LexemeType.OPERATOR, ".") && checkNext(LexemeType.IDENTIFIER)) {
                current += 2;
            }
            if (check(LexemeType.OPEN, "(") && peek().start() == previous().end()) {
                skipGroup();
            }
        }
        int end = previous().end();
        return new AttributeMarker(source.substring(prefix.start(), end), lines.span(prefix.start(), end));
    }

    private void skipGroup() {
        int depth = 0;
        while (!isAtEnd()) {
            Lexeme lexeme = advance();
            if (lexeme.type() == LexemeType.OPEN) {
                depth++;
            } else if (lexeme.type() == LexemeType.CLOSE && --depth == 0) {
                return;
            }
        }
    }

    private boolean isTest(List<String> attributes) {
        return attributes.stream().anyMatch(a -> DeclarationHeader.isTestAttribute(a, grammar.testAttributes()));
    }

    /**
     * A line break ends a declaration when the line ends with a word, a literal or a closing bracket.
     */
    private static boolean endsStatement(Lexeme last) {
        return last.type() == LexemeType.IDENTIFIER
                || last.type() == LexemeType.LITERAL
                || last.type() == LexemeType.CLOSE;
    }

    private void reportUnbalanced(String message, int offset) {
        diagnostics.reportWarning(DiagnosticCode.UNBALANCED_BRACES, message, logicalFileName,
                lines.lineOf(offset), lines.columnOf(offset));
    }

    private String blankComments(List<Token> tokens) {
        StringBuilder text = new StringBuilder(source);
        for (Token token : tokens) {
            if (token.kind().isComment()) {
                for (int i = token.span().startOffset(); i < token.span().endOffset(); i++) {
                    text.setCharAt(i, ' ');
                }
            }
        }
        return text.toString();
    }

    private static String collapse(String text) {
        return text.trim().replaceAll("\\s+", " ");
    }

    private static String moduleName(String fileName) {
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        String base = fileName.substring(slash + 1);
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }

    private boolean check(LexemeType type) {
        return !isAtEnd() && peek().type() == type;
    }

    private boolean check(LexemeType type, String text) {
        return !isAtEnd() && peek().is(type, text);
    }

    private boolean checkNext(LexemeType type) {
        return current + 1 < lexemes.size() && lexemes.get(current + 1).type() == type;
    }

    private boolean checkNext(LexemeType type, String text) {
        return current + 1 < lexemes.size() && lexemes.get(current + 1).is(type, text);
    }

    private Lexeme advance() {
        return lexemes.get(current++);
    }

    private Lexeme peek() {
        return lexemes.get(current);
    }

    private Lexeme previous() {
        return lexemes.get(current - 1);
    }

    private boolean isAtEnd() {
        return current >= lexemes.size();
    }
}
