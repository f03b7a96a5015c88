package org.docweave.extractor.frontend.classifier;

import org.docweave.extractor.frontend.lexer.Token;
import org.docweave.extractor.frontend.lexer.TokenKind;
import org.docweave.extractor.grammar.BlockCommentDelimiter;
import org.docweave.extractor.grammar.GrammarDescriptor;
import org.docweave.extractor.model.CommentKind;
import org.docweave.extractor.model.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Refines comment tokens into {@link CommentKind}s and merges runs of line comments.
 * <p>
 * Rule order, first match wins: a module-doc marker gives {@link CommentKind#MODULE_DOC}, a doc marker
 * gives {@link CommentKind#DOC_LINE} or {@link CommentKind#DOC_BLOCK}, anything else is plain.
 * Markers are tried longest first so that {@code ///} is never read as {@code //}.
 */
public class CommentClassifier {

    private final GrammarDescriptor grammar;
    private final List<String> moduleMarkers;
    private final List<String> docLineMarkers;
    private final List<String> docBlockMarkers;
    private final CommentText commentText;

    public CommentClassifier(GrammarDescriptor grammar) {
        this.grammar = grammar;
        this.moduleMarkers = longestFirst(grammar.moduleDocMarkers());
        this.docLineMarkers = longestFirst(grammar.docLineMarkers());
        this.docBlockMarkers = longestFirst(grammar.docBlockMarkers());
        this.commentText = new CommentText(grammar);
    }

    /**
     * Classifies a single comment token.
     *
     * @param token A {@link TokenKind#LINE_COMMENT} or {@link TokenKind#BLOCK_COMMENT} token.
     * @return The refined kind.
     * @throws IllegalArgumentException if the token is not a comment.
     */
    public CommentKind classify(Token token) {
        if (!token.kind().isComment()) {
            throw new IllegalArgumentException("Not a comment token: " + token.kind());
        }
        String text = token.text();
        boolean line = token.kind() == TokenKind.LINE_COMMENT;
        if (!line && isEmptyBlock(text)) {
            return CommentKind.PLAIN_BLOCK;
        }
        if (startsWithMarker(text, moduleMarkers)) {
            return CommentKind.MODULE_DOC;
        }
        if (line) {
            return startsWithMarker(text, docLineMarkers) ? CommentKind.DOC_LINE : CommentKind.PLAIN_LINE;
        }
        return startsWithMarker(text, docBlockMarkers) ? CommentKind.DOC_BLOCK : CommentKind.PLAIN_BLOCK;
    }

    /**
     * Classifies all comment tokens of a scan. Consecutive line comments of the same kind, separated only
     * by whitespace containing exactly one line break, become a single draft.
     *
     * @param tokens The complete token list of one file.
     * @return The drafts in source order, numbered from 0.
     */
    public List<CommentDraft> collect(List<Token> tokens) {
        List<CommentDraft> drafts = new ArrayList<>();
        int i = 0;
        while (i < tokens.size()) {
            Token first = tokens.get(i);
            if (!first.kind().isComment()) {
                i++;
                continue;
            }
            CommentKind kind = classify(first);
            int last = i;
            if (first.kind() == TokenKind.LINE_COMMENT) {
                while (last + 2 < tokens.size()
                        && isSingleLineBreak(tokens.get(last + 1))
                        && tokens.get(last + 2).kind() == TokenKind.LINE_COMMENT
                        && classify(tokens.get(last + 2)) == kind) {
                    last += 2;
                }
            }
            drafts.add(draft(drafts.size(), kind, tokens.subList(i, last + 1)));
            i = last + 1;
        }
        return drafts;
    }

    /**
     * @return The marker stripper configured for this grammar.
     */
    public CommentText commentText() {
        return commentText;
    }

    private CommentDraft draft(int id, CommentKind kind, List<Token> run) {
        Token first = run.get(0);
        Token last = run.get(run.size() - 1);
        StringBuilder raw = new StringBuilder();
        for (Token token : run) {
            raw.append(token.text());
        }
        SourceSpan span = new SourceSpan(first.span().startOffset(), last.span().endOffset(),
                first.span().startLine(), first.span().startColumn(),
                last.span().endLine(), last.span().endColumn());
        String rawText = raw.toString();
        return new CommentDraft(id, kind, first.kind(), span, rawText, commentText.strip(rawText, first.kind()));
    }

    private static boolean isSingleLineBreak(Token token) {
        if (token.kind() != TokenKind.CODE || !token.text().isBlank()) {
            return false;
        }
        return token.text().indexOf('\n') == token.text().lastIndexOf('\n') && token.text().indexOf('\n') >= 0;
    }

    private boolean isEmptyBlock(String text) {
        for (BlockCommentDelimiter delimiter : grammar.blockComments()) {
            if (text.equals(delimiter.open() + delimiter.close())) {
                return true;
            }
        }
        return false;
    }

    /**
     * A marker matches when the text starts with it and the next character does not repeat the
     * marker's last character, so {@code ////} and {@code /***} stay plain.
     */
    private static boolean startsWithMarker(String text, List<String> markers) {
        for (String marker : markers) {
            if (text.startsWith(marker)) {
                char lastChar = marker.charAt(marker.length() - 1);
                return text.length() == marker.length() || text.charAt(marker.length()) != lastChar;
            }
        }
        return false;
    }

    private static List<String> longestFirst(List<String> markers) {
        return markers.stream().sorted(Comparator.comparingInt(String::length).reversed()).toList();
    }
}
