package org.docweave.extractor.frontend.classifier;

import org.docweave.extractor.frontend.lexer.TokenKind;
import org.docweave.extractor.grammar.BlockCommentDelimiter;
import org.docweave.extractor.grammar.GrammarDescriptor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Removes comment markers from raw comment text.
 * <p>
 * Line comments lose their marker on every line; block comments lose the opener, the closer and a
 * decorative {@code *} at the start of continuation lines. The stripped text additionally drops one
 * space after the marker, trailing whitespace and leading/trailing blank lines.
 */
public final class CommentText {

    /**
     * One physical line of a comment with its markers removed.
     * @param offset The index of {@code content} inside the raw comment text.
     * @param content The text after the marker, before any closer.
     */
    public record Line(int offset, String content) {
    }

    private final List<String> lineMarkers;
    private final List<BlockCommentDelimiter> blockComments;
    private final List<String> blockOpeners;

    /**
     * @param grammar The grammar whose markers are stripped.
     */
    public CommentText(GrammarDescriptor grammar) {
        List<String> line = new ArrayList<>(grammar.lineCommentPrefixes());
        line.addAll(grammar.docLineMarkers());
        List<String> block = new ArrayList<>();
        for (BlockCommentDelimiter delimiter : grammar.blockComments()) {
            block.add(delimiter.open());
        }
        block.addAll(grammar.docBlockMarkers());
        for (String marker : grammar.moduleDocMarkers()) {
            if (grammar.lineCommentPrefixes().stream().anyMatch(marker::startsWith)) {
                line.add(marker);
            } else {
                block.add(marker);
            }
        }
        this.lineMarkers = longestFirst(line);
        this.blockOpeners = longestFirst(block);
        this.blockComments = grammar.blockComments();
    }

    /**
     * Splits a comment into its physical lines with the markers removed.
     *
     * @param rawText The verbatim comment text (a merged line run or one block comment).
     * @param kind Whether the text holds line comments or a block comment.
     * @return One entry per physical line.
     */
    public List<Line> lines(String rawText, TokenKind kind) {
        List<Line> result = new ArrayList<>();
        String closer = kind == TokenKind.BLOCK_COMMENT ? closerOf(rawText) : null;
        String[] parts = rawText.split("\n", -1);
        int offset = 0;
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i].endsWith("\r") ? parts[i].substring(0, parts[i].length() - 1) : parts[i];
            int start = skipWhitespace(part, 0);
            int end = part.length();
            if (kind == TokenKind.LINE_COMMENT) {
                start += markerLength(part, start, lineMarkers, rawText.length());
            } else {
                if (i == 0) {
                    start += markerLength(part, start, blockOpeners,
                            closer == null ? rawText.length() : rawText.length() - closer.length());
                } else if (part.startsWith("*", start) && (closer == null || !part.startsWith(closer, start))) {
                    start++;
                }
                if (i == parts.length - 1 && closer != null && part.endsWith(closer)
                        && part.length() - closer.length() >= start) {
                    end = part.length() - closer.length();
                }
            }
            result.add(new Line(offset + start, part.substring(start, end)));
            offset += parts[i].length() + 1;
        }
        return result;
    }

    /**
     * Produces the documentation text of a comment.
     *
     * @param rawText The verbatim comment text.
     * @param kind Whether the text holds line comments or a block comment.
     * @return The text without markers, e.g. {@code "Doc comment\nmore"}.
     */
    public String strip(String rawText, TokenKind kind) {
        List<String> content = lines(rawText, kind).stream()
                .map(line -> stripTrailing(line.content().startsWith(" ") ? line.content().substring(1) : line.content()))
                .collect(Collectors.toCollection(ArrayList::new));
        while (!content.isEmpty() && content.get(0).isEmpty()) {
            content.remove(0);
        }
        while (!content.isEmpty() && content.get(content.size() - 1).isEmpty()) {
            content.remove(content.size() - 1);
        }
        return String.join("\n", content);
    }

    /**
     * Finds the marker a comment line starts with.
     * @param available The number of characters the marker may occupy at most.
     */
    private static int markerLength(String line, int start, List<String> markers, int available) {
        for (String marker : markers) {
            if (marker.length() <= available && line.startsWith(marker, start)) {
                return marker.length();
            }
        }
        return 0;
    }

    private String closerOf(String rawText) {
        for (BlockCommentDelimiter delimiter : blockComments) {
            if (rawText.startsWith(delimiter.open()) && rawText.endsWith(delimiter.close())
                    && rawText.length() >= delimiter.open().length() + delimiter.close().length()) {
                return delimiter.close();
            }
        }
        return null;
    }

    private static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static String stripTrailing(String text) {
        int end = text.length();
        while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    private static List<String> longestFirst(List<String> markers) {
        return markers.stream().distinct().sorted(Comparator.comparingInt(String::length).reversed()).toList();
    }
}
