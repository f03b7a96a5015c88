package org.docweave.extractor.frontend.tagging;

import org.docweave.extractor.frontend.classifier.CommentDraft;
import org.docweave.extractor.frontend.classifier.CommentText;
import org.docweave.extractor.model.Annotation;
import org.docweave.extractor.model.AnnotationTag;
import org.docweave.extractor.model.LineIndex;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds tagged notes such as {@code TODO: Implement validation} in comments.
 * <p>
 * Each physical line of a comment is inspected after its marker and leading whitespace are removed.
 * A line is tagged when it starts with a built-in or custom keyword, matched case-sensitively, followed
 * by a colon, whitespace, the end of the line or an assignee in parentheses ({@code TODO(alice):}).
 */
public class AnnotationTagger {

    private final CommentText commentText;
    private final Set<String> customTags;
    private final LineIndex lines;

    /**
     * @param commentText The marker stripper of the file's grammar.
     * @param customTags Additional keywords reported as {@link AnnotationTag#CUSTOM}.
     * @param lines The line index of the file, for annotation positions.
     */
    public AnnotationTagger(CommentText commentText, Set<String> customTags, LineIndex lines) {
        this.commentText = commentText;
        this.customTags = Set.copyOf(customTags);
        this.lines = lines;
    }

    /**
     * Adds the annotations of one comment to its draft. The draft's owner or container must be set.
     * @param comment The comment to scan.
     * @return The number of annotations found.
     */
    public int tag(CommentDraft comment) {
        int found = 0;
        for (CommentText.Line line : commentText.lines(comment.rawText(), comment.tokenKind())) {
            String content = line.content();
            int start = 0;
            while (start < content.length() && Character.isWhitespace(content.charAt(start))) {
                start++;
            }
            int wordEnd = start;
            while (wordEnd < content.length() && isWordChar(content.charAt(wordEnd))) {
                wordEnd++;
            }
            String keyword = content.substring(start, wordEnd);
            Optional<AnnotationTag> tag = resolve(keyword);
            if (tag.isEmpty()) {
                continue;
            }

            int rest = wordEnd;
            String assignee = null;
            if (rest < content.length() && content.charAt(rest) == '(') {
                int close = content.indexOf(')', rest);
                if (close < 0) {
                    continue;
                }
                assignee = content.substring(rest + 1, close).trim();
                rest = close + 1;
            }
            if (rest < content.length() && content.charAt(rest) == ':') {
                rest++;
            } else if (rest < content.length() && !Character.isWhitespace(content.charAt(rest))) {
                continue;
            }

            int offset = comment.span().startOffset() + line.offset() + start;
            comment.annotations().add(new Annotation(tag.get(), keyword, assignee == null || assignee.isEmpty() ? null : assignee,
                    content.substring(rest).trim(), lines.lineOf(offset), lines.columnOf(offset),
                    comment.id(), comment.entityId()));
            found++;
        }
        return found;
    }

    private Optional<AnnotationTag> resolve(String keyword) {
        if (keyword.isEmpty()) {
            return Optional.empty();
        }
        Optional<AnnotationTag> builtIn = AnnotationTag.ofKeyword(keyword);
        if (builtIn.isPresent()) {
            return builtIn;
        }
        return customTags.contains(keyword) ? Optional.of(AnnotationTag.CUSTOM) : Optional.empty();
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }
}
