package org.docweave.extractor.frontend.tagging;

import org.docweave.extractor.model.DocTag;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts structured tags from documentation text: Javadoc/JSDoc {@code @tags},
 * Rust style {@code # Headings} and {@code Args:}/{@code Returns:} style sections.
 */
public final class DocTagExtractor {

    private static final Pattern AT_TAG = Pattern.compile("^@(\\w+)(?:\\s+(.*))?$");
    private static final Pattern HEADING = Pattern.compile("^#+\\s+(\\w+)");
    private static final Pattern SECTION = Pattern.compile("^(Args|Arguments|Returns|Raises|Yields|Throws):");
    private static final Pattern DESCRIPTION_SEPARATOR = Pattern.compile("\\s+-\\s+");
    /** Tags whose whole text is a description, e.g. {@code @return Sum of a and b}. */
    private static final Set<String> DESCRIPTION_ONLY = Set.of(
            "return", "returns", "brief", "summary", "description", "deprecated", "since", "author", "version");

    private DocTagExtractor() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param text Documentation text with comment markers removed.
     * @return The tags in order of appearance.
     */
    public static List<DocTag> extract(String text) {
        List<DocTag> tags = new ArrayList<>();
        for (String rawLine : text.split("\n")) {
            String line = rawLine.trim();
            Matcher at = AT_TAG.matcher(line);
            if (at.find()) {
                tags.add(atTag(at.group(1), at.group(2)));
                continue;
            }
            Matcher heading = HEADING.matcher(line);
            if (heading.find()) {
                tags.add(new DocTag(heading.group(1).toLowerCase(Locale.ROOT), "", null));
                continue;
            }
            Matcher section = SECTION.matcher(line);
            if (section.find()) {
                tags.add(new DocTag(section.group(1).toLowerCase(Locale.ROOT), "", null));
            }
        }
        return tags;
    }

    /**
     * {@code @param a - First number} and {@code @param a First number} both yield value {@code a}
     * and description {@code First number}; {@code @returns Sum} yields an empty value and description {@code Sum}.
     */
    private static DocTag atTag(String name, String rest) {
        if (rest == null || rest.isBlank()) {
            return new DocTag(name, "", null);
        }
        String trimmed = rest.trim();
        if (DESCRIPTION_ONLY.contains(name)) {
            return new DocTag(name, "", trimmed);
        }
        String[] separated = DESCRIPTION_SEPARATOR.split(trimmed, 2);
        if (separated.length == 2) {
            return new DocTag(name, separated[0].trim(), blankToNull(separated[1]));
        }
        String[] words = trimmed.split("\\s+", 2);
        return new DocTag(name, words[0], words.length == 2 ? blankToNull(words[1]) : null);
    }

    private static String blankToNull(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
