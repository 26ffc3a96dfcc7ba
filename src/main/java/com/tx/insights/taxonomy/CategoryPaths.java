package com.tx.insights.taxonomy;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization, slugging and humanizing of category path strings.
 *
 * <p>A category path is a list of segments separated by {@code >}, {@code /} or {@code |}.
 * The canonical form joins the trimmed, non-empty segments with {@code " > "}.
 * Node ids are slugs of the canonical path and therefore stable across runs.
 */
public final class CategoryPaths {

    public static final String SEPARATOR = " > ";

    private static final Pattern SEGMENT_SPLIT = Pattern.compile("[>/|]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern WORD_SPLIT = Pattern.compile("[\\s_-]+");

    private CategoryPaths() {
    }

    /**
     * Normalizes a raw category path. Returns an empty string for null or blank input.
     */
    public static String normalize(String rawPath) {
        return String.join(SEPARATOR, segments(rawPath));
    }

    /**
     * Splits a raw or canonical path into trimmed, non-empty segments.
     */
    public static List<String> segments(String rawPath) {
        List<String> segments = new ArrayList<>();
        if (rawPath == null || rawPath.isBlank()) {
            return segments;
        }
        for (String part : SEGMENT_SPLIT.split(rawPath)) {
            String segment = WHITESPACE.matcher(part.strip()).replaceAll(" ");
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    /**
     * Lower-cases the text and collapses every run of characters that are neither letters
     * nor digits into a single hyphen. Letters of any script are kept.
     */
    public static String slug(String text) {
        if (text == null) {
            return "";
        }
        String slug = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("-");
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '-') {
            end--;
        }
        return slug.substring(start, end);
    }

    /**
     * Derives the stable node id for a canonical path.
     */
    public static String nodeId(String canonicalPath) {
        String slug = slug(canonicalPath);
        if (!slug.isEmpty()) {
            return slug;
        }
        // Paths made only of punctuation still need a distinct id
        return "n-" + sha256(canonicalPath).substring(0, 12);
    }

    /**
     * Converts a raw segment to a display title. The first letter of every word is upper-cased;
     * the rest of a word is lower-cased only when the word is plain ASCII.
     */
    public static String humanize(String segment) {
        if (segment == null || segment.isBlank()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String word : WORD_SPLIT.split(segment.strip())) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            int first = word.codePointAt(0);
            int firstLength = Character.charCount(first);
            String rest = word.substring(firstLength);
            sb.appendCodePoint(Character.toTitleCase(first));
            sb.append(isAscii(word) ? rest.toLowerCase(Locale.ROOT) : rest);
        }
        return sb.toString();
    }

    private static boolean isAscii(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (word.charAt(i) > 0x7F) {
                return false;
            }
        }
        return true;
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
