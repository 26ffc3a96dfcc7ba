package com.tx.insights.matching;

import com.tx.insights.taxonomy.CategoryPaths;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reduces URLs to a comparable path: decoded, lower-cased, without scheme, host, query,
 * fragment, leading or trailing slashes, and without an {@code .html} suffix.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    /**
     * True when the subject key is meant as a URL rather than an identifier.
     */
    public static boolean looksLikeUrl(String key) {
        if (key == null) {
            return false;
        }
        String trimmed = key.strip();
        return trimmed.contains("://") || trimmed.startsWith("/") || trimmed.startsWith("www.");
    }

    /**
     * Normalized path of the URL, or empty when the URL cannot be parsed.
     */
    public static Optional<String> normalizePath(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String candidate = url.strip();
        if (candidate.startsWith("www.")) {
            candidate = "https://" + candidate;
        }
        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
        if (uri.isOpaque() || uri.getPath() == null) {
            return Optional.empty();
        }
        if (uri.getScheme() != null && uri.getHost() == null) {
            return Optional.empty();
        }

        String path = uri.getPath().toLowerCase(Locale.ROOT);
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') {
            start++;
        }
        while (end > start && path.charAt(end - 1) == '/') {
            end--;
        }
        path = path.substring(start, end);
        if (path.endsWith(".html")) {
            path = path.substring(0, path.length() - 5);
        } else if (path.endsWith(".htm")) {
            path = path.substring(0, path.length() - 4);
        }
        return Optional.of(path);
    }

    /**
     * Path segments of a normalized path, each reduced to its slug. Empty slugs are dropped.
     */
    public static List<String> slugSegments(String normalizedPath) {
        List<String> segments = new ArrayList<>();
        for (String part : normalizedPath.split("/")) {
            String slug = CategoryPaths.slug(part);
            if (!slug.isEmpty()) {
                segments.add(slug);
            }
        }
        return segments;
    }
}
