package com.tx.insights.matching;

import java.util.Locale;

/**
 * Origin of a metric fact.
 */
public enum MetricSource {
    SEARCH_CONSOLE,
    ANALYTICS,
    MERCHANT;

    /**
     * Parses a source name, accepting the short aliases used in exports.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static MetricSource fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Metric source must not be null");
        }
        return switch (value.strip().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "search_console", "searchconsole", "gsc" -> SEARCH_CONSOLE;
            case "analytics", "ga", "ga4" -> ANALYTICS;
            case "merchant", "merchant_center", "gmc" -> MERCHANT;
            default -> throw new IllegalArgumentException("Unknown metric source: " + value);
        };
    }
}
