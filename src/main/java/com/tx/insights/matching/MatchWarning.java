package com.tx.insights.matching;

/**
 * Non-fatal problem noticed while matching a fact.
 *
 * @param type       warning kind
 * @param factKey    key of the fact, or the product id for catalog warnings
 * @param subjectKey offending value
 * @param detail     human readable detail
 */
public record MatchWarning(Type type, String factKey, String subjectKey, String detail) {

    public enum Type {
        INVALID_GTIN,
        MALFORMED_URL
    }
}
