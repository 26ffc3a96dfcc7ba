package com.tx.insights.matching;

/**
 * What a strategy matched on. One record per strategy, each carrying only its own fields.
 */
public sealed interface MatchEvidence {

    MatchStrategy strategy();

    /**
     * @param matchedKey the identifier or normalized URL path that compared equal
     */
    record ExactUrl(String matchedKey) implements MatchEvidence {
        @Override
        public MatchStrategy strategy() {
            return MatchStrategy.EXACT_URL;
        }
    }

    /**
     * @param gtin canonical GTIN with leading zeros stripped
     */
    record Gtin(String gtin) implements MatchEvidence {
        @Override
        public MatchStrategy strategy() {
            return MatchStrategy.GTIN;
        }
    }

    /**
     * @param matchedPath      slugged node path that prefixed the URL
     * @param matchedSegments  number of URL segments consumed by the node path
     * @param totalSegments    number of segments in the URL path
     */
    record PathPrefix(String matchedPath, int matchedSegments, int totalSegments) implements MatchEvidence {
        @Override
        public MatchStrategy strategy() {
            return MatchStrategy.PATH_PREFIX;
        }
    }

    /**
     * @param keyword slugged category title found in the URL
     */
    record CategoryKeyword(String keyword) implements MatchEvidence {
        @Override
        public MatchStrategy strategy() {
            return MatchStrategy.CATEGORY_KEYWORD;
        }
    }

    /**
     * @param titleSlug slugged product title found in the subject key
     */
    record ProductTitle(String titleSlug) implements MatchEvidence {
        @Override
        public MatchStrategy strategy() {
            return MatchStrategy.PRODUCT_TITLE;
        }
    }
}
