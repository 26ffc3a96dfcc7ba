package com.tx.insights.matching;

/**
 * Matching cascade strategies in the order they are attempted.
 */
public enum MatchStrategy {
    EXACT_URL(1),
    GTIN(2),
    PATH_PREFIX(3),
    CATEGORY_KEYWORD(4),
    PRODUCT_TITLE(5),
    NONE(0);

    private final int order;

    MatchStrategy(int order) {
        this.order = order;
    }

    /**
     * Position in the cascade, 1-based; 0 for {@link #NONE}.
     */
    public int getOrder() {
        return order;
    }
}
