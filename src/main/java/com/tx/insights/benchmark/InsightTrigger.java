package com.tx.insights.benchmark;

/**
 * Conditions under which a node is flagged after peer benchmarking.
 * Ordered from most to least urgent.
 */
public enum InsightTrigger {
    CRITICAL("critical", "Urgently review and update product titles and images"),
    HIGH_PRIORITY("high", "Optimize product titles and descriptions"),
    CONVERSION_FOCUS("high", "Review pricing, shipping costs, and product descriptions"),
    COMPREHENSIVE_REVIEW("medium", "Comprehensive category optimization needed");

    private final String priority;
    private final String recommendation;

    InsightTrigger(String priority, String recommendation) {
        this.priority = priority;
        this.recommendation = recommendation;
    }

    public String getPriority() {
        return priority;
    }

    public String getRecommendation() {
        return recommendation;
    }
}
