package com.tx.insights.config;

/**
 * Thresholds of the peer-benchmark insight triggers.
 */
public class InsightConfig {

    private long minImpressions = 100;
    private long criticalImpressions = 10_000;
    private double criticalCtr = 0.005;
    private double highPriorityCtrDeficitPercent = 30;
    private long conversionFocusClicks = 100;
    private double conversionFocusRate = 0.01;
    private double reviewPerformanceScore = 50;
    private int reviewMinProducts = 5;

    /**
     * Nodes with fewer impressions raise no insights at all.
     */
    public long getMinImpressions() {
        return minImpressions;
    }

    public void setMinImpressions(long minImpressions) {
        this.minImpressions = minImpressions;
    }

    public long getCriticalImpressions() {
        return criticalImpressions;
    }

    public void setCriticalImpressions(long criticalImpressions) {
        this.criticalImpressions = criticalImpressions;
    }

    public double getCriticalCtr() {
        return criticalCtr;
    }

    public void setCriticalCtr(double criticalCtr) {
        this.criticalCtr = criticalCtr;
    }

    public double getHighPriorityCtrDeficitPercent() {
        return highPriorityCtrDeficitPercent;
    }

    public void setHighPriorityCtrDeficitPercent(double highPriorityCtrDeficitPercent) {
        this.highPriorityCtrDeficitPercent = highPriorityCtrDeficitPercent;
    }

    public long getConversionFocusClicks() {
        return conversionFocusClicks;
    }

    public void setConversionFocusClicks(long conversionFocusClicks) {
        this.conversionFocusClicks = conversionFocusClicks;
    }

    public double getConversionFocusRate() {
        return conversionFocusRate;
    }

    public void setConversionFocusRate(double conversionFocusRate) {
        this.conversionFocusRate = conversionFocusRate;
    }

    public double getReviewPerformanceScore() {
        return reviewPerformanceScore;
    }

    public void setReviewPerformanceScore(double reviewPerformanceScore) {
        this.reviewPerformanceScore = reviewPerformanceScore;
    }

    public int getReviewMinProducts() {
        return reviewMinProducts;
    }

    public void setReviewMinProducts(int reviewMinProducts) {
        this.reviewMinProducts = reviewMinProducts;
    }
}
