package com.tx.insights.config;

/**
 * Scoring weights, category thresholds and industry benchmarks.
 */
public class ScoringConfig {

    private ScoringWeights weights = ScoringWeights.DEFAULT;

    // Categorization
    private double highScoreThreshold = 70;
    private double mediumScoreThreshold = 40;
    private int lowEffortThreshold = 10;
    private int mediumEffortThreshold = 100;

    // Search position
    private double defaultPosition = 20;
    private double targetPosition = 3;

    // Industry benchmarks
    private double benchmarkConversionRate = 0.025;
    private double benchmarkAverageOrderValue = 150;
    private double benchmarkRevenuePerSession = 3.75;

    // Pricing
    private double marginTarget = 0.30;
    private double pricingTolerance = 0.05;

    public ScoringConfig() {
    }

    /**
     * Checks cross-field constraints that setters cannot check on their own.
     *
     * @throws IllegalArgumentException when thresholds are inconsistent
     */
    public void validate() {
        if (mediumScoreThreshold > highScoreThreshold) {
            throw new IllegalArgumentException("mediumScore threshold " + mediumScoreThreshold
                + " exceeds highScore threshold " + highScoreThreshold);
        }
        if (lowEffortThreshold > mediumEffortThreshold) {
            throw new IllegalArgumentException("lowEffort threshold " + lowEffortThreshold
                + " exceeds mediumEffort threshold " + mediumEffortThreshold);
        }
        if (defaultPosition < 1 || targetPosition < 1) {
            throw new IllegalArgumentException("Search positions start at 1");
        }
        if (benchmarkConversionRate <= 0 || benchmarkAverageOrderValue <= 0 || benchmarkRevenuePerSession <= 0) {
            throw new IllegalArgumentException("Benchmarks must be positive");
        }
        if (marginTarget <= 0 || marginTarget >= 1) {
            throw new IllegalArgumentException("Margin target must be between 0 and 1: " + marginTarget);
        }
    }

    // Getters and setters
    public ScoringWeights getWeights() {
        return weights;
    }

    public void setWeights(ScoringWeights weights) {
        this.weights = weights;
    }

    public double getHighScoreThreshold() {
        return highScoreThreshold;
    }

    public void setHighScoreThreshold(double highScoreThreshold) {
        this.highScoreThreshold = highScoreThreshold;
    }

    public double getMediumScoreThreshold() {
        return mediumScoreThreshold;
    }

    public void setMediumScoreThreshold(double mediumScoreThreshold) {
        this.mediumScoreThreshold = mediumScoreThreshold;
    }

    public int getLowEffortThreshold() {
        return lowEffortThreshold;
    }

    public void setLowEffortThreshold(int lowEffortThreshold) {
        this.lowEffortThreshold = lowEffortThreshold;
    }

    public int getMediumEffortThreshold() {
        return mediumEffortThreshold;
    }

    public void setMediumEffortThreshold(int mediumEffortThreshold) {
        this.mediumEffortThreshold = mediumEffortThreshold;
    }

    public double getDefaultPosition() {
        return defaultPosition;
    }

    public void setDefaultPosition(double defaultPosition) {
        this.defaultPosition = defaultPosition;
    }

    public double getTargetPosition() {
        return targetPosition;
    }

    public void setTargetPosition(double targetPosition) {
        this.targetPosition = targetPosition;
    }

    public double getBenchmarkConversionRate() {
        return benchmarkConversionRate;
    }

    public void setBenchmarkConversionRate(double benchmarkConversionRate) {
        this.benchmarkConversionRate = benchmarkConversionRate;
    }

    public double getBenchmarkAverageOrderValue() {
        return benchmarkAverageOrderValue;
    }

    public void setBenchmarkAverageOrderValue(double benchmarkAverageOrderValue) {
        this.benchmarkAverageOrderValue = benchmarkAverageOrderValue;
    }

    public double getBenchmarkRevenuePerSession() {
        return benchmarkRevenuePerSession;
    }

    public void setBenchmarkRevenuePerSession(double benchmarkRevenuePerSession) {
        this.benchmarkRevenuePerSession = benchmarkRevenuePerSession;
    }

    public double getMarginTarget() {
        return marginTarget;
    }

    public void setMarginTarget(double marginTarget) {
        this.marginTarget = marginTarget;
    }

    public double getPricingTolerance() {
        return pricingTolerance;
    }

    public void setPricingTolerance(double pricingTolerance) {
        this.pricingTolerance = pricingTolerance;
    }
}
