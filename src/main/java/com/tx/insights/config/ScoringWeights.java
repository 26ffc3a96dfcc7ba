package com.tx.insights.config;

/**
 * Weights of the five opportunity factors. They must be non-negative and sum to 1.0.
 *
 * @param traffic     traffic potential weight
 * @param revenue     revenue potential weight
 * @param pricing     pricing opportunity weight
 * @param competitive competitive gap weight
 * @param content     content quality weight
 */
public record ScoringWeights(double traffic, double revenue, double pricing, double competitive, double content) {

    public static final ScoringWeights DEFAULT = new ScoringWeights(0.25, 0.30, 0.25, 0.10, 0.10);

    private static final double TOLERANCE = 1e-6;

    public ScoringWeights {
        if (traffic < 0 || revenue < 0 || pricing < 0 || competitive < 0 || content < 0) {
            throw new IllegalArgumentException("Scoring weights must be non-negative");
        }
        double sum = traffic + revenue + pricing + competitive + content;
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException("Scoring weights must sum to 1.0 but sum to " + sum);
        }
    }
}
