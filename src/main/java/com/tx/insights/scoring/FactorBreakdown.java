package com.tx.insights.scoring;

import com.tx.insights.config.ScoringWeights;

/**
 * The five 0-100 sub-scores behind an opportunity score.
 */
public record FactorBreakdown(
    double trafficPotential,
    double revenuePotential,
    double pricingOpportunity,
    double competitiveGap,
    double contentQuality
) {

    public double weightedSum(ScoringWeights weights) {
        return trafficPotential * weights.traffic()
            + revenuePotential * weights.revenue()
            + pricingOpportunity * weights.pricing()
            + competitiveGap * weights.competitive()
            + contentQuality * weights.content();
    }
}
