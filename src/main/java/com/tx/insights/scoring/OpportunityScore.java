package com.tx.insights.scoring;

import com.tx.insights.scoring.RevenueCalculator.RevenuePotential;
import com.tx.insights.scoring.TrafficCalculator.TrafficPotential;

/**
 * Opportunity score of one node for one run.
 */
public final class OpportunityScore {

    private final String nodeId;
    private final double score;
    private final FactorBreakdown factors;
    private final Categorization categorization;
    private final Confidence confidence;
    private final double revenueImpactEstimate;
    private final TrafficPotential traffic;
    private final RevenuePotential revenue;
    private final PricingResult pricing;

    public OpportunityScore(String nodeId, double score, FactorBreakdown factors, Categorization categorization,
                            Confidence confidence, double revenueImpactEstimate, TrafficPotential traffic,
                            RevenuePotential revenue, PricingResult pricing) {
        this.nodeId = nodeId;
        this.score = score;
        this.factors = factors;
        this.categorization = categorization;
        this.confidence = confidence;
        this.revenueImpactEstimate = revenueImpactEstimate;
        this.traffic = traffic;
        this.revenue = revenue;
        this.pricing = pricing;
    }

    public String getNodeId() {
        return nodeId;
    }

    /** 0-100 */
    public double getScore() {
        return score;
    }

    public FactorBreakdown getFactors() {
        return factors;
    }

    public Categorization getCategorization() {
        return categorization;
    }

    public OpportunityCategory getCategory() {
        return categorization.category();
    }

    public Confidence getConfidence() {
        return confidence;
    }

    /**
     * Revenue gap to benchmark plus the revenue the market price supports.
     */
    public double getRevenueImpactEstimate() {
        return revenueImpactEstimate;
    }

    public long getProjectedTrafficIncrease() {
        return traffic.projectedClickIncrease();
    }

    public TrafficPotential getTraffic() {
        return traffic;
    }

    public RevenuePotential getRevenue() {
        return revenue;
    }

    public PricingResult getPricing() {
        return pricing;
    }

    public String getSuggestedAction() {
        return categorization.suggestedAction(score);
    }

    @Override
    public String toString() {
        return String.format("OpportunityScore{node=%s, score=%.1f, category=%s, confidence=%s, impact=%.2f}",
            nodeId, score, categorization.category(), confidence, revenueImpactEstimate);
    }
}
