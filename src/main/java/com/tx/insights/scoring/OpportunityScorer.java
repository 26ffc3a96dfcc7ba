package com.tx.insights.scoring;

import com.tx.insights.aggregation.AggregatedMetrics;
import com.tx.insights.aggregation.AggregationResult;
import com.tx.insights.config.ScoringConfig;
import com.tx.insights.config.ScoringWeights;
import com.tx.insights.scoring.RevenueCalculator.RevenuePotential;
import com.tx.insights.scoring.TrafficCalculator.TrafficPotential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weighted five-factor opportunity score per node.
 *
 * <pre>
 * score = trafficPotential   * 0.25
 *       + revenuePotential   * 0.30
 *       + pricingOpportunity * 0.25
 *       + competitiveGap     * 0.10
 *       + contentQuality     * 0.10
 * </pre>
 *
 * Weights come from {@link ScoringConfig}. Scoring reads only the node's own aggregated
 * metrics, pricing snapshot and content profile, so nodes can be scored in any order.
 */
public class OpportunityScorer {

    private static final Logger log = LoggerFactory.getLogger(OpportunityScorer.class);

    private final ScoringWeights weights;
    private final TrafficCalculator trafficCalculator;
    private final RevenueCalculator revenueCalculator;
    private final PricingCalculator pricingCalculator;
    private final OpportunityCategorizer categorizer;

    public OpportunityScorer() {
        this(new ScoringConfig());
    }

    public OpportunityScorer(ScoringConfig config) {
        config.validate();
        this.weights = config.getWeights();
        this.trafficCalculator = new TrafficCalculator(config);
        this.revenueCalculator = new RevenueCalculator(config);
        this.pricingCalculator = new PricingCalculator(config);
        this.categorizer = new OpportunityCategorizer(config);
    }

    public OpportunityScore score(AggregatedMetrics metrics, PricingSnapshot pricing, ContentProfile content) {
        ContentProfile profile = content == null ? ContentProfile.EMPTY : content;

        TrafficPotential traffic = trafficCalculator.calculate(metrics);
        RevenuePotential revenue = revenueCalculator.calculate(metrics);
        PricingResult pricingResult = pricingCalculator.calculate(pricing, metrics.getRevenue());

        double completeness = profile.completeness();
        double competitiveGap = marketShareGap(metrics) * 0.60 + (100.0 - completeness) * 0.40;
        double contentQuality = completeness * 0.70 + profile.mediaCoverage() * 0.30;

        FactorBreakdown factors = new FactorBreakdown(traffic.score(), revenue.score(), pricingResult.score(),
            competitiveGap, contentQuality);
        double score = Math.max(0.0, Math.min(100.0, factors.weightedSum(weights)));

        Categorization categorization = categorizer.categorizeFully(score, metrics.getTotalProductCount());
        Confidence confidence = Confidence.fromSourceCount(metrics.getSources().size());
        double impact = revenue.potentialRevenue() + pricingResult.estimatedRevenueImpact();

        return new OpportunityScore(metrics.getNodeId(), score, factors, categorization, confidence, impact,
            traffic, revenue, pricingResult);
    }

    /**
     * Scores every node of an aggregation. Missing pricing or content entries count as no data.
     */
    public Map<String, OpportunityScore> scoreAll(AggregationResult aggregation,
                                                  Map<String, PricingSnapshot> pricingByNode,
                                                  Map<String, ContentProfile> contentByNode) {
        Map<String, OpportunityScore> scores = new LinkedHashMap<>();
        for (AggregatedMetrics metrics : aggregation.all()) {
            String nodeId = metrics.getNodeId();
            scores.put(nodeId, score(metrics, pricingByNode.get(nodeId), contentByNode.get(nodeId)));
        }
        log.info("Scored {} nodes", scores.size());
        return scores;
    }

    /**
     * Share-of-search gap from the average position; unknown without search data.
     */
    static double marketShareGap(AggregatedMetrics metrics) {
        double position = metrics.getAveragePosition();
        if (position <= 0) return 50.0;
        if (position <= 3) return 10.0;
        if (position <= 10) return 40.0;
        if (position <= 20) return 70.0;
        return 90.0;
    }
}
