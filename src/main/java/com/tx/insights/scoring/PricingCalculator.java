package com.tx.insights.scoring;

import com.tx.insights.config.ScoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores pricing opportunity from a competitor price snapshot.
 *
 * <p>Composite: price gap 35%, margin opportunity 25%, competitive position 25%,
 * price elasticity 15%. A price above market caps the score below 50. Without usable market
 * data every factor is 0 and confidence is low.
 */
public class PricingCalculator {

    private static final Logger log = LoggerFactory.getLogger(PricingCalculator.class);

    static final double PRICE_GAP_WEIGHT = 0.35;
    static final double MARGIN_WEIGHT = 0.25;
    static final double POSITION_WEIGHT = 0.25;
    static final double ELASTICITY_WEIGHT = 0.15;
    static final double ABOVE_MARKET_CAP = 49.0;
    static final double AT_MARKET_INCREASE = 0.05;

    private final double tolerance;
    private final double marginTarget;

    public PricingCalculator() {
        this(new ScoringConfig());
    }

    public PricingCalculator(ScoringConfig config) {
        this.tolerance = config.getPricingTolerance();
        this.marginTarget = config.getMarginTarget();
    }

    /**
     * @param snapshot       market snapshot, may be null
     * @param currentRevenue revenue of the node, used for elasticity and revenue impact
     */
    public PricingResult calculate(PricingSnapshot snapshot, double currentRevenue) {
        if (snapshot == null || snapshot.competitorCount() <= 0) {
            return PricingResult.noData();
        }
        if (!snapshot.isUsable()) {
            log.debug("Unusable pricing snapshot {}", snapshot);
            return PricingResult.noData();
        }

        double our = snapshot.ourPrice();
        double median = snapshot.marketMedian();
        double relative = (our - median) / median;
        PricePosition position = relative < -tolerance
            ? PricePosition.BELOW_MARKET
            : relative > tolerance ? PricePosition.ABOVE_MARKET : PricePosition.AT_MARKET;

        double priceGap = priceGapScore(snapshot, position);
        double margin = marginOpportunity(snapshot.marginRate());
        double competitive = competitivePosition(snapshot, position);
        double elasticity = elasticity(position, currentRevenue);

        double score = priceGap * PRICE_GAP_WEIGHT
            + margin * MARGIN_WEIGHT
            + competitive * POSITION_WEIGHT
            + elasticity * ELASTICITY_WEIGHT;
        if (position == PricePosition.ABOVE_MARKET) {
            score = Math.min(score, ABOVE_MARKET_CAP);
        }
        score = clamp(score);

        double increase = switch (position) {
            case BELOW_MARKET -> median - our;
            case AT_MARKET -> our * AT_MARKET_INCREASE;
            default -> 0.0;
        };
        // volume held constant, so the impact cannot go negative
        double impact = currentRevenue > 0 ? currentRevenue * increase / our : 0.0;

        return new PricingResult(score, priceGap, margin, competitive, elasticity,
            relative * 100.0, position, increase, impact, confidence(snapshot));
    }

    private double priceGapScore(PricingSnapshot s, PricePosition position) {
        double our = s.ourPrice();
        double median = s.marketMedian();
        if (position == PricePosition.BELOW_MARKET) {
            double range = median - s.marketMin();
            return range > 0 ? clamp((median - our) / range * 100.0) : 50.0;
        }
        if (position == PricePosition.ABOVE_MARKET) {
            double range = s.marketMax() - median;
            return range > 0 ? Math.max(20.0, 50.0 - (our - median) / range * 30.0) : 30.0;
        }
        return 10.0;
    }

    private double marginOpportunity(Double marginRate) {
        if (marginRate == null || marginRate >= marginTarget) {
            return 0.0;
        }
        return clamp((marginTarget - Math.max(0.0, marginRate)) * 333.0);
    }

    private double competitivePosition(PricingSnapshot s, PricePosition position) {
        double density = Math.min(50.0, s.competitorCount() * 5.0);
        double bonus = switch (position) {
            case BELOW_MARKET -> 30.0;
            case AT_MARKET -> 15.0;
            default -> 5.0;
        };
        double tightness = 0.0;
        double spread = s.marketMax() - s.marketMin();
        double our = s.ourPrice();
        if (spread > 0 && our >= s.marketMin() && our <= s.marketMax()) {
            tightness = 20.0 * Math.max(0.0, 1.0 - Math.abs(our - s.marketMedian()) / spread);
        }
        return clamp(density + bonus + tightness);
    }

    private double elasticity(PricePosition position, double currentRevenue) {
        if (currentRevenue <= 0) {
            return 50.0;
        }
        return switch (position) {
            case BELOW_MARKET -> 80.0;
            case ABOVE_MARKET -> 20.0;
            default -> 50.0;
        };
    }

    private Confidence confidence(PricingSnapshot s) {
        double dispersion = (s.marketMax() - s.marketMin()) / s.marketMedian();
        if (s.competitorCount() < 5 || dispersion > 1.0) {
            return Confidence.LOW;
        }
        if (s.competitorCount() >= 10 && dispersion <= 0.5) {
            return Confidence.HIGH;
        }
        return Confidence.MEDIUM;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
