package com.tx.insights.scoring;

import com.tx.insights.aggregation.AggregatedMetrics;
import com.tx.insights.config.ScoringConfig;

/**
 * Traffic potential from search visibility: CTR gap against the expected CTR at the current
 * position (50%), room to climb in rank (30%) and impression volume (20%).
 */
public class TrafficCalculator {

    /** Expected organic CTR for positions 1 to 10. */
    private static final double[] EXPECTED_CTR = {
        0.285, 0.157, 0.094, 0.064, 0.044, 0.031, 0.022, 0.017, 0.014, 0.012
    };

    private final double defaultPosition;
    private final double targetPosition;

    /**
     * @param score                    0-100 composite
     * @param ctrGap                   0-100 score of the CTR shortfall
     * @param positionGap              0-100 score of the rank improvement room
     * @param impressionFactor         0-100 score of the impression volume at this rank
     * @param position                 position used, the default when the node has none
     * @param expectedCtr              expected CTR at that position
     * @param projectedClickIncrease   additional clicks at the target position
     */
    public record TrafficPotential(
        double score,
        double ctrGap,
        double positionGap,
        double impressionFactor,
        double position,
        double expectedCtr,
        long projectedClickIncrease
    ) {
        static final TrafficPotential NONE = new TrafficPotential(0, 0, 0, 0, 0, 0, 0);
    }

    public TrafficCalculator() {
        this(new ScoringConfig());
    }

    public TrafficCalculator(ScoringConfig config) {
        this.defaultPosition = config.getDefaultPosition();
        this.targetPosition = config.getTargetPosition();
    }

    public TrafficPotential calculate(AggregatedMetrics metrics) {
        long impressions = metrics.getImpressions();
        if (impressions == 0) {
            return TrafficPotential.NONE;
        }

        double position = metrics.getAveragePosition() > 0 ? metrics.getAveragePosition() : defaultPosition;
        position = Math.max(1.0, position);
        double expected = expectedCtr(position);

        double ctrGap = Math.min(100.0, Math.max(0.0, expected - metrics.getCtr()) * 500.0);
        double positionGap = positionGapScore(position);
        double impressionFactor = impressionFactor(impressions, position);
        double score = ctrGap * 0.50 + positionGap * 0.30 + impressionFactor * 0.20;

        long targetClicks = Math.round(impressions * expectedCtr(targetPosition));
        long increase = Math.max(0L, targetClicks - metrics.getClicks());

        return new TrafficPotential(score, ctrGap, positionGap, impressionFactor, position, expected, increase);
    }

    /**
     * Expected CTR at a (fractional) search position.
     */
    public static double expectedCtr(double position) {
        long rank = Math.max(1L, Math.round(position));
        if (rank <= EXPECTED_CTR.length) {
            return EXPECTED_CTR[(int) rank - 1];
        }
        if (rank <= 20) return 0.008;
        if (rank <= 30) return 0.004;
        return 0.002;
    }

    static double positionGapScore(double position) {
        if (position <= 1.0) {
            return 0.0;
        }
        if (position <= 3.0) {
            return (position - 1.0) * 30.0;
        }
        if (position <= 10.0) {
            return 60.0 + (position - 3.0) * 5.0;
        }
        return Math.min(100.0, 95.0 + (position - 10.0) * 0.5);
    }

    static double impressionFactor(long impressions, double position) {
        if (impressions > 1000 && position > 10) return 90.0;
        if (impressions > 500 && position > 5) return 70.0;
        if (impressions > 100 && position > 3) return 50.0;
        if (impressions < 100 && position > 10) return 30.0;
        return 10.0;
    }
}
