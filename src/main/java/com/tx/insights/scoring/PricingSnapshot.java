package com.tx.insights.scoring;

/**
 * Competitor price observations for a node's assortment, plus our own price and margin.
 *
 * @param ourPrice        our representative price
 * @param marketMedian    median competitor price
 * @param marketMin       lowest competitor price
 * @param marketMax       highest competitor price
 * @param competitorCount number of competitors observed
 * @param marginRate      our margin as a fraction of price, null when unknown
 */
public record PricingSnapshot(
    double ourPrice,
    double marketMedian,
    double marketMin,
    double marketMax,
    int competitorCount,
    Double marginRate
) {

    public static PricingSnapshot of(double ourPrice, double median, double min, double max, int competitors) {
        return new PricingSnapshot(ourPrice, median, min, max, competitors, null);
    }

    /**
     * True when the snapshot carries usable market data.
     */
    public boolean isUsable() {
        if (competitorCount <= 0) {
            return false;
        }
        if (!finiteNonNegative(ourPrice) || !finiteNonNegative(marketMedian)
            || !finiteNonNegative(marketMin) || !finiteNonNegative(marketMax)) {
            return false;
        }
        return ourPrice > 0 && marketMedian > 0 && marketMin <= marketMax;
    }

    private static boolean finiteNonNegative(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value) && value >= 0;
    }
}
