package com.tx.insights.scoring;

/**
 * Pricing opportunity of a node. Factor scores are 0-100; {@code score} is their weighted sum.
 *
 * @param score                  composite pricing opportunity
 * @param priceGapScore          opportunity from the distance to the market median
 * @param marginOpportunity      headroom between our margin and the target margin
 * @param competitivePosition    strength of our position in the observed market
 * @param priceElasticity        expected demand response to a price move
 * @param priceGapPercent        signed deviation from the median, positive when above market
 * @param position               band around the median
 * @param potentialPriceIncrease per-unit price increase the market supports
 * @param estimatedRevenueImpact revenue gained from that increase at current volume
 * @param confidence             evidence level from competitor count and price dispersion
 */
public record PricingResult(
    double score,
    double priceGapScore,
    double marginOpportunity,
    double competitivePosition,
    double priceElasticity,
    double priceGapPercent,
    PricePosition position,
    double potentialPriceIncrease,
    double estimatedRevenueImpact,
    Confidence confidence
) {

    private static final PricingResult NO_DATA =
        new PricingResult(0, 0, 0, 0, 0, 0, PricePosition.UNKNOWN, 0, 0, Confidence.LOW);

    public static PricingResult noData() {
        return NO_DATA;
    }

    public boolean hasData() {
        return position != PricePosition.UNKNOWN;
    }
}
