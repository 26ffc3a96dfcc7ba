package com.tx.insights.scoring;

/**
 * Where our price sits relative to the market median.
 */
public enum PricePosition {
    BELOW_MARKET,
    AT_MARKET,
    ABOVE_MARKET,
    UNKNOWN
}
