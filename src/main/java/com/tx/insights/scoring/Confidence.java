package com.tx.insights.scoring;

/**
 * How much evidence backs a score.
 */
public enum Confidence {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Confidence from the number of distinct metric sources behind a node:
     * three or more is high, two is medium, fewer is low.
     */
    public static Confidence fromSourceCount(int distinctSources) {
        if (distinctSources >= 3) return HIGH;
        if (distinctSources == 2) return MEDIUM;
        return LOW;
    }
}
