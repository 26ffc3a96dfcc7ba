package com.tx.insights.scoring;

import com.tx.insights.config.ScoringConfig;

/**
 * Buckets an opportunity by score and effort.
 *
 * <pre>
 *   score &gt;= 70, effort &lt;= 10  quick-win
 *   score &gt;= 70, effort &gt; 10   strategic
 *   40 &lt;= score &lt; 70, effort &lt;= 10  incremental
 *   40 &lt;= score &lt; 70, effort &gt; 10   long-term
 *   score &lt; 40                maintain
 * </pre>
 *
 * Boundaries belong to the higher-priority bucket. Effort is the product count under the node.
 * Negative or NaN scores resolve to maintain; negative effort counts as no effort.
 */
public class OpportunityCategorizer {

    private static final long LARGE_CATALOG = 100;

    private final double highScore;
    private final double mediumScore;
    private final int lowEffort;
    private final int mediumEffort;

    public OpportunityCategorizer() {
        this(new ScoringConfig());
    }

    public OpportunityCategorizer(ScoringConfig config) {
        this.highScore = config.getHighScoreThreshold();
        this.mediumScore = config.getMediumScoreThreshold();
        this.lowEffort = config.getLowEffortThreshold();
        this.mediumEffort = config.getMediumEffortThreshold();
    }

    public OpportunityCategory categorize(double score, long effort) {
        if (Double.isNaN(score) || score < mediumScore) {
            return OpportunityCategory.MAINTAIN;
        }
        if (score >= highScore) {
            return effortLevel(effort) == EffortLevel.LOW ? OpportunityCategory.QUICK_WIN : OpportunityCategory.STRATEGIC;
        }
        return effortLevel(effort) == EffortLevel.LOW ? OpportunityCategory.INCREMENTAL : OpportunityCategory.LONG_TERM;
    }

    public EffortLevel effortLevel(long effort) {
        long clamped = Math.max(0L, effort);
        if (clamped <= lowEffort) return EffortLevel.LOW;
        if (clamped <= mediumEffort) return EffortLevel.MEDIUM;
        return EffortLevel.HIGH;
    }

    public Categorization categorizeFully(double score, long effort) {
        OpportunityCategory category = categorize(score, effort);
        EffortLevel level = effortLevel(effort);
        return new Categorization(category, level, priority(category), timelineDays(category, effort));
    }

    /**
     * 1 = highest priority, 5 = lowest.
     */
    static int priority(OpportunityCategory category) {
        return switch (category) {
            case QUICK_WIN -> 1;
            case STRATEGIC -> 2;
            case INCREMENTAL -> 3;
            case LONG_TERM -> 4;
            case MAINTAIN -> 5;
        };
    }

    /**
     * Base days per category, half again as long above 100 products. Maintain is always 0.
     */
    static int timelineDays(OpportunityCategory category, long productCount) {
        int base = switch (category) {
            case QUICK_WIN -> 14;
            case STRATEGIC -> 90;
            case INCREMENTAL -> 30;
            case LONG_TERM -> 180;
            case MAINTAIN -> 0;
        };
        return productCount > LARGE_CATALOG ? (int) Math.round(base * 1.5) : base;
    }
}
