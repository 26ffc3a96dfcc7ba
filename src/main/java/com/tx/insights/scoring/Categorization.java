package com.tx.insights.scoring;

/**
 * Full categorization of a node's opportunity.
 *
 * @param category     score by effort bucket
 * @param effort       effort level derived from product count
 * @param priority     1 (highest) to 5 (lowest)
 * @param timelineDays estimated implementation time in days, 0 when no action is needed
 */
public record Categorization(OpportunityCategory category, EffortLevel effort, int priority, int timelineDays) {

    public String suggestedAction(double score) {
        return String.format("%s Score: %.0f/100", category.getSuggestedAction(), score);
    }
}
