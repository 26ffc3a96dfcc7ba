package com.tx.insights.benchmark;

/**
 * A fired trigger with its rendered issue and impact text.
 *
 * @param trigger         the condition that fired
 * @param issue           what is wrong, with the node's figures
 * @param potentialImpact what fixing it could gain
 */
public record Insight(InsightTrigger trigger, String issue, String potentialImpact) {

    public String recommendation() {
        return trigger.getRecommendation();
    }

    public String priority() {
        return trigger.getPriority();
    }
}
