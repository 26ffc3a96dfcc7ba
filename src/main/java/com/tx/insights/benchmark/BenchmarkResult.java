package com.tx.insights.benchmark;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Comparison of one node against its same-depth cohort.
 *
 * @param nodeId                node being compared
 * @param cohortSize            peers with impressions, the node included when it has any
 * @param cohortCtr             pooled cohort CTR (cohort clicks / cohort impressions)
 * @param cohortConversionRate  pooled cohort conversion rate (cohort conversions / cohort clicks)
 * @param ctrDelta              percent deviation of the node CTR from the cohort CTR
 * @param conversionDelta       percent deviation of the node conversion rate from the cohort rate
 * @param relativeRank          percent of other cohort members with a strictly lower CTR
 * @param performanceScore      0-100 absolute performance score
 * @param insights              fired triggers, most urgent first
 */
public record BenchmarkResult(
    String nodeId,
    int cohortSize,
    double cohortCtr,
    double cohortConversionRate,
    double ctrDelta,
    double conversionDelta,
    double relativeRank,
    int performanceScore,
    List<Insight> insights
) {

    public BenchmarkResult {
        insights = List.copyOf(insights);
    }

    public Set<InsightTrigger> triggers() {
        Set<InsightTrigger> triggers = EnumSet.noneOf(InsightTrigger.class);
        for (Insight insight : insights) {
            triggers.add(insight.trigger());
        }
        return triggers;
    }

    public boolean has(InsightTrigger trigger) {
        return insights.stream().anyMatch(i -> i.trigger() == trigger);
    }
}
