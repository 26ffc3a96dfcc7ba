package com.tx.insights.pipeline;

import com.tx.insights.matching.MatchStatistics;
import com.tx.insights.matching.MatchWarning;
import com.tx.insights.taxonomy.AnomalyType;
import com.tx.insights.taxonomy.TreeAnomaly;

import java.util.List;

/**
 * Non-fatal findings of a run: how well facts matched, what the matcher and the tree builder
 * flagged, and which inputs could not be placed.
 *
 * @param matchStatistics     match counts, rate and unmatched subjects
 * @param warnings            catalog and fact warnings in input order
 * @param anomalies           tree anomalies, conflicts included
 * @param unassignedFacts     matched facts that reached no node
 * @param unresolvedPricing   pricing keys that name no node of the tree
 */
public record RunDiagnostics(
    MatchStatistics matchStatistics,
    List<MatchWarning> warnings,
    List<TreeAnomaly> anomalies,
    int unassignedFacts,
    List<String> unresolvedPricing
) {

    public RunDiagnostics {
        warnings = List.copyOf(warnings);
        anomalies = List.copyOf(anomalies);
        unresolvedPricing = List.copyOf(unresolvedPricing);
    }

    public List<String> unmatchedSubjects() {
        return matchStatistics.getUnmatchedSubjects();
    }

    public List<TreeAnomaly> conflicts() {
        return anomalies.stream().filter(a -> a.type() == AnomalyType.PATH_CONFLICT).toList();
    }

    public boolean isClean() {
        return warnings.isEmpty() && anomalies.isEmpty() && unassignedFacts == 0
            && matchStatistics.getUnmatched() == 0 && unresolvedPricing.isEmpty();
    }
}
