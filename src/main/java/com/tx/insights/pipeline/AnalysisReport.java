package com.tx.insights.pipeline;

import com.tx.insights.aggregation.AggregationResult;
import com.tx.insights.benchmark.BenchmarkResult;
import com.tx.insights.scoring.OpportunityCategory;
import com.tx.insights.scoring.OpportunityScore;
import com.tx.insights.taxonomy.TaxonomyTree;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a completed run. Everything but the phase metrics is a pure function of the
 * run's input and configuration.
 */
public final class AnalysisReport {

    private final String runId;
    private final TaxonomyTree tree;
    private final AggregationResult aggregation;
    private final Map<String, OpportunityScore> scores;
    private final Map<String, BenchmarkResult> benchmarks;
    private final RunDiagnostics diagnostics;
    private final Map<RunPhase, PhaseMetrics> phaseMetrics;

    AnalysisReport(String runId, TaxonomyTree tree, AggregationResult aggregation,
                   Map<String, OpportunityScore> scores, Map<String, BenchmarkResult> benchmarks,
                   RunDiagnostics diagnostics, Map<RunPhase, PhaseMetrics> phaseMetrics) {
        this.runId = runId;
        this.tree = tree;
        this.aggregation = aggregation;
        this.scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        this.benchmarks = Collections.unmodifiableMap(new LinkedHashMap<>(benchmarks));
        this.diagnostics = diagnostics;
        this.phaseMetrics = Collections.unmodifiableMap(new EnumMap<>(phaseMetrics));
    }

    public String getRunId() {
        return runId;
    }

    public TaxonomyTree getTree() {
        return tree;
    }

    public AggregationResult getAggregation() {
        return aggregation;
    }

    public Map<String, OpportunityScore> getScores() {
        return scores;
    }

    public Map<String, BenchmarkResult> getBenchmarks() {
        return benchmarks;
    }

    public RunDiagnostics getDiagnostics() {
        return diagnostics;
    }

    public Map<RunPhase, PhaseMetrics> getPhaseMetrics() {
        return phaseMetrics;
    }

    /**
     * Highest scores first; ties keep tree order.
     */
    public List<OpportunityScore> topOpportunities(int limit) {
        return scores.values().stream()
            .sorted(Comparator.comparingDouble(OpportunityScore::getScore).reversed())
            .limit(Math.max(0, limit))
            .toList();
    }

    public Map<OpportunityCategory, Integer> countByCategory() {
        Map<OpportunityCategory, Integer> counts = new EnumMap<>(OpportunityCategory.class);
        for (OpportunityCategory category : OpportunityCategory.values()) {
            counts.put(category, 0);
        }
        for (OpportunityScore score : scores.values()) {
            counts.merge(score.getCategory(), 1, Integer::sum);
        }
        return counts;
    }

    public double getTotalRevenueImpact() {
        // roots only, descendants are already inside their ancestors' totals
        return tree.roots().stream()
            .map(root -> scores.get(root.getId()))
            .filter(score -> score != null)
            .mapToDouble(OpportunityScore::getRevenueImpactEstimate)
            .sum();
    }
}
