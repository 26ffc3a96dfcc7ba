package com.tx.insights.pipeline;

import com.tx.insights.aggregation.AggregationResult;
import com.tx.insights.aggregation.PerformanceAggregator;
import com.tx.insights.benchmark.BenchmarkResult;
import com.tx.insights.benchmark.PeerBenchmarker;
import com.tx.insights.config.AnalysisConfig;
import com.tx.insights.matching.FactMatcher;
import com.tx.insights.matching.MatchBatch;
import com.tx.insights.matching.MatchIndex;
import com.tx.insights.scoring.ContentProfile;
import com.tx.insights.scoring.ContentProfiler;
import com.tx.insights.scoring.OpportunityScore;
import com.tx.insights.scoring.OpportunityScorer;
import com.tx.insights.scoring.PricingSnapshot;
import com.tx.insights.taxonomy.CategoryPaths;
import com.tx.insights.taxonomy.TaxonomyBuilder;
import com.tx.insights.taxonomy.TaxonomyTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one analysis run. A run owns all of its intermediate results; separate runs share
 * nothing mutable and may execute concurrently.
 *
 * <p>{@link #advance()} executes exactly one phase. Matching completes fully before
 * aggregation begins. {@link #progress()} may be polled from any thread and returns the
 * snapshot published after the last completed phase.
 */
public final class AggregationRun {

    private static final Logger log = LoggerFactory.getLogger(AggregationRun.class);

    private final String runId;
    private final AnalysisConfig config;
    private final AnalysisInput input;
    private final Map<RunPhase, PhaseMetrics> phaseMetrics = new EnumMap<>(RunPhase.class);
    private final long startNanos;

    private volatile ProgressSnapshot progress;

    private TaxonomyTree tree;
    private MatchBatch matchBatch;
    private AggregationResult aggregation;
    private Map<String, OpportunityScore> scores;
    private List<String> unresolvedPricing;
    private Map<String, BenchmarkResult> benchmarks;
    private AnalysisReport report;

    AggregationRun(String runId, AnalysisConfig config, AnalysisInput input) {
        this.runId = runId;
        this.config = config;
        this.input = input;
        this.startNanos = System.nanoTime();
        this.progress = ProgressSnapshot.initial(runId);
    }

    public String getRunId() {
        return runId;
    }

    public ProgressSnapshot progress() {
        return progress;
    }

    public boolean isComplete() {
        return progress.isComplete();
    }

    /**
     * Runs the next phase and returns the progress after it. Does nothing once complete.
     */
    public synchronized ProgressSnapshot advance() {
        RunPhase phase = progress.nextPhase();
        if (phase == RunPhase.COMPLETE) {
            return progress;
        }

        PhaseMetrics metrics = new PhaseMetrics(phase);
        phaseMetrics.put(phase, metrics);
        metrics.start();
        log.debug("Run {} starting phase {}", runId, phase);

        switch (phase) {
            case TAXONOMY -> buildTaxonomy(metrics);
            case MATCH -> matchFacts(metrics);
            case AGGREGATE -> aggregate(metrics);
            case SCORE -> score(metrics);
            case BENCHMARK -> benchmark(metrics);
            default -> throw new IllegalStateException("Unexpected phase: " + phase);
        }
        metrics.complete();

        RunPhase next = phase.next();
        if (next == RunPhase.COMPLETE) {
            report = new AnalysisReport(runId, tree, aggregation, scores, benchmarks, diagnostics(), phaseMetrics);
        }
        progress = new ProgressSnapshot(runId, next, phase.ordinal() + 1, RunPhase.WORKING_PHASES,
            metrics.getItemsProcessed(), (System.nanoTime() - startNanos) / 1_000_000);
        log.info("Run {} completed {} in {} ms ({} items)", runId, phase, metrics.getElapsedTimeMs(),
            metrics.getItemsProcessed());
        return progress;
    }

    public AnalysisReport runToCompletion() {
        while (!isComplete()) {
            advance();
        }
        return report;
    }

    /**
     * @throws IllegalStateException when the run has phases left
     */
    public synchronized AnalysisReport report() {
        if (report == null) {
            throw new IllegalStateException("Run " + runId + " is not complete, next phase: " + progress.nextPhase());
        }
        return report;
    }

    private void buildTaxonomy(PhaseMetrics metrics) {
        TaxonomyBuilder builder = new TaxonomyBuilder(config.isStrictTaxonomy());
        tree = builder.build(input.getCategoryPaths(), input.getProducts(), input.getCategoryUrls());
        metrics.recordItems(tree.size());
        metrics.recordWarnings(tree.anomalies().size());
    }

    private void matchFacts(PhaseMetrics metrics) {
        FactMatcher matcher = new FactMatcher(config.getThreads(), config.getMatchTimeoutMinutes());
        MatchIndex index = MatchIndex.build(tree, input.getProducts());
        matchBatch = matcher.matchAll(input.getFacts(), index, metrics::recordItem);
        metrics.recordWarnings(matchBatch.warnings().size());
    }

    private void aggregate(PhaseMetrics metrics) {
        PerformanceAggregator aggregator = new PerformanceAggregator(config.getAggregationThreads());
        aggregation = aggregator.aggregate(tree, matchBatch);
        metrics.recordItems(tree.size());
    }

    private void score(PhaseMetrics metrics) {
        Map<String, ContentProfile> content = new ContentProfiler().profile(tree, input.getProducts());
        Map<String, PricingSnapshot> pricing = resolvePricing();
        scores = new OpportunityScorer(config.getScoring()).scoreAll(aggregation, pricing, content);
        metrics.recordItems(scores.size());
        metrics.recordWarnings(unresolvedPricing.size());
    }

    private void benchmark(PhaseMetrics metrics) {
        benchmarks = new PeerBenchmarker(config.getInsights()).benchmarkAll(tree, aggregation);
        metrics.recordItems(benchmarks.size());
    }

    /**
     * Maps pricing keys to node ids. A key that is a node id wins over the same text read
     * as a category path.
     */
    private Map<String, PricingSnapshot> resolvePricing() {
        Map<String, PricingSnapshot> byNode = new LinkedHashMap<>();
        unresolvedPricing = new ArrayList<>();
        input.getPricing().forEach((key, snapshot) -> {
            String nodeId = tree.contains(key) ? key : CategoryPaths.nodeId(CategoryPaths.normalize(key));
            if (tree.contains(nodeId)) {
                byNode.putIfAbsent(nodeId, snapshot);
            } else {
                log.warn("Pricing for '{}' names no category in the taxonomy", key);
                unresolvedPricing.add(key);
            }
        });
        return byNode;
    }

    private RunDiagnostics diagnostics() {
        return new RunDiagnostics(matchBatch.statistics(), matchBatch.warnings(), tree.anomalies(),
            aggregation.getUnassignedFacts(), unresolvedPricing);
    }
}
