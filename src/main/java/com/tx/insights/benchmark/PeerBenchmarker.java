package com.tx.insights.benchmark;

import com.tx.insights.aggregation.AggregatedMetrics;
import com.tx.insights.aggregation.AggregationResult;
import com.tx.insights.config.InsightConfig;
import com.tx.insights.taxonomy.TaxonomyNode;
import com.tx.insights.taxonomy.TaxonomyTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compares nodes against the other nodes at the same structural depth.
 *
 * <p>The cohort is the set of peers with at least one impression. Cohort rates are pooled
 * from cohort totals, never averaged over the members' own rates. Nodes below
 * {@link InsightConfig#getMinImpressions()} are still benchmarked but raise no insights.
 */
public class PeerBenchmarker {

    private static final Logger log = LoggerFactory.getLogger(PeerBenchmarker.class);

    private final InsightConfig config;

    public PeerBenchmarker() {
        this(new InsightConfig());
    }

    public PeerBenchmarker(InsightConfig config) {
        this.config = config;
    }

    /**
     * Benchmarks a node against a peer collection. The node may or may not be part of
     * {@code peers}; it is never counted as its own competitor.
     */
    public BenchmarkResult benchmark(AggregatedMetrics node, Collection<AggregatedMetrics> peers) {
        List<AggregatedMetrics> members = new ArrayList<>(peers.size() + 1);
        boolean containsNode = false;
        for (AggregatedMetrics peer : peers) {
            if (peer.getNodeId().equals(node.getNodeId())) {
                containsNode = true;
                members.add(node);
            } else {
                members.add(peer);
            }
        }
        if (!containsNode) {
            members.add(node);
        }
        return new Cohort(members).compare(node);
    }

    /**
     * Benchmarks every node of the tree against its peers at the same structural depth.
     * A node whose declared depth disagrees with the tree is grouped by where it actually sits.
     *
     * @return results keyed by node id, in tree order
     */
    public Map<String, BenchmarkResult> benchmarkAll(TaxonomyTree tree, AggregationResult aggregation) {
        Map<Integer, List<AggregatedMetrics>> byDepth = new TreeMap<>();
        for (TaxonomyNode node : tree.nodes()) {
            int depth = tree.depthOf(node.getId());
            aggregation.find(node.getId()).ifPresent(metrics ->
                byDepth.computeIfAbsent(depth, d -> new ArrayList<>()).add(metrics));
        }

        Map<Integer, Cohort> cohorts = new TreeMap<>();
        byDepth.forEach((depth, members) -> cohorts.put(depth, new Cohort(members)));

        Map<String, BenchmarkResult> results = new LinkedHashMap<>();
        for (TaxonomyNode node : tree.nodes()) {
            Cohort cohort = cohorts.get(tree.depthOf(node.getId()));
            aggregation.find(node.getId()).ifPresent(metrics -> results.put(node.getId(), cohort.compare(metrics)));
        }

        long flagged = results.values().stream().filter(r -> !r.insights().isEmpty()).count();
        log.info("Benchmarked {} nodes across {} depths, {} flagged", results.size(), cohorts.size(), flagged);
        return results;
    }

    /**
     * 0-100 absolute score: CTR (30), conversion rate (30), revenue (20) and volume (20).
     * Rate components only count once a node has enough traffic to judge.
     */
    public static int performanceScore(AggregatedMetrics metrics) {
        int score = 0;

        if (metrics.getImpressions() >= 100) {
            double ctr = metrics.getCtr();
            if (ctr >= 0.025) score += 30;
            else if (ctr >= 0.015) score += 20;
            else if (ctr >= 0.0086) score += 10;
            else if (ctr > 0) score += 5;
        }

        if (metrics.getClicks() >= 50) {
            double rate = metrics.getConversionRate();
            if (rate >= 0.035) score += 30;
            else if (rate >= 0.025) score += 20;
            else if (rate >= 0.0191) score += 10;
            else if (rate > 0) score += 5;
        }

        double revenue = metrics.getRevenue();
        if (revenue > 10_000) score += 20;
        else if (revenue > 5_000) score += 15;
        else if (revenue > 1_000) score += 10;
        else if (revenue > 100) score += 5;

        long impressions = metrics.getImpressions();
        if (impressions > 10_000) score += 20;
        else if (impressions > 5_000) score += 15;
        else if (impressions > 1_000) score += 10;
        else if (impressions > 100) score += 5;

        return Math.min(100, score);
    }

    static double percentDelta(double value, double reference) {
        return reference > 0 ? (value - reference) / reference * 100.0 : 0.0;
    }

    private List<Insight> insights(AggregatedMetrics metrics, double ctrDelta, double cohortCtr, int score) {
        List<Insight> insights = new ArrayList<>();
        if (metrics.getImpressions() < config.getMinImpressions()) {
            return insights;
        }
        double ctrPercent = metrics.getCtr() * 100.0;

        if (metrics.getImpressions() >= config.getCriticalImpressions() && metrics.getCtr() < config.getCriticalCtr()) {
            insights.add(new Insight(InsightTrigger.CRITICAL,
                String.format("Extremely low CTR (%.2f%%) despite high visibility", ctrPercent),
                String.format("Could gain %d more clicks/month", Math.round(metrics.getImpressions() * 0.02))));
        }
        if (ctrDelta <= -config.getHighPriorityCtrDeficitPercent()) {
            long gain = Math.max(0L, Math.round(metrics.getImpressions() * cohortCtr) - metrics.getClicks());
            insights.add(new Insight(InsightTrigger.HIGH_PRIORITY,
                String.format("CTR %.0f%% below peer average", Math.abs(ctrDelta)),
                String.format("Match peer performance for +%d clicks", gain)));
        }
        if (metrics.getClicks() >= config.getConversionFocusClicks()
                && metrics.getConversionRate() < config.getConversionFocusRate()) {
            insights.add(new Insight(InsightTrigger.CONVERSION_FOCUS,
                String.format("Low conversion rate (%.2f%%)", metrics.getConversionRate() * 100.0),
                String.format("Could gain $%d in revenue", Math.round(metrics.getClicks() * 0.02 * 50))));
        }
        if (score < config.getReviewPerformanceScore() && metrics.getTotalProductCount() > config.getReviewMinProducts()) {
            insights.add(new Insight(InsightTrigger.COMPREHENSIVE_REVIEW,
                String.format("Overall performance score only %d/100", score),
                "Significant revenue opportunity"));
        }
        return insights;
    }

    /**
     * Pooled totals and sorted CTRs of one cohort, shared by all its members.
     */
    private final class Cohort {
        private final int size;
        private final double ctr;
        private final double conversionRate;
        private final double[] sortedCtrs;

        Cohort(Collection<AggregatedMetrics> peers) {
            long impressions = 0;
            long clicks = 0;
            long conversions = 0;
            List<AggregatedMetrics> active = new ArrayList<>();
            for (AggregatedMetrics peer : peers) {
                if (peer.getImpressions() > 0) {
                    active.add(peer);
                    impressions += peer.getImpressions();
                    clicks += peer.getClicks();
                    conversions += peer.getConversions();
                }
            }
            this.size = active.size();
            this.ctr = impressions > 0 ? (double) clicks / impressions : 0.0;
            this.conversionRate = clicks > 0 ? (double) conversions / clicks : 0.0;
            this.sortedCtrs = active.stream().mapToDouble(AggregatedMetrics::getCtr).sorted().toArray();
        }

        BenchmarkResult compare(AggregatedMetrics metrics) {
            double ctrDelta = percentDelta(metrics.getCtr(), ctr);
            double conversionDelta = percentDelta(metrics.getConversionRate(), conversionRate);

            int others = metrics.getImpressions() > 0 ? size - 1 : size;
            double rank;
            if (others <= 0) {
                rank = 100.0;
            } else {
                rank = countBelow(metrics.getCtr()) * 100.0 / others;
            }

            int score = performanceScore(metrics);
            return new BenchmarkResult(metrics.getNodeId(), size, ctr, conversionRate, ctrDelta, conversionDelta,
                rank, score, insights(metrics, ctrDelta, ctr, score));
        }

        private int countBelow(double value) {
            // first index whose CTR is not strictly lower
            int low = 0;
            int high = sortedCtrs.length;
            while (low < high) {
                int mid = (low + high) >>> 1;
                if (sortedCtrs[mid] < value) {
                    low = mid + 1;
                } else {
                    high = mid;
                }
            }
            return low;
        }
    }
}
