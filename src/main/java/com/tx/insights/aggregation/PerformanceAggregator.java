package com.tx.insights.aggregation;

import com.tx.insights.matching.MatchBatch;
import com.tx.insights.matching.MatchResult;
import com.tx.insights.matching.MetricFact;
import com.tx.insights.taxonomy.TaxonomyTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Bottom-up roll-up of matched facts over a taxonomy.
 *
 * <ol>
 *   <li>sum matched facts into per-node direct totals, in fact order</li>
 *   <li>visit nodes deepest first; a node's total is its direct total plus its children's
 *       final totals, added in child order</li>
 *   <li>derive rates from each node's own totals</li>
 * </ol>
 *
 * Every node is visited once and every child total is read once by its parent. Root subtrees
 * are independent and may be rolled up on separate threads; the per-node addition order is the
 * same either way, so results are bit-identical.
 */
public class PerformanceAggregator {

    private static final Logger log = LoggerFactory.getLogger(PerformanceAggregator.class);

    private final int threads;

    public PerformanceAggregator() {
        this(1);
    }

    public PerformanceAggregator(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Aggregation threads must be at least 1: " + threads);
        }
        this.threads = threads;
    }

    public AggregationResult aggregate(TaxonomyTree tree, MatchBatch batch) {
        return aggregate(tree, batch.facts(), batch.results());
    }

    /**
     * Aggregates with results looked up by fact key. Facts without an entry count as unmatched.
     */
    public AggregationResult aggregate(TaxonomyTree tree, List<MetricFact> facts, Map<String, MatchResult> matches) {
        List<MatchResult> aligned = new ArrayList<>(facts.size());
        for (MetricFact fact : facts) {
            aligned.add(matches.getOrDefault(fact.key(), MatchResult.noMatch()));
        }
        return aggregate(tree, facts, aligned);
    }

    /**
     * Aggregates with results aligned to facts by position.
     */
    public AggregationResult aggregate(TaxonomyTree tree, List<MetricFact> facts, List<MatchResult> results) {
        if (facts.size() != results.size()) {
            throw new IllegalArgumentException("Facts and match results differ in size: "
                + facts.size() + " vs " + results.size());
        }

        int n = tree.size();
        MetricTotals[] direct = new MetricTotals[n];
        for (int i = 0; i < n; i++) {
            direct[i] = new MetricTotals();
        }

        int assigned = 0;
        int unmatched = 0;
        int unassigned = 0;
        MetricTotals assignedTotals = new MetricTotals();
        for (int i = 0; i < facts.size(); i++) {
            MatchResult result = results.get(i);
            if (result == null || !result.isMatched()) {
                unmatched++;
                continue;
            }
            int index = tree.indexOf(result.nodeId());
            if (index < 0) {
                unassigned++;
                log.debug("Fact {} matched {} but has no node in the tree", facts.get(i).key(), result.entityId());
                continue;
            }
            direct[index].add(facts.get(i));
            assignedTotals.add(facts.get(i));
            assigned++;
        }

        MetricTotals[] totals = new MetricTotals[n];
        int[] productTotals = new int[n];
        if (threads > 1 && tree.rootCount() > 1) {
            rollUpParallel(tree, direct, totals, productTotals);
        } else {
            rollUp(tree, tree.indexesByDepthDescending(), direct, totals, productTotals);
        }

        Map<String, AggregatedMetrics> metrics = new LinkedHashMap<>();
        MetricTotals grand = new MetricTotals();
        int grandProducts = 0;
        for (int i = 0; i < n; i++) {
            String nodeId = tree.nodeAt(i).getId();
            int directProducts = tree.nodeAt(i).getDirectProductIds().size();
            metrics.put(nodeId, AggregatedMetrics.fromTotals(nodeId, totals[i], directProducts, productTotals[i]));
        }
        for (int root : tree.rootIndexes()) {
            grand.add(totals[root]);
            grandProducts += productTotals[root];
        }

        if (grand.impressions != assignedTotals.impressions || grand.clicks != assignedTotals.clicks
            || grand.conversions != assignedTotals.conversions) {
            log.error("Root totals diverge from assigned facts: impressions {} vs {}",
                grand.impressions, assignedTotals.impressions);
        }

        AggregatedMetrics grandTotal = AggregatedMetrics.fromTotals(AggregationResult.ALL_NODES, grand,
            0, grandProducts);

        log.info("Aggregated {} facts over {} nodes ({} unmatched, {} unassigned)",
            assigned, n, unmatched, unassigned);

        return new AggregationResult(metrics, grandTotal, assigned, unmatched, unassigned, tree.anomalies());
    }

    /**
     * Rolls up the given nodes, which must be ordered so that children precede parents.
     */
    private void rollUp(TaxonomyTree tree, int[] order, MetricTotals[] direct, MetricTotals[] totals,
                        int[] productTotals) {
        for (int index : order) {
            MetricTotals total = direct[index].copy();
            int products = tree.nodeAt(index).getDirectProductIds().size();
            for (int child : tree.childIndexes(index)) {
                total.add(totals[child]);
                products += productTotals[child];
            }
            totals[index] = total;
            productTotals[index] = products;
        }
    }

    private void rollUpParallel(TaxonomyTree tree, MetricTotals[] direct, MetricTotals[] totals,
                                int[] productTotals) {
        int[] roots = tree.rootIndexes();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, roots.length));
        try {
            List<Future<?>> futures = new ArrayList<>(roots.length);
            for (int root : roots) {
                int[] order = subtreeDeepestFirst(tree, root);
                futures.add(executor.submit(() -> rollUp(tree, order, direct, totals, productTotals)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
            executor.shutdown();
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                log.warn("Aggregation pool did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Aggregation interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Aggregation of a root subtree failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Subtree indexes in reverse breadth-first order, so every child precedes its parent.
     */
    private static int[] subtreeDeepestFirst(TaxonomyTree tree, int root) {
        List<Integer> bfs = new ArrayList<>();
        bfs.add(root);
        for (int i = 0; i < bfs.size(); i++) {
            for (int child : tree.childIndexes(bfs.get(i))) {
                bfs.add(child);
            }
        }
        int[] order = new int[bfs.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = bfs.get(bfs.size() - 1 - i);
        }
        return order;
    }
}
