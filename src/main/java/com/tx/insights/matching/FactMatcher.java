package com.tx.insights.matching;

import com.tx.insights.taxonomy.Product;
import com.tx.insights.taxonomy.TaxonomyTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;

/**
 * Matches fact batches against a taxonomy on a fixed worker pool.
 *
 * <p>The fact list is partitioned into contiguous ranges, one per worker. Each worker writes
 * only its own result slots, so the fan-in is ordered by input position and the outcome is
 * identical for any thread count.
 */
public class FactMatcher {

    private static final Logger log = LoggerFactory.getLogger(FactMatcher.class);

    private final int threads;
    private final long timeoutMinutes;

    public FactMatcher() {
        this(1);
    }

    public FactMatcher(int threads) {
        this(threads, 60);
    }

    public FactMatcher(int threads, long timeoutMinutes) {
        if (threads < 1) {
            throw new IllegalArgumentException("Matcher threads must be at least 1: " + threads);
        }
        this.threads = threads;
        this.timeoutMinutes = timeoutMinutes;
    }

    public int getThreads() {
        return threads;
    }

    /**
     * Matches a single fact.
     */
    public MatchResult match(MetricFact fact, MatchIndex index, List<MatchWarning> warnings) {
        return new MatchCascade(index).match(fact, warnings);
    }

    public MatchBatch matchAll(List<MetricFact> facts, TaxonomyTree tree, Collection<Product> products) {
        return matchAll(facts, MatchIndex.build(tree, products), null);
    }

    /**
     * Matches every fact. Catalog warnings of the index come first in the warning list,
     * followed by fact warnings in fact order.
     *
     * @param latencyListener receives per-fact matching latency in microseconds, may be null
     */
    public MatchBatch matchAll(List<MetricFact> facts, MatchIndex index, LongConsumer latencyListener) {
        MatchCascade cascade = new MatchCascade(index);
        MatchResult[] results = new MatchResult[facts.size()];
        int workerCount = Math.max(1, Math.min(threads, facts.size()));

        log.info("Matching {} facts against {} nodes with {} workers", facts.size(), index.tree().size(), workerCount);

        List<MatchWorker> workers = partition(cascade, facts, results, workerCount, latencyListener);
        if (workerCount == 1) {
            workers.get(0).run();
        } else {
            runParallel(workers);
        }

        List<MatchWarning> warnings = new ArrayList<>(index.catalogWarnings());
        for (MatchWorker worker : workers) {
            warnings.addAll(worker.getWarnings());
        }

        MatchBatch batch = new MatchBatch(facts, Arrays.asList(results), warnings);
        log.info("Matching complete: {}", batch.statistics());
        return batch;
    }

    private List<MatchWorker> partition(MatchCascade cascade, List<MetricFact> facts, MatchResult[] results,
                                        int workerCount, LongConsumer latencyListener) {
        int perWorker = facts.size() / workerCount;
        int remainder = facts.size() % workerCount;

        List<MatchWorker> workers = new ArrayList<>(workerCount);
        int start = 0;
        for (int i = 0; i < workerCount; i++) {
            int count = perWorker + (i < remainder ? 1 : 0);
            workers.add(new MatchWorker(cascade, facts, results, start, start + count, latencyListener));
            start += count;
        }
        return workers;
    }

    private void runParallel(List<MatchWorker> workers) {
        ExecutorService executor = Executors.newFixedThreadPool(workers.size());
        try {
            List<Future<?>> futures = new ArrayList<>(workers.size());
            for (MatchWorker worker : workers) {
                futures.add(executor.submit(worker));
            }

            executor.shutdown();
            boolean completed = executor.awaitTermination(timeoutMinutes, TimeUnit.MINUTES);
            if (!completed) {
                throw new MatchingException("Matching timed out after " + timeoutMinutes + " minutes");
            }

            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MatchingException("Matching interrupted", e);
        } catch (ExecutionException e) {
            throw new MatchingException("Matching worker failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }
}
