package com.tx.insights.matching;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongConsumer;

/**
 * Worker that matches a contiguous range of facts.
 * Writes only to its own slots of the shared result array and keeps its own warning list.
 */
class MatchWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MatchWorker.class);

    private final MatchCascade cascade;
    private final List<MetricFact> facts;
    private final MatchResult[] results;
    private final int startIndex;
    private final int endIndex;
    private final List<MatchWarning> warnings = new ArrayList<>();
    private final LongConsumer latencyListener;

    MatchWorker(MatchCascade cascade, List<MetricFact> facts, MatchResult[] results,
                int startIndex, int endIndex, LongConsumer latencyListener) {
        this.cascade = cascade;
        this.facts = facts;
        this.results = results;
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.latencyListener = latencyListener;
    }

    @Override
    public void run() {
        log.debug("Matching facts {} to {}", startIndex, endIndex);
        for (int i = startIndex; i < endIndex; i++) {
            long start = System.nanoTime();
            results[i] = cascade.match(facts.get(i), warnings);
            if (latencyListener != null) {
                latencyListener.accept((System.nanoTime() - start) / 1000);
            }
        }
    }

    List<MatchWarning> getWarnings() {
        return warnings;
    }
}
