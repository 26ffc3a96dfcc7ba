package com.tx.insights.matching;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Match-rate diagnostics for one batch.
 */
public final class MatchStatistics {

    private final int total;
    private final int matched;
    private final double averageConfidence;
    private final int nodeMatches;
    private final int productMatches;
    private final Map<MatchStrategy, Integer> byStrategy;
    private final List<String> unmatchedSubjects;

    private MatchStatistics(int total, int matched, double averageConfidence, int nodeMatches,
                            int productMatches, Map<MatchStrategy, Integer> byStrategy,
                            List<String> unmatchedSubjects) {
        this.total = total;
        this.matched = matched;
        this.averageConfidence = averageConfidence;
        this.nodeMatches = nodeMatches;
        this.productMatches = productMatches;
        this.byStrategy = Collections.unmodifiableMap(byStrategy);
        this.unmatchedSubjects = List.copyOf(unmatchedSubjects);
    }

    /**
     * Computes statistics from facts and their results, aligned by position.
     */
    public static MatchStatistics from(List<MetricFact> facts, List<MatchResult> results) {
        if (facts.size() != results.size()) {
            throw new IllegalArgumentException("Facts and results differ in size: "
                + facts.size() + " vs " + results.size());
        }
        Map<MatchStrategy, Integer> byStrategy = new EnumMap<>(MatchStrategy.class);
        for (MatchStrategy strategy : MatchStrategy.values()) {
            byStrategy.put(strategy, 0);
        }
        Set<String> unmatched = new LinkedHashSet<>();
        int matched = 0;
        int nodes = 0;
        int products = 0;
        double confidenceSum = 0.0;

        for (int i = 0; i < results.size(); i++) {
            MatchResult result = results.get(i);
            byStrategy.merge(result.strategy(), 1, Integer::sum);
            if (result.isMatched()) {
                matched++;
                confidenceSum += result.confidence();
                if (result.target() == MatchTarget.NODE) {
                    nodes++;
                } else {
                    products++;
                }
            } else {
                unmatched.add(String.valueOf(facts.get(i).subjectKey()));
            }
        }

        double average = matched > 0 ? confidenceSum / matched : 0.0;
        return new MatchStatistics(facts.size(), matched, average, nodes, products, byStrategy,
            List.copyOf(unmatched));
    }

    public int getTotal() {
        return total;
    }

    public int getMatched() {
        return matched;
    }

    public int getUnmatched() {
        return total - matched;
    }

    /**
     * Matched share of the batch, 0 for an empty batch.
     */
    public double getMatchRate() {
        return total > 0 ? (double) matched / total : 0.0;
    }

    public double getAverageConfidence() {
        return averageConfidence;
    }

    public int getNodeMatches() {
        return nodeMatches;
    }

    public int getProductMatches() {
        return productMatches;
    }

    public Map<MatchStrategy, Integer> getByStrategy() {
        return byStrategy;
    }

    /**
     * Distinct unmatched subject keys in first-seen order.
     */
    public List<String> getUnmatchedSubjects() {
        return unmatchedSubjects;
    }

    @Override
    public String toString() {
        return String.format("MatchStatistics{total=%d, matched=%d, rate=%.3f, avgConfidence=%.3f, unmatched=%d}",
            total, matched, getMatchRate(), averageConfidence, unmatchedSubjects.size());
    }
}
