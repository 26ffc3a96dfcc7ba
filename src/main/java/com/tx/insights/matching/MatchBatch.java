package com.tx.insights.matching;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Results of matching a fact batch. Results are aligned with the input facts by position;
 * {@link #asMap()} offers the same results keyed by fact key in input order.
 */
public final class MatchBatch {

    private final List<MetricFact> facts;
    private final List<MatchResult> results;
    private final Map<String, MatchResult> byKey;
    private final List<MatchWarning> warnings;
    private final MatchStatistics statistics;

    public MatchBatch(List<MetricFact> facts, List<MatchResult> results, List<MatchWarning> warnings) {
        this.facts = List.copyOf(facts);
        this.results = List.copyOf(results);
        this.warnings = List.copyOf(warnings);
        this.statistics = MatchStatistics.from(this.facts, this.results);

        Map<String, MatchResult> map = new LinkedHashMap<>();
        for (int i = 0; i < this.facts.size(); i++) {
            map.putIfAbsent(this.facts.get(i).key(), this.results.get(i));
        }
        this.byKey = Collections.unmodifiableMap(map);
    }

    public List<MetricFact> facts() {
        return facts;
    }

    public List<MatchResult> results() {
        return results;
    }

    public MatchResult resultAt(int factIndex) {
        return results.get(factIndex);
    }

    public Map<String, MatchResult> asMap() {
        return byKey;
    }

    public List<MatchWarning> warnings() {
        return warnings;
    }

    public MatchStatistics statistics() {
        return statistics;
    }
}
