package com.tx.insights.aggregation;

import com.tx.insights.matching.MetricFact;
import com.tx.insights.matching.MetricSource;

import java.util.EnumSet;
import java.util.Set;

/**
 * Mutable accumulator of additive metrics. Confined to the thread aggregating its subtree.
 */
final class MetricTotals {

    long impressions;
    long clicks;
    long conversions;
    long sessions;
    long positionedImpressions;
    double revenue;
    double positionWeight;
    int factCount;
    final Set<MetricSource> sources = EnumSet.noneOf(MetricSource.class);

    void add(MetricFact fact) {
        impressions += fact.impressions();
        clicks += fact.clicks();
        conversions += fact.conversions();
        sessions += fact.sessions();
        positionedImpressions += fact.positionedImpressions();
        revenue += fact.revenue();
        positionWeight += fact.positionWeight();
        factCount++;
        sources.add(fact.source());
    }

    void add(MetricTotals other) {
        impressions += other.impressions;
        clicks += other.clicks;
        conversions += other.conversions;
        sessions += other.sessions;
        positionedImpressions += other.positionedImpressions;
        revenue += other.revenue;
        positionWeight += other.positionWeight;
        factCount += other.factCount;
        sources.addAll(other.sources);
    }

    MetricTotals copy() {
        MetricTotals copy = new MetricTotals();
        copy.add(this);
        return copy;
    }
}
