package com.tx.insights.aggregation;

import com.tx.insights.matching.MetricSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Rolled-up metrics of one node for one run.
 *
 * <p>Totals include the node's own facts and all descendants. Rates are derived here from
 * the node's own totals and are never averaged from children; a zero denominator yields 0.
 */
public final class AggregatedMetrics {

    private final String nodeId;
    private final long impressions;
    private final long clicks;
    private final long conversions;
    private final double revenue;
    private final long sessions;
    private final double positionWeight;
    private final long positionedImpressions;
    private final int factCount;
    private final int directProductCount;
    private final int totalProductCount;
    private final Set<MetricSource> sources;

    private final double ctr;
    private final double conversionRate;
    private final double averageOrderValue;
    private final double averagePosition;
    private final double revenuePerSession;

    private AggregatedMetrics(Builder b) {
        this.nodeId = b.nodeId;
        this.impressions = b.impressions;
        this.clicks = b.clicks;
        this.conversions = b.conversions;
        this.revenue = b.revenue;
        this.sessions = b.sessions;
        this.positionWeight = b.positionWeight;
        this.positionedImpressions = b.positionedImpressions;
        this.factCount = b.factCount;
        this.directProductCount = b.directProductCount;
        this.totalProductCount = b.totalProductCount;
        this.sources = b.sources.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(b.sources));

        this.ctr = ratio(clicks, impressions);
        this.conversionRate = ratio(conversions, clicks);
        this.averageOrderValue = ratio(revenue, conversions);
        this.averagePosition = ratio(positionWeight, positionedImpressions);
        this.revenuePerSession = ratio(revenue, sessions);
    }

    static AggregatedMetrics fromTotals(String nodeId, MetricTotals totals, int directProducts, int totalProducts) {
        Builder builder = builder(nodeId)
            .impressions(totals.impressions)
            .clicks(totals.clicks)
            .conversions(totals.conversions)
            .revenue(totals.revenue)
            .sessions(totals.sessions)
            .position(totals.positionWeight, totals.positionedImpressions)
            .factCount(totals.factCount)
            .productCounts(directProducts, totalProducts);
        builder.sources.addAll(totals.sources);
        return builder.build();
    }

    public static Builder builder(String nodeId) {
        return new Builder(nodeId);
    }

    private static double ratio(double numerator, double denominator) {
        return denominator > 0 ? numerator / denominator : 0.0;
    }

    public String getNodeId() {
        return nodeId;
    }

    public long getImpressions() {
        return impressions;
    }

    public long getClicks() {
        return clicks;
    }

    public long getConversions() {
        return conversions;
    }

    public double getRevenue() {
        return revenue;
    }

    public long getSessions() {
        return sessions;
    }

    public double getPositionWeight() {
        return positionWeight;
    }

    public long getPositionedImpressions() {
        return positionedImpressions;
    }

    public int getFactCount() {
        return factCount;
    }

    public int getDirectProductCount() {
        return directProductCount;
    }

    public int getTotalProductCount() {
        return totalProductCount;
    }

    public Set<MetricSource> getSources() {
        return sources;
    }

    /** clicks / impressions */
    public double getCtr() {
        return ctr;
    }

    /** conversions / clicks */
    public double getConversionRate() {
        return conversionRate;
    }

    /** revenue / conversions */
    public double getAverageOrderValue() {
        return averageOrderValue;
    }

    /** Impression-weighted average search position, 0 without position data. */
    public double getAveragePosition() {
        return averagePosition;
    }

    public double getRevenuePerSession() {
        return revenuePerSession;
    }

    public boolean hasSearchData() {
        return impressions > 0;
    }

    @Override
    public String toString() {
        return String.format(
            "AggregatedMetrics{node=%s, impressions=%d, clicks=%d, conversions=%d, revenue=%.2f, " +
                "ctr=%.4f, cr=%.4f, aov=%.2f, products=%d}",
            nodeId, impressions, clicks, conversions, revenue, ctr, conversionRate,
            averageOrderValue, totalProductCount);
    }

    public static final class Builder {
        private final String nodeId;
        private long impressions;
        private long clicks;
        private long conversions;
        private double revenue;
        private long sessions;
        private double positionWeight;
        private long positionedImpressions;
        private int factCount;
        private int directProductCount;
        private int totalProductCount;
        private final Set<MetricSource> sources = EnumSet.noneOf(MetricSource.class);

        private Builder(String nodeId) {
            this.nodeId = nodeId;
        }

        public Builder impressions(long impressions) {
            this.impressions = impressions;
            return this;
        }

        public Builder clicks(long clicks) {
            this.clicks = clicks;
            return this;
        }

        public Builder conversions(long conversions) {
            this.conversions = conversions;
            return this;
        }

        public Builder revenue(double revenue) {
            this.revenue = revenue;
            return this;
        }

        public Builder sessions(long sessions) {
            this.sessions = sessions;
            return this;
        }

        /**
         * Sets the average position directly, weighted by the current impressions.
         */
        public Builder averagePosition(double position) {
            this.positionWeight = position * impressions;
            this.positionedImpressions = position > 0 ? impressions : 0;
            return this;
        }

        Builder position(double positionWeight, long positionedImpressions) {
            this.positionWeight = positionWeight;
            this.positionedImpressions = positionedImpressions;
            return this;
        }

        Builder factCount(int factCount) {
            this.factCount = factCount;
            return this;
        }

        public Builder productCounts(int direct, int total) {
            this.directProductCount = direct;
            this.totalProductCount = total;
            return this;
        }

        public Builder sources(MetricSource... sources) {
            this.sources.addAll(Arrays.asList(sources));
            return this;
        }

        public AggregatedMetrics build() {
            return new AggregatedMetrics(this);
        }
    }
}
