package com.tx.insights.scoring;

import com.tx.insights.aggregation.AggregatedMetrics;
import com.tx.insights.config.ScoringConfig;

/**
 * Revenue potential against industry benchmarks: conversion gap (40%), order value gap (30%)
 * and monetization gap of traffic without revenue (30%).
 */
public class RevenueCalculator {

    /** Score when a node has neither traffic nor revenue. */
    static final double UNKNOWN_POTENTIAL = 50.0;

    private final double benchmarkConversionRate;
    private final double benchmarkAverageOrderValue;
    private final double benchmarkRevenuePerSession;

    public record RevenuePotential(
        double score,
        double conversionGap,
        double aovGap,
        double monetizationGap,
        double potentialRevenue,
        boolean hasData
    ) {
        static final RevenuePotential UNKNOWN = new RevenuePotential(UNKNOWN_POTENTIAL, 0, 0, 0, 0, false);
    }

    public RevenueCalculator() {
        this(new ScoringConfig());
    }

    public RevenueCalculator(ScoringConfig config) {
        this.benchmarkConversionRate = config.getBenchmarkConversionRate();
        this.benchmarkAverageOrderValue = config.getBenchmarkAverageOrderValue();
        this.benchmarkRevenuePerSession = config.getBenchmarkRevenuePerSession();
    }

    public RevenuePotential calculate(AggregatedMetrics metrics) {
        // conversion rate is per click when search clicks exist, per session otherwise
        long conversionBase = metrics.getClicks() > 0 ? metrics.getClicks() : metrics.getSessions();
        long visits = metrics.getSessions() > 0 ? metrics.getSessions() : metrics.getClicks();
        if (conversionBase == 0 && metrics.getRevenue() == 0 && metrics.getConversions() == 0) {
            return RevenuePotential.UNKNOWN;
        }

        double conversionRate = conversionBase > 0 ? (double) metrics.getConversions() / conversionBase : 0.0;
        double conversionGap = conversionGap(conversionRate);
        double aovGap = aovGap(metrics.getAverageOrderValue());
        double monetizationGap = monetizationGap(visits, metrics.getRevenue());

        double score = conversionGap * 0.40 + aovGap * 0.30 + monetizationGap * 0.30;
        double benchmarkRevenue = visits * benchmarkConversionRate * benchmarkAverageOrderValue;
        double potential = Math.max(0.0, benchmarkRevenue - metrics.getRevenue());

        return new RevenuePotential(score, conversionGap, aovGap, monetizationGap, potential, true);
    }

    double conversionGap(double conversionRate) {
        if (conversionRate >= benchmarkConversionRate) {
            return 0.0;
        }
        double relativeGap = (benchmarkConversionRate - conversionRate) / benchmarkConversionRate;
        if (relativeGap >= 0.8) return 100.0;
        if (relativeGap >= 0.5) return 80.0;
        if (relativeGap >= 0.3) return 60.0;
        if (relativeGap >= 0.1) return 40.0;
        return 20.0;
    }

    double aovGap(double averageOrderValue) {
        if (averageOrderValue >= benchmarkAverageOrderValue) {
            return 0.0;
        }
        double relativeGap = (benchmarkAverageOrderValue - averageOrderValue) / benchmarkAverageOrderValue;
        return Math.min(100.0, relativeGap * 200.0);
    }

    double monetizationGap(long visits, double revenue) {
        if (visits == 0) {
            return 0.0;
        }
        double revenuePerVisit = revenue / visits;
        if (visits > 1000 && revenuePerVisit < 1) return 100.0;
        if (visits > 500 && revenuePerVisit < 2) return 80.0;
        if (visits > 100 && revenuePerVisit < 3) return 60.0;
        if (visits > 50 && revenue == 0) return 50.0;
        if (revenuePerVisit < benchmarkRevenuePerSession) return 30.0;
        return 0.0;
    }
}
