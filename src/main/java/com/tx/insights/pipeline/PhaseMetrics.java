package com.tx.insights.pipeline;

import org.HdrHistogram.Histogram;

import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe metrics of one run phase. Metadata only, never an input to results.
 */
public class PhaseMetrics {

    private static final long MAX_LATENCY_MICROS = 60_000_000;

    private final RunPhase phase;
    private final LongAdder itemsProcessed = new LongAdder();
    private final LongAdder warnings = new LongAdder();
    private final Histogram itemLatencyHistogram;

    private volatile long startTimeNanos;
    private volatile long endTimeNanos;

    public PhaseMetrics(RunPhase phase) {
        this.phase = phase;
        // Per-item latencies from 1us to 60 seconds with 3 significant digits
        this.itemLatencyHistogram = new Histogram(1, MAX_LATENCY_MICROS, 3);
    }

    public void start() {
        this.startTimeNanos = System.nanoTime();
    }

    public void complete() {
        this.endTimeNanos = System.nanoTime();
    }

    /**
     * Records one item with its latency.
     */
    public void recordItem(long latencyMicros) {
        itemsProcessed.increment();
        synchronized (itemLatencyHistogram) {
            itemLatencyHistogram.recordValue(Math.max(0L, Math.min(latencyMicros, MAX_LATENCY_MICROS)));
        }
    }

    /**
     * Records items processed in bulk, without per-item latency.
     */
    public void recordItems(long count) {
        itemsProcessed.add(count);
    }

    public void recordWarnings(long count) {
        warnings.add(count);
    }

    public RunPhase getPhase() {
        return phase;
    }

    public long getItemsProcessed() {
        return itemsProcessed.sum();
    }

    public long getWarnings() {
        return warnings.sum();
    }

    public boolean hasLatencies() {
        synchronized (itemLatencyHistogram) {
            return itemLatencyHistogram.getTotalCount() > 0;
        }
    }

    public long getElapsedTimeMs() {
        if (startTimeNanos == 0) return 0;
        long end = endTimeNanos > 0 ? endTimeNanos : System.nanoTime();
        return (end - startTimeNanos) / 1_000_000;
    }

    public double getThroughput() {
        long elapsedMs = getElapsedTimeMs();
        if (elapsedMs == 0) return 0;
        return (itemsProcessed.sum() * 1000.0) / elapsedMs;
    }

    public double getAvgLatencyMs() {
        synchronized (itemLatencyHistogram) {
            return itemLatencyHistogram.getMean() / 1000.0;
        }
    }

    public double getMaxLatencyMs() {
        synchronized (itemLatencyHistogram) {
            return itemLatencyHistogram.getMaxValue() / 1000.0;
        }
    }

    public double getPercentileLatencyMs(double percentile) {
        synchronized (itemLatencyHistogram) {
            return itemLatencyHistogram.getValueAtPercentile(percentile) / 1000.0;
        }
    }

    public double getP50LatencyMs() {
        return getPercentileLatencyMs(50.0);
    }

    public double getP95LatencyMs() {
        return getPercentileLatencyMs(95.0);
    }

    public double getP99LatencyMs() {
        return getPercentileLatencyMs(99.0);
    }

    @Override
    public String toString() {
        return String.format(
            "PhaseMetrics{phase=%s, items=%d, warnings=%d, elapsed=%dms, throughput=%.1f/sec, p95=%.3fms}",
            phase, getItemsProcessed(), getWarnings(), getElapsedTimeMs(), getThroughput(), getP95LatencyMs());
    }
}
