package com.tx.insights.pipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PhaseMetricsTest {

    private PhaseMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = new PhaseMetrics(RunPhase.MATCH);
    }

    @Test
    void shouldReportZeroBeforeStart() {
        assertThat(metrics.getElapsedTimeMs()).isZero();
        assertThat(metrics.getThroughput()).isZero();
        assertThat(metrics.hasLatencies()).isFalse();
    }

    @Test
    void shouldCountItemsAndLatencies() {
        metrics.start();
        metrics.recordItem(1000);
        metrics.recordItem(3000);
        metrics.recordItems(5);
        metrics.recordWarnings(2);
        metrics.complete();

        assertThat(metrics.getItemsProcessed()).isEqualTo(7);
        assertThat(metrics.getWarnings()).isEqualTo(2);
        assertThat(metrics.hasLatencies()).isTrue();
        assertThat(metrics.getMaxLatencyMs()).isBetween(2.99, 3.01);
        assertThat(metrics.getP50LatencyMs()).isBetween(0.99, 1.01);
    }

    @Test
    void shouldClampOutOfRangeLatencies() {
        metrics.recordItem(-5);
        metrics.recordItem(Long.MAX_VALUE);

        assertThat(metrics.getItemsProcessed()).isEqualTo(2);
        assertThat(metrics.getMaxLatencyMs()).isGreaterThanOrEqualTo(59_000.0);
    }

    @Test
    void shouldAcceptRecordsFromManyThreads() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 4; i++) {
            executor.submit(() -> {
                for (int j = 0; j < 1000; j++) {
                    metrics.recordItem(j + 1);
                }
            });
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        assertThat(metrics.getItemsProcessed()).isEqualTo(4000);
    }

    @Test
    void shouldDescribeItself() {
        assertThat(metrics.toString()).startsWith("PhaseMetrics{phase=MATCH");
    }
}
