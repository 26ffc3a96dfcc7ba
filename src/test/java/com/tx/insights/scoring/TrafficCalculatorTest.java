package com.tx.insights.scoring;

import com.tx.insights.aggregation.AggregatedMetrics;
import com.tx.insights.scoring.TrafficCalculator.TrafficPotential;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TrafficCalculatorTest {

    private TrafficCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new TrafficCalculator();
    }

    @Test
    void shouldCombineCtrGapPositionGapAndImpressionVolume() {
        // Given - 1% CTR at position 8, where 1.7% is expected
        AggregatedMetrics metrics = AggregatedMetrics.builder("n")
            .impressions(10_000).clicks(100).averagePosition(8).build();

        // When
        TrafficPotential potential = calculator.calculate(metrics);

        // Then
        assertThat(potential.expectedCtr()).isEqualTo(0.017);
        assertThat(potential.ctrGap()).isCloseTo(3.5, within(1e-9));
        assertThat(potential.positionGap()).isCloseTo(85.0, within(1e-9));
        assertThat(potential.impressionFactor()).isEqualTo(70.0);
        assertThat(potential.score()).isCloseTo(41.25, within(1e-9));
        assertThat(potential.projectedClickIncrease()).isEqualTo(840);
    }

    @Test
    void shouldFallBackToDefaultPositionWithoutSearchRank() {
        AggregatedMetrics metrics = AggregatedMetrics.builder("n").impressions(2000).clicks(10).build();

        TrafficPotential potential = calculator.calculate(metrics);

        assertThat(potential.position()).isEqualTo(20.0);
        assertThat(potential.positionGap()).isEqualTo(100.0);
        assertThat(potential.impressionFactor()).isEqualTo(90.0);
    }

    @Test
    void shouldScoreZeroWithoutImpressions() {
        TrafficPotential potential = calculator.calculate(AggregatedMetrics.builder("n").clicks(5).build());

        assertThat(potential.score()).isZero();
        assertThat(potential.projectedClickIncrease()).isZero();
    }

    @Test
    void shouldNotProjectNegativeIncrease() {
        AggregatedMetrics metrics = AggregatedMetrics.builder("n")
            .impressions(1000).clicks(400).averagePosition(1).build();

        TrafficPotential potential = calculator.calculate(metrics);

        assertThat(potential.ctrGap()).isZero();
        assertThat(potential.projectedClickIncrease()).isZero();
    }

    @ParameterizedTest
    @CsvSource({"0.3, 0.285", "1, 0.285", "3, 0.094", "10.4, 0.012", "10.6, 0.008", "25, 0.004", "31, 0.002"})
    void shouldLookUpExpectedCtrByRoundedRank(double position, double expected) {
        assertThat(TrafficCalculator.expectedCtr(position)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"1, 0", "2, 30", "3, 60", "10, 95", "12, 96", "30, 100"})
    void shouldGrowPositionGapWithRank(double position, double expected) {
        assertThat(TrafficCalculator.positionGapScore(position)).isCloseTo(expected, within(1e-9));
    }
}
