package com.tx.insights.matching;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricFactTest {

    private static final DateRange JANUARY = DateRange.of("2024-01-01", "2024-01-31");

    @Test
    void shouldWeightPositionByImpressions() {
        MetricFact fact = MetricFact.builder("/a", MetricSource.SEARCH_CONSOLE, JANUARY)
            .impressions(200).position(4.5).build();

        assertThat(fact.hasPosition()).isTrue();
        assertThat(fact.positionWeight()).isEqualTo(900.0);
        assertThat(fact.positionedImpressions()).isEqualTo(200);
    }

    @Test
    void shouldIgnorePositionWithoutImpressions() {
        MetricFact fact = MetricFact.builder("/a", MetricSource.SEARCH_CONSOLE, JANUARY).position(3).build();

        assertThat(fact.hasPosition()).isFalse();
        assertThat(fact.positionWeight()).isZero();
    }

    @Test
    void shouldBuildKeyFromSourceSubjectAndRange() {
        MetricFact fact = MetricFact.builder("SKU-1", MetricSource.MERCHANT, JANUARY).build();

        assertThat(fact.key()).isEqualTo("MERCHANT|SKU-1|2024-01-01|2024-01-31");
    }

    @Test
    void shouldRejectNegativeCountsAndRevenue() {
        assertThatThrownBy(() -> MetricFact.builder("/a", MetricSource.ANALYTICS, JANUARY).clicks(-1).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MetricFact.builder("/a", MetricSource.ANALYTICS, JANUARY).revenue(Double.NaN).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectInvertedDateRange() {
        assertThatThrownBy(() -> DateRange.of("2024-02-01", "2024-01-01"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("after");
    }

    @Test
    void shouldParseSourceAliases() {
        assertThat(MetricSource.fromString("gsc")).isEqualTo(MetricSource.SEARCH_CONSOLE);
        assertThat(MetricSource.fromString(" GA4 ")).isEqualTo(MetricSource.ANALYTICS);
        assertThat(MetricSource.fromString("Merchant-Center")).isEqualTo(MetricSource.MERCHANT);
        assertThatThrownBy(() -> MetricSource.fromString("bing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bing");
    }
}
