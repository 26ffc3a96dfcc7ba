package com.tx.insights.scoring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TDD tests for OpportunityCategorizer.
 */
class OpportunityCategorizerTest {

    private OpportunityCategorizer categorizer;

    @BeforeEach
    void setUp() {
        categorizer = new OpportunityCategorizer();
    }

    @Nested
    class CategoryTests {

        @ParameterizedTest
        @CsvSource({
            "70, 10, QUICK_WIN",
            "95, 0, QUICK_WIN",
            "70, 11, STRATEGIC",
            "70, 101, STRATEGIC",
            "69.99, 5, INCREMENTAL",
            "40, 5, INCREMENTAL",
            "40, 11, LONG_TERM",
            "69.99, 500, LONG_TERM",
            "39.9, 0, MAINTAIN",
            "-5, 0, MAINTAIN",
            "80, -3, QUICK_WIN"
        })
        void shouldBucketByScoreAndEffort(double score, long effort, OpportunityCategory expected) {
            assertThat(categorizer.categorize(score, effort)).isEqualTo(expected);
        }

        @Test
        void shouldTreatNaNAsMaintain() {
            assertThat(categorizer.categorize(Double.NaN, 1)).isEqualTo(OpportunityCategory.MAINTAIN);
        }

        @Test
        void shouldUseLabelsAsDisplayName() {
            assertThat(OpportunityCategory.QUICK_WIN).hasToString("quick-win");
            assertThat(OpportunityCategory.LONG_TERM).hasToString("long-term");
        }
    }

    @Nested
    class EffortTests {

        @Test
        void shouldDeriveEffortLevelFromProductCount() {
            assertThat(categorizer.effortLevel(10)).isEqualTo(EffortLevel.LOW);
            assertThat(categorizer.effortLevel(100)).isEqualTo(EffortLevel.MEDIUM);
            assertThat(categorizer.effortLevel(101)).isEqualTo(EffortLevel.HIGH);
        }

        @ParameterizedTest
        @CsvSource({
            "QUICK_WIN, 5, 14",
            "STRATEGIC, 100, 90",
            "STRATEGIC, 101, 135",
            "INCREMENTAL, 100, 30",
            "INCREMENTAL, 101, 45",
            "LONG_TERM, 50, 180",
            "LONG_TERM, 5000, 270",
            "MAINTAIN, 5000, 0"
        })
        void shouldEstimateTimelineFromCategoryAndProductCount(OpportunityCategory category, long products, int days) {
            assertThat(OpportunityCategorizer.timelineDays(category, products)).isEqualTo(days);
        }
    }

    @Nested
    class FullCategorizationTests {

        @Test
        void shouldRankQuickWinsFirst() {
            Categorization result = categorizer.categorizeFully(85, 5);

            assertThat(result.category()).isEqualTo(OpportunityCategory.QUICK_WIN);
            assertThat(result.priority()).isEqualTo(1);
            assertThat(result.timelineDays()).isEqualTo(14);
        }

        @Test
        void shouldRankLowEffortIncrementalAboveLongTerm() {
            // Given
            Categorization light = categorizer.categorizeFully(50, 3);

            // When
            Categorization heavy = categorizer.categorizeFully(50, 500);

            // Then
            assertThat(light.category()).isEqualTo(OpportunityCategory.INCREMENTAL);
            assertThat(light.priority()).isEqualTo(3);
            assertThat(light.timelineDays()).isEqualTo(30);
            assertThat(heavy.category()).isEqualTo(OpportunityCategory.LONG_TERM);
            assertThat(heavy.effort()).isEqualTo(EffortLevel.HIGH);
            assertThat(heavy.priority()).isEqualTo(4);
            assertThat(heavy.timelineDays()).isEqualTo(270);
        }

        @Test
        void shouldScheduleMediumEffortStrategicWithoutStretch() {
            Categorization result = categorizer.categorizeFully(75, 60);

            assertThat(result.category()).isEqualTo(OpportunityCategory.STRATEGIC);
            assertThat(result.priority()).isEqualTo(2);
            assertThat(result.timelineDays()).isEqualTo(90);
        }

        @Test
        void shouldRankMaintainLastWithNoTimeline() {
            Categorization result = categorizer.categorizeFully(10, 3);

            assertThat(result.priority()).isEqualTo(5);
            assertThat(result.timelineDays()).isZero();
        }

        @Test
        void shouldAppendScoreToSuggestedAction() {
            assertThat(categorizer.categorizeFully(85.4, 5).suggestedAction(85.4))
                .isEqualTo("Prioritize immediately. Expected ROI within 2-4 weeks. Score: 85/100");
        }
    }
}
