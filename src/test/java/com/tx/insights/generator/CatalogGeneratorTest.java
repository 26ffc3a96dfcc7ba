package com.tx.insights.generator;

import com.tx.insights.dataset.CategoryEntry;
import com.tx.insights.dataset.Dataset;
import com.tx.insights.matching.GtinValidator;
import com.tx.insights.matching.MetricFact;
import com.tx.insights.matching.MetricSource;
import com.tx.insights.taxonomy.CategoryPaths;
import com.tx.insights.taxonomy.Product;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TDD tests for CatalogGenerator and RandomDataProvider.
 */
class CatalogGeneratorTest {

    private static Dataset generate(long seed, int products, int roots, int depth, double unmatched) {
        return new CatalogGenerator(new RandomDataProvider(seed), products, roots, depth, unmatched).generate();
    }

    @Nested
    class DeterminismTests {

        @Test
        void shouldProduceSameDatasetForSameSeed() {
            // When
            Dataset first = generate(42L, 50, 3, 2, 0.1);
            Dataset second = generate(42L, 50, 3, 2, 0.1);

            // Then
            assertThat(second.getCategories()).isEqualTo(first.getCategories());
            assertThat(second.getProducts()).isEqualTo(first.getProducts());
            assertThat(second.getFacts()).isEqualTo(first.getFacts());
            assertThat(second.getPricing()).isEqualTo(first.getPricing());
        }

        @Test
        void shouldProduceDifferentProductsForDifferentSeeds() {
            Dataset first = generate(1L, 20, 2, 1, 0.0);
            Dataset second = generate(2L, 20, 2, 1, 0.0);

            assertThat(second.getProducts()).isNotEqualTo(first.getProducts());
        }
    }

    @Nested
    class ShapeTests {

        @ParameterizedTest
        @ValueSource(ints = {0, 1, 2})
        void shouldPlaceProductsUnderLeafCategories(int depth) {
            // When
            Dataset dataset = generate(7L, 40, 3, depth, 0.0);

            // Then
            assertThat(dataset.getProducts()).hasSize(40);
            Set<String> paths = dataset.getCategories().stream()
                .map(CategoryEntry::path)
                .collect(Collectors.toSet());
            for (Product product : dataset.getProducts()) {
                assertThat(paths).contains(product.categoryPath());
                assertThat(CategoryPaths.segments(product.categoryPath())).hasSize(depth + 1);
            }
        }

        @Test
        void shouldPriceEveryRootCategory() {
            // When
            Dataset dataset = generate(11L, 10, 4, 1, 0.0);

            // Then
            List<String> roots = dataset.getCategories().stream()
                .map(CategoryEntry::path)
                .filter(path -> CategoryPaths.segments(path).size() == 1)
                .collect(Collectors.toList());
            assertThat(roots).hasSize(4);
            assertThat(dataset.getPricing().keySet()).containsExactlyElementsOf(roots);
            assertThat(dataset.getPricing().values()).allSatisfy(snapshot -> {
                assertThat(snapshot.isUsable()).isTrue();
                assertThat(snapshot.marginRate()).isBetween(0.05, 0.45);
            });
        }

        @Test
        void shouldGenerateRequestedNumberOfDistinctRoots() {
            // When
            Dataset dataset = generate(3L, 5, 60, 0, 0.0);

            // Then
            assertThat(dataset.getCategories()).hasSize(60);
            assertThat(dataset.getCategories()).extracting(CategoryEntry::path).doesNotHaveDuplicates();
        }

        @Test
        void shouldGiveEveryCategoryUrlOnOneDomain() {
            Dataset dataset = generate(5L, 10, 2, 2, 0.0);

            String domain = dataset.getCategories().get(0).url().split("/")[2];
            assertThat(dataset.getCategories()).allSatisfy(category ->
                assertThat(category.url()).startsWith("https://" + domain + "/"));
        }

        @Test
        void shouldMostlyGenerateValidGtins() {
            // When
            Dataset dataset = generate(13L, 400, 3, 1, 0.0);

            // Then
            long valid = dataset.getProducts().stream()
                .filter(product -> GtinValidator.isValid(product.gtin()))
                .count();
            long invalid = dataset.getProducts().stream()
                .filter(product -> product.hasGtin() && !GtinValidator.isValid(product.gtin()))
                .count();
            assertThat(valid).isGreaterThan(240);
            assertThat(invalid).isPositive();
        }
    }

    @Nested
    class FactTests {

        @Test
        void shouldGenerateOneFactPerProductPlusCategoryTraffic() {
            // When
            Dataset dataset = generate(21L, 30, 2, 1, 0.0);

            // Then
            assertThat(dataset.getFacts().size()).isBetween(30, 30 + dataset.getCategories().size());
            assertThat(dataset.getFacts()).noneMatch(fact -> fact.subjectKey().contains("/blog/"));
        }

        @Test
        void shouldAddUnmatchedBlogTraffic() {
            // When
            Dataset dataset = generate(21L, 30, 2, 1, 0.5);

            // Then
            List<MetricFact> blog = dataset.getFacts().stream()
                .filter(fact -> fact.subjectKey().contains("/blog/"))
                .collect(Collectors.toList());
            int others = dataset.getFacts().size() - blog.size();
            assertThat(blog).hasSize((int) Math.round(others * 0.5));
            assertThat(blog).allMatch(fact -> fact.source() == MetricSource.ANALYTICS);
        }

        @Test
        void shouldShapeMetricsBySource() {
            Dataset dataset = generate(8L, 200, 3, 1, 0.0);

            for (MetricFact fact : dataset.getFacts()) {
                assertThat(fact.clicks()).isLessThanOrEqualTo(Math.max(fact.impressions(), 800));
                switch (fact.source()) {
                    case SEARCH_CONSOLE -> {
                        assertThat(fact.position()).isBetween(1.0, 30.0);
                        assertThat(fact.impressions()).isPositive();
                    }
                    case ANALYTICS -> {
                        assertThat(fact.impressions()).isZero();
                        assertThat(fact.sessions()).isGreaterThanOrEqualTo(fact.clicks());
                    }
                    case MERCHANT -> assertThat(fact.position()).isZero();
                }
            }
        }
    }

    @Test
    void shouldRejectInvalidSettings() {
        RandomDataProvider random = new RandomDataProvider(1L);

        assertThatThrownBy(() -> new CatalogGenerator(random, -1, 1, 1, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CatalogGenerator(random, 10, 0, 1, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CatalogGenerator(random, 10, 1, 3, 0.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Depth");
    }

    @RepeatedTest(5)
    void shouldGenerateValidAndInvalidGtin13() {
        RandomDataProvider random = new RandomDataProvider(System.nanoTime());

        String valid = random.gtin13();
        String invalid = random.invalidGtin13();

        assertThat(valid).hasSize(13).doesNotStartWith("0");
        assertThat(GtinValidator.isValid(valid)).isTrue();
        assertThat(invalid).hasSize(13);
        assertThat(GtinValidator.isValid(invalid)).isFalse();
    }
}
