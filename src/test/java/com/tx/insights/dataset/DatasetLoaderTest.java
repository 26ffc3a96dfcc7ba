package com.tx.insights.dataset;

import com.tx.insights.matching.DateRange;
import com.tx.insights.matching.MetricFact;
import com.tx.insights.matching.MetricSource;
import com.tx.insights.pipeline.AnalysisInput;
import com.tx.insights.scoring.PricingSnapshot;
import com.tx.insights.taxonomy.Product;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TDD tests for DatasetLoader.
 */
class DatasetLoaderTest {

    private DatasetLoader loader;

    @BeforeEach
    void setUp() {
        loader = new DatasetLoader();
    }

    private static InputStream yaml(String... lines) {
        return new ByteArrayInputStream(String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    class SectionTests {

        @Test
        void shouldLoadAllSections() {
            // Given
            InputStream input = yaml(
                "categories:",
                "  - path: Electronics > Phones",
                "    url: https://shop.example.com/c/phones",
                "  - path: Home > Kitchen",
                "products:",
                "  - id: p1",
                "    title: Pixel 8",
                "    link: https://shop.example.com/p/pixel-8",
                "    gtin: '4006381333931'",
                "    categoryPath: Electronics > Phones",
                "    price: 699.0",
                "    imageLink: https://img.example.com/p1.jpg",
                "facts:",
                "  - subjectKey: https://shop.example.com/p/pixel-8",
                "    source: search_console",
                "    start: 2024-01-01",
                "    end: 2024-01-31",
                "    impressions: 1000",
                "    clicks: 50",
                "    position: 4.5",
                "pricing:",
                "  - path: Electronics > Phones",
                "    ourPrice: 699",
                "    marketMedian: 749",
                "    marketMin: 599",
                "    marketMax: 899",
                "    competitorCount: 6",
                "    margin: 0.2",
                "");

            // When
            Dataset dataset = loader.load(input);

            // Then
            assertThat(dataset.getCategories()).containsExactly(
                new CategoryEntry("Electronics > Phones", "https://shop.example.com/c/phones"),
                new CategoryEntry("Home > Kitchen", null));

            Product product = dataset.getProducts().get(0);
            assertThat(product.id()).isEqualTo("p1");
            assertThat(product.gtin()).isEqualTo("4006381333931");
            assertThat(product.price()).isEqualTo(699.0);
            assertThat(product.hasImage()).isTrue();
            assertThat(product.description()).isNull();

            MetricFact fact = dataset.getFacts().get(0);
            assertThat(fact.source()).isEqualTo(MetricSource.SEARCH_CONSOLE);
            assertThat(fact.dateRange()).isEqualTo(DateRange.of("2024-01-01", "2024-01-31"));
            assertThat(fact.impressions()).isEqualTo(1000);
            assertThat(fact.clicks()).isEqualTo(50);
            assertThat(fact.position()).isEqualTo(4.5);
            assertThat(fact.revenue()).isZero();

            assertThat(dataset.getPricing()).containsOnlyKeys("Electronics > Phones");
            assertThat(dataset.getPricing().get("Electronics > Phones"))
                .isEqualTo(new PricingSnapshot(699, 749, 599, 899, 6, 0.2));
        }

        @Test
        void shouldTreatMissingSectionsAsEmpty() {
            // When
            Dataset dataset = loader.load(yaml("products:", "  - id: only", ""));

            // Then
            assertThat(dataset.getProducts()).hasSize(1);
            assertThat(dataset.getCategories()).isEmpty();
            assertThat(dataset.getFacts()).isEmpty();
            assertThat(dataset.getPricing()).isEmpty();
        }

        @Test
        void shouldLoadEmptyDocumentAsEmptyDataset() {
            // When
            Dataset dataset = loader.load(yaml(""));

            // Then
            assertThat(dataset.getProducts()).isEmpty();
            assertThat(dataset.getFacts()).isEmpty();
        }

        @Test
        void shouldAcceptJson() {
            // Given
            InputStream input = yaml(
                "{\"products\": [{\"id\": \"p1\", \"title\": \"Mug\", \"categoryPath\": \"Home\"}],",
                " \"facts\": [{\"subjectKey\": \"p1\", \"source\": \"ga4\", \"date\": \"2024-03-05\",",
                "             \"sessions\": 40, \"conversions\": 2, \"revenue\": 30.5}]}");

            // When
            Dataset dataset = loader.load(input);

            // Then
            assertThat(dataset.getProducts()).extracting(Product::title).containsExactly("Mug");
            MetricFact fact = dataset.getFacts().get(0);
            assertThat(fact.source()).isEqualTo(MetricSource.ANALYTICS);
            assertThat(fact.sessions()).isEqualTo(40);
            assertThat(fact.revenue()).isEqualTo(30.5);
        }
    }

    @Nested
    class FactTests {

        @Test
        void shouldUseSingleDayForDate() {
            // When
            Dataset dataset = loader.load(yaml(
                "facts:",
                "  - subjectKey: p1",
                "    source: merchant",
                "    date: 2024-02-29",
                ""));

            // Then
            DateRange range = dataset.getFacts().get(0).dateRange();
            assertThat(range.start()).isEqualTo(LocalDate.of(2024, 2, 29));
            assertThat(range.end()).isEqualTo(range.start());
        }

        @Test
        void shouldReadTransactionsWhenConversionsAreAbsent() {
            // When
            Dataset dataset = loader.load(yaml(
                "facts:",
                "  - {subjectKey: p1, source: ga, date: '2024-01-01', transactions: 7}",
                "  - {subjectKey: p2, source: ga, date: '2024-01-01', transactions: 7, conversions: 3}",
                ""));

            // Then
            assertThat(dataset.getFacts()).extracting(MetricFact::conversions).containsExactly(7L, 3L);
        }

        @Test
        void shouldAcceptNumbersWrittenAsStrings() {
            // When
            Dataset dataset = loader.load(yaml(
                "facts:",
                "  - {subjectKey: p1, source: gsc, date: '2024-01-01', impressions: ' 120 ', clicks: '6'}",
                ""));

            // Then
            assertThat(dataset.getFacts().get(0).impressions()).isEqualTo(120);
            assertThat(dataset.getFacts().get(0).clicks()).isEqualTo(6);
        }
    }

    @Nested
    class PricingTests {

        @Test
        void shouldPreferNodeIdOverPath() {
            // When
            Dataset dataset = loader.load(yaml(
                "pricing:",
                "  - {nodeId: electronics-phones, path: Electronics > Phones, ourPrice: 10, marketMedian: 12,"
                    + " marketMin: 8, marketMax: 15, competitorCount: 3}",
                ""));

            // Then
            assertThat(dataset.getPricing()).containsOnlyKeys("electronics-phones");
            assertThat(dataset.getPricing().get("electronics-phones").marginRate()).isNull();
        }

        @Test
        void shouldKeepFirstEntryForDuplicateKey() {
            // When
            Dataset dataset = loader.load(yaml(
                "pricing:",
                "  - {path: Home, ourPrice: 10, marketMedian: 12, marketMin: 8, marketMax: 15, competitorCount: 3}",
                "  - {path: Home, ourPrice: 99, marketMedian: 12, marketMin: 8, marketMax: 15, competitorCount: 3}",
                ""));

            // Then
            assertThat(dataset.getPricing()).hasSize(1);
            assertThat(dataset.getPricing().get("Home").ourPrice()).isEqualTo(10.0);
        }

        @Test
        void shouldRejectEntryWithoutKey() {
            assertThatThrownBy(() -> loader.load(yaml(
                "pricing:",
                "  - {ourPrice: 10, marketMedian: 12}",
                "")))
                .isInstanceOf(DatasetException.class)
                .hasMessageContaining("Invalid pricing entry 0");
        }
    }

    @Nested
    class ErrorTests {

        @Test
        void shouldReportSectionAndIndexOfInvalidEntry() {
            assertThatThrownBy(() -> loader.load(yaml(
                "facts:",
                "  - {subjectKey: p1, source: gsc, date: '2024-01-01'}",
                "  - {subjectKey: p2, source: carrier-pigeon, date: '2024-01-01'}",
                "")))
                .isInstanceOf(DatasetException.class)
                .hasMessageContaining("Invalid facts entry 1")
                .hasMessageContaining("carrier-pigeon");
        }

        @Test
        void shouldRejectNegativeCounts() {
            assertThatThrownBy(() -> loader.load(yaml(
                "facts:",
                "  - {subjectKey: p1, source: gsc, date: '2024-01-01', clicks: -4}",
                "")))
                .isInstanceOf(DatasetException.class)
                .hasMessageContaining("Invalid facts entry 0");
        }

        @Test
        void shouldRejectBadDates() {
            assertThatThrownBy(() -> loader.load(yaml(
                "facts:",
                "  - {subjectKey: p1, source: gsc, start: '2024-02-10', end: '2024-02-01'}",
                "")))
                .isInstanceOf(DatasetException.class)
                .hasMessageContaining("is after end");

            assertThatThrownBy(() -> loader.load(yaml(
                "facts:",
                "  - {subjectKey: p1, source: gsc, date: 'yesterday'}",
                "")))
                .isInstanceOf(DatasetException.class)
                .hasMessageContaining("Invalid facts entry 0");
        }

        @Test
        void shouldRejectProductWithoutId() {
            assertThatThrownBy(() -> loader.load(yaml("products:", "  - title: Nameless", "")))
                .isInstanceOf(DatasetException.class)
                .hasMessageContaining("Invalid products entry 0")
                .hasMessageContaining("'id'");
        }

        @Test
        void shouldRejectNonListSection() {
            assertThatThrownBy(() -> loader.load(yaml("products: p1", "")))
                .isInstanceOf(DatasetException.class)
                .hasMessageContaining("Section 'products' must be a list");
        }

        @Test
        void shouldRejectScalarDocument() {
            assertThatThrownBy(() -> loader.load(yaml("just text")))
                .isInstanceOf(DatasetException.class)
                .hasMessageContaining("must be a mapping");
        }

        @Test
        void shouldRejectMalformedYaml() {
            assertThatThrownBy(() -> loader.load(yaml("products: [unclosed")))
                .isInstanceOf(DatasetException.class)
                .hasMessageStartingWith("Malformed dataset");
        }

        @Test
        void shouldWrapMissingFile(@TempDir Path dir) {
            Path missing = dir.resolve("missing.yaml");

            assertThatThrownBy(() -> loader.load(missing))
                .isInstanceOf(DatasetException.class)
                .hasMessageContaining("Cannot read dataset")
                .hasCauseInstanceOf(IOException.class);
        }
    }

    @Test
    void shouldBuildAnalysisInputFromFile(@TempDir Path dir) throws IOException {
        // Given
        Path file = dir.resolve("dataset.yaml");
        Files.writeString(file, String.join("\n",
            "categories:",
            "  - path: Electronics > Phones",
            "    url: https://shop.example.com/c/phones",
            "  - path: Home",
            "    url: ' '",
            "products:",
            "  - {id: p1, categoryPath: Electronics > Phones}",
            ""));

        // When
        AnalysisInput input = loader.load(file).toInput();

        // Then
        assertThat(input.getCategoryPaths()).containsExactly("Electronics > Phones", "Home");
        assertThat(input.getCategoryUrls()).containsOnlyKeys("Electronics > Phones");
        assertThat(input.getProducts()).hasSize(1);
    }
}
