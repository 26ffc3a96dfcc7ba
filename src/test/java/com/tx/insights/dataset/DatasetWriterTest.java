package com.tx.insights.dataset;

import com.tx.insights.matching.DateRange;
import com.tx.insights.matching.MetricFact;
import com.tx.insights.matching.MetricSource;
import com.tx.insights.scoring.PricingSnapshot;
import com.tx.insights.taxonomy.Product;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetWriterTest {

    private final DatasetWriter writer = new DatasetWriter();
    private final DatasetLoader loader = new DatasetLoader();

    private static Dataset sample() {
        Product phone = new Product("p1", "Pixel 8", "https://shop.example.com/p/pixel-8", "4006381333931",
            null, "Electronics > Phones", 699.0, "Flagship phone", null);
        MetricFact search = MetricFact.builder("https://shop.example.com/p/pixel-8", MetricSource.SEARCH_CONSOLE,
                DateRange.of("2024-01-01", "2024-01-31"))
            .impressions(1000).clicks(40).position(6.5)
            .build();
        MetricFact sales = MetricFact.builder("p1", MetricSource.ANALYTICS, DateRange.of("2024-01-01", "2024-01-31"))
            .sessions(120).conversions(3).revenue(2097.0)
            .build();
        return new Dataset(
            List.of(new CategoryEntry("Electronics > Phones", "https://shop.example.com/c/phones"),
                new CategoryEntry("Home", null)),
            List.of(phone),
            List.of(search, sales),
            Map.of("Electronics > Phones", new PricingSnapshot(699, 749, 599, 899, 6, 0.18)));
    }

    @Test
    void shouldProduceYamlTheLoaderReadsBack() {
        // Given
        Dataset original = sample();

        // When
        String yaml = writer.toYaml(original);
        Dataset reloaded = loader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        // Then
        assertThat(reloaded.getCategories()).isEqualTo(original.getCategories());
        assertThat(reloaded.getProducts()).isEqualTo(original.getProducts());
        assertThat(reloaded.getFacts()).isEqualTo(original.getFacts());
        assertThat(reloaded.getPricing()).isEqualTo(original.getPricing());
    }

    @Test
    void shouldOmitNullAndEmptyFields() {
        // When
        String yaml = writer.toYaml(sample());

        // Then
        assertThat(yaml).doesNotContain("mpn:");
        assertThat(yaml).doesNotContain("imageLink:");
        assertThat(yaml).doesNotContain("null");
        // the analytics fact has no position, the search fact no sessions
        assertThat(yaml.split("position:", -1)).hasSize(2);
        assertThat(yaml.split("sessions:", -1)).hasSize(2);
        assertThat(yaml).contains("source: search_console");
    }

    @Test
    void shouldWriteEmptySections() {
        // When
        String yaml = writer.toYaml(new Dataset(List.of(), List.of(), List.of(), Map.of()));

        // Then
        assertThat(yaml).contains("categories: []", "products: []", "facts: []", "pricing: []");
    }

    @Test
    void shouldWriteFile(@TempDir Path dir) throws Exception {
        // Given
        Path file = dir.resolve("out.yaml");

        // When
        writer.write(sample(), file);

        // Then
        assertThat(Files.readString(file)).startsWith("categories:");
        assertThat(loader.load(file).getFacts()).hasSize(2);
    }

    @Test
    void shouldWrapWriteFailure(@TempDir Path dir) {
        Path target = dir.resolve("no-such-dir").resolve("out.yaml");

        assertThatThrownBy(() -> writer.write(sample(), target))
            .isInstanceOf(DatasetException.class)
            .hasMessageContaining("Cannot write dataset");
    }
}
