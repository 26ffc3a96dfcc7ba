package com.tx.insights.dataset;

import com.tx.insights.matching.MetricFact;
import com.tx.insights.scoring.PricingSnapshot;
import com.tx.insights.taxonomy.Product;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes a dataset in the YAML layout {@link DatasetLoader} reads. Null fields are omitted.
 */
public class DatasetWriter {

    private static final Logger log = LoggerFactory.getLogger(DatasetWriter.class);

    public void write(Dataset dataset, Path path) {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(dataset, writer);
        } catch (IOException e) {
            throw new DatasetException("Cannot write dataset " + path + ": " + e.getMessage(), e);
        }
        log.info("Wrote {} to {}", dataset, path);
    }

    public void write(Dataset dataset, Writer writer) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        options.setWidth(120);
        new Yaml(options).dump(toMap(dataset), writer);
    }

    public String toYaml(Dataset dataset) {
        StringWriter out = new StringWriter();
        write(dataset, out);
        return out.toString();
    }

    private static Map<String, Object> toMap(Dataset dataset) {
        Map<String, Object> root = new LinkedHashMap<>();

        List<Map<String, Object>> categories = new ArrayList<>();
        for (CategoryEntry category : dataset.getCategories()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            put(entry, "path", category.path());
            put(entry, "url", category.url());
            categories.add(entry);
        }
        root.put("categories", categories);

        List<Map<String, Object>> products = new ArrayList<>();
        for (Product product : dataset.getProducts()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            put(entry, "id", product.id());
            put(entry, "title", product.title());
            put(entry, "link", product.link());
            put(entry, "gtin", product.gtin());
            put(entry, "mpn", product.mpn());
            put(entry, "categoryPath", product.categoryPath());
            entry.put("price", product.price());
            put(entry, "description", product.description());
            put(entry, "imageLink", product.imageLink());
            products.add(entry);
        }
        root.put("products", products);

        List<Map<String, Object>> facts = new ArrayList<>();
        for (MetricFact fact : dataset.getFacts()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("subjectKey", fact.subjectKey());
            entry.put("source", fact.source().name().toLowerCase(Locale.ROOT));
            entry.put("start", fact.dateRange().start().toString());
            entry.put("end", fact.dateRange().end().toString());
            entry.put("impressions", fact.impressions());
            entry.put("clicks", fact.clicks());
            entry.put("conversions", fact.conversions());
            entry.put("revenue", fact.revenue());
            if (fact.sessions() > 0) {
                entry.put("sessions", fact.sessions());
            }
            if (fact.position() > 0) {
                entry.put("position", fact.position());
            }
            facts.add(entry);
        }
        root.put("facts", facts);

        List<Map<String, Object>> pricing = new ArrayList<>();
        for (Map.Entry<String, PricingSnapshot> e : dataset.getPricing().entrySet()) {
            PricingSnapshot snapshot = e.getValue();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("path", e.getKey());
            entry.put("ourPrice", snapshot.ourPrice());
            entry.put("marketMedian", snapshot.marketMedian());
            entry.put("marketMin", snapshot.marketMin());
            entry.put("marketMax", snapshot.marketMax());
            entry.put("competitorCount", snapshot.competitorCount());
            put(entry, "margin", snapshot.marginRate());
            pricing.add(entry);
        }
        root.put("pricing", pricing);

        return root;
    }

    private static void put(Map<String, Object> entry, String key, Object value) {
        if (value != null) {
            entry.put(key, value);
        }
    }
}
