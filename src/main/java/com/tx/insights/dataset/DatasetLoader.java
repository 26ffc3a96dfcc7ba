package com.tx.insights.dataset;

import com.tx.insights.matching.DateRange;
import com.tx.insights.matching.MetricFact;
import com.tx.insights.matching.MetricSource;
import com.tx.insights.scoring.PricingSnapshot;
import com.tx.insights.taxonomy.Product;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a dataset file. YAML and JSON are both accepted.
 *
 * <pre>
 * categories: [{path, url}]
 * products:   [{id, title, link, gtin, mpn, categoryPath, price, description, imageLink}]
 * facts:      [{subjectKey, source, start, end | date, impressions, clicks, conversions, revenue, sessions, position}]
 * pricing:    [{path | nodeId, ourPrice, marketMedian, marketMin, marketMax, competitorCount, margin}]
 * </pre>
 *
 * Every section is optional. Entry errors are reported with the section and entry index.
 */
public class DatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(DatasetLoader.class);

    public Dataset load(Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            Dataset dataset = load(input);
            log.info("Loaded {} from {}", dataset, path);
            return dataset;
        } catch (IOException e) {
            throw new DatasetException("Cannot read dataset " + path + ": " + e.getMessage(), e);
        }
    }

    public Dataset load(InputStream input) {
        Object root;
        try {
            root = new Yaml().load(input);
        } catch (YAMLException e) {
            throw new DatasetException("Malformed dataset: " + e.getMessage(), e);
        }
        if (root == null) {
            return new Dataset(List.of(), List.of(), List.of(), Map.of());
        }
        if (!(root instanceof Map)) {
            throw new DatasetException("Dataset must be a mapping, found " + root.getClass().getSimpleName());
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) root;

        List<CategoryEntry> categories = new ArrayList<>();
        List<Map<String, Object>> categoryEntries = section(data, "categories");
        for (int i = 0; i < categoryEntries.size(); i++) {
            Map<String, Object> entry = categoryEntries.get(i);
            categories.add(parse("categories", i, () -> new CategoryEntry(required(entry, "path"), text(entry, "url"))));
        }

        List<Product> products = new ArrayList<>();
        List<Map<String, Object>> productEntries = section(data, "products");
        for (int i = 0; i < productEntries.size(); i++) {
            Map<String, Object> entry = productEntries.get(i);
            products.add(parse("products", i, () -> toProduct(entry)));
        }

        List<MetricFact> facts = new ArrayList<>();
        List<Map<String, Object>> factEntries = section(data, "facts");
        for (int i = 0; i < factEntries.size(); i++) {
            Map<String, Object> entry = factEntries.get(i);
            facts.add(parse("facts", i, () -> toFact(entry)));
        }

        Map<String, PricingSnapshot> pricing = new LinkedHashMap<>();
        List<Map<String, Object>> pricingEntries = section(data, "pricing");
        for (int i = 0; i < pricingEntries.size(); i++) {
            Map<String, Object> entry = pricingEntries.get(i);
            String key = parse("pricing", i, () -> pricingKey(entry));
            PricingSnapshot snapshot = parse("pricing", i, () -> toPricing(entry));
            if (pricing.putIfAbsent(key, snapshot) != null) {
                log.warn("Duplicate pricing entry {} for '{}', keeping the first", i, key);
            }
        }

        return new Dataset(categories, products, facts, pricing);
    }

    private static Product toProduct(Map<String, Object> entry) {
        return new Product(
            required(entry, "id"),
            text(entry, "title"),
            text(entry, "link"),
            text(entry, "gtin"),
            text(entry, "mpn"),
            text(entry, "categoryPath"),
            number(entry, "price", 0),
            text(entry, "description"),
            text(entry, "imageLink"));
    }

    private static MetricFact toFact(Map<String, Object> entry) {
        DateRange range;
        if (entry.containsKey("date")) {
            range = DateRange.single(date(entry, "date"));
        } else {
            range = new DateRange(date(entry, "start"), date(entry, "end"));
        }
        long conversions = entry.containsKey("conversions")
            ? (long) number(entry, "conversions", 0)
            : (long) number(entry, "transactions", 0);

        return MetricFact.builder(required(entry, "subjectKey"), MetricSource.fromString(required(entry, "source")), range)
            .impressions((long) number(entry, "impressions", 0))
            .clicks((long) number(entry, "clicks", 0))
            .conversions(conversions)
            .revenue(number(entry, "revenue", 0))
            .sessions((long) number(entry, "sessions", 0))
            .position(number(entry, "position", 0))
            .build();
    }

    private static String pricingKey(Map<String, Object> entry) {
        String key = text(entry, "nodeId");
        if (key == null) {
            key = text(entry, "path");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("pricing entry needs 'path' or 'nodeId'");
        }
        return key;
    }

    private static PricingSnapshot toPricing(Map<String, Object> entry) {
        Double margin = entry.get("margin") == null ? null : number(entry, "margin", 0);
        return new PricingSnapshot(
            number(entry, "ourPrice", 0),
            number(entry, "marketMedian", 0),
            number(entry, "marketMin", 0),
            number(entry, "marketMax", 0),
            (int) number(entry, "competitorCount", 0),
            margin);
    }

    private interface EntryParser<T> {
        T parse();
    }

    private static <T> T parse(String section, int index, EntryParser<T> parser) {
        try {
            return parser.parse();
        } catch (IllegalArgumentException | ClassCastException | DateTimeParseException e) {
            throw new DatasetException("Invalid " + section + " entry " + index + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> section(Map<String, Object> data, String name) {
        Object value = data.get(name);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new DatasetException("Section '" + name + "' must be a list");
        }
        List<Object> items = (List<Object>) value;
        List<Map<String, Object>> entries = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            if (!(item instanceof Map)) {
                throw new DatasetException("Invalid " + name + " entry " + i + ": expected a mapping");
            }
            entries.add((Map<String, Object>) item);
        }
        return entries;
    }

    private static String required(Map<String, Object> entry, String key) {
        String value = text(entry, key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing '" + key + "'");
        }
        return value;
    }

    private static String text(Map<String, Object> entry, String key) {
        Object value = entry.get(key);
        return value == null ? null : String.valueOf(value);
    }

    private static double number(Map<String, Object> entry, String key, double defaultValue) {
        Object value = entry.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' is not a number: " + value, e);
        }
    }

    private static LocalDate date(Map<String, Object> entry, String key) {
        Object value = entry.get(key);
        if (value == null) {
            throw new IllegalArgumentException("missing '" + key + "'");
        }
        // unquoted YAML dates arrive as timestamps at UTC midnight
        if (value instanceof Date) {
            return ((Date) value).toInstant().atZone(ZoneOffset.UTC).toLocalDate();
        }
        return LocalDate.parse(value.toString().strip());
    }
}
