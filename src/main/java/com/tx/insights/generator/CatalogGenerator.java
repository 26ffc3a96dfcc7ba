package com.tx.insights.generator;

import com.tx.insights.dataset.CategoryEntry;
import com.tx.insights.dataset.Dataset;
import com.tx.insights.matching.DateRange;
import com.tx.insights.matching.MetricFact;
import com.tx.insights.matching.MetricSource;
import com.tx.insights.scoring.PricingSnapshot;
import com.tx.insights.taxonomy.CategoryPaths;
import com.tx.insights.taxonomy.Product;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Generates a synthetic catalog: a category tree, products under its leaves, metric facts
 * from all three sources and pricing for the top-level categories. Output depends only on
 * the seed of the {@link RandomDataProvider} and the settings.
 */
public class CatalogGenerator {

    private static final Logger log = LoggerFactory.getLogger(CatalogGenerator.class);

    private static final LocalDate PERIOD_START = LocalDate.of(2024, 1, 1);
    private static final LocalDate PERIOD_END = LocalDate.of(2024, 1, 31);

    private final RandomDataProvider random;
    private final int productCount;
    private final int rootCount;
    private final int depth;
    private final double unmatchedRatio;

    /**
     * @param productCount   products to generate
     * @param rootCount      top-level categories
     * @param depth          category levels below the roots, 0 to 2
     * @param unmatchedRatio share of extra facts whose subject matches nothing
     */
    public CatalogGenerator(RandomDataProvider random, int productCount, int rootCount, int depth,
                            double unmatchedRatio) {
        if (productCount < 0 || rootCount < 1) {
            throw new IllegalArgumentException("Need a non-negative product count and at least one root category");
        }
        if (depth < 0 || depth > 2) {
            throw new IllegalArgumentException("Depth must be between 0 and 2: " + depth);
        }
        this.random = random;
        this.productCount = productCount;
        this.rootCount = rootCount;
        this.depth = depth;
        this.unmatchedRatio = Math.max(0.0, unmatchedRatio);
    }

    public Dataset generate() {
        String domain = random.domain();
        List<String> leafPaths = new ArrayList<>();
        List<String> rootPaths = new ArrayList<>();
        List<CategoryEntry> categories = generateCategories(domain, rootPaths, leafPaths);

        List<Product> products = new ArrayList<>(productCount);
        for (int i = 0; i < productCount; i++) {
            products.add(generateProduct(domain, i, random.randomChoice(leafPaths)));
        }

        List<MetricFact> facts = new ArrayList<>();
        DateRange period = new DateRange(PERIOD_START, PERIOD_END);
        for (Product product : products) {
            facts.add(productFact(product, random.source(), period));
        }
        for (CategoryEntry category : categories) {
            if (random.randomBoolean(0.5)) {
                facts.add(trafficFact(category.url(), MetricSource.SEARCH_CONSOLE, period));
            }
        }
        int unmatched = (int) Math.round(facts.size() * unmatchedRatio);
        for (int i = 0; i < unmatched; i++) {
            String url = "https://" + domain + "/blog/" + random.slugWords(3);
            facts.add(trafficFact(url, MetricSource.ANALYTICS, period));
        }

        Map<String, PricingSnapshot> pricing = new LinkedHashMap<>();
        for (String rootPath : rootPaths) {
            pricing.put(rootPath, generatePricing());
        }

        Dataset dataset = new Dataset(categories, products, facts, pricing);
        log.info("Generated {}", dataset);
        return dataset;
    }

    private List<CategoryEntry> generateCategories(String domain, List<String> rootPaths, List<String> leafPaths) {
        Set<String> roots = new LinkedHashSet<>();
        int attempts = 0;
        while (roots.size() < rootCount && attempts++ < rootCount * 20) {
            roots.add(random.department());
        }
        // the department list is finite, fall back to numbered roots
        int extra = 1;
        while (roots.size() < rootCount) {
            roots.add("Department " + extra++);
        }

        List<CategoryEntry> categories = new ArrayList<>();
        for (String root : roots) {
            rootPaths.add(root);
            categories.add(category(domain, root));
            if (depth == 0) {
                leafPaths.add(root);
                continue;
            }
            for (String child : distinct(random.randomInt(2, 4), random::productNoun)) {
                String childPath = root + CategoryPaths.SEPARATOR + child;
                categories.add(category(domain, childPath));
                if (depth == 1) {
                    leafPaths.add(childPath);
                    continue;
                }
                for (String grandchild : distinct(random.randomInt(1, 3), random::material)) {
                    String leafPath = childPath + CategoryPaths.SEPARATOR + grandchild;
                    categories.add(category(domain, leafPath));
                    leafPaths.add(leafPath);
                }
            }
        }
        return categories;
    }

    private interface NameSource {
        String next();
    }

    private static Set<String> distinct(int count, NameSource source) {
        Set<String> names = new LinkedHashSet<>();
        int attempts = 0;
        while (names.size() < count && attempts++ < count * 10) {
            names.add(source.next());
        }
        return names;
    }

    private static CategoryEntry category(String domain, String path) {
        StringBuilder url = new StringBuilder("https://").append(domain);
        for (String segment : CategoryPaths.segments(path)) {
            url.append('/').append(CategoryPaths.slug(segment));
        }
        return new CategoryEntry(path, url.toString());
    }

    private Product generateProduct(String domain, int sequence, String categoryPath) {
        String id = String.format("SKU-%06d", sequence + 1);
        String title = random.productTitle();
        String link = "https://" + domain + "/products/" + CategoryPaths.slug(title) + "-" + (sequence + 1);

        String gtin;
        double roll = random.randomDouble();
        if (roll < 0.80) {
            gtin = random.gtin13();
        } else if (roll < 0.90) {
            gtin = random.invalidGtin13();
        } else {
            gtin = null;
        }

        return new Product(id, title, link, gtin,
            random.randomBoolean(0.5) ? "MPN-" + random.randomInt(10_000, 99_999) : null,
            categoryPath,
            random.randomBoolean(0.95) ? random.price() : 0.0,
            random.description(),
            random.randomBoolean(0.85) ? "https://" + domain + "/images/" + id.toLowerCase(Locale.ROOT) + ".jpg" : null);
    }

    private MetricFact productFact(Product product, MetricSource source, DateRange period) {
        String subject = switch (source) {
            case SEARCH_CONSOLE, ANALYTICS -> product.link();
            case MERCHANT -> product.gtin() != null && random.randomBoolean(0.5) ? product.gtin() : product.id();
        };
        return trafficFact(subject, source, period);
    }

    private MetricFact trafficFact(String subjectKey, MetricSource source, DateRange period) {
        long impressions = source == MetricSource.ANALYTICS ? 0 : random.randomLong(50, 20_000);
        long clicks = impressions > 0
            ? Math.round(impressions * (0.002 + random.randomDouble() * 0.05))
            : random.randomLong(10, 800);
        long conversions = Math.round(clicks * random.randomDouble() * 0.05);
        double revenue = Math.round(conversions * (20 + random.randomDouble() * 180) * 100.0) / 100.0;

        MetricFact.Builder builder = MetricFact.builder(subjectKey, source, period)
            .impressions(impressions)
            .clicks(clicks)
            .conversions(conversions)
            .revenue(revenue);
        if (source == MetricSource.SEARCH_CONSOLE) {
            builder.position(Math.round((1 + random.randomDouble() * 29) * 10.0) / 10.0);
        }
        if (source == MetricSource.ANALYTICS) {
            builder.sessions(Math.round(clicks * (1.1 + random.randomDouble())));
        }
        return builder.build();
    }

    private PricingSnapshot generatePricing() {
        double median = random.price();
        double spread = median * (0.1 + random.randomDouble() * 0.6);
        double ourPrice = Math.round(median * (0.8 + random.randomDouble() * 0.4) * 100.0) / 100.0;
        double margin = Math.round((0.05 + random.randomDouble() * 0.4) * 100.0) / 100.0;
        return new PricingSnapshot(ourPrice, median,
            Math.max(0.01, Math.round((median - spread) * 100.0) / 100.0),
            Math.round((median + spread) * 100.0) / 100.0,
            random.randomInt(1, 20),
            margin);
    }
}
