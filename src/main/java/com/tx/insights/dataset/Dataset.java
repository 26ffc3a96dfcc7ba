package com.tx.insights.dataset;

import com.tx.insights.matching.MetricFact;
import com.tx.insights.pipeline.AnalysisInput;
import com.tx.insights.scoring.PricingSnapshot;
import com.tx.insights.taxonomy.Product;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of a dataset file: categories, products, metric facts and pricing snapshots.
 */
public final class Dataset {

    private final List<CategoryEntry> categories;
    private final List<Product> products;
    private final List<MetricFact> facts;
    private final Map<String, PricingSnapshot> pricing;

    public Dataset(List<CategoryEntry> categories, List<Product> products, List<MetricFact> facts,
                   Map<String, PricingSnapshot> pricing) {
        this.categories = List.copyOf(categories);
        this.products = List.copyOf(products);
        this.facts = List.copyOf(facts);
        this.pricing = Collections.unmodifiableMap(new LinkedHashMap<>(pricing));
    }

    public List<CategoryEntry> getCategories() {
        return categories;
    }

    public List<Product> getProducts() {
        return products;
    }

    public List<MetricFact> getFacts() {
        return facts;
    }

    /**
     * Pricing keyed by category path or node id.
     */
    public Map<String, PricingSnapshot> getPricing() {
        return pricing;
    }

    public AnalysisInput toInput() {
        AnalysisInput.Builder builder = AnalysisInput.builder();
        for (CategoryEntry category : categories) {
            builder.categoryPath(category.path());
            if (category.url() != null && !category.url().isBlank()) {
                builder.categoryUrl(category.path(), category.url());
            }
        }
        return builder.products(products)
            .facts(facts)
            .pricing(pricing)
            .build();
    }

    @Override
    public String toString() {
        return String.format("Dataset{categories=%d, products=%d, facts=%d, pricing=%d}",
            categories.size(), products.size(), facts.size(), pricing.size());
    }
}
