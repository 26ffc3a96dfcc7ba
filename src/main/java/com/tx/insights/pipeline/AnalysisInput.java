package com.tx.insights.pipeline;

import com.tx.insights.matching.MetricFact;
import com.tx.insights.scoring.PricingSnapshot;
import com.tx.insights.taxonomy.Product;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one analysis run reads. Immutable once built.
 *
 * <p>Pricing snapshots are keyed by raw category path or by node id; keys are resolved
 * against the tree when the run scores.
 */
public final class AnalysisInput {

    private final List<String> categoryPaths;
    private final List<Product> products;
    private final Map<String, String> categoryUrls;
    private final List<MetricFact> facts;
    private final Map<String, PricingSnapshot> pricing;

    private AnalysisInput(Builder builder) {
        this.categoryPaths = List.copyOf(builder.categoryPaths);
        this.products = List.copyOf(builder.products);
        this.categoryUrls = Collections.unmodifiableMap(new LinkedHashMap<>(builder.categoryUrls));
        this.facts = List.copyOf(builder.facts);
        this.pricing = Collections.unmodifiableMap(new LinkedHashMap<>(builder.pricing));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getCategoryPaths() {
        return categoryPaths;
    }

    public List<Product> getProducts() {
        return products;
    }

    /**
     * Raw category path to canonical category URL.
     */
    public Map<String, String> getCategoryUrls() {
        return categoryUrls;
    }

    public List<MetricFact> getFacts() {
        return facts;
    }

    public Map<String, PricingSnapshot> getPricing() {
        return pricing;
    }

    public static final class Builder {
        private final List<String> categoryPaths = new ArrayList<>();
        private final List<Product> products = new ArrayList<>();
        private final Map<String, String> categoryUrls = new LinkedHashMap<>();
        private final List<MetricFact> facts = new ArrayList<>();
        private final Map<String, PricingSnapshot> pricing = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder categoryPath(String path) {
            categoryPaths.add(path);
            return this;
        }

        public Builder categoryPaths(Collection<String> paths) {
            categoryPaths.addAll(paths);
            return this;
        }

        public Builder categoryUrl(String path, String url) {
            categoryUrls.put(path, url);
            return this;
        }

        public Builder categoryUrls(Map<String, String> urls) {
            categoryUrls.putAll(urls);
            return this;
        }

        public Builder product(Product product) {
            products.add(product);
            return this;
        }

        public Builder products(Collection<Product> items) {
            products.addAll(items);
            return this;
        }

        public Builder fact(MetricFact fact) {
            facts.add(fact);
            return this;
        }

        public Builder facts(Collection<MetricFact> items) {
            facts.addAll(items);
            return this;
        }

        /**
         * @param pathOrNodeId raw category path or node id
         */
        public Builder pricing(String pathOrNodeId, PricingSnapshot snapshot) {
            pricing.put(pathOrNodeId, snapshot);
            return this;
        }

        public Builder pricing(Map<String, PricingSnapshot> snapshots) {
            pricing.putAll(snapshots);
            return this;
        }

        public AnalysisInput build() {
            return new AnalysisInput(this);
        }
    }
}
