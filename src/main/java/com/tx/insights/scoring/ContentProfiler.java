package com.tx.insights.scoring;

import com.tx.insights.matching.GtinValidator;
import com.tx.insights.taxonomy.Product;
import com.tx.insights.taxonomy.TaxonomyTree;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rolls product data completeness up the taxonomy, deepest nodes first.
 */
public class ContentProfiler {

    private static final int MIN_DESCRIPTION_LENGTH = 50;

    /**
     * Completeness of one product: title, description over 50 characters, price, image and a
     * valid GTIN are worth 20 points each.
     */
    public static double completeness(Product product) {
        double score = 0;
        if (product.title() != null && !product.title().isBlank()) score += 20;
        if (product.description() != null && product.description().strip().length() > MIN_DESCRIPTION_LENGTH) score += 20;
        if (product.price() > 0) score += 20;
        if (product.hasImage()) score += 20;
        if (product.hasGtin() && GtinValidator.isValid(product.gtin())) score += 20;
        return score;
    }

    public Map<String, ContentProfile> profile(TaxonomyTree tree, Collection<Product> products) {
        Map<String, Product> byId = new HashMap<>();
        for (Product product : products) {
            byId.putIfAbsent(product.id(), product);
        }

        ContentProfile[] totals = new ContentProfile[tree.size()];
        for (int index : tree.indexesByDepthDescending()) {
            ContentProfile total = ContentProfile.EMPTY;
            for (String productId : tree.nodeAt(index).getDirectProductIds()) {
                Product product = byId.get(productId);
                if (product != null) {
                    total = total.plus(new ContentProfile(1, completeness(product), product.hasImage() ? 1 : 0));
                }
            }
            for (int child : tree.childIndexes(index)) {
                total = total.plus(totals[child]);
            }
            totals[index] = total;
        }

        Map<String, ContentProfile> result = new LinkedHashMap<>();
        for (int i = 0; i < totals.length; i++) {
            result.put(tree.nodeAt(i).getId(), totals[i]);
        }
        return result;
    }
}
