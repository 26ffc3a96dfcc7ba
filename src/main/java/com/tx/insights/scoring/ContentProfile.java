package com.tx.insights.scoring;

/**
 * Content coverage of all products under a node. Sums are additive so profiles roll up like metrics.
 *
 * @param productCount    products under the node
 * @param completenessSum sum of per-product completeness scores (0-100 each)
 * @param withImage       products that carry an image
 */
public record ContentProfile(int productCount, double completenessSum, int withImage) {

    public static final ContentProfile EMPTY = new ContentProfile(0, 0, 0);

    /** Mean product completeness, 0-100. */
    public double completeness() {
        return productCount > 0 ? completenessSum / productCount : 0.0;
    }

    /** Share of products with an image, 0-100. */
    public double mediaCoverage() {
        return productCount > 0 ? withImage * 100.0 / productCount : 0.0;
    }

    ContentProfile plus(ContentProfile other) {
        return new ContentProfile(productCount + other.productCount,
            completenessSum + other.completenessSum, withImage + other.withImage);
    }
}
