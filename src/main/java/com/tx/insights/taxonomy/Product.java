package com.tx.insights.taxonomy;

/**
 * A catalog product as supplied by a merchant feed. Products are the leaves of the
 * taxonomy: each one belongs to the node of its normalized category path.
 *
 * @param id           merchant offer id, unique within a catalog
 * @param title        product title
 * @param link         landing page URL
 * @param gtin         global trade item number, may be null or invalid
 * @param mpn          manufacturer part number
 * @param categoryPath raw category path, e.g. {@code "Electronics > Phones"}
 * @param price        current price, 0 when unknown
 * @param description  product description
 * @param imageLink    main image URL
 */
public record Product(
    String id,
    String title,
    String link,
    String gtin,
    String mpn,
    String categoryPath,
    double price,
    String description,
    String imageLink
) {

    public Product {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Product id must not be blank");
        }
        if (price < 0 || Double.isNaN(price)) {
            throw new IllegalArgumentException("Product price must be non-negative: " + id);
        }
    }

    public static Product of(String id, String title, String categoryPath) {
        return new Product(id, title, null, null, null, categoryPath, 0, null, null);
    }

    public boolean hasImage() {
        return imageLink != null && !imageLink.isBlank();
    }

    public boolean hasGtin() {
        return gtin != null && !gtin.isBlank();
    }
}
