package com.tx.insights.matching;

import com.tx.insights.taxonomy.CategoryPaths;
import com.tx.insights.taxonomy.Product;
import com.tx.insights.taxonomy.TaxonomyNode;
import com.tx.insights.taxonomy.TaxonomyTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup structures over a taxonomy and its products, built once per run and
 * shared read-only by all matching workers.
 */
public final class MatchIndex {

    private static final Logger log = LoggerFactory.getLogger(MatchIndex.class);

    /** Slugs shorter than this are too ambiguous for containment matching. */
    static final int MIN_KEYWORD_LENGTH = 3;

    private final TaxonomyTree tree;
    private final Map<String, Product> productsById;
    private final Map<String, String> nodeByUrlPath;
    private final Map<String, String> productByLinkPath;
    private final Map<String, String> productByGtin;
    private final Map<String, String> nodeBySlugPath;
    private final List<Keyword> categoryKeywords;
    private final List<Keyword> productTitles;
    private final List<MatchWarning> catalogWarnings;
    private final int maxPathSegments;

    record Keyword(String slug, String entityId, int depth) {}

    private MatchIndex(TaxonomyTree tree, Collection<Product> products) {
        this.tree = tree;
        Map<String, Product> byId = new HashMap<>();
        Map<String, String> byUrl = new HashMap<>();
        Map<String, String> byLink = new HashMap<>();
        Map<String, String> byGtin = new HashMap<>();
        Map<String, String> bySlugPath = new HashMap<>();
        List<Keyword> keywords = new ArrayList<>();
        List<Keyword> titles = new ArrayList<>();
        List<MatchWarning> warnings = new ArrayList<>();
        int longestPath = 0;

        for (TaxonomyNode node : tree.nodes()) {
            if (node.getUrl() != null) {
                UrlNormalizer.normalizePath(node.getUrl())
                    .ifPresentOrElse(
                        path -> byUrl.merge(path, node.getId(), MatchIndex::lowerId),
                        () -> warnings.add(new MatchWarning(MatchWarning.Type.MALFORMED_URL, node.getId(),
                            node.getUrl(), "Category URL cannot be parsed")));
            }

            List<String> slugs = new ArrayList<>();
            for (String title : node.getPath()) {
                String slug = CategoryPaths.slug(title);
                if (!slug.isEmpty()) {
                    slugs.add(slug);
                }
            }
            if (!slugs.isEmpty()) {
                bySlugPath.merge(String.join("/", slugs), node.getId(), MatchIndex::lowerId);
                longestPath = Math.max(longestPath, slugs.size());
            }

            String titleSlug = CategoryPaths.slug(node.getTitle());
            if (titleSlug.length() >= MIN_KEYWORD_LENGTH) {
                keywords.add(new Keyword(titleSlug, node.getId(), tree.depthOf(node.getId())));
            }
        }

        for (Product product : products) {
            if (byId.putIfAbsent(product.id(), product) != null) {
                log.debug("Duplicate product id {} ignored for matching", product.id());
                continue;
            }
            if (product.link() != null && !product.link().isBlank()) {
                UrlNormalizer.normalizePath(product.link())
                    .ifPresent(path -> byLink.merge(path, product.id(), MatchIndex::lowerId));
            }
            if (product.hasGtin()) {
                if (GtinValidator.isValid(product.gtin())) {
                    byGtin.merge(GtinValidator.canonical(product.gtin()), product.id(), MatchIndex::lowerId);
                } else {
                    warnings.add(new MatchWarning(MatchWarning.Type.INVALID_GTIN, product.id(),
                        product.gtin(), "Catalog GTIN fails checksum, excluded from GTIN matching"));
                }
            }
            String titleSlug = CategoryPaths.slug(product.title());
            if (titleSlug.length() >= MIN_KEYWORD_LENGTH) {
                titles.add(new Keyword(titleSlug, product.id(), 0));
            }
        }

        // deepest category first, then the most specific keyword
        keywords.sort(Comparator.comparingInt(Keyword::depth).reversed()
            .thenComparing(Comparator.comparingInt((Keyword k) -> k.slug().length()).reversed())
            .thenComparing(Keyword::entityId));
        titles.sort(Comparator.comparingInt((Keyword k) -> k.slug().length()).reversed()
            .thenComparing(Keyword::entityId));

        this.productsById = Map.copyOf(byId);
        this.nodeByUrlPath = Map.copyOf(byUrl);
        this.productByLinkPath = Map.copyOf(byLink);
        this.productByGtin = Map.copyOf(byGtin);
        this.nodeBySlugPath = Map.copyOf(bySlugPath);
        this.categoryKeywords = List.copyOf(keywords);
        this.productTitles = List.copyOf(titles);
        this.catalogWarnings = List.copyOf(warnings);
        this.maxPathSegments = longestPath;

        if (!catalogWarnings.isEmpty()) {
            log.warn("Match index built with {} catalog warnings", catalogWarnings.size());
        }
    }

    /**
     * Entities sharing a URL, slug path or GTIN resolve to the lowest id, whatever the input order.
     */
    private static String lowerId(String current, String candidate) {
        return candidate.compareTo(current) < 0 ? candidate : current;
    }

    public static MatchIndex build(TaxonomyTree tree, Collection<Product> products) {
        MatchIndex index = new MatchIndex(tree, products);
        log.debug("Match index: {} nodes, {} products, {} GTINs, {} URLs",
            tree.size(), index.productsById.size(), index.productByGtin.size(),
            index.nodeByUrlPath.size() + index.productByLinkPath.size());
        return index;
    }

    public TaxonomyTree tree() {
        return tree;
    }

    Optional<Product> productById(String id) {
        return Optional.ofNullable(productsById.get(id));
    }

    Optional<String> nodeByUrlPath(String normalizedPath) {
        return Optional.ofNullable(nodeByUrlPath.get(normalizedPath));
    }

    Optional<String> productByLinkPath(String normalizedPath) {
        return Optional.ofNullable(productByLinkPath.get(normalizedPath));
    }

    Optional<String> productByCanonicalGtin(String canonicalGtin) {
        return Optional.ofNullable(productByGtin.get(canonicalGtin));
    }

    Optional<String> nodeBySlugPath(String slugPath) {
        return Optional.ofNullable(nodeBySlugPath.get(slugPath));
    }

    int maxPathSegments() {
        return maxPathSegments;
    }

    List<Keyword> categoryKeywords() {
        return categoryKeywords;
    }

    List<Keyword> productTitles() {
        return productTitles;
    }

    /**
     * Owning node of a product, or null when the product has no category.
     */
    String owningNode(String productId) {
        return tree.nodeOfProduct(productId).map(TaxonomyNode::getId).orElse(null);
    }

    /**
     * Problems found in the catalog itself (invalid product GTINs, unparsable category URLs).
     */
    public List<MatchWarning> catalogWarnings() {
        return catalogWarnings;
    }
}
