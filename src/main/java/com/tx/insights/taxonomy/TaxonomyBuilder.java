package com.tx.insights.taxonomy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a {@link TaxonomyTree} from category path strings and product feeds.
 *
 * <p>Each path is normalized, split into segments, and one node is created per distinct
 * path prefix. Ids are derived from the canonical prefix, so identical category strings
 * always produce identical ids.
 *
 * <p>When a prefix resolves to an id already owned by a node with a different parent chain,
 * a strict builder throws {@link TaxonomyConflictException}. A lenient builder records
 * a {@link AnomalyType#PATH_CONFLICT} anomaly and skips the rest of that path while other
 * paths proceed.
 */
public class TaxonomyBuilder {

    private static final Logger log = LoggerFactory.getLogger(TaxonomyBuilder.class);

    private final boolean strict;

    public TaxonomyBuilder() {
        this(false);
    }

    public TaxonomyBuilder(boolean strict) {
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    public TaxonomyTree build(Collection<String> categoryPaths) {
        return build(categoryPaths, List.of(), Map.of());
    }

    public TaxonomyTree buildFromProducts(Collection<Product> products, Map<String, String> categoryUrls) {
        return build(List.of(), products, categoryUrls);
    }

    /**
     * Builds the tree from explicit category paths, the category paths of the given products
     * and the keys of {@code categoryUrls} (raw path to canonical category URL), in that order.
     */
    public TaxonomyTree build(Collection<String> categoryPaths, Collection<Product> products,
                              Map<String, String> categoryUrls) {
        BuildState state = new BuildState();

        for (String path : categoryPaths) {
            state.addPath(path);
        }

        int unassigned = 0;
        for (Product product : products) {
            String leafId = state.addPath(product.categoryPath());
            if (leafId == null) {
                unassigned++;
                continue;
            }
            String owner = state.productOwners.putIfAbsent(product.id(), leafId);
            if (owner == null) {
                state.drafts.get(leafId).productIds.add(product.id());
            } else if (!owner.equals(leafId)) {
                log.warn("Product {} listed under {} and {}, keeping {}", product.id(), owner, leafId, owner);
            }
        }

        for (Map.Entry<String, String> entry : categoryUrls.entrySet()) {
            String leafId = state.addPath(entry.getKey());
            if (leafId != null && entry.getValue() != null && !entry.getValue().isBlank()) {
                state.drafts.get(leafId).url = entry.getValue().strip();
            }
        }

        List<TaxonomyNode> nodes = new ArrayList<>(state.drafts.size());
        for (Draft draft : state.drafts.values()) {
            nodes.add(draft.toNode());
        }

        log.info("Built taxonomy with {} nodes from {} paths and {} products ({} without category, {} conflicts)",
            nodes.size(), categoryPaths.size(), products.size(), unassigned, state.conflicts.size());

        return new TaxonomyTree(nodes, state.anomalies);
    }

    private final class BuildState {
        private final Map<String, Draft> drafts = new LinkedHashMap<>();
        private final Map<String, String> productOwners = new LinkedHashMap<>();
        private final List<TreeAnomaly> anomalies = new ArrayList<>();
        private final List<TaxonomyConflictException> conflicts = new ArrayList<>();
        private final Set<String> reportedVariants = new HashSet<>();

        /**
         * Adds every prefix of the path and returns the leaf id, or null when the path is empty
         * or was cut short by a conflict.
         */
        String addPath(String rawPath) {
            List<String> segments = CategoryPaths.segments(rawPath);
            if (segments.isEmpty()) {
                return null;
            }

            String parentId = null;
            List<String> titles = new ArrayList<>(segments.size());
            for (int i = 0; i < segments.size(); i++) {
                String prefix = String.join(CategoryPaths.SEPARATOR, segments.subList(0, i + 1));
                String id = CategoryPaths.nodeId(prefix);
                titles.add(CategoryPaths.humanize(segments.get(i)));

                Draft existing = drafts.get(id);
                if (existing == null) {
                    drafts.put(id, new Draft(id, parentId, i, titles, prefix));
                } else if (!Objects.equals(existing.parentId, parentId)) {
                    TaxonomyConflictException conflict = new TaxonomyConflictException(
                        "Category path '" + prefix + "' resolves to node '" + id
                            + "' already owned by '" + existing.canonicalPath + "'",
                        id, prefix);
                    if (strict) {
                        throw conflict;
                    }
                    log.warn(conflict.getMessage());
                    conflicts.add(conflict);
                    anomalies.add(new TreeAnomaly(AnomalyType.PATH_CONFLICT, id, conflict.getMessage()));
                    return null;
                } else if (!existing.canonicalPath.equals(prefix) && reportedVariants.add(prefix)) {
                    anomalies.add(new TreeAnomaly(AnomalyType.DUPLICATE_PATH, id,
                        "'" + prefix + "' merged into '" + existing.canonicalPath + "'"));
                }
                parentId = id;
            }
            return parentId;
        }
    }

    private static final class Draft {
        private final String id;
        private final String parentId;
        private final int depth;
        private final List<String> path;
        private final String canonicalPath;
        private final Set<String> productIds = new LinkedHashSet<>();
        private String url;

        Draft(String id, String parentId, int depth, List<String> path, String canonicalPath) {
            this.id = id;
            this.parentId = parentId;
            this.depth = depth;
            this.path = List.copyOf(path);
            this.canonicalPath = canonicalPath;
        }

        TaxonomyNode toNode() {
            String title = path.get(path.size() - 1);
            return new TaxonomyNode(id, title, parentId, depth, path, canonicalPath, url, productIds);
        }
    }
}
