package com.tx.insights.taxonomy;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable category node. Metrics are never stored here; a run keeps them
 * in its aggregation result keyed by node id.
 */
public final class TaxonomyNode {

    private final String id;
    private final String title;
    private final String parentId;
    private final int depth;
    private final List<String> path;
    private final String canonicalPath;
    private final String url;
    private final Set<String> directProductIds;

    public TaxonomyNode(String id, String title, String parentId, int depth,
                        List<String> path, String canonicalPath, String url,
                        Set<String> directProductIds) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        if (depth < 0) {
            throw new IllegalArgumentException("Node depth must be non-negative: " + id);
        }
        this.id = id;
        this.title = title;
        this.parentId = parentId;
        this.depth = depth;
        this.path = path == null ? List.of() : List.copyOf(path);
        this.canonicalPath = canonicalPath == null ? "" : canonicalPath;
        this.url = url;
        this.directProductIds = directProductIds == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(directProductIds));
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getParentId() {
        return parentId;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    /**
     * Declared depth, root = 0. {@link TaxonomyTree#depthOf(String)} returns the structural depth.
     */
    public int getDepth() {
        return depth;
    }

    /**
     * Humanized titles from the root down to this node.
     */
    public List<String> getPath() {
        return path;
    }

    public String getCanonicalPath() {
        return canonicalPath;
    }

    public String getUrl() {
        return url;
    }

    public Set<String> getDirectProductIds() {
        return directProductIds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaxonomyNode)) return false;
        TaxonomyNode that = (TaxonomyNode) o;
        return depth == that.depth
            && id.equals(that.id)
            && Objects.equals(title, that.title)
            && Objects.equals(parentId, that.parentId)
            && path.equals(that.path)
            && canonicalPath.equals(that.canonicalPath)
            && Objects.equals(url, that.url)
            && directProductIds.equals(that.directProductIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, parentId, depth, canonicalPath);
    }

    @Override
    public String toString() {
        return "TaxonomyNode{" +
            "id='" + id + '\'' +
            ", title='" + title + '\'' +
            ", parentId='" + parentId + '\'' +
            ", depth=" + depth +
            ", products=" + directProductIds.size() +
            '}';
    }
}
