package com.tx.insights.taxonomy;

/**
 * Thrown when a category path resolves to a node id that is already owned by a node
 * with a different parent chain.
 */
public class TaxonomyConflictException extends RuntimeException {

    private final String nodeId;
    private final String categoryPath;

    public TaxonomyConflictException(String message, String nodeId, String categoryPath) {
        super(message);
        this.nodeId = nodeId;
        this.categoryPath = categoryPath;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getCategoryPath() {
        return categoryPath;
    }
}
