package com.tx.insights.aggregation;

import com.tx.insights.taxonomy.TreeAnomaly;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-node metrics of one aggregation, in tree order, plus the grand total over all
 * assigned facts.
 */
public final class AggregationResult {

    /** Node id used for the grand total. */
    public static final String ALL_NODES = "(all)";

    private final Map<String, AggregatedMetrics> metricsByNode;
    private final AggregatedMetrics grandTotal;
    private final int assignedFacts;
    private final int unmatchedFacts;
    private final int unassignedFacts;
    private final List<TreeAnomaly> anomalies;

    AggregationResult(Map<String, AggregatedMetrics> metricsByNode, AggregatedMetrics grandTotal,
                      int assignedFacts, int unmatchedFacts, int unassignedFacts, List<TreeAnomaly> anomalies) {
        this.metricsByNode = Collections.unmodifiableMap(metricsByNode);
        this.grandTotal = grandTotal;
        this.assignedFacts = assignedFacts;
        this.unmatchedFacts = unmatchedFacts;
        this.unassignedFacts = unassignedFacts;
        this.anomalies = List.copyOf(anomalies);
    }

    public Map<String, AggregatedMetrics> getMetricsByNode() {
        return metricsByNode;
    }

    public Collection<AggregatedMetrics> all() {
        return metricsByNode.values();
    }

    public Optional<AggregatedMetrics> find(String nodeId) {
        return Optional.ofNullable(metricsByNode.get(nodeId));
    }

    public AggregatedMetrics get(String nodeId) {
        AggregatedMetrics metrics = metricsByNode.get(nodeId);
        if (metrics == null) {
            throw new IllegalArgumentException("No metrics for node: " + nodeId);
        }
        return metrics;
    }

    public AggregatedMetrics getGrandTotal() {
        return grandTotal;
    }

    public int getAssignedFacts() {
        return assignedFacts;
    }

    public int getUnmatchedFacts() {
        return unmatchedFacts;
    }

    /**
     * Facts that matched a product without a category, or a node missing from the tree.
     */
    public int getUnassignedFacts() {
        return unassignedFacts;
    }

    public List<TreeAnomaly> getAnomalies() {
        return anomalies;
    }
}
