package com.tx.insights.taxonomy;

/**
 * A non-fatal taxonomy anomaly surfaced in run diagnostics.
 *
 * @param type   anomaly kind
 * @param nodeId node the anomaly is attached to
 * @param detail human readable detail
 */
public record TreeAnomaly(AnomalyType type, String nodeId, String detail) {

    @Override
    public String toString() {
        return type + "[" + nodeId + "]: " + detail;
    }
}
