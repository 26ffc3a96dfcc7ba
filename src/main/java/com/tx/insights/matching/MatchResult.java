package com.tx.insights.matching;

/**
 * Outcome of matching one fact.
 *
 * @param target     kind of entity matched
 * @param entityId   id of the matched node or product, null when unmatched
 * @param nodeId     node the fact is attributed to; for products the owning node, may be null
 * @param confidence 0 for no match, 1.0 for exact strategies
 * @param evidence   strategy specific evidence, null when unmatched
 */
public record MatchResult(
    MatchTarget target,
    String entityId,
    String nodeId,
    double confidence,
    MatchEvidence evidence
) {

    private static final MatchResult NO_MATCH = new MatchResult(MatchTarget.NONE, null, null, 0.0, null);

    public static MatchResult noMatch() {
        return NO_MATCH;
    }

    public static MatchResult node(String nodeId, double confidence, MatchEvidence evidence) {
        return new MatchResult(MatchTarget.NODE, nodeId, nodeId, confidence, evidence);
    }

    public static MatchResult product(String productId, String owningNodeId, double confidence,
                                      MatchEvidence evidence) {
        return new MatchResult(MatchTarget.PRODUCT, productId, owningNodeId, confidence, evidence);
    }

    public boolean isMatched() {
        return target != MatchTarget.NONE;
    }

    public MatchStrategy strategy() {
        return evidence == null ? MatchStrategy.NONE : evidence.strategy();
    }
}
