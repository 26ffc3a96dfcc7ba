package com.tx.insights.matching;

/**
 * Kind of entity a fact resolved to.
 */
public enum MatchTarget {
    NODE,
    PRODUCT,
    NONE
}
