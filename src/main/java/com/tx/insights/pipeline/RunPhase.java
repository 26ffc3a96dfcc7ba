package com.tx.insights.pipeline;

/**
 * Phases of an analysis run, in execution order. Each phase starts only after the previous
 * one has completed.
 */
public enum RunPhase {
    TAXONOMY,
    MATCH,
    AGGREGATE,
    SCORE,
    BENCHMARK,
    COMPLETE;

    /** Number of phases that do work. */
    public static final int WORKING_PHASES = values().length - 1;

    public RunPhase next() {
        return this == COMPLETE ? COMPLETE : values()[ordinal() + 1];
    }
}
