package com.tx.insights.pipeline;

/**
 * Immutable view of a run's progress, taken after a phase completes.
 *
 * @param runId           run the snapshot belongs to
 * @param nextPhase       phase that runs next, {@link RunPhase#COMPLETE} when done
 * @param completedPhases phases completed so far
 * @param totalPhases     phases in a full run
 * @param itemsProcessed  items handled by the phase that just completed
 * @param elapsedMs       wall time since the run started
 */
public record ProgressSnapshot(
    String runId,
    RunPhase nextPhase,
    int completedPhases,
    int totalPhases,
    long itemsProcessed,
    long elapsedMs
) {

    static ProgressSnapshot initial(String runId) {
        return new ProgressSnapshot(runId, RunPhase.TAXONOMY, 0, RunPhase.WORKING_PHASES, 0, 0);
    }

    public boolean isComplete() {
        return nextPhase == RunPhase.COMPLETE;
    }

    public double percentComplete() {
        return totalPhases == 0 ? 100.0 : completedPhases * 100.0 / totalPhases;
    }
}
