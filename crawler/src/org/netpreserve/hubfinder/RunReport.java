package org.netpreserve.hubfinder;

/**
 * How a run ended.
 *
 * @param runId         the run
 * @param status        final status
 * @param progress      counters at the end of the run
 * @param remainingGaps uncovered targets seen in the last planning cycle
 */
public record RunReport(String runId, Status status, Progress progress, int remainingGaps) {
    public enum Status {
        COMPLETED,
        /** Finished, but some candidates were dropped after transient failures. */
        COMPLETED_WITH_GAPS,
        ABORTED,
        /** A startup stage failed. */
        FAILED
    }
}
