package org.netpreserve.hubfinder;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.validate.ValidationResult;

/**
 * What a worker did with one dispatched candidate.
 *
 * @param workerId   the worker that handled it
 * @param candidate  the candidate
 * @param validation the validation result for hub candidates, null otherwise or on failure
 * @param status     HTTP status of a non-hub fetch, 0 if there was none
 * @param durationMs time spent fetching
 * @param error      why the candidate could not be handled, null on success
 */
public record WorkOutcome(
        String workerId,
        Candidate candidate,
        @Nullable ValidationResult validation,
        int status,
        long durationMs,
        @Nullable String error) {

    static WorkOutcome validated(String workerId, ValidationResult result) {
        return new WorkOutcome(workerId, result.candidate(), result, 0, result.fetchDurationMs(), null);
    }

    static WorkOutcome fetched(String workerId, Candidate candidate, int status, long durationMs) {
        return new WorkOutcome(workerId, candidate, null, status, durationMs, null);
    }

    static WorkOutcome failed(String workerId, Candidate candidate, long durationMs, String error) {
        return new WorkOutcome(workerId, candidate, null, 0, durationMs, error);
    }
}
