package org.netpreserve.hubfinder.validate;

import org.netpreserve.hubfinder.Candidate;
import org.netpreserve.hubfinder.util.Url;

import java.util.List;

/**
 * @param candidate        the candidate validated
 * @param verdict          final verdict
 * @param evidence         what the verdict is based on
 * @param articleUrls      article links found on a confirmed hub
 * @param fetchAttempts    network fetches made, 0 if everything came from the cache
 * @param fetchDurationMs  total time spent fetching
 * @param transientFailure the verdict is INCONCLUSIVE because retries ran out
 * @param history          validation states passed through
 */
public record ValidationResult(
        Candidate candidate,
        Verdict verdict,
        Evidence evidence,
        List<Url> articleUrls,
        int fetchAttempts,
        long fetchDurationMs,
        boolean transientFailure,
        List<ValidationState> history) {

    public ValidationResult {
        articleUrls = List.copyOf(articleUrls);
        history = List.copyOf(history);
    }

    public String reason() {
        return evidence.reason();
    }

    /**
     * Fetches beyond the first.
     */
    public int retries() {
        return Math.max(0, fetchAttempts - 1);
    }
}
