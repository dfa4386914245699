package org.netpreserve.hubfinder;

import java.time.Instant;

/**
 * Behavioral progress of a run.
 *
 * @param runId             run identifier
 * @param date              when the snapshot was taken
 * @param runtime           milliseconds since the run started
 * @param phase             current phase, only ever advances
 * @param entitiesProposed  distinct targets proposed so far
 * @param entitiesValidated distinct targets confirmed so far
 * @param confirmed         CONFIRMED verdicts
 * @param rejected          REJECTED verdicts
 * @param inconclusive      INCONCLUSIVE verdicts (dropped for the run)
 * @param articles          distinct article URLs surfaced from confirmed hubs
 * @param fetches           candidates fetched, hub or not
 */
public record Progress(
        String runId,
        Instant date,
        long runtime,
        Phase phase,
        long entitiesProposed,
        long entitiesValidated,
        long confirmed,
        long rejected,
        long inconclusive,
        long articles,
        long fetches) {

    public enum Phase {
        DISCOVERY, VALIDATION, INDEXING, COMPLETION
    }

    /**
     * True while fewer than half of the proposed entities have been validated.
     */
    public boolean isGapEmphasis() {
        return entitiesProposed > 0 && entitiesValidated * 2 < entitiesProposed;
    }
}
