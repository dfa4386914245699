package org.netpreserve.hubfinder.predict;

import org.netpreserve.hubfinder.Candidate;
import org.netpreserve.hubfinder.HubTarget;

import java.util.List;

/**
 * Produces candidate hub URLs for a target on one domain. Implementations must not mutate anything.
 */
public interface PredictionStrategy {
    Strategy strategy();

    List<Candidate> generate(HubTarget target, PredictionContext context);
}
