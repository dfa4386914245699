package org.netpreserve.hubfinder.plan;

import java.util.List;

/**
 * Output of one planning cycle.
 *
 * @param candidates top candidates, highest score first
 * @param warnings   failures of plugins or gap analyzers that were skipped this cycle
 * @param gapCount   uncovered targets seen across all domains and analyzers
 */
public record PlanResult(List<ScoredCandidate> candidates, List<String> warnings, int gapCount) {
    public PlanResult {
        candidates = List.copyOf(candidates);
        warnings = List.copyOf(warnings);
    }
}
