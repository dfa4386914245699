package org.netpreserve.hubfinder.plan;

import org.netpreserve.hubfinder.Candidate;

import java.util.Comparator;

public record ScoredCandidate(Candidate candidate, double score) {
    public static final Comparator<ScoredCandidate> HIGHEST_FIRST =
            Comparator.comparingDouble(ScoredCandidate::score).reversed();
}
