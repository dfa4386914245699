package org.netpreserve.hubfinder.plan;

import org.netpreserve.hubfinder.Candidate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Shared scratch space for one planning cycle. Plugins and gap analyzers post proposals and host annotations here;
 * the planner reads them back once everyone has contributed. A new board is used for every cycle.
 */
public class Blackboard {
    private final List<Candidate> proposals = new ArrayList<>();
    private final Map<String, Long> costEstimates = new HashMap<>();
    private final List<String> warnings = new ArrayList<>();

    public void propose(Candidate candidate) {
        proposals.add(candidate);
    }

    public void proposeAll(Collection<Candidate> candidates) {
        proposals.addAll(candidates);
    }

    public List<Candidate> proposals() {
        return List.copyOf(proposals);
    }

    public void estimateCost(String host, long costMs) {
        costEstimates.put(host, costMs);
    }

    public OptionalLong costEstimate(String host) {
        Long estimate = costEstimates.get(host);
        return estimate == null ? OptionalLong.empty() : OptionalLong.of(estimate);
    }

    public void warn(String warning) {
        warnings.add(warning);
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }
}
