package org.netpreserve.hubfinder.predict;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.HubKind;
import org.netpreserve.hubfinder.HubTarget;
import org.netpreserve.hubfinder.config.DomainConfig;
import org.netpreserve.hubfinder.gazetteer.Gazetteer;
import org.netpreserve.hubfinder.learn.LearnedPattern;
import org.netpreserve.hubfinder.util.Url;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable view of what is known about one domain at the start of a planning cycle.
 *
 * @param site                the domain being planned
 * @param gazetteer           reference data
 * @param patterns            learned patterns by hub kind
 * @param confirmedHubs       coverage snapshot, target key to confirmed URL
 * @param attempted           normalized URLs already queued, dispatched or validated this run
 * @param pendingTargets      target keys with a candidate queued or in flight
 * @param minPatternSuccesses confirmations before a learned pattern is used
 */
public record PredictionContext(
        DomainConfig site,
        Gazetteer gazetteer,
        Map<HubKind, List<LearnedPattern>> patterns,
        Map<String, Url> confirmedHubs,
        Set<Url> attempted,
        Set<String> pendingTargets,
        int minPatternSuccesses) {

    public PredictionContext {
        patterns = Map.copyOf(patterns);
        confirmedHubs = Map.copyOf(confirmedHubs);
        attempted = Set.copyOf(attempted);
        pendingTargets = Set.copyOf(pendingTargets);
    }

    public static PredictionContext empty(DomainConfig site, Gazetteer gazetteer) {
        return new PredictionContext(site, gazetteer, Map.of(), Map.of(), Set.of(), Set.of(), 1);
    }

    public String domain() {
        return site.host();
    }

    public Url base() {
        return site.url();
    }

    public List<LearnedPattern> patterns(HubKind kind) {
        return patterns.getOrDefault(kind, List.of());
    }

    public @Nullable Url confirmedUrl(HubTarget target) {
        return confirmedHubs.get(target.key());
    }

    public boolean isCovered(HubTarget target) {
        return confirmedHubs.containsKey(target.key());
    }

    public boolean wasAttempted(Url url) {
        return attempted.contains(url.normalize());
    }

    public boolean isPending(HubTarget target) {
        return pendingTargets.contains(target.key());
    }
}
