package org.netpreserve.hubfinder.gap;

import org.netpreserve.hubfinder.HubTarget;
import org.netpreserve.hubfinder.util.Url;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Confirmed hubs per domain for the current run. Coverage only grows: there is no way to un-confirm a target.
 */
public class CoverageTracker {
    private final Map<String, Map<String, Url>> byDomain = new HashMap<>();

    public synchronized void load(String domain, Map<String, Url> snapshot) {
        Map<String, Url> coverage = byDomain.computeIfAbsent(domain, d -> new LinkedHashMap<>());
        snapshot.forEach(coverage::putIfAbsent);
    }

    /**
     * @return true if the target was not covered before
     */
    public synchronized boolean confirm(String domain, HubTarget target, Url url) {
        return byDomain.computeIfAbsent(domain, d -> new LinkedHashMap<>()).putIfAbsent(target.key(), url) == null;
    }

    public synchronized boolean isCovered(String domain, HubTarget target) {
        return byDomain.getOrDefault(domain, Map.of()).containsKey(target.key());
    }

    public synchronized Map<String, Url> snapshot(String domain) {
        return Map.copyOf(byDomain.getOrDefault(domain, Map.of()));
    }

    public synchronized int covered(String domain) {
        return byDomain.getOrDefault(domain, Map.of()).size();
    }
}
