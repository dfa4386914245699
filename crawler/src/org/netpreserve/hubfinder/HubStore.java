package org.netpreserve.hubfinder;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.learn.LearnedPattern;
import org.netpreserve.hubfinder.util.Url;

import java.util.List;
import java.util.Map;

/**
 * Durable state shared between runs: hub records, learned patterns and the coverage they imply. Implementations
 * signal failure with unchecked exceptions.
 */
public interface HubStore {
    /**
     * Fails fast if the store can't be reached.
     */
    void check();

    @Nullable HubRecord getHubRecord(Url url);

    /**
     * Inserts or updates the record for its URL. Article URLs are merged with those already stored.
     */
    void putHubRecord(HubRecord record);

    /**
     * Patterns for a domain and hub kind, strongest first.
     */
    List<LearnedPattern> getLearnedPatterns(String domain, HubKind kind);

    void putLearnedPattern(LearnedPattern pattern);

    /**
     * Confirmed hubs of a domain, target key to URL.
     */
    Map<String, Url> getCoverageSnapshot(String domain);
}
