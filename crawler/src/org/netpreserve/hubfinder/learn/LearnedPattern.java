package org.netpreserve.hubfinder.learn;

import org.netpreserve.hubfinder.HubKind;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A URL path template that has produced confirmed hubs on a domain.
 *
 * @param domain        host the pattern was learned on
 * @param kind          hub kind it predicts
 * @param template      path with placeholders, e.g. "/world/{slug}"
 * @param successCount  number of distinct confirmed hubs matching the template
 * @param averageYield  mean number of articles found per confirmed hub
 * @param lastUpdated   time of the latest confirmation
 * @param confirmedUrls the confirmed URLs that support the pattern
 */
public record LearnedPattern(
        String domain,
        HubKind kind,
        String template,
        int successCount,
        double averageYield,
        Instant lastUpdated,
        Set<String> confirmedUrls) {
    static final double BASE_CONFIDENCE = 0.70;
    static final double CONFIDENCE_STEP = 0.05;
    static final double MAX_CONFIDENCE = 0.95;
    /**
     * Strongest first: higher average yield, then more successes. Only a higher-yield template displaces the
     * current best.
     */
    public static final Comparator<LearnedPattern> BEST_FIRST = Comparator
            .comparingDouble(LearnedPattern::averageYield).reversed()
            .thenComparing(Comparator.comparingInt(LearnedPattern::successCount).reversed())
            .thenComparing(LearnedPattern::template);

    public LearnedPattern {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(template, "template");
        confirmedUrls = confirmedUrls == null ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(confirmedUrls));
    }

    public static LearnedPattern first(String domain, HubKind kind, String template, String url, int yield,
                                       Instant now) {
        return new LearnedPattern(domain, kind, template, 1, yield, now, Set.of(url));
    }

    /**
     * Rises by a fixed step with each success and never exceeds the top of the learned-pattern band.
     */
    public double confidence() {
        if (successCount <= 0) return BASE_CONFIDENCE;
        return Math.min(MAX_CONFIDENCE, BASE_CONFIDENCE + CONFIDENCE_STEP * (successCount - 1));
    }

    public boolean supportedBy(String url) {
        return confirmedUrls.contains(url);
    }

    public LearnedPattern withConfirmation(String url, int yield, Instant now) {
        var urls = new TreeSet<>(confirmedUrls);
        urls.add(url);
        double average = (averageYield * successCount + yield) / (successCount + 1);
        return new LearnedPattern(domain, kind, template, successCount + 1, average, now, urls);
    }
}
