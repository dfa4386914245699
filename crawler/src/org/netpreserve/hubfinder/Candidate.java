package org.netpreserve.hubfinder;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.predict.Strategy;
import org.netpreserve.hubfinder.util.Url;

import java.util.Objects;

/**
 * A URL proposed for fetching.
 *
 * @param url             normalized URL
 * @param target          what hub the URL is predicted to be, or null for non-hub work such as articles
 * @param strategy        the prediction strategy that produced a hub candidate
 * @param confidence      0..1, within the strategy's band
 * @param estimatedCostMs expected fetch time, negative if unknown
 * @param source          discovery method, keys the base bonus
 * @param gapFill         true if the candidate targets a high-importance coverage gap
 */
public record Candidate(
        Url url,
        @Nullable HubTarget target,
        @Nullable Strategy strategy,
        double confidence,
        long estimatedCostMs,
        SourceLabel source,
        boolean gapFill) {
    public static final long UNKNOWN_COST = -1;

    public Candidate {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(source, "source");
    }

    public static Candidate hub(Url url, HubTarget target, Strategy strategy, double confidence) {
        return new Candidate(url, target, strategy, strategy.clamp(confidence), UNKNOWN_COST,
                strategy.source(), false);
    }

    public static Candidate article(Url url) {
        return new Candidate(url, null, null, 1.0, UNKNOWN_COST, SourceLabel.ARTICLE_FROM_HUB, false);
    }

    public boolean isHub() {
        return target != null;
    }

    public String host() {
        return url.host();
    }

    public Candidate withEstimatedCost(long estimatedCostMs) {
        return new Candidate(url, target, strategy, confidence, estimatedCostMs, source, gapFill);
    }

    public Candidate withGapFill(boolean gapFill) {
        return new Candidate(url, target, strategy, confidence, estimatedCostMs, source, gapFill);
    }

    public Candidate withSource(SourceLabel source) {
        return new Candidate(url, target, strategy, confidence, estimatedCostMs, source, gapFill);
    }
}
