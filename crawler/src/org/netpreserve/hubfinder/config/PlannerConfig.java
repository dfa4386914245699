package org.netpreserve.hubfinder.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.hubfinder.CrawlMode;
import org.netpreserve.hubfinder.HubKind;
import org.netpreserve.hubfinder.util.DurationDeserializer;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Planning and scoring settings.
 *
 * @param mode                  initial crawl mode
 * @param hubKinds              which gap analyzers run
 * @param batchSize             top-N candidates admitted per planning cycle; also the low-water mark that triggers
 *                              a new cycle
 * @param maxCandidatesPerCycle cap on proposals from each gap analyzer per cycle
 * @param frontierCapacity      maximum queued candidates
 * @param minPatternSuccesses   confirmations before a learned pattern is used for prediction
 * @param gapFillBoost          score boost for candidates filling a high-importance gap
 * @param highImportance        importance at or above which a gap counts as high-importance
 * @param bonuses               base bonus per source label
 * @param followArticles        propose article links from confirmed hubs as non-hub candidates
 * @param interval              period of the background planning cycle
 */
public record PlannerConfig(
        CrawlMode mode,
        List<HubKind> hubKinds,
        int batchSize,
        int maxCandidatesPerCycle,
        int frontierCapacity,
        int minPatternSuccesses,
        double gapFillBoost,
        int highImportance,
        Map<String, Double> bonuses,
        boolean followArticles,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration interval) {

    public PlannerConfig withHubKinds(List<HubKind> hubKinds) {
        return new PlannerConfig(mode, hubKinds, batchSize, maxCandidatesPerCycle, frontierCapacity,
                minPatternSuccesses, gapFillBoost, highImportance, bonuses, followArticles, interval);
    }

    public PlannerConfig withMode(CrawlMode mode) {
        return new PlannerConfig(mode, hubKinds, batchSize, maxCandidatesPerCycle, frontierCapacity,
                minPatternSuccesses, gapFillBoost, highImportance, bonuses, followArticles, interval);
    }

    public PlannerConfig withFollowArticles(boolean followArticles) {
        return new PlannerConfig(mode, hubKinds, batchSize, maxCandidatesPerCycle, frontierCapacity,
                minPatternSuccesses, gapFillBoost, highImportance, bonuses, followArticles, interval);
    }
}
