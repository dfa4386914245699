package org.netpreserve.hubfinder.plan;

import org.netpreserve.hubfinder.Candidate;
import org.netpreserve.hubfinder.CrawlMode;
import org.netpreserve.hubfinder.gap.Gap;
import org.netpreserve.hubfinder.gap.GapAnalyzer;
import org.netpreserve.hubfinder.predict.PredictionContext;
import org.netpreserve.hubfinder.telemetry.EventType;
import org.netpreserve.hubfinder.telemetry.Telemetry;
import org.netpreserve.hubfinder.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Blackboard planner. Each cycle:
 * <ol>
 *     <li>runs every reasoning plugin against every domain,</li>
 *     <li>merges in the gap analyzers' proposals,</li>
 *     <li>applies the per-host cost estimates,</li>
 *     <li>de-duplicates by URL,</li>
 *     <li>scores every candidate,</li>
 *     <li>and returns the top N, highest score first.</li>
 * </ol>
 * Equal scores keep the order in which candidates were proposed, so the same inputs always give the same plan.
 */
public class Planner {
    private static final Logger log = LoggerFactory.getLogger(Planner.class);
    private final List<ReasoningPlugin> plugins;
    private final List<GapAnalyzer> analyzers;
    private final PriorityScorer scorer;
    private final Telemetry telemetry;

    public Planner(List<ReasoningPlugin> plugins, List<GapAnalyzer> analyzers, PriorityScorer scorer,
                   Telemetry telemetry) {
        this.plugins = List.copyOf(plugins);
        this.analyzers = List.copyOf(analyzers);
        this.scorer = scorer;
        this.telemetry = telemetry;
    }

    public PriorityScorer scorer() {
        return scorer;
    }

    public PlanResult plan(List<PredictionContext> contexts, CrawlMode mode, boolean gapEmphasis, int limit) {
        var board = new Blackboard();

        for (PredictionContext context : contexts) {
            for (ReasoningPlugin plugin : plugins) {
                try {
                    plugin.contribute(context, board);
                } catch (RuntimeException e) {
                    log.atWarn().addKeyValue("plugin", plugin.name())
                            .addKeyValue("domain", context.domain())
                            .setCause(e)
                            .log("Reasoning plugin failed, skipping it this cycle");
                    board.warn(plugin.name() + " failed for " + context.domain() + ": " + e);
                }
            }
        }

        int gapCount = 0;
        for (PredictionContext context : contexts) {
            for (GapAnalyzer analyzer : analyzers) {
                try {
                    List<Gap> gaps = analyzer.findGaps(context.site(), context.confirmedHubs());
                    gapCount += gaps.size();
                    board.proposeAll(analyzer.proposeForGaps(gaps, context));
                } catch (RuntimeException e) {
                    log.atWarn().addKeyValue("analyzer", analyzer.kind().label())
                            .addKeyValue("domain", context.domain())
                            .setCause(e)
                            .log("Gap analyzer failed, skipping it this cycle");
                    board.warn(analyzer.kind().label() + " analyzer failed for " + context.domain() + ": " + e);
                }
            }
        }

        Map<String, PredictionContext> contextsByDomain = new LinkedHashMap<>();
        for (PredictionContext context : contexts) contextsByDomain.putIfAbsent(context.domain(), context);

        Map<Url, Candidate> merged = new LinkedHashMap<>();
        for (Candidate candidate : board.proposals()) {
            PredictionContext context = contextsByDomain.get(candidate.host().toLowerCase(Locale.ROOT));
            if (context != null) {
                if (context.wasAttempted(candidate.url())) continue;
                if (candidate.target() != null && context.isCovered(candidate.target())) continue;
            }
            if (candidate.estimatedCostMs() < 0) {
                OptionalLong estimate = board.costEstimate(candidate.host().toLowerCase(Locale.ROOT));
                if (estimate.isPresent()) candidate = candidate.withEstimatedCost(estimate.getAsLong());
            }
            merged.merge(candidate.url(), candidate, this::preferred);
        }

        var scored = new ArrayList<ScoredCandidate>(merged.size());
        for (Candidate candidate : merged.values()) {
            scored.add(new ScoredCandidate(candidate, scorer.score(candidate, mode, gapEmphasis)));
        }
        scored.sort(ScoredCandidate.HIGHEST_FIRST);
        List<ScoredCandidate> top = scored.size() > limit ? scored.subList(0, Math.max(limit, 0)) : scored;

        for (ScoredCandidate entry : top) {
            Candidate candidate = entry.candidate();
            telemetry.emit(EventType.CANDIDATE_PROPOSED, candidate.host(), Map.of(
                    "url", candidate.url().toString(),
                    "target", candidate.target() == null ? "" : candidate.target().key(),
                    "source", candidate.source().label(),
                    "confidence", candidate.confidence(),
                    "score", entry.score()));
        }
        log.atDebug().addKeyValue("proposals", board.proposals().size())
                .addKeyValue("unique", merged.size())
                .addKeyValue("selected", top.size())
                .addKeyValue("gaps", gapCount)
                .log("Planning cycle finished");
        return new PlanResult(top, board.warnings(), gapCount);
    }

    /**
     * Of two proposals for the same URL keeps the one with the higher source bonus, then the lower known cost.
     * A gap-fill flag on either is kept.
     */
    private Candidate preferred(Candidate first, Candidate second) {
        double firstBonus = scorer.bonus(first.source());
        double secondBonus = scorer.bonus(second.source());
        Candidate winner;
        if (secondBonus > firstBonus) {
            winner = second;
        } else if (secondBonus == firstBonus && costOrMax(second) < costOrMax(first)) {
            winner = second;
        } else {
            winner = first;
        }
        return first.gapFill() || second.gapFill() ? winner.withGapFill(true) : winner;
    }

    private static long costOrMax(Candidate candidate) {
        return candidate.estimatedCostMs() < 0 ? Long.MAX_VALUE : candidate.estimatedCostMs();
    }
}
