package org.netpreserve.hubfinder.plan;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.hubfinder.Candidate;
import org.netpreserve.hubfinder.CrawlMode;
import org.netpreserve.hubfinder.HubKind;
import org.netpreserve.hubfinder.HubTarget;
import org.netpreserve.hubfinder.SourceLabel;
import org.netpreserve.hubfinder.gap.CountryGapAnalyzer;
import org.netpreserve.hubfinder.gap.GapAnalyzer;
import org.netpreserve.hubfinder.gap.TopicGapAnalyzer;
import org.netpreserve.hubfinder.gazetteer.FileGazetteer;
import org.netpreserve.hubfinder.predict.PredictionContext;
import org.netpreserve.hubfinder.predict.PredictionStrategyLibrary;
import org.netpreserve.hubfinder.predict.Strategy;
import org.netpreserve.hubfinder.telemetry.EventType;
import org.netpreserve.hubfinder.telemetry.Telemetry;
import org.netpreserve.hubfinder.util.Url;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.netpreserve.hubfinder.TestFixtures.*;

class PlannerTest {
    private final PriorityScorer scorer = new PriorityScorer(Map.of(
            "hub-validated", 40.0,
            "adaptive-seed", 30.0,
            "article-from-hub", 5.0,
            "hub-guess", 10.0), 20);
    private FileGazetteer gazetteer;
    private PredictionStrategyLibrary library;
    private Telemetry telemetry;

    @BeforeEach
    void setUp() {
        gazetteer = gazetteer();
        library = new PredictionStrategyLibrary();
        telemetry = mock(Telemetry.class);
    }

    private List<GapAnalyzer> analyzers() {
        return List.of(new CountryGapAnalyzer(gazetteer, library, 70, 10),
                new TopicGapAnalyzer(gazetteer, library, 70, 10));
    }

    private static List<String> urls(PlanResult result) {
        return result.candidates().stream().map(c -> c.candidate().url().toString()).toList();
    }

    @Test
    void failingPluginIsSkipped() {
        ReasoningPlugin broken = new ReasoningPlugin() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public void contribute(PredictionContext context, Blackboard board) {
                throw new IllegalStateException("boom");
            }
        };
        var planner = new Planner(List.of(broken), analyzers(), scorer, telemetry);

        PlanResult result = planner.plan(List.of(PredictionContext.empty(site(), gazetteer)), CrawlMode.NORMAL,
                false, 100);

        assertEquals(6, result.candidates().size());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).startsWith("broken failed"));
        assertEquals(6, result.gapCount());
    }

    @Test
    void sameInputsGiveSamePlan() {
        var planner = new Planner(List.of(), analyzers(), scorer, telemetry);
        var context = PredictionContext.empty(site(), gazetteer);

        PlanResult first = planner.plan(List.of(context), CrawlMode.NORMAL, false, 100);
        PlanResult second = planner.plan(List.of(context), CrawlMode.NORMAL, false, 100);

        assertEquals(urls(first), urls(second));
    }

    @Test
    void candidatesAreOrderedByScoreAndLimited() {
        var planner = new Planner(List.of(), analyzers(), scorer, telemetry);

        PlanResult result = planner.plan(List.of(PredictionContext.empty(site(), gazetteer)), CrawlMode.NORMAL,
                false, 3);

        assertEquals(3, result.candidates().size());
        for (int i = 1; i < result.candidates().size(); i++) {
            assertTrue(result.candidates().get(i - 1).score() >= result.candidates().get(i).score());
        }
        // gap-fill candidates outrank sport, the only gap below the importance threshold
        assertTrue(result.candidates().get(0).candidate().gapFill());
        assertEquals(url("/world/united-states").toString(), urls(result).get(0));
        verify(telemetry, times(3)).emit(eq(EventType.CANDIDATE_PROPOSED), eq("news.example.com"), anyMap());
    }

    @Test
    void duplicateUrlsKeepTheHigherBonus() {
        Url url = url("/world/germany");
        ReasoningPlugin guesser = fixed("guesser", new Candidate(url, HubTarget.of(GERMANY),
                Strategy.FALLBACK_PATTERN, 0.3, Candidate.UNKNOWN_COST, SourceLabel.HUB_GUESS, false));
        ReasoningPlugin validated = fixed("validated", new Candidate(url, HubTarget.of(GERMANY),
                Strategy.GAZETTEER_DERIVED, 0.65, Candidate.UNKNOWN_COST, SourceLabel.HUB_VALIDATED, false));
        var planner = new Planner(List.of(guesser, validated), List.of(), scorer, telemetry);

        PlanResult result = planner.plan(List.of(PredictionContext.empty(site(), gazetteer)), CrawlMode.NORMAL,
                false, 10);

        assertEquals(1, result.candidates().size());
        assertEquals(SourceLabel.HUB_VALIDATED, result.candidates().get(0).candidate().source());
        assertEquals(40.0, result.candidates().get(0).score());
    }

    @Test
    void attemptedAndCoveredCandidatesAreDropped() {
        Candidate attempted = Candidate.hub(url("/world/germany"), HubTarget.of(GERMANY),
                Strategy.GAZETTEER_DERIVED, 0.6);
        Candidate covered = Candidate.hub(url("/news/world/usa"), HubTarget.of(US), Strategy.GAZETTEER_DERIVED, 0.6);
        var context = new PredictionContext(site(), gazetteer, Map.of(),
                Map.of(HubTarget.of(US).key(), url("/world/us")), Set.of(url("/world/germany")), Set.of(), 1);
        var planner = new Planner(List.of(fixed("fixed", attempted, covered)), List.of(), scorer, telemetry);

        assertTrue(planner.plan(List.of(context), CrawlMode.NORMAL, false, 10).candidates().isEmpty());
    }

    @Test
    void costEstimatesAdjustScores() {
        var costs = new CostModel();
        costs.record("news.example.com", 20);
        Candidate candidate = Candidate.hub(url("/world/germany"), HubTarget.of(GERMANY),
                Strategy.GAZETTEER_DERIVED, 0.6);
        var planner = new Planner(List.of(new CostEstimator(costs), fixed("fixed", candidate)), List.of(), scorer,
                telemetry);

        ScoredCandidate scored = planner.plan(List.of(PredictionContext.empty(site(), gazetteer)),
                CrawlMode.NORMAL, false, 10).candidates().get(0);

        assertEquals(20, scored.candidate().estimatedCostMs());
        assertEquals(30 + 3 * 0.8, scored.score(), 1e-9);
    }

    @Test
    void gazetteerReasonerProposesSiblingsOfConfirmedHubs() {
        var context = new PredictionContext(site(), gazetteer, Map.of(),
                Map.of(HubTarget.of(FRANCE).key(), url("/international/france")), Set.of(),
                Set.of(HubTarget.of(CHINA).key()), 1);
        var planner = new Planner(List.of(new GazetteerReasoner(Set.of(HubKind.COUNTRY))), List.of(), scorer,
                telemetry);

        PlanResult result = planner.plan(List.of(context), CrawlMode.NORMAL, false, 10);

        assertEquals(List.of(url("/international/united-states").toString(),
                url("/international/germany").toString()), urls(result));
        assertTrue(result.candidates().stream()
                .allMatch(c -> c.candidate().source() == SourceLabel.HUB_VALIDATED));
    }

    @Test
    void gazetteerReasonerIgnoresDisabledKinds() {
        var context = new PredictionContext(site(), gazetteer, Map.of(),
                Map.of(HubTarget.of(FRANCE).key(), url("/international/france")), Set.of(), Set.of(), 1);
        var board = new Blackboard();

        new GazetteerReasoner(Set.of(HubKind.TOPIC)).contribute(context, board);

        assertTrue(board.proposals().isEmpty());
    }

    private static ReasoningPlugin fixed(String name, Candidate... candidates) {
        return new ReasoningPlugin() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void contribute(PredictionContext context, Blackboard board) {
                board.proposeAll(List.of(candidates));
            }
        };
    }
}
