package org.netpreserve.hubfinder.predict;

import org.junit.jupiter.api.Test;
import org.netpreserve.hubfinder.Candidate;
import org.netpreserve.hubfinder.HubKind;
import org.netpreserve.hubfinder.HubTarget;
import org.netpreserve.hubfinder.SourceLabel;
import org.netpreserve.hubfinder.learn.LearnedPattern;
import org.netpreserve.hubfinder.util.Url;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.netpreserve.hubfinder.TestFixtures.*;

class PredictionStrategyLibraryTest {
    private final PredictionStrategyLibrary library = new PredictionStrategyLibrary();

    private static List<Url> urls(List<Candidate> candidates) {
        return candidates.stream().map(Candidate::url).toList();
    }

    private static PredictionContext withPatterns(int minSuccesses, LearnedPattern... patterns) {
        return new PredictionContext(site(), gazetteer(), Map.of(HubKind.COUNTRY, List.of(patterns)), Map.of(),
                Set.of(), Set.of(), minSuccesses);
    }

    @Test
    void gazetteerPredictionsComeBeforeFallbacks() {
        List<Candidate> candidates = library.generate(HubTarget.of(FRANCE),
                PredictionContext.empty(site(), gazetteer()));

        assertEquals(List.of(url("/world/france"), url("/news/world/france"), url("/international/france")),
                urls(candidates).subList(0, 3));
        assertEquals(Strategy.GAZETTEER_DERIVED, candidates.get(0).strategy());
        assertEquals(0.70, candidates.get(0).confidence(), 1e-9);
        assertTrue(urls(candidates).contains(url("/fr")));
        assertTrue(urls(candidates).contains(url("/places/france")));
        assertEquals(urls(candidates).size(), Set.copyOf(urls(candidates)).size());
    }

    @Test
    void everyConfidenceIsWithinItsStrategyBand() {
        var context = withPatterns(1, new LearnedPattern("news.example.com", HubKind.COUNTRY, "/section/{slug}",
                20, 10, Instant.EPOCH, Set.of()));
        for (Candidate candidate : library.generate(HubTarget.of(FRANCE), context)) {
            Strategy strategy = candidate.strategy();
            assertTrue(candidate.confidence() >= strategy.minConfidence()
                       && candidate.confidence() <= strategy.maxConfidence(), candidate.toString());
        }
    }

    @Test
    void learnedPatternsLeadOnceTrusted() {
        var pattern = new LearnedPattern("news.example.com", HubKind.COUNTRY, "/section/{slug}", 3, 10,
                Instant.EPOCH, Set.of());

        List<Candidate> trusted = library.generate(HubTarget.of(FRANCE), withPatterns(3, pattern));
        assertEquals(url("/section/france"), trusted.get(0).url());
        assertEquals(Strategy.LEARNED_PATTERN, trusted.get(0).strategy());
        assertEquals(SourceLabel.HUB_VALIDATED, trusted.get(0).source());
        assertEquals(0.80, trusted.get(0).confidence(), 1e-9);

        List<Candidate> untrusted = library.generate(HubTarget.of(FRANCE), withPatterns(4, pattern));
        assertFalse(urls(untrusted).contains(url("/section/france")));
    }

    @Test
    void childHubsAreComposedFromConfirmedParents() {
        var context = new PredictionContext(site(), gazetteer(), Map.of(),
                Map.of(HubTarget.of(US).key(), url("/news/usa/")), Set.of(), Set.of(), 1);

        List<Candidate> candidates = library.generate(HubTarget.of(CALIFORNIA), context);

        Candidate composed = candidates.stream()
                .filter(c -> c.strategy() == Strategy.REGIONAL_COMPOSITION)
                .findFirst().orElseThrow();
        assertEquals(url("/news/usa/california"), composed.url());
        assertEquals(0.60, composed.confidence(), 1e-9);
        assertTrue(urls(candidates).contains(url("/united-states/california")));
    }

    @Test
    void compositeTargetsGetCompositePaths() {
        List<Candidate> candidates = library.generate(HubTarget.of(HubKind.PLACE_TOPIC, FRANCE, POLITICS),
                PredictionContext.empty(site(), gazetteer()));

        assertEquals(url("/france/politics"), candidates.get(0).url());
        assertTrue(urls(candidates).contains(url("/tag/france-politics")));
    }

    @Test
    void failingStrategyIsSkipped() {
        PredictionStrategy broken = new PredictionStrategy() {
            @Override
            public Strategy strategy() {
                return Strategy.LEARNED_PATTERN;
            }

            @Override
            public List<Candidate> generate(HubTarget target, PredictionContext context) {
                throw new IllegalStateException("boom");
            }
        };
        var guarded = new PredictionStrategyLibrary(List.of(new FallbackStrategy(), broken));

        List<Candidate> candidates = guarded.generate(HubTarget.of(FRANCE),
                PredictionContext.empty(site(), gazetteer()));

        assertEquals(url("/france"), candidates.get(0).url());
    }

    @Test
    void offSiteCandidatesAreDropped() {
        PredictionStrategy offSite = new PredictionStrategy() {
            @Override
            public Strategy strategy() {
                return Strategy.FALLBACK_PATTERN;
            }

            @Override
            public List<Candidate> generate(HubTarget target, PredictionContext context) {
                return List.of(Candidate.hub(new Url("https://elsewhere.example/france"), target, strategy(), 0.3),
                        Candidate.hub(url("/France/"), target, strategy(), 0.3));
            }
        };

        List<Candidate> candidates = new PredictionStrategyLibrary(List.of(offSite))
                .generate(HubTarget.of(FRANCE), PredictionContext.empty(site(), gazetteer()));

        assertEquals(List.of(url("/France")), urls(candidates));
    }
}
