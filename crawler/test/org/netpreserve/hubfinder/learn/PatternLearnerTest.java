package org.netpreserve.hubfinder.learn;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.netpreserve.hubfinder.Database;
import org.netpreserve.hubfinder.HubKind;
import org.netpreserve.hubfinder.HubTarget;
import org.netpreserve.hubfinder.InMemoryDatabaseTestExtension;
import org.netpreserve.hubfinder.Storage;
import org.netpreserve.hubfinder.telemetry.EventType;
import org.netpreserve.hubfinder.telemetry.Telemetry;
import org.netpreserve.hubfinder.validate.Verdict;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.netpreserve.hubfinder.TestFixtures.*;
import static org.netpreserve.hubfinder.learn.PatternLearner.Observation.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class PatternLearnerTest {
    private static final String DOMAIN = "news.example.com";
    private Storage storage;
    private Telemetry telemetry;
    private PatternLearner learner;

    @BeforeEach
    void setUp(Database database) {
        storage = new Storage(database);
        telemetry = mock(Telemetry.class);
        learner = new PatternLearner(storage, telemetry,
                Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void learnsAndReinforcesTemplates() {
        assertEquals(CREATED, learner.observe(DOMAIN, HubTarget.of(FRANCE), url("/world/france"),
                Verdict.CONFIRMED, 10));
        assertEquals(REINFORCED, learner.observe(DOMAIN, HubTarget.of(GERMANY), url("/world/germany"),
                Verdict.CONFIRMED, 20));

        List<LearnedPattern> patterns = storage.getLearnedPatterns(DOMAIN, HubKind.COUNTRY);
        assertEquals(1, patterns.size());
        LearnedPattern pattern = patterns.get(0);
        assertEquals("/world/{slug}", pattern.template());
        assertEquals(2, pattern.successCount());
        assertEquals(15.0, pattern.averageYield(), 1e-9);
        assertEquals(0.75, pattern.confidence(), 1e-9);
        verify(telemetry, times(2)).emit(eq(EventType.PATTERN_LEARNED), eq(DOMAIN), anyMap());
    }

    @Test
    void observingTheSameHubTwiceChangesNothing() {
        learner.observe(DOMAIN, HubTarget.of(FRANCE), url("/world/france"), Verdict.CONFIRMED, 10);

        assertEquals(UNCHANGED, learner.observe(DOMAIN, HubTarget.of(FRANCE), url("/world/france/"),
                Verdict.CONFIRMED, 50));

        LearnedPattern pattern = storage.getLearnedPatterns(DOMAIN, HubKind.COUNTRY).get(0);
        assertEquals(1, pattern.successCount());
        assertEquals(10.0, pattern.averageYield(), 1e-9);
    }

    @Test
    void rejectionsLeavePatternsAlone() {
        learner.observe(DOMAIN, HubTarget.of(FRANCE), url("/world/france"), Verdict.CONFIRMED, 10);

        assertEquals(IGNORED, learner.observe(DOMAIN, HubTarget.of(GERMANY), url("/world/germany"),
                Verdict.REJECTED, 0));
        assertEquals(IGNORED, learner.observe(DOMAIN, HubTarget.of(CHINA), url("/world/china"),
                Verdict.INCONCLUSIVE, 0));

        LearnedPattern pattern = storage.getLearnedPatterns(DOMAIN, HubKind.COUNTRY).get(0);
        assertEquals(1, pattern.successCount());
        assertEquals(2, learner.rejections(DOMAIN, HubKind.COUNTRY));
    }

    @Test
    void urlsThatDontNameTheirEntityTeachNothing() {
        assertEquals(IGNORED, learner.observe(DOMAIN, HubTarget.of(FRANCE), url("/section/42"),
                Verdict.CONFIRMED, 10));
        assertTrue(storage.getLearnedPatterns(DOMAIN, HubKind.COUNTRY).isEmpty());
        verifyNoInteractions(telemetry);
    }

    @Test
    void equalYieldTemplatesAreRankedBySuccess() {
        learner.observe(DOMAIN, HubTarget.of(FRANCE), url("/world/france"), Verdict.CONFIRMED, 10);
        learner.observe(DOMAIN, HubTarget.of(GERMANY), url("/international/germany"), Verdict.CONFIRMED, 10);
        learner.observe(DOMAIN, HubTarget.of(CHINA), url("/international/china"), Verdict.CONFIRMED, 10);

        assertEquals(List.of("/international/{slug}", "/world/{slug}"),
                storage.getLearnedPatterns(DOMAIN, HubKind.COUNTRY).stream().map(LearnedPattern::template).toList());
    }

    @Test
    void onlyAHigherYieldTemplateSupersedesTheBest() {
        learner.observe(DOMAIN, HubTarget.of(FRANCE), url("/world/france"), Verdict.CONFIRMED, 20);
        learner.observe(DOMAIN, HubTarget.of(GERMANY), url("/international/germany"), Verdict.CONFIRMED, 5);
        learner.observe(DOMAIN, HubTarget.of(CHINA), url("/international/china"), Verdict.CONFIRMED, 5);

        List<LearnedPattern> patterns = storage.getLearnedPatterns(DOMAIN, HubKind.COUNTRY);
        assertEquals(List.of("/world/{slug}", "/international/{slug}"),
                patterns.stream().map(LearnedPattern::template).toList());
        assertEquals(2, patterns.get(1).successCount());

        learner.observe(DOMAIN, HubTarget.of(US), url("/international/united-states"), Verdict.CONFIRMED, 50);

        patterns = storage.getLearnedPatterns(DOMAIN, HubKind.COUNTRY);
        assertEquals("/international/{slug}", patterns.get(0).template());
        assertEquals(20.0, patterns.get(0).averageYield());
        assertEquals(3, patterns.get(0).successCount());
    }

    @Test
    void bestFirstPrefersYieldOverSuccesses() {
        Instant now = Instant.parse("2024-05-01T00:00:00Z");
        var frequent = new LearnedPattern(DOMAIN, HubKind.COUNTRY, "/tag/{slug}", 5, 4, now, null);
        var productive = new LearnedPattern(DOMAIN, HubKind.COUNTRY, "/world/{slug}", 1, 12, now, null);

        assertTrue(LearnedPattern.BEST_FIRST.compare(productive, frequent) < 0);
    }
}
