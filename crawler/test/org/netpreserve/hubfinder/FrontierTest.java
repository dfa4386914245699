package org.netpreserve.hubfinder;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.hubfinder.plan.ScoredCandidate;
import org.netpreserve.hubfinder.predict.Strategy;
import org.netpreserve.hubfinder.telemetry.EventType;
import org.netpreserve.hubfinder.telemetry.Telemetry;
import org.netpreserve.hubfinder.util.Url;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.netpreserve.hubfinder.TestFixtures.*;

class FrontierTest {
    private Telemetry telemetry;
    private TestClock clock;
    private Frontier frontier;

    @BeforeEach
    void setUp() {
        telemetry = mock(Telemetry.class);
        clock = new TestClock();
        frontier = new Frontier(10, 1000, null, telemetry, clock);
    }

    private static ScoredCandidate hub(String url, HubTarget target, double score) {
        return new ScoredCandidate(Candidate.hub(new Url(url), target, Strategy.GAZETTEER_DERIVED, 0.6), score);
    }

    private static ScoredCandidate hub(String path, double score) {
        return hub(url(path).toString(), HubTarget.of(FRANCE), score);
    }

    @Test
    void highestScoreIsTakenFirst() throws CrawlLimitException {
        frontier.offer(hub("https://a.example/x", HubTarget.of(FRANCE), 10));
        frontier.offer(hub("https://b.example/x", HubTarget.of(GERMANY), 30));
        frontier.offer(hub("https://c.example/x", HubTarget.of(CHINA), 20));

        assertEquals("b.example", frontier.takeNext().host());
        assertEquals("c.example", frontier.takeNext().host());
        assertEquals("a.example", frontier.takeNext().host());
        assertNull(frontier.takeNext());
        assertEquals(3, frontier.inFlight());
        verify(telemetry, times(3)).emit(eq(EventType.CANDIDATE_DISPATCHED), anyString(), anyMap());
    }

    @Test
    void equalScoresKeepInsertionOrder() throws CrawlLimitException {
        frontier.offer(hub("https://a.example/1", HubTarget.of(FRANCE), 10));
        frontier.offer(hub("https://b.example/1", HubTarget.of(FRANCE), 10));

        assertEquals("a.example", frontier.takeNext().host());
    }

    @Test
    void urlsAreAdmittedOncePerRun() throws CrawlLimitException {
        assertTrue(frontier.offer(hub("/world/france", 10)));
        assertFalse(frontier.offer(hub("/world/france", 50)));

        Candidate taken = frontier.takeNext();
        frontier.release(taken);
        frontier.complete(taken);

        assertFalse(frontier.offer(hub("/world/france", 10)));
        assertEquals(Set.of(url("/world/france")), frontier.knownUrls());
    }

    @Test
    void hostIsLockedWhileInFlightAndThrottledAfterwards() throws CrawlLimitException {
        frontier.offer(hub("/world/france", 20));
        frontier.offer(hub(url("/world/germany").toString(), HubTarget.of(GERMANY), 10));

        Candidate first = frontier.takeNext();
        assertEquals(url("/world/france"), first.url());
        assertNull(frontier.takeNext(), "host busy");

        frontier.release(first);
        assertNull(frontier.takeNext(), "politeness delay");

        clock.advance(Duration.ofMillis(999));
        assertNull(frontier.takeNext());
        clock.advance(Duration.ofMillis(1));
        assertEquals(url("/world/germany"), frontier.takeNext().url());
    }

    @Test
    void fullFrontierEvictsTheLowestScore() {
        var small = new Frontier(2, 0, null, telemetry, clock);
        small.offer(hub("https://a.example/x", HubTarget.of(FRANCE), 10));
        small.offer(hub("https://b.example/x", HubTarget.of(GERMANY), 5));

        assertFalse(small.offer(hub("https://c.example/x", HubTarget.of(CHINA), 1)));
        assertTrue(small.offer(hub("https://d.example/x", HubTarget.of(US), 7)));

        assertEquals(2, small.size());
        assertEquals(Set.of("country-hub:fr", "country-hub:us"), small.pendingTargets());
        assertFalse(small.knownUrls().contains(new Url("https://b.example/x")));
    }

    @Test
    void fetchLimitStopsDispatch() throws CrawlLimitException {
        var limited = new Frontier(10, 0, 1L, telemetry, clock);
        limited.offer(hub("https://a.example/x", HubTarget.of(FRANCE), 10));
        limited.offer(hub("https://b.example/x", HubTarget.of(GERMANY), 5));

        assertNotNull(limited.takeNext());
        assertThrows(CrawlLimitException.class, limited::takeNext);
    }

    @Test
    void pausedFrontierDispatchesNothing() throws CrawlLimitException {
        frontier.offer(hub("/world/france", 10));

        assertTrue(frontier.pause());
        assertFalse(frontier.pause());
        assertNull(frontier.takeNext());
        assertTrue(frontier.resume());
        assertFalse(frontier.resume());
        assertNotNull(frontier.takeNext());
    }

    @Test
    void abortDiscardsQueueAndStopsDispatch() throws CrawlLimitException {
        frontier.offer(hub("https://a.example/x", HubTarget.of(FRANCE), 10));
        frontier.offer(hub("https://b.example/x", HubTarget.of(GERMANY), 5));
        Candidate inFlight = frontier.takeNext();

        assertEquals(1, frontier.abort());

        assertEquals(0, frontier.size());
        assertTrue(frontier.isClosed());
        assertNull(frontier.takeNext());
        assertFalse(frontier.offer(hub("https://c.example/x", HubTarget.of(CHINA), 50)));
        assertEquals(Set.of("country-hub:fr"), frontier.pendingTargets());

        frontier.release(inFlight);
        frontier.complete(inFlight);
        assertTrue(frontier.isIdle());
    }

    @Test
    void rescoreReordersQueue() throws CrawlLimitException {
        frontier.offer(hub("https://a.example/x", HubTarget.of(FRANCE), 10));
        frontier.offer(new ScoredCandidate(Candidate.article(new Url("https://b.example/2024/05/story")), 20));

        frontier.rescore(candidate -> candidate.isHub() ? 1000 : -1000);

        assertEquals("a.example", frontier.snapshot().get(0).candidate().host());
        assertEquals(1000, frontier.snapshot().get(0).score());
        assertEquals("a.example", frontier.takeNext().host());
    }

    private static class TestClock extends Clock {
        private Instant now = Instant.parse("2024-05-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
