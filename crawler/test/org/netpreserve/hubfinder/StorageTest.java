package org.netpreserve.hubfinder;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.netpreserve.hubfinder.learn.LearnedPattern;
import org.netpreserve.hubfinder.util.Url;
import org.netpreserve.hubfinder.validate.Evidence;
import org.netpreserve.hubfinder.validate.Verdict;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.netpreserve.hubfinder.TestFixtures.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class StorageTest {
    private static final Instant T1 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-05-02T10:00:00Z");

    private static HubRecord record(Url url, HubTarget target, Verdict verdict, Set<String> articles, Instant at) {
        return new HubRecord(url, "news.example.com", target.kind(), target.key(),
                target.entities().stream().map(e -> e.id()).toList(), verdict, articles, at,
                Evidence.of(200, url.toString(), false, "hub structure"));
    }

    @Test
    void storesAndMergesHubRecords(Database database) {
        var storage = new Storage(database);
        Url url = url("/world/france");

        storage.putHubRecord(record(url, HubTarget.of(FRANCE), Verdict.CONFIRMED, Set.of("https://a/1"), T1));
        storage.putHubRecord(record(url, HubTarget.of(FRANCE), Verdict.CONFIRMED, Set.of("https://a/2"), T2));

        HubRecord stored = storage.getHubRecord(url);
        assertNotNull(stored);
        assertEquals(HubKind.COUNTRY, stored.kind());
        assertEquals(List.of("fr"), stored.entityIds());
        assertEquals(Set.of("https://a/1", "https://a/2"), stored.articleUrls());
        assertEquals(T2, stored.visitedAt());
        assertEquals("hub structure", stored.evidence().reason());
        assertNull(storage.getHubRecord(url("/world/nowhere")));
    }

    @Test
    void coverageSnapshotContainsOnlyConfirmedHubs(Database database) {
        var storage = new Storage(database);
        storage.putHubRecord(record(url("/world/france"), HubTarget.of(FRANCE), Verdict.CONFIRMED, Set.of(), T1));
        storage.putHubRecord(record(url("/world/germany"), HubTarget.of(GERMANY), Verdict.REJECTED, Set.of(), T1));
        var placeTopic = HubTarget.of(HubKind.PLACE_TOPIC, FRANCE, POLITICS);
        storage.putHubRecord(record(url("/world/france/politics"), placeTopic, Verdict.CONFIRMED, Set.of(), T2));

        Map<String, Url> coverage = storage.getCoverageSnapshot("news.example.com");

        assertEquals(Map.of("country-hub:fr", url("/world/france"),
                "place-topic-hub:fr+politics", url("/world/france/politics")), coverage);
        assertTrue(storage.getCoverageSnapshot("other.example.org").isEmpty());
    }

    @Test
    void learnedPatternsAreReturnedStrongestFirst(Database database) {
        var storage = new Storage(database);
        storage.putLearnedPattern(LearnedPattern.first("news.example.com", HubKind.COUNTRY, "/{slug}",
                "https://news.example.com/france", 10, T1));
        storage.putLearnedPattern(new LearnedPattern("news.example.com", HubKind.COUNTRY, "/world/{slug}", 2, 12.5,
                T2, Set.of("https://news.example.com/world/france", "https://news.example.com/world/china")));
        storage.putLearnedPattern(LearnedPattern.first("news.example.com", HubKind.TOPIC, "/{slug}",
                "https://news.example.com/politics", 10, T1));

        List<LearnedPattern> patterns = storage.getLearnedPatterns("news.example.com", HubKind.COUNTRY);

        assertEquals(List.of("/world/{slug}", "/{slug}"), patterns.stream().map(LearnedPattern::template).toList());
        assertEquals(2, patterns.get(0).successCount());
        assertEquals(12.5, patterns.get(0).averageYield());
        assertTrue(patterns.get(0).supportedBy("https://news.example.com/world/china"));
    }

    @Test
    void checkSucceedsOnOpenDatabase(Database database) {
        assertDoesNotThrow(() -> new Storage(database).check());
    }
}
