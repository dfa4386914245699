package org.netpreserve.hubfinder;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.netpreserve.hubfinder.config.ConfigLoader;
import org.netpreserve.hubfinder.config.DomainConfig;
import org.netpreserve.hubfinder.config.JobConfig;
import org.netpreserve.hubfinder.config.PlannerConfig;
import org.netpreserve.hubfinder.config.ValidationConfig;
import org.netpreserve.hubfinder.fetch.Fetcher;
import org.netpreserve.hubfinder.gazetteer.FileGazetteer;
import org.netpreserve.hubfinder.learn.LearnedPattern;
import org.netpreserve.hubfinder.telemetry.EventType;
import org.netpreserve.hubfinder.telemetry.Telemetry;
import org.netpreserve.hubfinder.telemetry.TelemetryEvent;
import org.netpreserve.hubfinder.util.Url;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;
import static org.netpreserve.hubfinder.TestFixtures.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class JobTest {
    private static final Set<String> HUB_PATHS = Set.of("/world/united-states", "/world/china", "/world/france",
            "/international/germany", "/politics", "/sport");
    private Telemetry telemetry;
    private final List<TelemetryEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        telemetry = new Telemetry();
        telemetry.subscribe(events::add);
    }

    @AfterEach
    void tearDown() {
        telemetry.close();
    }

    private static JobConfig config(List<DomainConfig> domains, int workers, int batchSize) throws IOException {
        JobConfig defaults = ConfigLoader.defaults();
        PlannerConfig planner = defaults.planner();
        return defaults.withDomains(domains)
                .withCrawl(defaults.crawl().withWorkers(workers).withDelay(0).withRetryBackoff(Duration.ofMillis(1)))
                .withPlanner(new PlannerConfig(CrawlMode.NORMAL, List.of(HubKind.COUNTRY, HubKind.TOPIC), batchSize,
                        50, 1000, 1, planner.gapFillBoost(), planner.highImportance(), planner.bonuses(), false,
                        Duration.ofSeconds(1)))
                .withValidation(new ValidationConfig(5, 3, 64, Duration.ofMillis(1)));
    }

    private static void await(String what, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("timed out waiting for " + what);
            Thread.sleep(10);
        }
    }

    private long count(EventType type) {
        return events.stream().filter(event -> event.type() == type).count();
    }

    @Test
    void discoversHubsUntilEveryGapIsFilled(Database database) throws Exception {
        Fetcher fetcher = (url, timeout) -> HUB_PATHS.contains(url.path())
                ? html(url, hubPage("Section " + url.path(), 6, 4))
                : status(url, 404);
        var storage = new Storage(database);
        RunReport report;

        try (var job = new Job(config(List.of(site()), 2, 20), storage, database.progress(), gazetteer(), fetcher,
                telemetry)) {
            job.start();
            report = job.awaitStop(Duration.ofSeconds(30));

            assertNotNull(report, "job did not stop");
            assertEquals(RunReport.Status.COMPLETED, report.status());
            assertEquals(0, report.remainingGaps());
            assertEquals(Job.State.STOPPED, job.state());

            Map<String, Url> coverage = job.coverage("news.example.com");
            assertEquals(6, coverage.size());
            assertEquals(url("/international/germany"), coverage.get("country-hub:de"));
            assertEquals(coverage, storage.getCoverageSnapshot("news.example.com"));

            List<LearnedPattern> patterns = storage.getLearnedPatterns("news.example.com", HubKind.COUNTRY);
            assertEquals("/world/{slug}", patterns.get(0).template());
            assertEquals(3, patterns.get(0).successCount());

            Progress progress = report.progress();
            assertEquals(6, progress.entitiesValidated());
            assertTrue(progress.confirmed() >= 6);
            assertTrue(progress.rejected() > 0);
            assertEquals(6, progress.articles());
        }

        assertEquals(Progress.Phase.COMPLETION, database.progress().latest(report.runId()).phase());
        assertTrue(telemetry.flush(Duration.ofSeconds(5)));
        assertEquals(6, count(EventType.GAP_FILLED));
        assertTrue(count(EventType.HUB_CONFIRMED) >= 6);
        assertTrue(count(EventType.PATTERN_LEARNED) >= 6);
    }

    @Test
    void abortDropsQueuedWorkAndStopsDispatching(Database database) throws Exception {
        var domains = new ArrayList<DomainConfig>();
        for (String host : List.of("a", "b", "c", "d", "e")) {
            domains.add(new DomainConfig(new Url("https://" + host + ".example/")));
        }
        Fetcher hanging = (url, timeout) -> {
            Thread.sleep(60_000);
            throw new AssertionError("fetch should have been interrupted");
        };

        try (var job = new Job(config(domains, 5, 25), new Storage(database), database.progress(), gazetteer(),
                hanging, telemetry)) {
            job.start();
            await("five fetches in flight", () -> job.frontier().inFlight() == 5);
            long dispatchedAtAbort = job.frontier().dispatched();

            assertTrue(job.abort());
            assertTrue(job.frontier().isClosed());
            assertEquals(0, job.frontier().size());
            assertNull(job.frontier().takeNext());
            assertFalse(job.abort());
            RunReport report = job.awaitStop(Duration.ofSeconds(30));

            assertNotNull(report);
            assertEquals(RunReport.Status.ABORTED, report.status());
            assertEquals(Job.State.STOPPED, job.state());
            assertEquals(0, job.frontier().size());
            assertEquals(dispatchedAtAbort, job.frontier().dispatched());
            assertFalse(job.pause());
            assertFalse(job.setMode(CrawlMode.EXCLUSIVE_HUB_FOCUS));

            assertTrue(telemetry.flush(Duration.ofSeconds(5)));
            assertEquals(dispatchedAtAbort, count(EventType.CANDIDATE_DISPATCHED));
            assertEquals(0, count(EventType.HUB_REJECTED) + count(EventType.HUB_CONFIRMED));
        }
    }

    @Test
    void pauseResumeAndModeChanges(Database database) throws Exception {
        Fetcher hanging = (url, timeout) -> {
            Thread.sleep(60_000);
            throw new AssertionError("fetch should have been interrupted");
        };
        try (var job = new Job(config(List.of(site()), 1, 20), new Storage(database), database.progress(),
                gazetteer(), hanging, telemetry)) {
            assertFalse(job.pause());
            job.start();
            await("first dispatch", () -> job.frontier().inFlight() == 1);

            assertTrue(job.pause());
            assertEquals(Job.State.PAUSED, job.state());
            assertTrue(job.frontier().isPaused());
            assertFalse(job.pause());

            assertTrue(job.setMode(CrawlMode.EXCLUSIVE_HUB_FOCUS));
            assertFalse(job.setMode(CrawlMode.EXCLUSIVE_HUB_FOCUS));
            assertEquals(CrawlMode.EXCLUSIVE_HUB_FOCUS, job.mode());

            assertTrue(job.resume());
            assertFalse(job.resume());
            assertEquals(Job.State.RUNNING, job.state());
            assertThrows(Job.BadStateException.class, job::start);
        }
    }

    @Test
    void failedStartupStageStopsTheJob() throws Exception {
        HubStore store = mock(HubStore.class);
        doThrow(new IllegalStateException("database is locked")).when(store).check();
        Fetcher fetcher = mock(Fetcher.class);

        try (var job = new Job(config(List.of(site()), 2, 20), store, null, gazetteer(), fetcher, telemetry)) {
            FatalCrawlException e = assertThrows(FatalCrawlException.class, job::start);

            assertEquals("storage-check", e.stage());
            assertEquals(Job.State.STOPPED, job.state());
            assertEquals(RunReport.Status.FAILED, job.report().status());
            assertEquals(RunReport.Status.FAILED, job.awaitStop(Duration.ofSeconds(1)).status());
            assertThrows(Job.BadStateException.class, job::start);
        }
        verifyNoInteractions(fetcher);
        assertTrue(telemetry.flush(Duration.ofSeconds(5)));
        assertTrue(events.stream().anyMatch(event -> "failed".equals(event.attribute("stage"))));
    }

    @Test
    void emptyGazetteerIsFatal(Database database) throws Exception {
        Fetcher fetcher = mock(Fetcher.class);

        try (var job = new Job(config(List.of(site()), 2, 20), new Storage(database), database.progress(),
                new FileGazetteer(List.of()), fetcher, telemetry)) {
            FatalCrawlException e = assertThrows(FatalCrawlException.class, job::start);

            assertEquals("gazetteer-check", e.stage());
            assertEquals(Job.State.STOPPED, job.state());
            assertEquals(RunReport.Status.FAILED, job.report().status());
            assertEquals(0, job.frontier().dispatched());
        }
        verifyNoInteractions(fetcher);
    }

    @Test
    void transientFailuresCompleteWithGaps(Database database) throws Exception {
        Fetcher unavailable = (url, timeout) -> status(url, 503);

        try (var job = new Job(config(List.of(site()), 2, 20), new Storage(database), database.progress(),
                gazetteer(), unavailable, telemetry)) {
            job.start();
            RunReport report = job.awaitStop(Duration.ofSeconds(30));

            assertNotNull(report, "job did not stop");
            assertEquals(RunReport.Status.COMPLETED_WITH_GAPS, report.status());
            assertEquals(6, report.remainingGaps());
            assertEquals(0, report.progress().confirmed());
            assertTrue(report.progress().inconclusive() > 0);
            assertTrue(job.coverage("news.example.com").isEmpty());
        }
        assertTrue(telemetry.flush(Duration.ofSeconds(5)));
        assertEquals(0, count(EventType.HUB_CONFIRMED));
        assertTrue(count(EventType.HUB_INCONCLUSIVE) > 0);
    }

    @Test
    void emptyJobCompletesImmediately(Database database) throws Exception {
        try (var job = new Job(config(List.of(), 1, 20), new Storage(database), database.progress(), gazetteer(),
                mock(Fetcher.class), telemetry)) {
            job.start();
            RunReport report = job.awaitStop(Duration.ofSeconds(10));

            assertNotNull(report);
            assertEquals(RunReport.Status.COMPLETED, report.status());
        }
    }
}
