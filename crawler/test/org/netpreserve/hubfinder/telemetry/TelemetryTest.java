package org.netpreserve.hubfinder.telemetry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryTest {
    @Test
    void deliversEventsInOrder() throws InterruptedException {
        List<TelemetryEvent> received = new CopyOnWriteArrayList<>();
        try (var telemetry = new Telemetry()) {
            telemetry.subscribe(received::add);
            telemetry.emit(EventType.CANDIDATE_PROPOSED, "news.example.com", Map.of("url", "https://a/1"));
            telemetry.emit(EventType.HUB_CONFIRMED, "news.example.com", Map.of("url", "https://a/1"));

            assertTrue(telemetry.flush(Duration.ofSeconds(5)));
        }

        assertEquals(List.of(EventType.CANDIDATE_PROPOSED, EventType.HUB_CONFIRMED),
                received.stream().map(TelemetryEvent::type).toList());
        assertEquals("https://a/1", received.get(1).attribute("url"));
    }

    @Test
    void failingSinkDoesNotStopOthers() throws InterruptedException {
        List<TelemetryEvent> received = new CopyOnWriteArrayList<>();
        try (var telemetry = new Telemetry()) {
            telemetry.subscribe(event -> {
                throw new IllegalStateException("broken sink");
            });
            telemetry.subscribe(received::add);
            telemetry.emit(EventType.GAP_FILLED, null, Map.of());

            assertTrue(telemetry.flush(Duration.ofSeconds(5)));
        }
        assertEquals(1, received.size());
    }

    @Test
    void fullQueueDropsInsteadOfBlocking() throws InterruptedException {
        var blocked = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        try (var telemetry = new Telemetry(1)) {
            telemetry.subscribe(event -> {
                blocked.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            telemetry.emit(EventType.PATTERN_LEARNED, null, Map.of());
            assertTrue(blocked.await(5, TimeUnit.SECONDS));
            telemetry.emit(EventType.PATTERN_LEARNED, null, Map.of());
            telemetry.emit(EventType.PATTERN_LEARNED, null, Map.of());

            assertEquals(1, telemetry.dropped());
            release.countDown();
        }
    }

    @Test
    void loggingSinkAcceptsEveryEventType() {
        var sink = new LoggingTelemetrySink();
        for (EventType type : EventType.values()) {
            assertDoesNotThrow(() -> sink.accept(new TelemetryEvent(type, Instant.now(), "example.com",
                    Map.of("key", "value"))));
        }
    }
}
