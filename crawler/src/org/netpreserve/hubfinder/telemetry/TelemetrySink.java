package org.netpreserve.hubfinder.telemetry;

/**
 * Receives telemetry events on the dispatcher thread. Implementations should be quick; a slow sink delays the
 * others but never the crawl.
 */
public interface TelemetrySink {
    void accept(TelemetryEvent event);
}
