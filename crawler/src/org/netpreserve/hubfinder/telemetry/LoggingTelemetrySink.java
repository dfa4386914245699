package org.netpreserve.hubfinder.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.Map;

/**
 * Writes each event as a structured log line.
 */
public class LoggingTelemetrySink implements TelemetrySink {
    private static final Logger log = LoggerFactory.getLogger("org.netpreserve.hubfinder.telemetry");

    @Override
    public void accept(TelemetryEvent event) {
        LoggingEventBuilder builder = event.type() == EventType.CANDIDATE_PROPOSED
                                      || event.type() == EventType.CANDIDATE_DISPATCHED ? log.atDebug() : log.atInfo();
        builder = builder.addKeyValue("event", event.type().label())
                .addKeyValue("timestamp", event.timestamp());
        if (event.domain() != null) builder = builder.addKeyValue("domain", event.domain());
        for (Map.Entry<String, Object> entry : event.attributes().entrySet()) {
            builder = builder.addKeyValue(entry.getKey(), entry.getValue());
        }
        builder.log(event.type().label());
    }
}
