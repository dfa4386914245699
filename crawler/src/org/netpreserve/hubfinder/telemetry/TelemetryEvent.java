package org.netpreserve.hubfinder.telemetry;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param type       what happened
 * @param timestamp  when it happened
 * @param domain     the domain concerned, null for run-wide events
 * @param attributes event-specific details
 */
public record TelemetryEvent(EventType type, Instant timestamp, @Nullable String domain,
                             Map<String, Object> attributes) {
    public TelemetryEvent {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public @Nullable Object attribute(String name) {
        return attributes.get(name);
    }
}
