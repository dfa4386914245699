package org.netpreserve.hubfinder.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.hubfinder.util.DurationDeserializer;

import java.time.Duration;

/**
 * Global crawl limits. Reaching either one drains the run.
 *
 * @param fetches maximum number of URLs to dispatch
 * @param time    maximum duration to run the crawl for
 */
public record LimitsConfig(
        Long fetches,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration time
) {
}
