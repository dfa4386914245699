package org.netpreserve.hubfinder.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.hubfinder.util.DurationDeserializer;

import java.time.Duration;

/**
 * Configuration for how the crawl should behave.
 *
 * @param userAgent    User-Agent string to identify as to servers
 * @param workers      number of concurrent fetch workers
 * @param delay        milliseconds to wait between requests to the same host
 * @param fetchTimeout per-request timeout
 * @param maxRetries   retries of a transient failure before giving up
 * @param retryBackoff initial backoff, doubled on each retry
 * @param limits       global crawl limits (fetches, time)
 */
public record CrawlConfig(
        String userAgent,
        int workers,
        long delay,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration fetchTimeout,
        int maxRetries,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration retryBackoff,
        LimitsConfig limits) {

    public CrawlConfig withWorkers(int workers) {
        return new CrawlConfig(userAgent, workers, delay, fetchTimeout, maxRetries, retryBackoff, limits);
    }

    public CrawlConfig withDelay(long delay) {
        return new CrawlConfig(userAgent, workers, delay, fetchTimeout, maxRetries, retryBackoff, limits);
    }

    public CrawlConfig withRetryBackoff(Duration retryBackoff) {
        return new CrawlConfig(userAgent, workers, delay, fetchTimeout, maxRetries, retryBackoff, limits);
    }

    public CrawlConfig withLimits(LimitsConfig limits) {
        return new CrawlConfig(userAgent, workers, delay, fetchTimeout, maxRetries, retryBackoff, limits);
    }
}
