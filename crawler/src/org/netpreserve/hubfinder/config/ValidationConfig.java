package org.netpreserve.hubfinder.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.hubfinder.util.DurationDeserializer;

import java.time.Duration;

/**
 * Hub validation thresholds.
 *
 * @param minArticleLinks     article links a page needs to count as a hub
 * @param minNavLinks         navigation links a page needs to count as a hub
 * @param cacheSize           entries in the per-run page cache
 * @param inconclusiveBackoff wait before the single re-check of an ambiguous page
 */
public record ValidationConfig(
        int minArticleLinks,
        int minNavLinks,
        int cacheSize,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration inconclusiveBackoff) {
}
