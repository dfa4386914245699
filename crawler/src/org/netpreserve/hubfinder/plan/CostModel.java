package org.netpreserve.hubfinder.plan;

import org.netpreserve.hubfinder.Candidate;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Running average fetch time per host, fed by completed fetches.
 */
public class CostModel {
    private final Map<String, Average> averages = new HashMap<>();

    public synchronized void record(String host, long durationMs) {
        if (durationMs < 0) return;
        averages.computeIfAbsent(host.toLowerCase(Locale.ROOT), h -> new Average()).add(durationMs);
    }

    /**
     * @return average milliseconds, or {@link Candidate#UNKNOWN_COST} if nothing has been fetched from the host
     */
    public synchronized long estimate(String host) {
        Average average = averages.get(host.toLowerCase(Locale.ROOT));
        return average == null ? Candidate.UNKNOWN_COST : Math.round(average.mean);
    }

    private static class Average {
        private long count;
        private double mean;

        void add(long value) {
            count++;
            mean += (value - mean) / count;
        }
    }
}
