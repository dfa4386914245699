package org.netpreserve.hubfinder;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.plan.ScoredCandidate;
import org.netpreserve.hubfinder.telemetry.EventType;
import org.netpreserve.hubfinder.telemetry.Telemetry;
import org.netpreserve.hubfinder.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.ToDoubleFunction;

/**
 * The shared priority queue of work. Queue contents, per-host politeness and in-flight bookkeeping all live behind
 * this object's monitor.
 * <p>
 * Workers take the highest-scored candidate whose host is neither busy nor inside its politeness delay. A URL is
 * admitted at most once per run.
 */
public class Frontier {
    private static final Logger log = LoggerFactory.getLogger(Frontier.class);
    private static final Comparator<Entry> ORDER = Comparator.comparingDouble(Entry::score).reversed()
            .thenComparingLong(Entry::sequence);
    private final PriorityQueue<Entry> queue = new PriorityQueue<>(ORDER);
    private final Set<Url> known = new HashSet<>();
    private final Map<String, Integer> pendingTargets = new HashMap<>();
    private final Map<String, Instant> nextVisit = new HashMap<>();
    private final Set<String> lockedHosts = new HashSet<>();
    private final int capacity;
    private final long delayMs;
    private final @Nullable Long fetchLimit;
    private final Telemetry telemetry;
    private final Clock clock;
    private long sequence;
    private long dispatched;
    private int inFlight;
    private boolean paused;
    private boolean closed;

    public Frontier(int capacity, long delayMs, @Nullable Long fetchLimit, Telemetry telemetry) {
        this(capacity, delayMs, fetchLimit, telemetry, Clock.systemUTC());
    }

    public Frontier(int capacity, long delayMs, @Nullable Long fetchLimit, Telemetry telemetry, Clock clock) {
        this.capacity = capacity;
        this.delayMs = delayMs;
        this.fetchLimit = fetchLimit;
        this.telemetry = telemetry;
        this.clock = clock;
    }

    private record Entry(Candidate candidate, double score, long sequence) {
    }

    /**
     * Queues a candidate unless its URL was seen before this run. When full, the lowest-scored entry is evicted to
     * make room for a better one.
     *
     * @return true if the candidate was queued
     */
    public synchronized boolean offer(ScoredCandidate scored) {
        Candidate candidate = scored.candidate();
        if (closed || known.contains(candidate.url())) return false;
        if (queue.size() >= capacity) {
            Entry lowest = lowest();
            if (lowest == null || ORDER.compare(new Entry(candidate, scored.score(), Long.MAX_VALUE), lowest) >= 0) {
                return false;
            }
            queue.remove(lowest);
            known.remove(lowest.candidate().url());
            untrackTarget(lowest.candidate());
            log.atDebug().addKeyValue("url", lowest.candidate().url())
                    .addKeyValue("score", lowest.score())
                    .log("Evicted lowest priority candidate");
        }
        queue.add(new Entry(candidate, scored.score(), sequence++));
        known.add(candidate.url());
        if (candidate.target() != null) pendingTargets.merge(candidate.target().key(), 1, Integer::sum);
        notifyAll();
        return true;
    }

    private @Nullable Entry lowest() {
        Entry lowest = null;
        for (Entry entry : queue) {
            if (lowest == null || ORDER.compare(entry, lowest) > 0) lowest = entry;
        }
        return lowest;
    }

    /**
     * Takes the best candidate that may be fetched now and locks its host until {@link #release(Candidate)}.
     *
     * @return null if paused, closed or every queued host is busy or throttled
     * @throws CrawlLimitException if the run's fetch limit has been reached
     */
    public synchronized @Nullable Candidate takeNext() throws CrawlLimitException {
        if (closed || paused) return null;
        if (fetchLimit != null && dispatched >= fetchLimit) {
            throw new CrawlLimitException("fetch limit reached");
        }
        Instant now = clock.instant();
        var skipped = new ArrayList<Entry>();
        try {
            while (!queue.isEmpty()) {
                Entry entry = queue.poll();
                String host = entry.candidate().host();
                Instant next = nextVisit.get(host);
                if (lockedHosts.contains(host) || (next != null && next.isAfter(now))) {
                    skipped.add(entry);
                    continue;
                }
                lockedHosts.add(host);
                inFlight++;
                dispatched++;
                Candidate candidate = entry.candidate();
                telemetry.emit(EventType.CANDIDATE_DISPATCHED, host, Map.of(
                        "url", candidate.url().toString(),
                        "target", candidate.target() == null ? "" : candidate.target().key(),
                        "score", entry.score()));
                return candidate;
            }
            return null;
        } finally {
            queue.addAll(skipped);
        }
    }

    /**
     * Unlocks the candidate's host and starts its politeness delay. Called by the worker once its fetch is over.
     */
    public synchronized void release(Candidate candidate) {
        lockedHosts.remove(candidate.host());
        nextVisit.put(candidate.host(), clock.instant().plusMillis(delayMs));
        notifyAll();
    }

    /**
     * Marks a dispatched candidate's outcome as processed.
     */
    public synchronized void complete(Candidate candidate) {
        if (inFlight > 0) inFlight--;
        untrackTarget(candidate);
        notifyAll();
    }

    private void untrackTarget(Candidate candidate) {
        if (candidate.target() == null) return;
        pendingTargets.computeIfPresent(candidate.target().key(), (key, count) -> count > 1 ? count - 1 : null);
    }

    /**
     * Blocks until the frontier changes or the timeout elapses.
     */
    public synchronized void awaitWork(long timeoutMs) throws InterruptedException {
        if (closed) return;
        long wait = timeoutMs;
        if (!paused) {
            Instant now = clock.instant();
            for (Entry entry : queue) {
                Instant next = nextVisit.get(entry.candidate().host());
                if (next != null && next.isAfter(now) && !lockedHosts.contains(entry.candidate().host())) {
                    wait = Math.min(wait, Math.max(1, next.toEpochMilli() - now.toEpochMilli()));
                }
            }
        }
        wait(Math.max(1, wait));
    }

    public synchronized boolean pause() {
        if (paused) return false;
        paused = true;
        return true;
    }

    public synchronized boolean resume() {
        if (!paused) return false;
        paused = false;
        notifyAll();
        return true;
    }

    public synchronized boolean isPaused() {
        return paused;
    }

    /**
     * Stops dispatching. Queued candidates stay where they are, in-flight ones can still complete.
     */
    public synchronized void close() {
        closed = true;
        notifyAll();
    }

    /**
     * Closes the frontier and drops everything queued.
     *
     * @return the number of queued candidates discarded
     */
    public synchronized int abort() {
        int discarded = queue.size();
        for (Entry entry : queue) untrackTarget(entry.candidate());
        queue.clear();
        closed = true;
        notifyAll();
        return discarded;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Recomputes every queued score, e.g. after the crawl mode changed.
     */
    public synchronized void rescore(ToDoubleFunction<Candidate> scorer) {
        var entries = new ArrayList<>(queue);
        queue.clear();
        for (Entry entry : entries) {
            queue.add(new Entry(entry.candidate(), scorer.applyAsDouble(entry.candidate()), entry.sequence()));
        }
    }

    /**
     * Queued candidates in dispatch order, ignoring politeness.
     */
    public synchronized List<ScoredCandidate> snapshot() {
        var entries = new ArrayList<>(queue);
        entries.sort(ORDER);
        var result = new ArrayList<ScoredCandidate>(entries.size());
        for (Entry entry : entries) result.add(new ScoredCandidate(entry.candidate(), entry.score()));
        return result;
    }

    /**
     * Every URL admitted this run, whether still queued, in flight or done.
     */
    public synchronized Set<Url> knownUrls() {
        return new HashSet<>(known);
    }

    public synchronized Set<String> pendingTargets() {
        return new HashSet<>(pendingTargets.keySet());
    }

    public synchronized int size() {
        return queue.size();
    }

    public synchronized int inFlight() {
        return inFlight;
    }

    public synchronized long dispatched() {
        return dispatched;
    }

    public synchronized boolean isIdle() {
        return queue.isEmpty() && inFlight == 0;
    }
}
