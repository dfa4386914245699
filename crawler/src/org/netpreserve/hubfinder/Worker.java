package org.netpreserve.hubfinder;

import org.netpreserve.hubfinder.fetch.FetchException;
import org.netpreserve.hubfinder.fetch.FetchResult;
import org.netpreserve.hubfinder.fetch.Fetcher;
import org.netpreserve.hubfinder.validate.HubValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Takes candidates from the frontier one at a time: hub candidates are validated, anything else is just fetched.
 * Outcomes are handed to the job for processing on its coordinator thread.
 */
public class Worker {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);
    static final long IDLE_WAIT_MS = 1000;
    final String id;
    private final Frontier frontier;
    private final HubValidator validator;
    private final Fetcher fetcher;
    private final Duration fetchTimeout;
    private final Consumer<WorkOutcome> outcomes;
    private final Consumer<CrawlLimitException> limitReached;
    private Thread thread;
    private volatile boolean closed = false;

    public Worker(String id, Frontier frontier, HubValidator validator, Fetcher fetcher, Duration fetchTimeout,
                  Consumer<WorkOutcome> outcomes, Consumer<CrawlLimitException> limitReached) {
        this.id = id;
        this.frontier = frontier;
        this.validator = validator;
        this.fetcher = fetcher;
        this.fetchTimeout = fetchTimeout;
        this.outcomes = outcomes;
        this.limitReached = limitReached;
    }

    /**
     * Finishes the current candidate then exits.
     */
    public void closeAsyncGraceful() {
        closed = true;
    }

    /**
     * Interrupts the current fetch.
     */
    void closeAsync() {
        if (closed && thread != null && !thread.isAlive()) return;
        closed = true;
        if (thread != null) thread.interrupt();
    }

    /**
     * @return false if the thread is still running after the timeout
     */
    boolean join(Duration timeout) throws InterruptedException {
        if (thread == null) return true;
        thread.join(Math.max(1, timeout.toMillis()));
        return !thread.isAlive();
    }

    void run() throws InterruptedException {
        while (!closed) {
            Candidate candidate;
            try {
                candidate = frontier.takeNext();
            } catch (CrawlLimitException e) {
                log.info("Worker {} stopping: {}", id, e.getMessage());
                limitReached.accept(e);
                return;
            }
            if (candidate == null) {
                frontier.awaitWork(IDLE_WAIT_MS);
                continue;
            }

            log.atDebug().addKeyValue("url", candidate.url())
                    .addKeyValue("target", candidate.target())
                    .log("Worker {} took candidate", id);

            WorkOutcome outcome;
            try {
                outcome = candidate.isHub() ? WorkOutcome.validated(id, validator.validate(candidate))
                        : fetch(candidate);
            } catch (RuntimeException e) {
                log.atError().addKeyValue("url", candidate.url()).setCause(e).log("Worker {} failed", id);
                outcome = WorkOutcome.failed(id, candidate, 0, e.toString());
            } finally {
                frontier.release(candidate);
            }
            outcomes.accept(outcome);
        }
    }

    private WorkOutcome fetch(Candidate candidate) throws InterruptedException {
        try {
            FetchResult result = fetcher.fetch(candidate.url(), fetchTimeout);
            log.atInfo().addKeyValue("url", candidate.url())
                    .addKeyValue("status", result.status())
                    .addKeyValue("durationMs", result.fetchDurationMs())
                    .log("Fetched");
            return WorkOutcome.fetched(id, candidate, result.status(), result.fetchDurationMs());
        } catch (FetchException e) {
            log.atInfo().addKeyValue("url", candidate.url()).addKeyValue("kind", e.kind())
                    .log("Fetch failed: {}", e.getMessage());
            return WorkOutcome.failed(id, candidate, 0, e.getMessage());
        }
    }

    public synchronized void start() {
        log.info("Starting worker {}", id);
        thread = new Thread(() -> {
            try {
                run();
            } catch (InterruptedException e) {
                if (!closed) log.warn("Worker {} interrupted", id);
            } catch (Exception e) {
                log.error("Worker crashed", e);
            }
        }, "Worker-" + id);
        thread.start();
    }
}
