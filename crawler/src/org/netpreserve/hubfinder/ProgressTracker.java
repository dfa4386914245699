package org.netpreserve.hubfinder;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.util.NamedThreadFactory;
import org.netpreserve.hubfinder.util.Url;
import org.netpreserve.hubfinder.validate.ValidationResult;
import org.netpreserve.hubfinder.validate.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Counts what the run has done and periodically snapshots it to the progress table.
 */
public class ProgressTracker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);
    private final @Nullable ProgressDAO dao;
    private final String runId;
    private final Clock clock;
    private final ScheduledExecutorService scheduler =
            Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("progress"));
    private final long snapshotIntervalMillis;
    private ScheduledFuture<?> snapshotTask;
    private Instant sessionStartTime;
    private boolean stopped;
    private Progress.Phase phase = Progress.Phase.DISCOVERY;
    private final Set<String> proposedTargets = new HashSet<>();
    private final Set<String> validatedTargets = new HashSet<>();
    private final Set<String> articles = new HashSet<>();
    private long confirmed;
    private long rejected;
    private long inconclusive;
    private long transientFailures;
    private long fetches;

    public ProgressTracker(@Nullable ProgressDAO dao, String runId, Duration snapshotInterval) {
        this(dao, runId, snapshotInterval, Clock.systemUTC());
    }

    public ProgressTracker(@Nullable ProgressDAO dao, String runId, Duration snapshotInterval, Clock clock) {
        this.dao = dao;
        this.runId = runId;
        this.snapshotIntervalMillis = Math.max(1, snapshotInterval.toMillis());
        this.clock = clock;
    }

    public synchronized void startSession() {
        if (sessionStartTime != null) return;
        sessionStartTime = clock.instant();
        if (dao != null) {
            snapshotTask = scheduler.scheduleAtFixedRate(this::snapshot, snapshotIntervalMillis,
                    snapshotIntervalMillis, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Moves to the completion phase and writes a final snapshot.
     */
    public synchronized void stopSession() {
        if (sessionStartTime == null || stopped) return;
        stopped = true;
        if (snapshotTask != null) {
            snapshotTask.cancel(false);
            snapshotTask = null;
        }
        advance(Progress.Phase.COMPLETION);
        snapshot();
    }

    private synchronized void snapshot() {
        if (dao == null || sessionStartTime == null) return;
        try {
            dao.createSnapshot(current());
        } catch (RuntimeException e) {
            log.error("Failed to save progress snapshot", e);
        }
    }

    public synchronized void proposed(HubTarget target) {
        proposedTargets.add(target.key());
    }

    public synchronized void fetched() {
        fetches++;
    }

    public synchronized void validated(ValidationResult result) {
        advance(Progress.Phase.VALIDATION);
        HubTarget target = result.candidate().target();
        if (result.verdict() == Verdict.CONFIRMED) {
            confirmed++;
            if (target != null) validatedTargets.add(target.key());
            for (Url article : result.articleUrls()) articles.add(article.toString());
            if (!result.articleUrls().isEmpty()) advance(Progress.Phase.INDEXING);
        } else if (result.verdict() == Verdict.REJECTED) {
            rejected++;
        } else {
            inconclusive++;
            if (result.transientFailure()) transientFailures++;
        }
    }

    private void advance(Progress.Phase next) {
        if (next.ordinal() > phase.ordinal()) {
            log.info("Progress phase {} -> {}", phase, next);
            phase = next;
        }
    }

    public synchronized long transientFailures() {
        return transientFailures;
    }

    public synchronized Progress current() {
        Instant now = clock.instant();
        long runtime = sessionStartTime == null ? 0 : Duration.between(sessionStartTime, now).toMillis();
        return new Progress(runId, now, runtime, phase, proposedTargets.size(), validatedTargets.size(), confirmed,
                rejected, inconclusive, articles.size(), fetches);
    }

    @Override
    public void close() {
        stopSession();
        scheduler.shutdownNow();
    }
}
