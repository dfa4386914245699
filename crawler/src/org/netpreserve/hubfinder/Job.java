package org.netpreserve.hubfinder;

import com.fasterxml.uuid.Generators;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.config.DomainConfig;
import org.netpreserve.hubfinder.config.JobConfig;
import org.netpreserve.hubfinder.config.LimitsConfig;
import org.netpreserve.hubfinder.fetch.Fetcher;
import org.netpreserve.hubfinder.fetch.HttpFetcher;
import org.netpreserve.hubfinder.gap.CoverageTracker;
import org.netpreserve.hubfinder.gap.GapAnalyzer;
import org.netpreserve.hubfinder.gazetteer.EntityKind;
import org.netpreserve.hubfinder.gazetteer.FileGazetteer;
import org.netpreserve.hubfinder.gazetteer.Gazetteer;
import org.netpreserve.hubfinder.learn.LearnedPattern;
import org.netpreserve.hubfinder.learn.PatternLearner;
import org.netpreserve.hubfinder.plan.CostEstimator;
import org.netpreserve.hubfinder.plan.CostModel;
import org.netpreserve.hubfinder.plan.GazetteerReasoner;
import org.netpreserve.hubfinder.plan.PlanResult;
import org.netpreserve.hubfinder.plan.Planner;
import org.netpreserve.hubfinder.plan.PriorityScorer;
import org.netpreserve.hubfinder.plan.ScoredCandidate;
import org.netpreserve.hubfinder.predict.PredictionContext;
import org.netpreserve.hubfinder.predict.PredictionStrategyLibrary;
import org.netpreserve.hubfinder.telemetry.EventType;
import org.netpreserve.hubfinder.telemetry.LoggingTelemetrySink;
import org.netpreserve.hubfinder.telemetry.Telemetry;
import org.netpreserve.hubfinder.util.NamedThreadFactory;
import org.netpreserve.hubfinder.util.Url;
import org.netpreserve.hubfinder.validate.HubValidator;
import org.netpreserve.hubfinder.validate.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A hub discovery run: plans candidates, hands them to a bounded pool of workers and learns from the outcomes.
 * <p>
 * Planning and outcome processing happen on a single coordinator thread, so coverage and learned patterns are
 * only ever mutated from one place. The control methods can be called from any thread and are no-ops when they
 * don't apply to the current state.
 */
public class Job implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Job.class);
    static final Duration WORKER_JOIN_TIMEOUT = Duration.ofSeconds(30);
    private final String runId = Generators.timeBasedEpochGenerator().generate().toString();
    private final JobConfig config;
    private final HubStore store;
    private final Gazetteer gazetteer;
    private final Fetcher fetcher;
    private final Telemetry telemetry;
    private final Frontier frontier;
    private final Planner planner;
    private final PriorityScorer scorer;
    private final PatternLearner learner;
    private final HubValidator validator;
    private final CoverageTracker coverage = new CoverageTracker();
    private final CostModel costModel = new CostModel();
    private final ProgressTracker progressTracker;
    private final List<Worker> workers = new ArrayList<>();
    private final List<AutoCloseable> resources = new ArrayList<>();
    private final ScheduledExecutorService coordinator =
            Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("coordinator"));
    private final Lock controlLock = new ReentrantLock();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile State state = State.INITIALIZING;
    private volatile CrawlMode mode;
    private volatile RunReport report;
    private volatile int lastGapCount;
    private boolean started;

    public enum State {
        INITIALIZING, RUNNING, PAUSED, DRAINING, ABORTING, STOPPED
    }

    public Job(JobConfig config, HubStore store, @Nullable ProgressDAO progressDao, Gazetteer gazetteer,
               Fetcher fetcher, Telemetry telemetry) {
        this.config = config;
        this.store = store;
        this.gazetteer = gazetteer;
        this.fetcher = fetcher;
        this.telemetry = telemetry;
        this.mode = config.planner().mode();
        LimitsConfig limits = config.crawl().limits();
        this.frontier = new Frontier(config.planner().frontierCapacity(), config.crawl().delay(),
                limits == null ? null : limits.fetches(), telemetry);
        this.scorer = new PriorityScorer(config.planner());
        var library = new PredictionStrategyLibrary();
        var analyzers = new ArrayList<GapAnalyzer>();
        for (HubKind kind : config.planner().hubKinds()) {
            analyzers.add(GapAnalyzer.forKind(kind, gazetteer, library, config.planner().highImportance(),
                    config.planner().maxCandidatesPerCycle()));
        }
        this.planner = new Planner(
                List.of(new GazetteerReasoner(Set.copyOf(config.planner().hubKinds())), new CostEstimator(costModel)),
                analyzers, scorer, telemetry);
        this.learner = new PatternLearner(store, telemetry);
        this.validator = new HubValidator(fetcher, config.validation(), config.crawl());
        this.progressTracker = new ProgressTracker(progressDao, runId, config.planner().interval().multipliedBy(12));
    }

    /**
     * Opens a job backed by a SQLite database in the job directory, fetching over HTTP and logging telemetry.
     */
    public static Job open(Path jobDir, JobConfig config) throws IOException {
        Files.createDirectories(jobDir);
        Gazetteer gazetteer = config.gazetteer() == null ? FileGazetteer.loadBundled()
                : FileGazetteer.load(jobDir.resolve(config.gazetteer()));
        Database db = Database.open(jobDir.resolve(config.storage().path()));
        var telemetry = new Telemetry();
        telemetry.subscribe(new LoggingTelemetrySink());
        var job = new Job(config, new Storage(db), db.progress(), gazetteer,
                new HttpFetcher(config.crawl().userAgent()), telemetry);
        job.resources.add(db);
        job.resources.add(telemetry);
        return job;
    }

    /**
     * Runs the startup stages and starts the workers.
     *
     * @throws BadStateException   if the job was already started or aborted
     * @throws FatalCrawlException if a startup stage failed; the job is then STOPPED with status FAILED
     */
    public void start() throws BadStateException, FatalCrawlException {
        controlLock.lock();
        try {
            if (started) throw new BadStateException("Job already started, state is " + state);
            if (state != State.INITIALIZING) throw new BadStateException("Can only start an INITIALIZING job");
            started = true;
            log.atInfo().addKeyValue("runId", runId)
                    .addKeyValue("domains", config.domains().size())
                    .addKeyValue("mode", mode.label())
                    .log("Starting job");

            String stage = "storage-check";
            try {
                store.check();
                stageReached(stage);

                stage = "gazetteer-check";
                checkGazetteer();
                stageReached(stage);

                stage = "coverage-loaded";
                for (DomainConfig domain : config.domains()) {
                    coverage.load(domain.host(), store.getCoverageSnapshot(domain.host()));
                }
                stageReached(stage);

                stage = "workers-started";
                for (int i = 0; i < config.crawl().workers(); i++) {
                    workers.add(new Worker(String.valueOf(i), frontier, validator, fetcher,
                            config.crawl().fetchTimeout(), this::submitOutcome, this::limitReached));
                }
                for (Worker worker : workers) {
                    worker.start();
                }
                stageReached(stage);
            } catch (RuntimeException e) {
                failStartup(stage, e);
                throw new FatalCrawlException(stage, e);
            }

            state = State.RUNNING;
            emitLifecycle("running", Map.of());
            progressTracker.startSession();
            long intervalMs = Math.max(1, config.planner().interval().toMillis());
            coordinator.scheduleWithFixedDelay(this::planningCycle, 0, intervalMs, TimeUnit.MILLISECONDS);
            LimitsConfig limits = config.crawl().limits();
            if (limits != null && limits.time() != null) {
                coordinator.schedule(() -> beginDrain("time limit reached"), limits.time().toMillis(),
                        TimeUnit.MILLISECONDS);
            }
        } finally {
            controlLock.unlock();
        }
    }

    private void checkGazetteer() {
        var hintSets = new ArrayList<List<String>>();
        for (DomainConfig domain : config.domains()) hintSets.add(domain.hints());
        if (hintSets.isEmpty()) hintSets.add(List.of());
        boolean usable = false;
        for (EntityKind kind : EntityKind.values()) {
            for (List<String> hints : hintSets) {
                if (!gazetteer.listEntities(kind, hints).isEmpty()) usable = true;
            }
        }
        if (!usable) throw new IllegalStateException("Gazetteer has no entities for any configured domain");

        int countries = gazetteer.listEntities(EntityKind.COUNTRY, List.of()).size();
        int topics = gazetteer.listEntities(EntityKind.TOPIC, List.of()).size();
        if (countries == 0 || topics == 0) {
            log.warn("Gazetteer has {} countries and {} topics, seed lists will be used", countries, topics);
        }
    }

    private void stageReached(String stage) {
        log.info("Startup stage {} done", stage);
        emitLifecycle(stage, Map.of());
    }

    private void failStartup(String stage, RuntimeException e) {
        log.atError().addKeyValue("runId", runId).addKeyValue("stage", stage).setCause(e)
                .log("Startup failed");
        for (Worker worker : workers) {
            worker.closeAsync();
        }
        coordinator.shutdownNow();
        state = State.STOPPED;
        report = new RunReport(runId, RunReport.Status.FAILED, progressTracker.current(), 0);
        emitLifecycle("failed", Map.of("failedStage", stage, "error", String.valueOf(e.getMessage())));
        stopped.countDown();
    }

    private void emitLifecycle(String stage, Map<String, Object> attributes) {
        var attrs = new LinkedHashMap<String, Object>(attributes);
        attrs.put("stage", stage);
        attrs.put("runId", runId);
        attrs.put("state", state.name());
        telemetry.emit(EventType.LIFECYCLE_STAGE_CHANGED, null, attrs);
    }

    private PredictionContext context(DomainConfig site) {
        Map<HubKind, List<LearnedPattern>> patterns = new EnumMap<>(HubKind.class);
        for (HubKind kind : config.planner().hubKinds()) {
            patterns.put(kind, store.getLearnedPatterns(site.host(), kind));
        }
        return new PredictionContext(site, gazetteer, patterns, coverage.snapshot(site.host()), frontier.knownUrls(),
                frontier.pendingTargets(), config.planner().minPatternSuccesses());
    }

    private void planningCycle() {
        try {
            plan();
        } catch (RuntimeException e) {
            log.error("Planning cycle failed", e);
        }
    }

    private void plan() {
        if (state != State.RUNNING) return;
        int room = Math.min(config.planner().batchSize(), config.planner().frontierCapacity() - frontier.size());
        if (room <= 0) return;
        var contexts = new ArrayList<PredictionContext>();
        for (DomainConfig domain : config.domains()) {
            contexts.add(context(domain));
        }
        PlanResult plan = planner.plan(contexts, mode, progressTracker.current().isGapEmphasis(), room);
        lastGapCount = plan.gapCount();
        int admitted = 0;
        for (ScoredCandidate scored : plan.candidates()) {
            if (frontier.offer(scored)) {
                admitted++;
                HubTarget target = scored.candidate().target();
                if (target != null) progressTracker.proposed(target);
            }
        }
        log.atDebug().addKeyValue("admitted", admitted)
                .addKeyValue("gaps", plan.gapCount())
                .addKeyValue("warnings", plan.warnings().size())
                .addKeyValue("queued", frontier.size())
                .log("Planned");
        if (admitted == 0 && frontier.isIdle()) {
            beginDrain("no more candidates");
        }
    }

    private void submitOutcome(WorkOutcome outcome) {
        try {
            coordinator.execute(() -> processOutcome(outcome));
        } catch (RejectedExecutionException e) {
            log.atDebug().addKeyValue("url", outcome.candidate().url()).log("Discarding outcome, job has stopped");
        }
    }

    private void limitReached(CrawlLimitException e) {
        try {
            coordinator.execute(() -> beginDrain(e.getMessage()));
        } catch (RejectedExecutionException rejected) {
            log.debug("Ignoring {}, job has stopped", e.getMessage());
        }
    }

    private void processOutcome(WorkOutcome outcome) {
        if (state == State.ABORTING || state == State.STOPPED) {
            log.atDebug().addKeyValue("url", outcome.candidate().url()).log("Discarding outcome after abort");
            return;
        }
        try {
            handleOutcome(outcome);
        } catch (RuntimeException e) {
            log.atError().addKeyValue("url", outcome.candidate().url()).setCause(e)
                    .log("Failed to process outcome");
        } finally {
            frontier.complete(outcome.candidate());
        }

        if (state == State.DRAINING) {
            if (frontier.inFlight() == 0) finish(completionStatus());
        } else if (frontier.size() < config.planner().batchSize()) {
            plan();
        }
    }

    private void handleOutcome(WorkOutcome outcome) {
        Candidate candidate = outcome.candidate();
        String domain = candidate.host().toLowerCase(Locale.ROOT);
        progressTracker.fetched();
        if (outcome.durationMs() > 0) costModel.record(domain, outcome.durationMs());
        if (outcome.error() != null) {
            log.atWarn().addKeyValue("url", candidate.url()).log("Candidate failed: {}", outcome.error());
            return;
        }
        ValidationResult result = outcome.validation();
        if (result == null) return;

        HubTarget target = Objects.requireNonNull(candidate.target());
        store.putHubRecord(HubRecord.from(result, domain, Instant.now()));
        progressTracker.validated(result);

        var attributes = new LinkedHashMap<String, Object>();
        attributes.put("url", candidate.url().toString());
        attributes.put("target", target.key());
        attributes.put("strategy", candidate.strategy() == null ? "" : candidate.strategy().label());
        attributes.put("reason", result.reason());
        attributes.put("retries", result.retries());

        switch (result.verdict()) {
            case CONFIRMED -> {
                attributes.put("articles", result.articleUrls().size());
                telemetry.emit(EventType.HUB_CONFIRMED, domain, attributes);
                if (coverage.confirm(domain, target, candidate.url())) {
                    telemetry.emit(EventType.GAP_FILLED, domain, Map.of(
                            "target", target.key(),
                            "kind", target.kind().label(),
                            "url", candidate.url().toString(),
                            "covered", coverage.covered(domain)));
                }
                learner.observe(domain, target, candidate.url(), result.verdict(), result.articleUrls().size());
                if (config.planner().followArticles()) followArticles(result);
            }
            case REJECTED -> {
                telemetry.emit(EventType.HUB_REJECTED, domain, attributes);
                learner.observe(domain, target, candidate.url(), result.verdict(), 0);
            }
            case INCONCLUSIVE -> {
                attributes.put("transient", result.transientFailure());
                telemetry.emit(EventType.HUB_INCONCLUSIVE, domain, attributes);
                learner.observe(domain, target, candidate.url(), result.verdict(), 0);
            }
        }
    }

    private void followArticles(ValidationResult result) {
        boolean gapEmphasis = progressTracker.current().isGapEmphasis();
        int queued = 0;
        for (Url articleUrl : result.articleUrls()) {
            if (!articleUrl.sameHost(result.candidate().url())) continue;
            Candidate article = Candidate.article(articleUrl.normalize())
                    .withEstimatedCost(costModel.estimate(articleUrl.host()));
            if (frontier.offer(new ScoredCandidate(article, scorer.score(article, mode, gapEmphasis)))) queued++;
        }
        log.atDebug().addKeyValue("hub", result.candidate().url()).addKeyValue("queued", queued)
                .log("Queued articles from hub");
    }

    private RunReport.Status completionStatus() {
        return progressTracker.transientFailures() > 0 ? RunReport.Status.COMPLETED_WITH_GAPS
                : RunReport.Status.COMPLETED;
    }

    /**
     * Stops dispatching new work and finishes once in-flight work is done. Runs on the coordinator.
     */
    private void beginDrain(String reason) {
        controlLock.lock();
        try {
            if (state != State.RUNNING && state != State.PAUSED) return;
            state = State.DRAINING;
        } finally {
            controlLock.unlock();
        }
        log.info("Draining job: {}", reason);
        emitLifecycle("draining", Map.of("reason", reason));
        frontier.close();
        for (Worker worker : workers()) {
            worker.closeAsyncGraceful();
        }
        if (frontier.inFlight() == 0) finish(completionStatus());
    }

    private void finish(RunReport.Status status) {
        RunReport finalReport;
        controlLock.lock();
        try {
            if (state == State.STOPPED) return;
            coordinator.shutdown();
            progressTracker.stopSession();
            state = State.STOPPED;
            finalReport = new RunReport(runId, status, progressTracker.current(), lastGapCount);
            report = finalReport;
        } finally {
            controlLock.unlock();
        }
        Progress progress = finalReport.progress();
        log.atInfo().addKeyValue("runId", runId)
                .addKeyValue("status", status)
                .addKeyValue("confirmed", progress.confirmed())
                .addKeyValue("rejected", progress.rejected())
                .addKeyValue("inconclusive", progress.inconclusive())
                .addKeyValue("remainingGaps", finalReport.remainingGaps())
                .log("Job stopped");
        emitLifecycle("stopped", Map.of("status", status.name()));
        stopped.countDown();
    }

    /**
     * Stops dispatching until {@link #resume()}. In-flight work still completes.
     *
     * @return false if the job wasn't running
     */
    public boolean pause() {
        controlLock.lock();
        try {
            if (state != State.RUNNING) return false;
            state = State.PAUSED;
            frontier.pause();
        } finally {
            controlLock.unlock();
        }
        log.info("Job paused");
        emitLifecycle("paused", Map.of());
        return true;
    }

    /**
     * @return false if the job wasn't paused
     */
    public boolean resume() {
        controlLock.lock();
        try {
            if (state != State.PAUSED) return false;
            state = State.RUNNING;
            frontier.resume();
        } finally {
            controlLock.unlock();
        }
        log.info("Job resumed");
        emitLifecycle("resumed", Map.of());
        try {
            coordinator.execute(this::planningCycle);
        } catch (RejectedExecutionException e) {
            log.debug("Not planning after resume, job has stopped");
        }
        return true;
    }

    /**
     * Switches crawl mode and re-scores the queued candidates.
     *
     * @return false if the mode was already set or the job is stopping
     */
    public boolean setMode(CrawlMode newMode) {
        Objects.requireNonNull(newMode, "mode");
        controlLock.lock();
        try {
            if (state == State.ABORTING || state == State.STOPPED || newMode == mode) return false;
            mode = newMode;
            rescore();
        } finally {
            controlLock.unlock();
        }
        log.info("Crawl mode set to {}", newMode.label());
        emitLifecycle("mode-changed", Map.of("mode", newMode.label()));
        try {
            // a planning cycle already running may have scored with the old mode
            coordinator.execute(this::rescore);
        } catch (RejectedExecutionException e) {
            log.debug("Not re-scoring on the coordinator, job has stopped");
        }
        return true;
    }

    private void rescore() {
        CrawlMode current = mode;
        boolean gapEmphasis = progressTracker.current().isGapEmphasis();
        frontier.rescore(candidate -> scorer.score(candidate, current, gapEmphasis));
    }

    /**
     * Drops all queued work, interrupts the workers and stops once they have exited. Outcomes arriving after this
     * call are discarded.
     *
     * @return false if the job was already aborting or stopped
     */
    public boolean abort() {
        int discarded;
        controlLock.lock();
        try {
            if (state == State.ABORTING || state == State.STOPPED) return false;
            state = State.ABORTING;
            discarded = frontier.abort();
        } finally {
            controlLock.unlock();
        }
        log.atInfo().addKeyValue("discarded", discarded).log("Aborting job");
        emitLifecycle("aborting", Map.of("discarded", discarded));
        List<Worker> workers = workers();
        for (Worker worker : workers) {
            worker.closeAsync();
        }
        if (workers.isEmpty()) {
            finish(RunReport.Status.ABORTED);
        } else {
            new NamedThreadFactory("reaper").newThread(() -> {
                try {
                    for (Worker worker : workers) {
                        if (!worker.join(WORKER_JOIN_TIMEOUT)) {
                            log.warn("Worker {} did not exit within {}", worker.id, WORKER_JOIN_TIMEOUT);
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for workers to exit");
                } finally {
                    finish(RunReport.Status.ABORTED);
                }
            }).start();
        }
        return true;
    }

    /**
     * Waits for the job to stop.
     *
     * @return the final report, or null if the timeout elapsed first
     */
    public @Nullable RunReport awaitStop(Duration timeout) throws InterruptedException {
        if (!stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) return null;
        return report;
    }

    @Override
    public void close() {
        abort();
        try {
            if (awaitStop(WORKER_JOIN_TIMEOUT) == null) {
                log.warn("Job did not stop within {}", WORKER_JOIN_TIMEOUT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        progressTracker.close();
        coordinator.shutdownNow();
        for (int i = resources.size() - 1; i >= 0; i--) {
            try {
                resources.get(i).close();
            } catch (Exception e) {
                log.error("Failed to close {}", resources.get(i).getClass().getSimpleName(), e);
            }
        }
    }

    private List<Worker> workers() {
        controlLock.lock();
        try {
            return new ArrayList<>(workers);
        } finally {
            controlLock.unlock();
        }
    }

    public String runId() {
        return runId;
    }

    public State state() {
        return state;
    }

    public CrawlMode mode() {
        return mode;
    }

    public JobConfig config() {
        return config;
    }

    public Frontier frontier() {
        return frontier;
    }

    public Progress progress() {
        return progressTracker.current();
    }

    public Map<String, Url> coverage(String domain) {
        return coverage.snapshot(domain);
    }

    public @Nullable RunReport report() {
        return report;
    }

    public static class BadStateException extends Exception {
        public BadStateException(String message) {
            super(message);
        }
    }
}
