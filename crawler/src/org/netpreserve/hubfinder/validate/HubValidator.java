package org.netpreserve.hubfinder.validate;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.Candidate;
import org.netpreserve.hubfinder.HubTarget;
import org.netpreserve.hubfinder.config.CrawlConfig;
import org.netpreserve.hubfinder.config.ValidationConfig;
import org.netpreserve.hubfinder.fetch.FetchException;
import org.netpreserve.hubfinder.fetch.FetchResult;
import org.netpreserve.hubfinder.fetch.Fetcher;
import org.netpreserve.hubfinder.gazetteer.Entity;
import org.netpreserve.hubfinder.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import static org.netpreserve.hubfinder.validate.ValidationState.*;

/**
 * Decides whether a fetched candidate URL is a hub page for its target.
 * <p>
 * Pages come from the per-run cache when possible. Transient failures (timeouts, 408, 429, 5xx) are retried with
 * exponential backoff and end INCONCLUSIVE when retries run out. Ambiguous pages get one re-check that bypasses the
 * cache and are REJECTED if still ambiguous.
 */
public class HubValidator {
    private static final Logger log = LoggerFactory.getLogger(HubValidator.class);
    private final Fetcher fetcher;
    private final ContentCache cache;
    private final ContentAnalyzer analyzer;
    private final ValidationConfig config;
    private final Duration fetchTimeout;
    private final int maxRetries;
    private final Duration retryBackoff;

    public HubValidator(Fetcher fetcher, ValidationConfig config, CrawlConfig crawlConfig) {
        this(fetcher, new ContentCache(config.cacheSize()), new ContentAnalyzer(), config,
                crawlConfig.fetchTimeout(), crawlConfig.maxRetries(), crawlConfig.retryBackoff());
    }

    public HubValidator(Fetcher fetcher, ContentCache cache, ContentAnalyzer analyzer, ValidationConfig config,
                        Duration fetchTimeout, int maxRetries, Duration retryBackoff) {
        this.fetcher = fetcher;
        this.cache = cache;
        this.analyzer = analyzer;
        this.config = config;
        this.fetchTimeout = fetchTimeout;
        this.maxRetries = maxRetries;
        this.retryBackoff = retryBackoff;
    }

    public ValidationResult validate(Candidate candidate) throws InterruptedException {
        HubTarget target = Objects.requireNonNull(candidate.target(), "not a hub candidate");
        var validation = new HubValidation();
        boolean bypassCache = false;
        int attempts = 0;
        long fetchMs = 0;
        while (true) {
            Fetched fetched = fetch(candidate.url(), bypassCache);
            attempts += fetched.attempts();
            fetchMs += fetched.durationMs();

            Judgement judgement;
            if (fetched.error() != null) {
                judgement = judgeError(fetched.error());
            } else {
                validation.transition(FETCHED);
                judgement = judge(candidate.url(), target, fetched.result(), fetched.fromCache());
            }

            switch (judgement.outcome()) {
                case CONFIRMED -> {
                    validation.transition(CONFIRMED);
                    return result(candidate, Verdict.CONFIRMED, judgement, attempts, fetchMs, false, validation);
                }
                case REJECTED -> {
                    validation.transition(REJECTED);
                    return result(candidate, Verdict.REJECTED, judgement, attempts, fetchMs, false, validation);
                }
                case TRANSIENT -> {
                    validation.transition(INCONCLUSIVE);
                    return result(candidate, Verdict.INCONCLUSIVE, judgement, attempts, fetchMs, true, validation);
                }
                case AMBIGUOUS -> {
                    validation.transition(INCONCLUSIVE);
                    if (validation.canRecheck()) {
                        log.atDebug().addKeyValue("url", candidate.url())
                                .addKeyValue("reason", judgement.evidence().reason())
                                .log("Inconclusive, re-checking after backoff");
                        Thread.sleep(config.inconclusiveBackoff().toMillis());
                        validation.recheck();
                        bypassCache = true;
                        continue;
                    }
                    validation.transition(REJECTED);
                    var settled = judgement.withReason("still inconclusive after re-check: " +
                                                       judgement.evidence().reason());
                    return result(candidate, Verdict.REJECTED, settled, attempts, fetchMs, false, validation);
                }
            }
        }
    }

    private ValidationResult result(Candidate candidate, Verdict verdict, Judgement judgement, int attempts,
                                    long fetchMs, boolean transientFailure, HubValidation validation) {
        log.atInfo().addKeyValue("url", candidate.url())
                .addKeyValue("target", candidate.target())
                .addKeyValue("verdict", verdict)
                .addKeyValue("reason", judgement.evidence().reason())
                .addKeyValue("attempts", attempts)
                .log("Validated candidate");
        List<Url> articles = verdict == Verdict.CONFIRMED ? judgement.articles() : List.of();
        return new ValidationResult(candidate, verdict, judgement.evidence(), articles, attempts, fetchMs,
                transientFailure, validation.history());
    }

    private Fetched fetch(Url url, boolean bypassCache) throws InterruptedException {
        if (!bypassCache) {
            FetchResult cached = cache.get(url);
            if (cached != null) return new Fetched(cached, null, true, 0, 0);
        }
        int attempt = 0;
        long durationMs = 0;
        while (true) {
            attempt++;
            try {
                FetchResult result = fetcher.fetch(url, fetchTimeout);
                durationMs += result.fetchDurationMs();
                if (isTransientStatus(result.status())) {
                    if (attempt <= maxRetries) {
                        backoff(url, attempt, "HTTP " + result.status());
                        continue;
                    }
                } else {
                    cache.put(url, result);
                }
                return new Fetched(result, null, false, attempt, durationMs);
            } catch (FetchException e) {
                if (e.isTransient() && attempt <= maxRetries) {
                    backoff(url, attempt, e.getMessage());
                    continue;
                }
                return new Fetched(null, e, false, attempt, durationMs);
            }
        }
    }

    private void backoff(Url url, int attempt, String reason) throws InterruptedException {
        long delay = retryBackoff.toMillis() << (attempt - 1);
        log.atDebug().addKeyValue("url", url)
                .addKeyValue("attempt", attempt)
                .addKeyValue("delayMs", delay)
                .log("Transient failure ({}), retrying", reason);
        Thread.sleep(delay);
    }

    static boolean isTransientStatus(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    private static Judgement judgeError(FetchException e) {
        return switch (e.kind()) {
            case STRUCTURAL -> Judgement.of(Outcome.REJECTED, Evidence.of("fetch failed: " + e.getMessage()));
            case TRANSIENT -> Judgement.of(Outcome.TRANSIENT, Evidence.of("retries exhausted: " + e.getMessage()));
            case REDIRECT_LOOP -> Judgement.of(Outcome.AMBIGUOUS, Evidence.of("redirect loop"));
        };
    }

    private Judgement judge(Url url, HubTarget target, FetchResult result, boolean fromCache) {
        int status = result.status();
        String finalUrl = result.finalUrl().toString();
        if (isTransientStatus(status)) {
            return Judgement.of(Outcome.TRANSIENT,
                    Evidence.of(status, finalUrl, fromCache, "retries exhausted: HTTP " + status));
        }
        if (!result.isSuccess()) {
            return Judgement.of(Outcome.REJECTED, Evidence.of(status, finalUrl, fromCache, "HTTP " + status));
        }
        if (result.isRedirected() && result.finalUrl().isRoot()) {
            return Judgement.of(Outcome.REJECTED,
                    Evidence.of(status, finalUrl, fromCache, "redirected to site root"));
        }
        if (result.body().length == 0 || !result.isHtml()) {
            return Judgement.of(Outcome.AMBIGUOUS,
                    Evidence.of(status, finalUrl, fromCache, "empty or non-HTML response"));
        }

        Url checkedUrl = result.finalUrl().sameHost(url) ? result.finalUrl() : url;
        String structureProblem = UrlStructureCheck.rejectReason(checkedUrl);
        PageMetrics metrics = analyzer.analyze(result.finalUrl(), result.bodyAsString());

        Map<String, Boolean> entityChecks = new LinkedHashMap<>();
        boolean allEntitiesMatch = true;
        for (Entity entity : target.entities()) {
            boolean matches = UrlStructureCheck.matchesEntity(checkedUrl, entity) || mentions(metrics, entity);
            entityChecks.put(entity.id(), matches);
            allEntitiesMatch &= matches;
        }

        boolean dated = UrlStructureCheck.isDated(checkedUrl);
        var evidence = new Evidence(status, finalUrl, metrics.title(), metrics.linkCount(), metrics.navLinkCount(),
                metrics.articleLinks().size(), metrics.articlePage(), dated, entityChecks, fromCache, "");

        if (structureProblem != null) {
            return Judgement.of(Outcome.REJECTED, evidence.withReason("URL structure: " + structureProblem));
        }
        if (metrics.articlePage()) {
            return Judgement.of(Outcome.REJECTED, evidence.withReason("single article page"));
        }
        if (!allEntitiesMatch) {
            return Judgement.of(Outcome.REJECTED, evidence.withReason("page does not name " +
                    String.join(" and ", entityChecks.entrySet().stream()
                            .filter(entry -> !entry.getValue()).map(Map.Entry::getKey).toList())));
        }
        if (metrics.articleLinks().size() >= config.minArticleLinks()
            && metrics.navLinkCount() >= config.minNavLinks()) {
            return new Judgement(Outcome.CONFIRMED, evidence.withReason("hub structure"), metrics.articleLinks());
        }
        return Judgement.of(Outcome.AMBIGUOUS, evidence.withReason("too few article or navigation links"));
    }

    private static boolean mentions(PageMetrics metrics, Entity entity) {
        var text = new StringBuilder(metrics.title() == null ? "" : metrics.title());
        for (String heading : metrics.headings()) text.append(' ').append(heading);
        String haystack = text.toString().toLowerCase(Locale.ROOT);
        for (String name : entity.names()) {
            if (containsWord(haystack, name)) return true;
        }
        return false;
    }

    /**
     * True if {@code name} occurs in {@code text} not directly preceded or followed by a letter or digit, so
     * "india" is found in "India news" but not in "Indiana".
     */
    static boolean containsWord(String text, String name) {
        if (name.isEmpty()) return false;
        int from = 0;
        while (true) {
            int i = text.indexOf(name, from);
            if (i == -1) return false;
            int end = i + name.length();
            boolean startsWord = i == 0 || !Character.isLetterOrDigit(text.codePointBefore(i));
            boolean endsWord = end == text.length() || !Character.isLetterOrDigit(text.codePointAt(end));
            if (startsWord && endsWord) return true;
            from = i + 1;
        }
    }

    private enum Outcome {
        CONFIRMED, REJECTED, TRANSIENT, AMBIGUOUS
    }

    private record Judgement(Outcome outcome, Evidence evidence, List<Url> articles) {
        static Judgement of(Outcome outcome, Evidence evidence) {
            return new Judgement(outcome, evidence, List.of());
        }

        Judgement withReason(String reason) {
            return new Judgement(outcome, evidence.withReason(reason), articles);
        }
    }

    private record Fetched(@Nullable FetchResult result, @Nullable FetchException error, boolean fromCache,
                           int attempts, long durationMs) {
    }
}
