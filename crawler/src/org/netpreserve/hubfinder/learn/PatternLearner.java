package org.netpreserve.hubfinder.learn;

import org.netpreserve.hubfinder.HubKind;
import org.netpreserve.hubfinder.HubStore;
import org.netpreserve.hubfinder.HubTarget;
import org.netpreserve.hubfinder.telemetry.EventType;
import org.netpreserve.hubfinder.telemetry.Telemetry;
import org.netpreserve.hubfinder.util.Url;
import org.netpreserve.hubfinder.validate.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns confirmed hubs into reusable URL templates.
 * <p>
 * Only called from the outcome-processing thread. Observing the same confirmed URL again changes nothing, and
 * rejections never weaken a pattern: they are only counted.
 */
public class PatternLearner {
    private static final Logger log = LoggerFactory.getLogger(PatternLearner.class);
    private final HubStore store;
    private final Telemetry telemetry;
    private final Clock clock;
    private final Map<String, Long> rejections = new HashMap<>();

    public PatternLearner(HubStore store, Telemetry telemetry) {
        this(store, telemetry, Clock.systemUTC());
    }

    public PatternLearner(HubStore store, Telemetry telemetry, Clock clock) {
        this.store = store;
        this.telemetry = telemetry;
        this.clock = clock;
    }

    public enum Observation {
        /** A new template was learned. */
        CREATED,
        /** An existing template gained a new supporting URL. */
        REINFORCED,
        /** The URL already supports its template. */
        UNCHANGED,
        /** Nothing to learn from this outcome. */
        IGNORED
    }

    public Observation observe(String domain, HubTarget target, Url url, Verdict verdict, int articleCount) {
        if (verdict != Verdict.CONFIRMED) {
            rejections.merge(domain + " " + target.kind().label(), 1L, Long::sum);
            return Observation.IGNORED;
        }

        String template = UrlTemplates.extract(url, target);
        if (template == null) {
            log.atDebug().addKeyValue("url", url).addKeyValue("target", target.key())
                    .log("Confirmed hub URL doesn't name its entities, nothing to learn");
            return Observation.IGNORED;
        }

        String urlKey = url.normalize().toString();
        List<LearnedPattern> existing = store.getLearnedPatterns(domain, target.kind());
        LearnedPattern previousBest = existing.isEmpty() ? null : existing.get(0);
        LearnedPattern current = null;
        for (LearnedPattern pattern : existing) {
            if (pattern.template().equals(template)) {
                current = pattern;
                break;
            }
        }
        if (current != null && current.supportedBy(urlKey)) return Observation.UNCHANGED;

        Instant now = clock.instant();
        LearnedPattern updated = current == null
                ? LearnedPattern.first(domain, target.kind(), template, urlKey, articleCount, now)
                : current.withConfirmation(urlKey, articleCount, now);
        store.putLearnedPattern(updated);

        log.atInfo().addKeyValue("domain", domain)
                .addKeyValue("kind", target.kind().label())
                .addKeyValue("template", template)
                .addKeyValue("successCount", updated.successCount())
                .log(current == null ? "Learned new hub pattern" : "Reinforced hub pattern");
        telemetry.emit(EventType.PATTERN_LEARNED, domain, Map.of(
                "kind", target.kind().label(),
                "template", template,
                "successCount", updated.successCount(),
                "averageYield", updated.averageYield(),
                "url", urlKey));

        if (previousBest != null && !previousBest.template().equals(template)
            && LearnedPattern.BEST_FIRST.compare(updated, previousBest) < 0) {
            log.atInfo().addKeyValue("domain", domain)
                    .addKeyValue("kind", target.kind().label())
                    .addKeyValue("template", template)
                    .addKeyValue("superseded", previousBest.template())
                    .addKeyValue("averageYield", updated.averageYield())
                    .log("Hub pattern superseded");
        }
        return current == null ? Observation.CREATED : Observation.REINFORCED;
    }

    /**
     * Non-confirmed outcomes seen this run for a domain and hub kind.
     */
    public long rejections(String domain, HubKind kind) {
        return rejections.getOrDefault(domain + " " + kind.label(), 0L);
    }
}
