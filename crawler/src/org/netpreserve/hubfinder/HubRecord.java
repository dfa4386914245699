package org.netpreserve.hubfinder;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.util.Url;
import org.netpreserve.hubfinder.validate.Evidence;
import org.netpreserve.hubfinder.validate.ValidationResult;
import org.netpreserve.hubfinder.validate.Verdict;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The stored outcome of validating one URL.
 *
 * @param url         normalized URL
 * @param domain      host the URL belongs to
 * @param kind        hub kind the URL was validated as
 * @param targetKey   coverage key of the target
 * @param entityIds   ids of the target's entities
 * @param verdict     latest verdict
 * @param articleUrls article links found on the page across all visits
 * @param visitedAt   time of the latest visit
 * @param evidence    what the latest verdict is based on
 */
public record HubRecord(
        Url url,
        String domain,
        HubKind kind,
        String targetKey,
        List<String> entityIds,
        Verdict verdict,
        Set<String> articleUrls,
        Instant visitedAt,
        @Nullable Evidence evidence) {

    public HubRecord {
        entityIds = entityIds == null ? List.of() : List.copyOf(entityIds);
        articleUrls = articleUrls == null ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(articleUrls));
    }

    public static HubRecord from(ValidationResult result, String domain, Instant visitedAt) {
        HubTarget target = result.candidate().target();
        if (target == null) throw new IllegalArgumentException("not a hub candidate: " + result.candidate().url());
        var articles = new TreeSet<String>();
        for (Url article : result.articleUrls()) articles.add(article.toString());
        return new HubRecord(result.candidate().url(), domain, target.kind(), target.key(),
                target.entities().stream().map(entity -> entity.id()).toList(), result.verdict(), articles,
                visitedAt, result.evidence());
    }

    /**
     * Combines a later visit into this record: the newer verdict and evidence win, article URLs accumulate.
     */
    public HubRecord merge(HubRecord newer) {
        var articles = new TreeSet<>(articleUrls);
        articles.addAll(newer.articleUrls);
        return new HubRecord(url, newer.domain, newer.kind, newer.targetKey, newer.entityIds, newer.verdict, articles,
                newer.visitedAt, newer.evidence);
    }
}
