package org.netpreserve.hubfinder.validate;

import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * What the validator saw when it reached its verdict. Stored as JSON on the hub record.
 *
 * @param status           HTTP status, null if the fetch failed
 * @param finalUrl         URL after redirects
 * @param title            page title
 * @param linkCount        same-site links on the page
 * @param navLinkCount     links inside navigation elements
 * @param articleLinkCount distinct article-shaped links
 * @param articlePage      page itself looks like a single article
 * @param datedUrl         URL path contains a date
 * @param entityChecks     per entity id, whether the URL or title names it
 * @param fromCache        page came from the per-run cache
 * @param reason           short explanation of the verdict
 */
public record Evidence(
        @Nullable Integer status,
        @Nullable String finalUrl,
        @Nullable String title,
        int linkCount,
        int navLinkCount,
        int articleLinkCount,
        boolean articlePage,
        boolean datedUrl,
        Map<String, Boolean> entityChecks,
        boolean fromCache,
        String reason) {

    public Evidence {
        entityChecks = entityChecks == null ? Map.of() : Map.copyOf(entityChecks);
    }

    public static Evidence of(String reason) {
        return new Evidence(null, null, null, 0, 0, 0, false, false, Map.of(), false, reason);
    }

    public static Evidence of(@Nullable Integer status, @Nullable String finalUrl, boolean fromCache, String reason) {
        return new Evidence(status, finalUrl, null, 0, 0, 0, false, false, Map.of(), fromCache, reason);
    }

    public Evidence withReason(String reason) {
        return new Evidence(status, finalUrl, title, linkCount, navLinkCount, articleLinkCount, articlePage, datedUrl,
                entityChecks, fromCache, reason);
    }
}
