package org.netpreserve.hubfinder.validate;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.gazetteer.Entity;
import org.netpreserve.hubfinder.util.Url;

import java.util.List;
import java.util.regex.Pattern;

/**
 * URL-only heuristics for telling hub pages from articles.
 */
public final class UrlStructureCheck {
    static final int MAX_DEPTH = 5;
    static final int ARTICLE_SLUG_WORDS = 5;
    private static final Pattern DATED = Pattern.compile(
            "/(19|20)\\d{2}/(0?[1-9]|1[0-2])(/|$)|(19|20)\\d{2}-(0[1-9]|1[0-2])-[0-3]\\d");
    private static final Pattern ARTICLE_EXTENSION = Pattern.compile("\\.(s?html?|php|aspx?|jsp)$");
    private static final Pattern NUMERIC_ID = Pattern.compile("(^|[-_.])\\d{5,}$");

    private UrlStructureCheck() {
    }

    public static boolean isDated(Url url) {
        return DATED.matcher(url.path()).find();
    }

    /**
     * Returns why the URL can't be a hub, or null if its shape is acceptable.
     */
    public static @Nullable String rejectReason(Url url) {
        List<String> segments = url.pathSegments();
        if (segments.isEmpty()) return "site root";
        if (isDated(url)) return "dated path";
        if (segments.size() > MAX_DEPTH) return "path deeper than " + MAX_DEPTH;
        if (ARTICLE_EXTENSION.matcher(segments.get(segments.size() - 1)).find()) return "article file extension";
        return null;
    }

    /**
     * Dated paths, long hyphenated slugs and trailing numeric ids are typical of article URLs.
     */
    public static boolean looksLikeArticle(Url url) {
        List<String> segments = url.pathSegments();
        if (segments.isEmpty()) return false;
        if (isDated(url)) return true;
        String last = segments.get(segments.size() - 1);
        if (NUMERIC_ID.matcher(last).find()) return true;
        String stem = ARTICLE_EXTENSION.matcher(last).replaceFirst("");
        return stem.split("-").length >= ARTICLE_SLUG_WORDS;
    }

    /**
     * True if some path segment is one of the entity's variants, alone or as a hyphenated part.
     */
    public static boolean matchesEntity(Url url, Entity entity) {
        for (String segment : url.pathSegments()) {
            for (String variant : entity.variants()) {
                if (segment.equals(variant)
                    || segment.startsWith(variant + "-")
                    || segment.endsWith("-" + variant)
                    || segment.contains("-" + variant + "-")) {
                    return true;
                }
            }
        }
        return false;
    }
}
