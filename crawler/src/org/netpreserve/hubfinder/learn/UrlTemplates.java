package org.netpreserve.hubfinder.learn;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.HubKind;
import org.netpreserve.hubfinder.HubTarget;
import org.netpreserve.hubfinder.gazetteer.Entity;
import org.netpreserve.hubfinder.gazetteer.EntityKind;
import org.netpreserve.hubfinder.util.Url;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between concrete hub URLs and path templates.
 * <p>
 * Placeholders: {@code {slug}} and {@code {code}} stand for the entity of a single-entity hub,
 * {@code {primary}}, {@code {primary-code}} and {@code {secondary}} for the two entities of a composite hub.
 */
public final class UrlTemplates {
    public static final String SLUG = "{slug}";
    public static final String CODE = "{code}";
    public static final String PRIMARY = "{primary}";
    public static final String PRIMARY_CODE = "{primary-code}";
    public static final String SECONDARY = "{secondary}";

    private UrlTemplates() {
    }

    /**
     * Replaces the path segments naming the target's entities with placeholders. Returns null if the URL path
     * doesn't mention every entity of the target.
     */
    public static @Nullable String extract(Url url, HubTarget target) {
        List<String> segments = url.pathSegments();
        if (segments.isEmpty()) return null;
        var result = new ArrayList<>(segments);
        if (!target.kind().isComposite()) {
            int i = lastMatch(segments, target.primary(), -1);
            if (i < 0) return null;
            result.set(i, placeholderFor(segments.get(i), target.primary(), SLUG, CODE));
            return join(result);
        }

        Entity primary = target.primary();
        Entity secondary = target.secondary();
        if (target.kind() == HubKind.CROSS_PLACE) {
            for (int i = segments.size() - 1; i >= 0; i--) {
                if (isPairSegment(segments.get(i), primary, secondary)) {
                    result.set(i, PRIMARY + "-" + SECONDARY);
                    return join(result);
                }
            }
        }
        int j = lastMatch(segments, secondary, -1);
        if (j < 0) return null;
        int i = lastMatch(segments, primary, j);
        if (i < 0) return null;
        result.set(j, SECONDARY);
        result.set(i, placeholderFor(segments.get(i), primary, PRIMARY, PRIMARY_CODE));
        return join(result);
    }

    /**
     * Fills in the placeholders for a target. Returns null if the template doesn't fit the target's shape.
     */
    public static @Nullable String expand(String template, HubTarget target) {
        boolean composite = template.contains(PRIMARY) || template.contains(SECONDARY);
        if (composite != target.kind().isComposite()) return null;
        Entity primary = target.primary();
        String path = template;
        if (composite) {
            if (path.contains(PRIMARY_CODE)) {
                if (primary.kind() != EntityKind.COUNTRY) return null;
                path = path.replace(PRIMARY_CODE, primary.code());
            }
            path = path.replace(PRIMARY, primary.slug()).replace(SECONDARY, target.secondary().slug());
        } else {
            if (path.contains(CODE)) {
                if (primary.kind() != EntityKind.COUNTRY) return null;
                path = path.replace(CODE, primary.code());
            }
            path = path.replace(SLUG, primary.slug());
        }
        return path.contains("{") ? null : path;
    }

    private static int lastMatch(List<String> segments, Entity entity, int skip) {
        List<String> variants = entity.variants();
        for (int i = segments.size() - 1; i >= 0; i--) {
            if (i == skip) continue;
            if (variants.contains(segments.get(i))) return i;
        }
        return -1;
    }

    private static boolean isPairSegment(String segment, Entity first, Entity second) {
        for (String a : first.variants()) {
            for (String b : second.variants()) {
                if (segment.equals(a + "-" + b)) return true;
            }
        }
        return false;
    }

    private static String placeholderFor(String segment, Entity entity, String slugPlaceholder,
                                         String codePlaceholder) {
        if (entity.kind() == EntityKind.COUNTRY && segment.equals(entity.code()) && !segment.equals(entity.slug())) {
            return codePlaceholder;
        }
        return slugPlaceholder;
    }

    private static String join(List<String> segments) {
        return "/" + String.join("/", segments);
    }
}
