package org.netpreserve.hubfinder.gazetteer;

import com.fasterxml.jackson.annotation.JsonCreator;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.util.Slugs;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A place or topic from the reference gazetteer.
 *
 * @param kind       what sort of entity this is
 * @param id         stable identifier, for countries the ISO 3166 alpha-2 code
 * @param name       display name
 * @param importance ranking weight, higher is more important; 0 means unranked
 * @param parentId   the enclosing place (country of a region, region or country of a city)
 * @param aliases    alternative names ("uk" for the United Kingdom)
 */
public record Entity(
        EntityKind kind,
        String id,
        String name,
        int importance,
        @Nullable String parentId,
        List<String> aliases) {

    @JsonCreator
    public Entity {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public Entity(EntityKind kind, String id, String name, int importance) {
        this(kind, id, name, importance, null, List.of());
    }

    public String slug() {
        return Slugs.slugify(name);
    }

    public String code() {
        return id.toLowerCase(Locale.ROOT);
    }

    /**
     * The path-segment spellings this entity may appear under: its slug, alias slugs and for countries its code.
     */
    public List<String> variants() {
        var variants = new ArrayList<String>();
        variants.add(slug());
        for (String alias : aliases) {
            String slug = Slugs.slugify(alias);
            if (!slug.isEmpty() && !variants.contains(slug)) variants.add(slug);
        }
        if (kind == EntityKind.COUNTRY && !variants.contains(code())) variants.add(code());
        return variants;
    }

    /**
     * Names to look for in page text: the display name and aliases, lower-cased.
     */
    public List<String> names() {
        var names = new ArrayList<String>();
        names.add(name.toLowerCase(Locale.ROOT));
        for (String alias : aliases) {
            String lower = alias.toLowerCase(Locale.ROOT);
            if (!names.contains(lower)) names.add(lower);
        }
        return names;
    }
}
