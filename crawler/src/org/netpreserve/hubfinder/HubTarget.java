package org.netpreserve.hubfinder;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.gazetteer.Entity;

import java.util.List;
import java.util.Objects;

/**
 * The entity, or ordered pair of entities, a hub page is about.
 *
 * @param kind      the hub kind
 * @param primary   the place (or topic) for single hubs; the place for place+topic, the parent for hierarchical
 *                  hubs and the first place for cross-place hubs
 * @param secondary the topic, child place or second place of a composite hub
 */
public record HubTarget(HubKind kind, Entity primary, @Nullable Entity secondary) {
    public HubTarget {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(primary, "primary");
        if (kind.isComposite() && secondary == null) {
            throw new IllegalArgumentException(kind.label() + " needs two entities");
        }
        if (!kind.isComposite() && secondary != null) {
            throw new IllegalArgumentException(kind.label() + " takes a single entity");
        }
    }

    public static HubTarget of(Entity entity) {
        return new HubTarget(HubKind.forEntity(entity.kind()), entity, null);
    }

    public static HubTarget of(HubKind kind, Entity primary, Entity secondary) {
        return new HubTarget(kind, primary, secondary);
    }

    public static String key(HubKind kind, String primaryId, @Nullable String secondaryId) {
        return kind.label() + ":" + identifier(primaryId, secondaryId);
    }

    private static String identifier(String primaryId, @Nullable String secondaryId) {
        return secondaryId == null ? primaryId : primaryId + "+" + secondaryId;
    }

    /**
     * Stable coverage key, e.g. "country-hub:fr" or "place-topic-hub:fr+politics".
     */
    public String key() {
        return key(kind, primary.id(), secondary == null ? null : secondary.id());
    }

    /**
     * Entity identifier(s) without the kind, used to break ordering ties.
     */
    public String identifier() {
        return identifier(primary.id(), secondary == null ? null : secondary.id());
    }

    public List<Entity> entities() {
        return secondary == null ? List.of(primary) : List.of(primary, secondary);
    }

    /**
     * Importance of a single entity, or for composites the product of both scaled back to 0..100.
     */
    public int importance() {
        if (secondary == null) return primary.importance();
        return primary.importance() * secondary.importance() / 100;
    }

    public String displayName() {
        return secondary == null ? primary.name() : primary.name() + " / " + secondary.name();
    }

    @Override
    public String toString() {
        return key();
    }
}
