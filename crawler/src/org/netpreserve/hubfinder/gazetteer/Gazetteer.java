package org.netpreserve.hubfinder.gazetteer;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only reference data about places and topics.
 */
public interface Gazetteer {
    Comparator<Entity> BY_IMPORTANCE = Comparator.comparingInt(Entity::importance).reversed()
            .thenComparing(Entity::id);

    /**
     * Entities of the given kind relevant to a domain, most important first. Hints are country codes the site
     * covers; regions and cities are limited to those countries when hints are given.
     */
    List<Entity> listEntities(EntityKind kind, Collection<String> domainHints);

    Optional<Entity> find(String id);

    /**
     * Places whose parent is the given entity.
     */
    List<Entity> children(Entity parent);

    default int importanceRank(Entity entity) {
        return entity.importance();
    }

    /**
     * Walks up the parent chain to the enclosing country, or returns the entity itself if it is one.
     */
    default Optional<Entity> countryOf(Entity entity) {
        Entity current = entity;
        for (int depth = 0; current != null && depth < 8; depth++) {
            if (current.kind() == EntityKind.COUNTRY) return Optional.of(current);
            if (current.parentId() == null) return Optional.empty();
            current = find(current.parentId()).orElse(null);
        }
        return Optional.empty();
    }
}
