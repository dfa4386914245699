package org.netpreserve.hubfinder.gazetteer;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Globally important entities used when a domain has no ranked entities of a kind.
 */
public final class SeedEntities {
    private static final List<Entity> COUNTRIES = List.of(
            new Entity(EntityKind.COUNTRY, "us", "United States", 100, null, List.of("usa", "us")),
            new Entity(EntityKind.COUNTRY, "gb", "United Kingdom", 95, null, List.of("uk", "britain")),
            new Entity(EntityKind.COUNTRY, "cn", "China", 90),
            new Entity(EntityKind.COUNTRY, "in", "India", 85),
            new Entity(EntityKind.COUNTRY, "fr", "France", 80),
            new Entity(EntityKind.COUNTRY, "de", "Germany", 75),
            new Entity(EntityKind.COUNTRY, "ru", "Russia", 70),
            new Entity(EntityKind.COUNTRY, "jp", "Japan", 65),
            new Entity(EntityKind.COUNTRY, "br", "Brazil", 60),
            new Entity(EntityKind.COUNTRY, "au", "Australia", 55));

    private static final List<Entity> TOPICS = List.of(
            new Entity(EntityKind.TOPIC, "politics", "Politics", 80),
            new Entity(EntityKind.TOPIC, "business", "Business", 75),
            new Entity(EntityKind.TOPIC, "technology", "Technology", 70, null, List.of("tech")),
            new Entity(EntityKind.TOPIC, "science", "Science", 65),
            new Entity(EntityKind.TOPIC, "sport", "Sport", 60, null, List.of("sports")),
            new Entity(EntityKind.TOPIC, "health", "Health", 55),
            new Entity(EntityKind.TOPIC, "culture", "Culture", 50, null, List.of("arts")),
            new Entity(EntityKind.TOPIC, "environment", "Environment", 45, null, List.of("climate")));

    private SeedEntities() {
    }

    public static List<Entity> forKind(EntityKind kind) {
        return switch (kind) {
            case COUNTRY -> COUNTRIES;
            case TOPIC -> TOPICS;
            case REGION, CITY -> List.of();
        };
    }

    public static Optional<Entity> find(String id) {
        return Stream.concat(COUNTRIES.stream(), TOPICS.stream())
                .filter(entity -> entity.id().equals(id))
                .findFirst();
    }
}
