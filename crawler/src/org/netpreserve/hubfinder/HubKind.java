package org.netpreserve.hubfinder;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.gazetteer.EntityKind;

import java.util.Locale;

public enum HubKind {
    COUNTRY("country-hub", EntityKind.COUNTRY),
    REGION("region-hub", EntityKind.REGION),
    CITY("city-hub", EntityKind.CITY),
    TOPIC("topic-hub", EntityKind.TOPIC),
    /** A place crossed with a topic, e.g. /world/france/politics. */
    PLACE_TOPIC("place-topic-hub", null),
    /** A place within a confirmed parent place, e.g. /us/california. */
    PLACE_PLACE("hierarchical-place-hub", null),
    /** Two peer places covered together, e.g. /world/us-china. */
    CROSS_PLACE("cross-place-hub", null);

    private final String label;
    private final EntityKind entityKind;

    HubKind(String label, @Nullable EntityKind entityKind) {
        this.label = label;
        this.entityKind = entityKind;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * The entity kind of a single-entity hub, or null for composite kinds.
     */
    public @Nullable EntityKind entityKind() {
        return entityKind;
    }

    public boolean isComposite() {
        return entityKind == null;
    }

    public static HubKind forEntity(EntityKind kind) {
        return switch (kind) {
            case COUNTRY -> COUNTRY;
            case REGION -> REGION;
            case CITY -> CITY;
            case TOPIC -> TOPIC;
        };
    }

    @JsonCreator
    public static HubKind fromString(String value) {
        if (value == null) return null;
        for (HubKind kind : values()) {
            if (kind.label.equalsIgnoreCase(value)) return kind;
        }
        return valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
