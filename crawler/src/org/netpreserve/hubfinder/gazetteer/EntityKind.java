package org.netpreserve.hubfinder.gazetteer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EntityKind {
    COUNTRY, REGION, CITY, TOPIC;

    public boolean isPlace() {
        return this != TOPIC;
    }

    @JsonCreator
    public static EntityKind fromString(String value) {
        return value == null ? null : valueOf(value.toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
