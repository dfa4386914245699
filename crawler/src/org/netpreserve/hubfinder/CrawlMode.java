package org.netpreserve.hubfinder;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CrawlMode {
    NORMAL("normal"),
    /** Every hub candidate outranks every non-hub candidate. */
    EXCLUSIVE_HUB_FOCUS("exclusive-hub-focus");

    private final String label;

    CrawlMode(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static CrawlMode fromString(String value) {
        if (value == null) return null;
        for (CrawlMode mode : values()) {
            if (mode.label.equalsIgnoreCase(value)) return mode;
        }
        return valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
