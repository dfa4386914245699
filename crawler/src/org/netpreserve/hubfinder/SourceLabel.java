package org.netpreserve.hubfinder;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a candidate was discovered. The label keys the configurable base bonus of the priority score.
 */
public enum SourceLabel {
    HUB_VALIDATED("hub-validated"),
    ADAPTIVE_SEED("adaptive-seed"),
    ARTICLE_FROM_HUB("article-from-hub"),
    HUB_GUESS("hub-guess");

    private final String label;

    SourceLabel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
