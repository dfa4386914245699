package org.netpreserve.hubfinder.telemetry;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
    CANDIDATE_PROPOSED("candidate-proposed"),
    CANDIDATE_DISPATCHED("candidate-dispatched"),
    HUB_CONFIRMED("hub-confirmed"),
    HUB_REJECTED("hub-rejected"),
    HUB_INCONCLUSIVE("hub-inconclusive"),
    GAP_FILLED("gap-filled"),
    PATTERN_LEARNED("pattern-learned"),
    LIFECYCLE_STAGE_CHANGED("lifecycle-stage-changed");

    private final String label;

    EventType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
