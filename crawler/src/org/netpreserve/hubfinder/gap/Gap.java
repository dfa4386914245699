package org.netpreserve.hubfinder.gap;

import org.netpreserve.hubfinder.HubTarget;

import java.util.Comparator;

/**
 * An expected hub that hasn't been confirmed yet.
 */
public record Gap(HubTarget target, int importance) {
    /**
     * Most important first, ties broken by entity identifier.
     */
    public static final Comparator<Gap> ORDER = Comparator.comparingInt(Gap::importance).reversed()
            .thenComparing(gap -> gap.target().identifier());

    public static Gap of(HubTarget target) {
        return new Gap(target, target.importance());
    }
}
