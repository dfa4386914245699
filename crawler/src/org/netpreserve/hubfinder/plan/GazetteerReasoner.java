package org.netpreserve.hubfinder.plan;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.Candidate;
import org.netpreserve.hubfinder.HubKind;
import org.netpreserve.hubfinder.HubTarget;
import org.netpreserve.hubfinder.SourceLabel;
import org.netpreserve.hubfinder.gazetteer.Entity;
import org.netpreserve.hubfinder.gazetteer.EntityKind;
import org.netpreserve.hubfinder.gazetteer.Gazetteer;
import org.netpreserve.hubfinder.learn.UrlTemplates;
import org.netpreserve.hubfinder.predict.PredictionContext;
import org.netpreserve.hubfinder.predict.Strategy;
import org.netpreserve.hubfinder.util.Url;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Predicts sibling hubs: if /world/france is a confirmed country hub, /world/germany probably is too. The URL shape
 * of each confirmed single-entity hub is applied to the most important uncovered entities of the same kind.
 */
public class GazetteerReasoner implements ReasoningPlugin {
    static final double CONFIDENCE = 0.65;
    static final int MAX_SIBLINGS_PER_KIND = 10;
    private final Set<HubKind> enabledKinds;

    public GazetteerReasoner(Set<HubKind> enabledKinds) {
        this.enabledKinds = enabledKinds.isEmpty() ? EnumSet.noneOf(HubKind.class) : EnumSet.copyOf(enabledKinds);
    }

    @Override
    public String name() {
        return "gazetteer-reasoner";
    }

    @Override
    public void contribute(PredictionContext context, Blackboard board) {
        Gazetteer gazetteer = context.gazetteer();
        Map<HubKind, Set<String>> shapes = new LinkedHashMap<>();
        context.confirmedHubs().forEach((key, url) -> {
            HubTarget target = parseSingleTarget(key, gazetteer);
            if (target == null || !enabledKinds.contains(target.kind())) return;
            String template = UrlTemplates.extract(url, target);
            if (template != null) shapes.computeIfAbsent(target.kind(), k -> new LinkedHashSet<>()).add(template);
        });

        shapes.forEach((kind, templates) -> {
            EntityKind entityKind = kind.entityKind();
            int proposed = 0;
            for (Entity sibling : gazetteer.listEntities(entityKind, context.site().hints())) {
                if (proposed >= MAX_SIBLINGS_PER_KIND) break;
                HubTarget target = HubTarget.of(sibling);
                if (context.isCovered(target) || context.isPending(target)) continue;
                for (String template : templates) {
                    String path = UrlTemplates.expand(template, target);
                    if (path == null) continue;
                    Url url = context.base().withPath(path).normalize();
                    if (context.wasAttempted(url)) continue;
                    board.propose(Candidate.hub(url, target, Strategy.GAZETTEER_DERIVED, CONFIDENCE)
                            .withSource(SourceLabel.HUB_VALIDATED));
                    proposed++;
                    break;
                }
            }
        });
    }

    private static @Nullable HubTarget parseSingleTarget(String key, Gazetteer gazetteer) {
        int colon = key.indexOf(':');
        if (colon < 0 || key.indexOf('+') >= 0) return null;
        HubKind kind;
        try {
            kind = HubKind.fromString(key.substring(0, colon));
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (kind.isComposite()) return null;
        return gazetteer.find(key.substring(colon + 1))
                .filter(entity -> entity.kind() == kind.entityKind())
                .map(HubTarget::of)
                .orElse(null);
    }
}
