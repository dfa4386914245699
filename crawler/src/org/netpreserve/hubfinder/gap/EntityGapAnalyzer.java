package org.netpreserve.hubfinder.gap;

import org.netpreserve.hubfinder.HubKind;
import org.netpreserve.hubfinder.HubTarget;
import org.netpreserve.hubfinder.config.DomainConfig;
import org.netpreserve.hubfinder.gazetteer.Entity;
import org.netpreserve.hubfinder.gazetteer.EntityKind;
import org.netpreserve.hubfinder.gazetteer.Gazetteer;
import org.netpreserve.hubfinder.predict.PredictionStrategyLibrary;
import org.netpreserve.hubfinder.util.Url;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Gaps for single-entity hubs. Sub-national places are only expected on sites with country hints or once the
 * enclosing country has a confirmed hub.
 */
abstract class EntityGapAnalyzer extends GapAnalyzer {
    private final EntityKind entityKind;

    EntityGapAnalyzer(EntityKind entityKind, Gazetteer gazetteer, PredictionStrategyLibrary library,
                      int highImportance, int maxCandidates) {
        super(HubKind.forEntity(entityKind), gazetteer, library, highImportance, maxCandidates);
        this.entityKind = entityKind;
    }

    @Override
    protected List<HubTarget> expectedTargets(DomainConfig site, Map<String, Url> confirmedHubs) {
        var targets = new ArrayList<HubTarget>();
        for (Entity entity : rankedEntities(entityKind, site)) {
            if (entityKind == EntityKind.REGION || entityKind == EntityKind.CITY) {
                if (site.hints().isEmpty() && !countryConfirmed(entity, confirmedHubs)) continue;
            }
            targets.add(HubTarget.of(entity));
        }
        return targets;
    }

    private boolean countryConfirmed(Entity entity, Map<String, Url> confirmedHubs) {
        return gazetteer.countryOf(entity)
                .map(country -> confirmedHubs.containsKey(HubTarget.of(country).key()))
                .orElse(false);
    }
}
