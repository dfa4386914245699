package org.netpreserve.hubfinder.gap;

import org.netpreserve.hubfinder.HubKind;
import org.netpreserve.hubfinder.HubTarget;
import org.netpreserve.hubfinder.config.DomainConfig;
import org.netpreserve.hubfinder.gazetteer.Entity;
import org.netpreserve.hubfinder.gazetteer.Gazetteer;
import org.netpreserve.hubfinder.predict.PredictionStrategyLibrary;
import org.netpreserve.hubfinder.util.Url;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parent/child place gaps such as us/california, for parents with a confirmed country or region hub.
 */
public class HierarchicalPlaceGapAnalyzer extends GapAnalyzer {
    static final int MAX_PARENTS = 5;

    public HierarchicalPlaceGapAnalyzer(Gazetteer gazetteer, PredictionStrategyLibrary library, int highImportance,
                                        int maxCandidates) {
        super(HubKind.PLACE_PLACE, gazetteer, library, highImportance, maxCandidates);
    }

    @Override
    protected List<HubTarget> expectedTargets(DomainConfig site, Map<String, Url> confirmedHubs) {
        var parents = new ArrayList<Entity>(limit(confirmedEntities(HubKind.COUNTRY, confirmedHubs), MAX_PARENTS));
        parents.addAll(limit(confirmedEntities(HubKind.REGION, confirmedHubs), MAX_PARENTS));
        var targets = new ArrayList<HubTarget>();
        for (Entity parent : parents) {
            for (Entity child : gazetteer.children(parent)) {
                if (!child.kind().isPlace() || gazetteer.importanceRank(child) <= 0) continue;
                targets.add(HubTarget.of(HubKind.PLACE_PLACE, parent, child));
            }
        }
        return targets;
    }
}
