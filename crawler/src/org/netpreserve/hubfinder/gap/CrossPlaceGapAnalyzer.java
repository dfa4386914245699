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
 * Gaps for hubs covering two peer countries together, e.g. us-china relations. Each unordered pair of confirmed
 * countries is expected once, with the more important country first.
 */
public class CrossPlaceGapAnalyzer extends GapAnalyzer {
    static final int MAX_PLACES = 6;

    public CrossPlaceGapAnalyzer(Gazetteer gazetteer, PredictionStrategyLibrary library, int highImportance,
                                 int maxCandidates) {
        super(HubKind.CROSS_PLACE, gazetteer, library, highImportance, maxCandidates);
    }

    @Override
    protected List<HubTarget> expectedTargets(DomainConfig site, Map<String, Url> confirmedHubs) {
        List<Entity> places = limit(confirmedEntities(HubKind.COUNTRY, confirmedHubs), MAX_PLACES);
        var targets = new ArrayList<HubTarget>();
        for (int i = 0; i < places.size(); i++) {
            for (int j = i + 1; j < places.size(); j++) {
                targets.add(HubTarget.of(HubKind.CROSS_PLACE, places.get(i), places.get(j)));
            }
        }
        return targets;
    }
}
