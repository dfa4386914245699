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
 * Place+topic gaps, e.g. France/politics. Only countries that already have a confirmed hub are crossed with the
 * site's most important topics.
 */
public class PlaceTopicGapAnalyzer extends GapAnalyzer {
    static final int MAX_PLACES = 5;
    static final int MAX_TOPICS = 8;

    public PlaceTopicGapAnalyzer(Gazetteer gazetteer, PredictionStrategyLibrary library, int highImportance,
                                 int maxCandidates) {
        super(HubKind.PLACE_TOPIC, gazetteer, library, highImportance, maxCandidates);
    }

    @Override
    protected List<HubTarget> expectedTargets(DomainConfig site, Map<String, Url> confirmedHubs) {
        List<Entity> places = limit(confirmedEntities(HubKind.COUNTRY, confirmedHubs), MAX_PLACES);
        if (places.isEmpty()) return List.of();
        List<Entity> topics = limit(rankedEntities(EntityKind.TOPIC, site), MAX_TOPICS);
        var targets = new ArrayList<HubTarget>();
        for (Entity place : places) {
            for (Entity topic : topics) {
                targets.add(HubTarget.of(HubKind.PLACE_TOPIC, place, topic));
            }
        }
        return targets;
    }
}
