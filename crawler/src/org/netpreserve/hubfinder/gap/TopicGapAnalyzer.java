package org.netpreserve.hubfinder.gap;

import org.netpreserve.hubfinder.gazetteer.EntityKind;
import org.netpreserve.hubfinder.gazetteer.Gazetteer;
import org.netpreserve.hubfinder.predict.PredictionStrategyLibrary;

public class TopicGapAnalyzer extends EntityGapAnalyzer {
    public TopicGapAnalyzer(Gazetteer gazetteer, PredictionStrategyLibrary library, int highImportance,
                           int maxCandidates) {
        super(EntityKind.TOPIC, gazetteer, library, highImportance, maxCandidates);
    }
}
