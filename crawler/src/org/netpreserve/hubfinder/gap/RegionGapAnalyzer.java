package org.netpreserve.hubfinder.gap;

import org.netpreserve.hubfinder.gazetteer.EntityKind;
import org.netpreserve.hubfinder.gazetteer.Gazetteer;
import org.netpreserve.hubfinder.predict.PredictionStrategyLibrary;

public class RegionGapAnalyzer extends EntityGapAnalyzer {
    public RegionGapAnalyzer(Gazetteer gazetteer, PredictionStrategyLibrary library, int highImportance,
                           int maxCandidates) {
        super(EntityKind.REGION, gazetteer, library, highImportance, maxCandidates);
    }
}
