package org.netpreserve.hubfinder.gap;

import org.netpreserve.hubfinder.gazetteer.EntityKind;
import org.netpreserve.hubfinder.gazetteer.Gazetteer;
import org.netpreserve.hubfinder.predict.PredictionStrategyLibrary;

public class CityGapAnalyzer extends EntityGapAnalyzer {
    public CityGapAnalyzer(Gazetteer gazetteer, PredictionStrategyLibrary library, int highImportance,
                           int maxCandidates) {
        super(EntityKind.CITY, gazetteer, library, highImportance, maxCandidates);
    }
}
