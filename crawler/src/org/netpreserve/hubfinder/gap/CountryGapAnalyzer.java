package org.netpreserve.hubfinder.gap;

import org.netpreserve.hubfinder.gazetteer.EntityKind;
import org.netpreserve.hubfinder.gazetteer.Gazetteer;
import org.netpreserve.hubfinder.predict.PredictionStrategyLibrary;

public class CountryGapAnalyzer extends EntityGapAnalyzer {
    public CountryGapAnalyzer(Gazetteer gazetteer, PredictionStrategyLibrary library, int highImportance,
                           int maxCandidates) {
        super(EntityKind.COUNTRY, gazetteer, library, highImportance, maxCandidates);
    }
}
