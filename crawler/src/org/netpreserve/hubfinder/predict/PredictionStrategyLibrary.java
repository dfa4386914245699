package org.netpreserve.hubfinder.predict;

import org.netpreserve.hubfinder.Candidate;
import org.netpreserve.hubfinder.HubTarget;
import org.netpreserve.hubfinder.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the registered prediction strategies in precedence order and merges their output. A URL produced by more
 * than one strategy is kept only from the first.
 */
public class PredictionStrategyLibrary {
    private static final Logger log = LoggerFactory.getLogger(PredictionStrategyLibrary.class);
    private final List<PredictionStrategy> strategies;

    public PredictionStrategyLibrary() {
        this(List.of(new LearnedPatternStrategy(), new GazetteerStrategy(), new FallbackStrategy(),
                new RegionalCompositionStrategy()));
    }

    public PredictionStrategyLibrary(List<PredictionStrategy> strategies) {
        var sorted = new ArrayList<>(strategies);
        sorted.sort(Comparator.comparingInt(strategy -> strategy.strategy().ordinal()));
        this.strategies = List.copyOf(sorted);
    }

    public List<Candidate> generate(HubTarget target, PredictionContext context) {
        Map<Url, Candidate> merged = new LinkedHashMap<>();
        for (PredictionStrategy strategy : strategies) {
            List<Candidate> generated;
            try {
                generated = strategy.generate(target, context);
            } catch (RuntimeException e) {
                log.atWarn().addKeyValue("strategy", strategy.strategy().label())
                        .addKeyValue("target", target.key())
                        .setCause(e)
                        .log("Prediction strategy failed, skipping");
                continue;
            }
            for (Candidate candidate : generated) {
                if (!candidate.url().isValid() || !candidate.url().sameHost(context.base())) continue;
                Url normalized = candidate.url().normalize();
                merged.putIfAbsent(normalized, new Candidate(normalized, candidate.target(), candidate.strategy(),
                        candidate.confidence(), candidate.estimatedCostMs(), candidate.source(),
                        candidate.gapFill()));
            }
        }
        return List.copyOf(merged.values());
    }
}
