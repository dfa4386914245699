package org.netpreserve.hubfinder.predict;

import com.fasterxml.jackson.annotation.JsonValue;
import org.netpreserve.hubfinder.SourceLabel;

/**
 * Prediction strategies in precedence order, each with its confidence band.
 */
public enum Strategy {
    LEARNED_PATTERN("learned-pattern", 0.70, 0.95, SourceLabel.HUB_VALIDATED),
    GAZETTEER_DERIVED("gazetteer-derived", 0.50, 0.70, SourceLabel.ADAPTIVE_SEED),
    FALLBACK_PATTERN("fallback-pattern", 0.20, 0.40, SourceLabel.HUB_GUESS),
    REGIONAL_COMPOSITION("regional-composition", 0.40, 0.60, SourceLabel.ADAPTIVE_SEED);

    private final String label;
    private final double minConfidence;
    private final double maxConfidence;
    private final SourceLabel source;

    Strategy(String label, double minConfidence, double maxConfidence, SourceLabel source) {
        this.label = label;
        this.minConfidence = minConfidence;
        this.maxConfidence = maxConfidence;
        this.source = source;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public double minConfidence() {
        return minConfidence;
    }

    public double maxConfidence() {
        return maxConfidence;
    }

    /**
     * Source label given to candidates from this strategy.
     */
    public SourceLabel source() {
        return source;
    }

    public double clamp(double confidence) {
        return Math.max(minConfidence, Math.min(maxConfidence, confidence));
    }

    /**
     * Confidence of the n-th (0-based) guess of a strategy whose guesses get less likely as they go.
     */
    double stepDown(int n, double step) {
        return clamp(maxConfidence - n * step);
    }
}
