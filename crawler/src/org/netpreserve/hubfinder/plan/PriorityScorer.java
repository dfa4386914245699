package org.netpreserve.hubfinder.plan;

import org.netpreserve.hubfinder.Candidate;
import org.netpreserve.hubfinder.CrawlMode;
import org.netpreserve.hubfinder.SourceLabel;
import org.netpreserve.hubfinder.config.PlannerConfig;

import java.util.Map;

/**
 * Turns a candidate into a priority score. Higher scores are dispatched first.
 * <p>
 * The score is the base bonus of the candidate's source, adjusted by at most 10% of that bonus for expected fetch
 * cost, plus a boost for filling an important coverage gap. Estimates up to {@value #FAST_COST_MS}ms are
 * rewarded, estimates above {@value #SLOW_COST_MS}ms are penalized, anything in between is neutral. In
 * {@link CrawlMode#EXCLUSIVE_HUB_FOCUS} hub candidates are lifted into a band no non-hub candidate can reach.
 */
public class PriorityScorer {
    static final long FAST_COST_MS = 100;
    static final long SLOW_COST_MS = 500;
    static final double MAX_COST_FRACTION = 0.1;
    static final double EXCLUSIVE_OFFSET = 1000;
    static final double EXCLUSIVE_SPAN = 999;
    private final Map<String, Double> bonuses;
    private final double gapFillBoost;

    public PriorityScorer(PlannerConfig config) {
        this(config.bonuses(), config.gapFillBoost());
    }

    public PriorityScorer(Map<String, Double> bonuses, double gapFillBoost) {
        this.bonuses = Map.copyOf(bonuses);
        this.gapFillBoost = gapFillBoost;
    }

    public double bonus(SourceLabel source) {
        Double bonus = bonuses.get(source.label());
        return bonus == null ? 0 : bonus;
    }

    /**
     * @param raw    the base bonus
     * @param costMs estimated fetch time, negative if unknown
     */
    static double costAdjustment(double raw, long costMs) {
        if (costMs < 0) return 0;
        double limit = MAX_COST_FRACTION * Math.abs(raw);
        if (costMs <= FAST_COST_MS) return limit * (1 - (double) costMs / FAST_COST_MS);
        if (costMs <= SLOW_COST_MS) return 0;
        return -limit * Math.min((double) (costMs - SLOW_COST_MS) / SLOW_COST_MS, 1);
    }

    public double score(Candidate candidate, CrawlMode mode, boolean gapEmphasis) {
        double raw = bonus(candidate.source());
        double score = raw + costAdjustment(raw, candidate.estimatedCostMs());
        if (candidate.gapFill()) {
            score += gapEmphasis ? 2 * gapFillBoost : gapFillBoost;
        }
        if (mode == CrawlMode.EXCLUSIVE_HUB_FOCUS) {
            if (candidate.isHub()) {
                return EXCLUSIVE_OFFSET + Math.max(0, Math.min(score, EXCLUSIVE_SPAN));
            }
            return Math.min(score, 0) - EXCLUSIVE_OFFSET;
        }
        return score;
    }
}
