package org.netpreserve.hubfinder.plan;

import org.netpreserve.hubfinder.Candidate;
import org.netpreserve.hubfinder.predict.PredictionContext;

/**
 * Annotates the blackboard with the expected fetch time of each planned domain.
 */
public class CostEstimator implements ReasoningPlugin {
    private final CostModel model;

    public CostEstimator(CostModel model) {
        this.model = model;
    }

    @Override
    public String name() {
        return "cost-estimator";
    }

    @Override
    public void contribute(PredictionContext context, Blackboard board) {
        long estimate = model.estimate(context.domain());
        if (estimate != Candidate.UNKNOWN_COST) {
            board.estimateCost(context.domain(), estimate);
        }
    }
}
