package org.netpreserve.hubfinder.plan;

import org.netpreserve.hubfinder.predict.PredictionContext;

/**
 * Contributes proposals or annotations to the planning blackboard. Plugins are registered explicitly with the
 * {@link Planner}; an exception thrown from one is logged and the cycle continues without it.
 */
public interface ReasoningPlugin {
    String name();

    void contribute(PredictionContext context, Blackboard board);
}
