package org.netpreserve.hubfinder.predict;

import org.netpreserve.hubfinder.Candidate;
import org.netpreserve.hubfinder.HubTarget;
import org.netpreserve.hubfinder.learn.LearnedPattern;
import org.netpreserve.hubfinder.learn.UrlTemplates;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands templates that already produced confirmed hubs of the same kind on the domain.
 */
public class LearnedPatternStrategy implements PredictionStrategy {
    @Override
    public Strategy strategy() {
        return Strategy.LEARNED_PATTERN;
    }

    @Override
    public List<Candidate> generate(HubTarget target, PredictionContext context) {
        var patterns = new ArrayList<>(context.patterns(target.kind()));
        patterns.sort(LearnedPattern.BEST_FIRST);
        var candidates = new ArrayList<Candidate>();
        for (LearnedPattern pattern : patterns) {
            if (pattern.successCount() < context.minPatternSuccesses()) continue;
            String path = UrlTemplates.expand(pattern.template(), target);
            if (path == null) continue;
            candidates.add(Candidate.hub(context.base().withPath(path), target, strategy(), pattern.confidence()));
        }
        return candidates;
    }
}
