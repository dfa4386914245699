package org.netpreserve.hubfinder.predict;

import org.netpreserve.hubfinder.Candidate;
import org.netpreserve.hubfinder.HubTarget;

import java.util.ArrayList;
import java.util.List;

/**
 * Generic URL shapes news sites commonly use, tried when nothing better is known.
 */
public class FallbackStrategy implements PredictionStrategy {
    private static final List<String> PLACE_TEMPLATES = List.of(
            "/{slug}", "/world/{slug}", "/places/{slug}", "/tag/{slug}", "/topics/{slug}");
    private static final List<String> TOPIC_TEMPLATES = List.of(
            "/topics/{slug}", "/section/{slug}", "/tag/{slug}", "/{slug}");
    private static final List<String> COMPOSITE_TEMPLATES = List.of(
            "/tag/{primary}-{secondary}", "/{primary}-{secondary}", "/topics/{secondary}/{primary}");
    private static final double STEP = 0.04;

    @Override
    public Strategy strategy() {
        return Strategy.FALLBACK_PATTERN;
    }

    @Override
    public List<Candidate> generate(HubTarget target, PredictionContext context) {
        List<String> templates;
        if (target.kind().isComposite()) {
            templates = COMPOSITE_TEMPLATES;
        } else if (target.primary().kind().isPlace()) {
            templates = PLACE_TEMPLATES;
        } else {
            templates = TOPIC_TEMPLATES;
        }
        var candidates = new ArrayList<Candidate>(templates.size());
        int n = 0;
        for (String template : templates) {
            String path = template
                    .replace("{slug}", target.primary().slug())
                    .replace("{primary}", target.primary().slug());
            if (target.secondary() != null) path = path.replace("{secondary}", target.secondary().slug());
            candidates.add(Candidate.hub(context.base().withPath(path), target, strategy(),
                    strategy().stepDown(n++, STEP)));
        }
        return candidates;
    }
}
