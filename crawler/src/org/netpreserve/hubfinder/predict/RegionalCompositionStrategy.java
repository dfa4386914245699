package org.netpreserve.hubfinder.predict;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.Candidate;
import org.netpreserve.hubfinder.HubKind;
import org.netpreserve.hubfinder.HubTarget;
import org.netpreserve.hubfinder.gazetteer.Entity;
import org.netpreserve.hubfinder.util.Url;

import java.util.ArrayList;
import java.util.List;

/**
 * Appends a child slug to the confirmed URL of the parent hub: once /world/us is confirmed,
 * /world/us/california is worth a try.
 */
public class RegionalCompositionStrategy implements PredictionStrategy {

    @Override
    public Strategy strategy() {
        return Strategy.REGIONAL_COMPOSITION;
    }

    @Override
    public List<Candidate> generate(HubTarget target, PredictionContext context) {
        var candidates = new ArrayList<Candidate>();
        Entity primary = target.primary();
        switch (target.kind()) {
            case REGION, CITY -> {
                if (primary.parentId() == null) break;
                context.gazetteer().find(primary.parentId()).ifPresent(parent ->
                        add(candidates, context.confirmedUrl(HubTarget.of(parent)), primary.slug(), target,
                                strategy().maxConfidence(), context));
            }
            case PLACE_TOPIC -> {
                add(candidates, context.confirmedUrl(HubTarget.of(primary)), target.secondary().slug(), target,
                        strategy().maxConfidence(), context);
                add(candidates, context.confirmedUrl(HubTarget.of(target.secondary())), primary.slug(), target,
                        0.50, context);
            }
            case PLACE_PLACE, CROSS_PLACE -> add(candidates, context.confirmedUrl(HubTarget.of(primary)),
                    target.secondary().slug(), target,
                    target.kind() == HubKind.PLACE_PLACE ? strategy().maxConfidence() : 0.50, context);
            case COUNTRY, TOPIC -> {
            }
        }
        return candidates;
    }

    private void add(List<Candidate> candidates, @Nullable Url parentUrl, String childSlug, HubTarget target,
                     double confidence, PredictionContext context) {
        if (parentUrl == null || !parentUrl.sameHost(context.base())) return;
        String path = parentUrl.normalize().path();
        String childPath = path.endsWith("/") ? path + childSlug : path + "/" + childSlug;
        candidates.add(Candidate.hub(parentUrl.withPath(childPath), target, strategy(), confidence));
    }
}
