package org.netpreserve.hubfinder.predict;

import org.netpreserve.hubfinder.Candidate;
import org.netpreserve.hubfinder.HubTarget;
import org.netpreserve.hubfinder.gazetteer.Entity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds URLs from entity names, codes and aliases combined with common regional prefixes.
 */
public class GazetteerStrategy implements PredictionStrategy {
    private static final List<String> REGIONAL_PREFIXES = List.of("/world/", "/news/world/", "/international/");
    private static final int MAX_VARIANTS = 3;
    private static final double STEP = 0.02;

    @Override
    public Strategy strategy() {
        return Strategy.GAZETTEER_DERIVED;
    }

    @Override
    public List<Candidate> generate(HubTarget target, PredictionContext context) {
        var paths = new LinkedHashSet<String>();
        Entity primary = target.primary();
        List<String> variants = variants(primary);
        switch (target.kind()) {
            case COUNTRY -> {
                for (String variant : variants) {
                    for (String prefix : REGIONAL_PREFIXES) paths.add(prefix + variant);
                }
                paths.add("/" + primary.code());
            }
            case TOPIC -> {
                for (String variant : variants) {
                    paths.add("/" + variant);
                    paths.add("/news/" + variant);
                }
            }
            case REGION, CITY -> {
                Optional<Entity> parent = primary.parentId() == null ? Optional.empty()
                        : context.gazetteer().find(primary.parentId());
                for (String variant : variants) {
                    if (parent.isPresent()) {
                        paths.add("/" + parent.get().slug() + "/" + variant);
                        paths.add("/world/" + parent.get().slug() + "/" + variant);
                    } else {
                        paths.add("/news/" + variant);
                    }
                }
            }
            case PLACE_TOPIC -> {
                String topic = target.secondary().slug();
                for (String place : variants) {
                    paths.add("/" + place + "/" + topic);
                    paths.add("/world/" + place + "/" + topic);
                    paths.add("/" + topic + "/" + place);
                }
            }
            case PLACE_PLACE -> {
                String child = target.secondary().slug();
                for (String parent : variants) {
                    paths.add("/" + parent + "/" + child);
                    paths.add("/world/" + parent + "/" + child);
                    paths.add("/news/" + parent + "/" + child);
                }
            }
            case CROSS_PLACE -> {
                String second = target.secondary().slug();
                for (String first : variants) {
                    paths.add("/world/" + first + "-" + second);
                    paths.add("/world/" + first + "/" + second);
                }
            }
        }
        return toCandidates(paths, target, context);
    }

    private static List<String> variants(Entity entity) {
        List<String> variants = entity.variants();
        return variants.size() > MAX_VARIANTS ? variants.subList(0, MAX_VARIANTS) : variants;
    }

    private List<Candidate> toCandidates(Set<String> paths, HubTarget target, PredictionContext context) {
        var candidates = new ArrayList<Candidate>(paths.size());
        int n = 0;
        for (String path : paths) {
            candidates.add(Candidate.hub(context.base().withPath(path), target, strategy(),
                    strategy().stepDown(n++, STEP)));
        }
        return candidates;
    }
}
