package org.netpreserve.hubfinder.gap;

import org.netpreserve.hubfinder.Candidate;
import org.netpreserve.hubfinder.HubKind;
import org.netpreserve.hubfinder.HubTarget;
import org.netpreserve.hubfinder.config.DomainConfig;
import org.netpreserve.hubfinder.gazetteer.Entity;
import org.netpreserve.hubfinder.gazetteer.EntityKind;
import org.netpreserve.hubfinder.gazetteer.Gazetteer;
import org.netpreserve.hubfinder.gazetteer.SeedEntities;
import org.netpreserve.hubfinder.predict.PredictionContext;
import org.netpreserve.hubfinder.predict.PredictionStrategyLibrary;
import org.netpreserve.hubfinder.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the hubs of one kind a domain is expected to have but doesn't yet, and proposes a URL for each.
 */
public abstract class GapAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(GapAnalyzer.class);
    public static final int DEFAULT_MAX_CANDIDATES = 50;
    protected final Gazetteer gazetteer;
    private final HubKind kind;
    private final PredictionStrategyLibrary library;
    private final int highImportance;
    private final int maxCandidates;

    protected GapAnalyzer(HubKind kind, Gazetteer gazetteer, PredictionStrategyLibrary library, int highImportance,
                          int maxCandidates) {
        this.kind = kind;
        this.gazetteer = gazetteer;
        this.library = library;
        this.highImportance = highImportance;
        this.maxCandidates = maxCandidates;
    }

    public static GapAnalyzer forKind(HubKind kind, Gazetteer gazetteer, PredictionStrategyLibrary library,
                                      int highImportance, int maxCandidates) {
        return switch (kind) {
            case COUNTRY -> new CountryGapAnalyzer(gazetteer, library, highImportance, maxCandidates);
            case REGION -> new RegionGapAnalyzer(gazetteer, library, highImportance, maxCandidates);
            case CITY -> new CityGapAnalyzer(gazetteer, library, highImportance, maxCandidates);
            case TOPIC -> new TopicGapAnalyzer(gazetteer, library, highImportance, maxCandidates);
            case PLACE_TOPIC -> new PlaceTopicGapAnalyzer(gazetteer, library, highImportance, maxCandidates);
            case PLACE_PLACE -> new HierarchicalPlaceGapAnalyzer(gazetteer, library, highImportance, maxCandidates);
            case CROSS_PLACE -> new CrossPlaceGapAnalyzer(gazetteer, library, highImportance, maxCandidates);
        };
    }

    public HubKind kind() {
        return kind;
    }

    /**
     * Every target of this analyzer's kind the domain should have a hub for.
     */
    protected abstract List<HubTarget> expectedTargets(DomainConfig site, Map<String, Url> confirmedHubs);

    /**
     * Expected targets without a confirmed hub, most important first.
     */
    public List<Gap> findGaps(DomainConfig site, Map<String, Url> confirmedHubs) {
        var gaps = new ArrayList<Gap>();
        var seen = new HashSet<String>();
        for (HubTarget target : expectedTargets(site, confirmedHubs)) {
            if (confirmedHubs.containsKey(target.key()) || !seen.add(target.key())) continue;
            gaps.add(Gap.of(target));
        }
        gaps.sort(Gap.ORDER);
        return gaps;
    }

    /**
     * For each gap, in order, the best prediction not yet attempted this run. Gaps with a candidate already queued
     * or in flight are skipped.
     */
    public List<Candidate> proposeForGaps(List<Gap> gaps, PredictionContext context) {
        var candidates = new ArrayList<Candidate>();
        for (Gap gap : gaps) {
            if (candidates.size() >= maxCandidates) break;
            if (context.isCovered(gap.target()) || context.isPending(gap.target())) continue;
            for (Candidate candidate : library.generate(gap.target(), context)) {
                if (context.wasAttempted(candidate.url())) continue;
                candidates.add(candidate.withGapFill(gap.importance() >= highImportance));
                break;
            }
        }
        return candidates;
    }

    /**
     * Entities of a kind with a positive importance rank for the site, or the global seed list if there are none.
     */
    protected List<Entity> rankedEntities(EntityKind entityKind, DomainConfig site) {
        List<Entity> entities = gazetteer.listEntities(entityKind, site.hints()).stream()
                .filter(entity -> gazetteer.importanceRank(entity) > 0)
                .toList();
        if (entities.isEmpty()) {
            List<Entity> seeds = SeedEntities.forKind(entityKind);
            if (!seeds.isEmpty()) {
                log.debug("No ranked {} entities for {}, using seed list", entityKind.label(), site.host());
            }
            return seeds;
        }
        return entities;
    }

    /**
     * Entities that already have a confirmed single-entity hub of the given kind, most important first.
     */
    protected List<Entity> confirmedEntities(HubKind singleKind, Map<String, Url> confirmedHubs) {
        String prefix = singleKind.label() + ":";
        var entities = new ArrayList<Entity>();
        for (String key : confirmedHubs.keySet()) {
            if (!key.startsWith(prefix) || key.indexOf('+') >= 0) continue;
            String id = key.substring(prefix.length());
            Optional<Entity> entity = gazetteer.find(id).or(() -> SeedEntities.find(id));
            entity.ifPresent(entities::add);
        }
        entities.sort(Gazetteer.BY_IMPORTANCE);
        return entities;
    }

    static <T> List<T> limit(List<T> list, int max) {
        return list.size() > max ? list.subList(0, max) : list;
    }
}
