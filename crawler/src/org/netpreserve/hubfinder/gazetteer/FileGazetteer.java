package org.netpreserve.hubfinder.gazetteer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Gazetteer backed by a YAML file of the form:
 * <pre>
 * entities:
 *   - {kind: country, id: fr, name: France, importance: 90, aliases: [french republic]}
 *   - {kind: region, id: fr-idf, name: Île-de-France, importance: 40, parentId: fr}
 * </pre>
 */
public class FileGazetteer implements Gazetteer {
    private static final Logger log = LoggerFactory.getLogger(FileGazetteer.class);
    private final Map<String, Entity> byId = new LinkedHashMap<>();
    private final Map<EntityKind, List<Entity>> byKind = new EnumMap<>(EntityKind.class);
    private final Map<String, List<Entity>> byParent = new HashMap<>();

    public FileGazetteer(Collection<Entity> entities) {
        for (Entity entity : entities) {
            Entity previous = byId.put(entity.id(), entity);
            if (previous != null) {
                log.warn("Duplicate gazetteer id {}, keeping {}", entity.id(), entity.name());
                byKind.get(previous.kind()).remove(previous);
                if (previous.parentId() != null) byParent.get(previous.parentId()).remove(previous);
            }
            byKind.computeIfAbsent(entity.kind(), k -> new ArrayList<>()).add(entity);
            if (entity.parentId() != null) {
                byParent.computeIfAbsent(entity.parentId(), k -> new ArrayList<>()).add(entity);
            }
        }
        byKind.values().forEach(list -> list.sort(BY_IMPORTANCE));
        byParent.values().forEach(list -> list.sort(BY_IMPORTANCE));
    }

    public static FileGazetteer load(Path file) throws IOException {
        try (var stream = Files.newInputStream(file)) {
            return load(stream);
        }
    }

    /**
     * Loads the gazetteer bundled with the crawler.
     */
    public static FileGazetteer loadBundled() throws IOException {
        try (var stream = Objects.requireNonNull(FileGazetteer.class.getResourceAsStream("gazetteer.yaml"),
                "missing gazetteer.yaml")) {
            return load(stream);
        }
    }

    private static FileGazetteer load(InputStream stream) throws IOException {
        var mapper = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();
        GazetteerFile file = mapper.readValue(stream, GazetteerFile.class);
        var gazetteer = new FileGazetteer(file.entities() == null ? List.of() : file.entities());
        log.info("Loaded gazetteer with {} entities", gazetteer.size());
        return gazetteer;
    }

    @Override
    public List<Entity> listEntities(EntityKind kind, Collection<String> domainHints) {
        List<Entity> all = byKind.getOrDefault(kind, List.of());
        if (domainHints == null || domainHints.isEmpty() || !kind.isPlace() || kind == EntityKind.COUNTRY) {
            return List.copyOf(all);
        }
        var hints = new HashSet<String>();
        for (String hint : domainHints) hints.add(hint.toLowerCase(Locale.ROOT));
        return all.stream()
                .filter(entity -> countryOf(entity).map(country -> hints.contains(country.code())).orElse(false))
                .toList();
    }

    @Override
    public Optional<Entity> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public List<Entity> children(Entity parent) {
        return List.copyOf(byParent.getOrDefault(parent.id(), List.of()));
    }

    public int size() {
        return byId.size();
    }

    record GazetteerFile(List<Entity> entities) {
    }
}
