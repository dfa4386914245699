package org.netpreserve.hubfinder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.hubfinder.db.HubRecordDAO;
import org.netpreserve.hubfinder.db.LearnedPatternDAO;
import org.netpreserve.hubfinder.learn.LearnedPattern;
import org.netpreserve.hubfinder.util.Url;
import org.netpreserve.hubfinder.validate.Evidence;
import org.netpreserve.hubfinder.validate.Verdict;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * HubStore on the job's SQLite database. Collections and evidence are stored as JSON text.
 */
public class Storage implements HubStore {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Set<String>> STRING_SET = new TypeReference<>() {
    };
    private final Database db;
    private final ObjectMapper json = new ObjectMapper().findAndRegisterModules();

    public Storage(Database db) {
        this.db = db;
    }

    @Override
    public void check() {
        db.ping();
    }

    @Override
    public @Nullable HubRecord getHubRecord(Url url) {
        HubRecordDAO.Row row = db.hubRecords().find(url.normalize());
        return row == null ? null : toRecord(row);
    }

    @Override
    public void putHubRecord(HubRecord record) {
        db.useTransaction(tx -> {
            HubRecordDAO.Row existing = tx.hubRecords().find(record.url());
            HubRecord merged = existing == null ? record : toRecord(existing).merge(record);
            tx.hubRecords().upsert(toRow(merged));
        });
    }

    @Override
    public List<LearnedPattern> getLearnedPatterns(String domain, HubKind kind) {
        return db.learnedPatterns().find(domain, kind.label()).stream().map(this::toPattern).toList();
    }

    @Override
    public void putLearnedPattern(LearnedPattern pattern) {
        db.learnedPatterns().upsert(new LearnedPatternDAO.Row(pattern.domain(), pattern.kind().label(),
                pattern.template(), pattern.successCount(), pattern.averageYield(), pattern.lastUpdated(),
                write(pattern.confirmedUrls())));
    }

    @Override
    public Map<String, Url> getCoverageSnapshot(String domain) {
        var coverage = new LinkedHashMap<String, Url>();
        for (HubRecordDAO.CoverageRow row : db.hubRecords().confirmed(domain)) {
            coverage.putIfAbsent(row.targetKey(), row.url());
        }
        return coverage;
    }

    private HubRecord toRecord(HubRecordDAO.Row row) {
        return new HubRecord(row.url(), row.domain(), HubKind.fromString(row.kind()), row.targetKey(),
                read(row.entityIds(), STRING_LIST), Verdict.valueOf(row.verdict()), read(row.articleUrls(), STRING_SET),
                row.visitedAt(), row.evidence() == null ? null : read(row.evidence(), Evidence.class));
    }

    private HubRecordDAO.Row toRow(HubRecord record) {
        return new HubRecordDAO.Row(record.url(), record.domain(), record.kind().label(), record.targetKey(),
                write(record.entityIds()), record.verdict().name(), write(record.articleUrls()), record.visitedAt(),
                record.evidence() == null ? null : write(record.evidence()));
    }

    private LearnedPattern toPattern(LearnedPatternDAO.Row row) {
        return new LearnedPattern(row.domain(), HubKind.fromString(row.kind()), row.template(), row.successCount(),
                row.averageYield(), row.lastUpdated(), read(row.confirmedUrls(), STRING_SET));
    }

    private String write(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private <T> T read(String value, TypeReference<T> type) {
        try {
            return json.readValue(value, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private <T> T read(String value, Class<T> type) {
        try {
            return json.readValue(value, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
