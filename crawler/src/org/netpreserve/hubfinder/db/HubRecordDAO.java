package org.netpreserve.hubfinder.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.netpreserve.hubfinder.util.Url;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(HubRecordDAO.Row.class)
@RegisterConstructorMapper(HubRecordDAO.CoverageRow.class)
public interface HubRecordDAO {
    @SqlQuery("SELECT * FROM hub_records WHERE url = ?")
    Row find(Url url);

    @SqlUpdate("""
            INSERT INTO hub_records (url, domain, kind, target_key, entity_ids, verdict, article_urls, visited_at, evidence)
            VALUES (:url, :domain, :kind, :targetKey, :entityIds, :verdict, :articleUrls, :visitedAt, :evidence)
            ON CONFLICT (url) DO UPDATE SET
                domain = excluded.domain,
                kind = excluded.kind,
                target_key = excluded.target_key,
                entity_ids = excluded.entity_ids,
                verdict = excluded.verdict,
                article_urls = excluded.article_urls,
                visited_at = excluded.visited_at,
                evidence = excluded.evidence
            """)
    void upsert(@BindMethods Row row);

    @SqlQuery("""
            SELECT target_key, url FROM hub_records
            WHERE domain = ? AND verdict = 'CONFIRMED'
            ORDER BY visited_at, url
            """)
    List<CoverageRow> confirmed(String domain);

    @SqlQuery("SELECT COUNT(*) FROM hub_records WHERE domain = :domain AND verdict = :verdict")
    long countByVerdict(String domain, String verdict);

    record Row(Url url, String domain, String kind, String targetKey, String entityIds, String verdict,
               String articleUrls, Instant visitedAt, String evidence) {
    }

    record CoverageRow(String targetKey, Url url) {
    }
}
