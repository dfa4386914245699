package org.netpreserve.hubfinder.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(LearnedPatternDAO.Row.class)
public interface LearnedPatternDAO {
    @SqlQuery("""
            SELECT * FROM learned_patterns
            WHERE domain = :domain AND kind = :kind
            ORDER BY average_yield DESC, success_count DESC, template
            """)
    List<Row> find(String domain, String kind);

    @SqlUpdate("""
            INSERT INTO learned_patterns (domain, kind, template, success_count, average_yield, last_updated, confirmed_urls)
            VALUES (:domain, :kind, :template, :successCount, :averageYield, :lastUpdated, :confirmedUrls)
            ON CONFLICT (domain, kind, template) DO UPDATE SET
                success_count = excluded.success_count,
                average_yield = excluded.average_yield,
                last_updated = excluded.last_updated,
                confirmed_urls = excluded.confirmed_urls
            """)
    void upsert(@BindMethods Row row);

    record Row(String domain, String kind, String template, int successCount, double averageYield,
               Instant lastUpdated, String confirmedUrls) {
    }
}
