package org.netpreserve.hubfinder;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

@RegisterConstructorMapper(Progress.class)
public interface ProgressDAO {
    String COLUMNS = "run_id, date, runtime, phase, entities_proposed, entities_validated, confirmed, rejected, " +
                     "inconclusive, articles, fetches";

    @SqlUpdate("INSERT INTO progress (" + COLUMNS + ") VALUES (:runId, :date, :runtime, :phase, :entitiesProposed, " +
               ":entitiesValidated, :confirmed, :rejected, :inconclusive, :articles, :fetches)")
    void createSnapshot(@BindMethods Progress progress);

    @SqlQuery("SELECT " + COLUMNS + " FROM progress WHERE run_id = ? ORDER BY id DESC LIMIT 1")
    Progress latest(String runId);

    @SqlQuery("SELECT COUNT(*) FROM progress WHERE run_id = ?")
    long countSnapshots(String runId);
}
