package com.acme.intake.persistence.jdbc.dedup;

import com.acme.intake.config.IntakeConfig;
import com.acme.intake.persistence.jdbc.config.DataSourceFactory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** H2-specific implementation of DedupRepository */
@Singleton
@Requires(property = "intake.db.dialect", value = "H2")
public class H2DedupRepository extends JdbcDedupRepository {

  public H2DedupRepository(@Named(DataSourceFactory.TARGET) DataSource dataSource, IntakeConfig config) {
    super(dataSource, config.getTarget().getQueryTimeoutSeconds());
  }

  @Override
  protected String getInsertContentHashSql() {
    return """
        INSERT INTO intake_content_hash (content_hash, job_id, terminal_state, recorded_at)
        SELECT CAST(? AS VARCHAR(64)), CAST(? AS UUID), CAST(? AS VARCHAR(16)), CAST(? AS TIMESTAMP)
        WHERE NOT EXISTS(SELECT 1 FROM intake_content_hash WHERE content_hash = ? AND job_id = ?)
        """;
  }
}
