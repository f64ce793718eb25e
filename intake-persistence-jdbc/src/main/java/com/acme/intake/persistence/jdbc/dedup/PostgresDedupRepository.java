package com.acme.intake.persistence.jdbc.dedup;

import com.acme.intake.config.IntakeConfig;
import com.acme.intake.persistence.jdbc.config.DataSourceFactory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** PostgreSQL-specific implementation of DedupRepository */
@Singleton
@Requires(property = "intake.db.dialect", value = "PostgreSQL")
public class PostgresDedupRepository extends JdbcDedupRepository {

  public PostgresDedupRepository(
      @Named(DataSourceFactory.TARGET) DataSource dataSource, IntakeConfig config) {
    super(dataSource, config.getTarget().getQueryTimeoutSeconds());
  }

  @Override
  protected String getInsertContentHashSql() {
    return """
        INSERT INTO intake_content_hash (content_hash, job_id, terminal_state, recorded_at)
        VALUES (?, ?, ?, ?)
        ON CONFLICT (content_hash, job_id) DO NOTHING
        """;
  }
}
