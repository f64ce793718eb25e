package com.acme.intake.persistence.jdbc.job;

import com.acme.intake.config.IntakeConfig;
import com.acme.intake.persistence.jdbc.config.DataSourceFactory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** PostgreSQL-specific implementation of JobRepository */
@Singleton
@Requires(property = "intake.ledger.dialect", value = "PostgreSQL")
public class PostgresJobRepository extends JdbcJobRepository {

  public PostgresJobRepository(
      @Named(DataSourceFactory.LEDGER) DataSource dataSource, IntakeConfig config) {
    super(
        dataSource,
        config.getTarget().getQueryTimeoutSeconds(),
        config.getQueue().getMaxRetries());
  }

  @Override
  protected String getAssignContentHashSql() {
    return """
        UPDATE intake_job
        SET content_hash = COALESCE(content_hash, ?), updated_at = ?
        WHERE id = ?
        RETURNING content_hash
        """;
  }
}
