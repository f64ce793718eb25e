package com.acme.intake.persistence.jdbc.job;

import com.acme.intake.config.IntakeConfig;
import com.acme.intake.persistence.jdbc.config.DataSourceFactory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** H2-specific implementation of JobRepository */
@Singleton
@Requires(property = "intake.ledger.dialect", value = "H2")
public class H2JobRepository extends JdbcJobRepository {

  public H2JobRepository(
      @Named(DataSourceFactory.LEDGER) DataSource dataSource, IntakeConfig config) {
    super(
        dataSource,
        config.getTarget().getQueryTimeoutSeconds(),
        config.getQueue().getMaxRetries());
  }

  @Override
  protected String getAssignContentHashSql() {
    return """
        SELECT content_hash FROM FINAL TABLE (
          UPDATE intake_job
          SET content_hash = COALESCE(content_hash, ?), updated_at = ?
          WHERE id = ?
        )
        """;
  }
}
