package com.acme.intake.persistence.jdbc.loader;

import com.acme.intake.config.IntakeConfig;
import com.acme.intake.persistence.jdbc.config.DataSourceFactory;
import com.acme.intake.persistence.jdbc.dedup.JdbcDedupRepository;
import com.acme.intake.persistence.jdbc.schema.TableDefinitions;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** PostgreSQL-specific loader: INSERT ... SELECT ... ON CONFLICT DO UPDATE. */
@Singleton
@Requires(property = "intake.db.dialect", value = "PostgreSQL")
public class PostgresStagingLoader extends JdbcStagingLoader {

  public PostgresStagingLoader(
      @Named(DataSourceFactory.TARGET) DataSource dataSource,
      JdbcDedupRepository dedup,
      IntakeConfig config) {
    super(dataSource, dedup, config);
  }

  @Override
  protected String getUpsertSql() {
    return "INSERT INTO " + tables.targetTable() + " (" + tables.dataColumnList() + ", "
        + TableDefinitions.SOURCE_JOB_ID + ", " + TableDefinitions.PROCESSED_AT + ")\n"
        + "SELECT " + tables.dataColumnList() + ", " + TableDefinitions.SOURCE_JOB_ID
        + ", CAST(? AS TIMESTAMP) FROM " + tables.stagingTable()
        + " WHERE " + TableDefinitions.RUN_ID + " = ?\n"
        + "ON CONFLICT (" + tables.keyColumn() + ") DO UPDATE SET " + updateAssignments("EXCLUDED");
  }
}
