package com.acme.intake.persistence.jdbc.loader;

import com.acme.intake.config.IntakeConfig;
import com.acme.intake.persistence.jdbc.config.DataSourceFactory;
import com.acme.intake.persistence.jdbc.dedup.JdbcDedupRepository;
import com.acme.intake.persistence.jdbc.schema.TableDefinitions;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.util.stream.Collectors;
import javax.sql.DataSource;

/** H2-specific loader: MERGE INTO ... USING the staged run. */
@Singleton
@Requires(property = "intake.db.dialect", value = "H2")
public class H2StagingLoader extends JdbcStagingLoader {

  public H2StagingLoader(
      @Named(DataSourceFactory.TARGET) DataSource dataSource,
      JdbcDedupRepository dedup,
      IntakeConfig config) {
    super(dataSource, dedup, config);
  }

  @Override
  protected String getUpsertSql() {
    String key = tables.keyColumn();
    String columns = tables.dataColumnList() + ", " + TableDefinitions.SOURCE_JOB_ID + ", "
        + TableDefinitions.PROCESSED_AT;
    String sourceValues = tables.dataColumns().stream()
        .map(c -> "s." + c.name())
        .collect(Collectors.joining(", "))
        + ", s." + TableDefinitions.SOURCE_JOB_ID + ", s." + TableDefinitions.PROCESSED_AT;

    return "MERGE INTO " + tables.targetTable() + " t\n"
        + "USING (SELECT " + tables.dataColumnList() + ", " + TableDefinitions.SOURCE_JOB_ID
        + ", CAST(? AS TIMESTAMP) AS " + TableDefinitions.PROCESSED_AT
        + " FROM " + tables.stagingTable() + " WHERE " + TableDefinitions.RUN_ID + " = ?) s\n"
        + "ON (t." + key + " = s." + key + ")\n"
        + "WHEN MATCHED THEN UPDATE SET " + updateAssignments("s") + "\n"
        + "WHEN NOT MATCHED THEN INSERT (" + columns + ") VALUES (" + sourceValues + ")";
  }
}
