package com.acme.intake.persistence.jdbc.schema;

import com.acme.intake.config.ColumnSpec;
import com.acme.intake.config.DatabaseConfig;
import com.acme.intake.config.SheetLayout;
import java.util.List;
import java.util.stream.Collectors;

/**
 * DDL and column lists for the staging and target tables, derived from the configured sheet
 * layout. Identifiers are validated at startup, so they are safe to splice into SQL.
 */
public class TableDefinitions {

  public static final String RUN_ID = "run_id";
  public static final String SOURCE_JOB_ID = "source_job_id";
  public static final String PROCESSED_AT = "processed_at";

  static final String KEY_SQL_TYPE = "VARCHAR(512)";

  private final DatabaseConfig database;
  private final SheetLayout layout;

  public TableDefinitions(DatabaseConfig database, SheetLayout layout) {
    this.database = database;
    this.layout = layout;
  }

  public String targetTable() {
    return database.getTargetTable();
  }

  public String stagingTable() {
    return database.stagingTable();
  }

  public String keyColumn() {
    return layout.keyColumnName();
  }

  /** Key column first, then the configured columns. */
  public List<ColumnSpec> dataColumns() {
    return layout.allColumns();
  }

  /** Configured columns other than the key. */
  public List<ColumnSpec> valueColumns() {
    return layout.getColumns();
  }

  public String dataColumnList() {
    return dataColumns().stream().map(ColumnSpec::name).collect(Collectors.joining(", "));
  }

  public String createStagingSchemaSql() {
    return "CREATE SCHEMA IF NOT EXISTS " + database.getStagingSchema();
  }

  public String createStagingTableSql() {
    StringBuilder sql = new StringBuilder("CREATE TABLE IF NOT EXISTS ")
        .append(stagingTable()).append(" (\n")
        .append("  ").append(RUN_ID).append(" VARCHAR(64) NOT NULL,\n")
        .append("  ").append(keyColumn()).append(' ').append(KEY_SQL_TYPE).append(" NOT NULL,\n");
    for (ColumnSpec column : valueColumns()) {
      sql.append("  ").append(column.name()).append(' ').append(column.type().sqlType()).append(",\n");
    }
    return sql.append("  ").append(SOURCE_JOB_ID).append(" VARCHAR(36),\n")
        .append("  PRIMARY KEY (").append(RUN_ID).append(", ").append(keyColumn()).append(")\n")
        .append(")")
        .toString();
  }

  public String createTargetTableSql() {
    StringBuilder sql = new StringBuilder("CREATE TABLE IF NOT EXISTS ")
        .append(targetTable()).append(" (\n")
        .append("  ").append(keyColumn()).append(' ').append(KEY_SQL_TYPE).append(" NOT NULL PRIMARY KEY,\n");
    for (ColumnSpec column : valueColumns()) {
      sql.append("  ").append(column.name()).append(' ').append(column.type().sqlType()).append(",\n");
    }
    return sql.append("  ").append(SOURCE_JOB_ID).append(" VARCHAR(36),\n")
        .append("  ").append(PROCESSED_AT).append(" TIMESTAMP\n")
        .append(")")
        .toString();
  }
}
