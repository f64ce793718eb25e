package com.acme.intake.persistence.jdbc.schema;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.intake.config.ColumnSpec;
import com.acme.intake.config.ColumnType;
import com.acme.intake.config.ConnectionConfig;
import com.acme.intake.config.DatabaseConfig;
import com.acme.intake.config.SheetLayout;
import org.junit.jupiter.api.Test;

class TableDefinitionsTest {

  private final TableDefinitions tables = new TableDefinitions(
      DatabaseConfig.builder()
          .connection(ConnectionConfig.builder().jdbcUrl("jdbc:h2:mem:x").build())
          .stagingSchema("stage")
          .targetTable("shipments")
          .build(),
      SheetLayout.builder()
          .uniqueKey("HAWB")
          .column(new ColumnSpec("pieces", ColumnType.NUMBER, false))
          .column(new ColumnSpec("delivered", ColumnType.BOOLEAN, false))
          .build());

  @Test
  void targetTableHasKeyAndBookkeepingColumns() {
    assertThat(tables.createTargetTableSql())
        .startsWith("CREATE TABLE IF NOT EXISTS shipments (")
        .contains("hawb VARCHAR(512) NOT NULL PRIMARY KEY")
        .contains("pieces DECIMAL(38,10)")
        .contains("delivered BOOLEAN")
        .contains("source_job_id VARCHAR(36)")
        .contains("processed_at TIMESTAMP");
  }

  @Test
  void stagingTableIsKeyedByRun() {
    assertThat(tables.createStagingTableSql())
        .startsWith("CREATE TABLE IF NOT EXISTS stage.shipments_stage (")
        .contains("run_id VARCHAR(64) NOT NULL")
        .contains("PRIMARY KEY (run_id, hawb)")
        .doesNotContain("processed_at");
    assertThat(tables.createStagingSchemaSql()).isEqualTo("CREATE SCHEMA IF NOT EXISTS stage");
  }

  @Test
  void columnListStartsWithKey() {
    assertThat(tables.dataColumnList()).isEqualTo("hawb, pieces, delivered");
  }
}
