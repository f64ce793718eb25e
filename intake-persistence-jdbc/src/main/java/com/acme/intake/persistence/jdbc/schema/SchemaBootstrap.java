package com.acme.intake.persistence.jdbc.schema;

import com.acme.intake.config.Dialect;
import com.acme.intake.config.IntakeConfig;
import com.acme.intake.core.PermanentException;
import com.acme.intake.persistence.jdbc.ExceptionTranslator;
import com.acme.intake.persistence.jdbc.config.DataSourceFactory;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings both databases to the shape the service needs: Flyway migrations for the job ledger and
 * the dedup index, then the staging schema, staging table and target table for the configured
 * columns. Safe to run on every start.
 */
@Singleton
public class SchemaBootstrap {

  private static final Logger LOG = LoggerFactory.getLogger(SchemaBootstrap.class);

  static final String LEDGER_HISTORY_TABLE = "intake_ledger_history";
  static final String DEDUP_HISTORY_TABLE = "intake_dedup_history";

  private final DataSource target;
  private final DataSource ledger;
  private final IntakeConfig config;
  private final TableDefinitions tables;

  public SchemaBootstrap(
      @Named(DataSourceFactory.TARGET) DataSource target,
      @Named(DataSourceFactory.LEDGER) DataSource ledger,
      IntakeConfig config) {
    this.target = target;
    this.ledger = ledger;
    this.config = config;
    this.tables = new TableDefinitions(config.getTarget(), config.getLayout());
  }

  public void migrate() {
    migrate(ledger, "db/ledger", config.getLedger().getDialect(), LEDGER_HISTORY_TABLE);
    migrate(target, "db/dedup", config.getTarget().getConnection().getDialect(), DEDUP_HISTORY_TABLE);
    createLoadTables();
  }

  private void migrate(DataSource dataSource, String root, Dialect dialect, String historyTable) {
    String location = "classpath:" + root + "/" + dialect.name().toLowerCase(Locale.ROOT);
    try {
      MigrateResult result = Flyway.configure()
          .dataSource(dataSource)
          .locations(location)
          .table(historyTable)
          .baselineOnMigrate(true)
          .baselineVersion("0")
          .load()
          .migrate();
      LOG.info("Migrated {} ({}): {} migration(s) applied", root, dialect, result.migrationsExecuted);
    } catch (FlywayException e) {
      throw new PermanentException("Schema migration failed for " + location + ": " + e.getMessage(), e);
    }
  }

  private void createLoadTables() {
    try (Connection conn = target.getConnection();
        Statement st = conn.createStatement()) {
      st.execute(tables.createStagingSchemaSql());
      st.execute(tables.createStagingTableSql());
      st.execute(tables.createTargetTableSql());
      LOG.info("Staging table {} and target table {} are in place",
          tables.stagingTable(), tables.targetTable());
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "create staging and target tables", LOG);
    }
  }
}
