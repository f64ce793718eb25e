package com.acme.intake.persistence.jdbc;

import com.acme.intake.config.ColumnSpec;
import com.acme.intake.config.ColumnType;
import com.acme.intake.config.ConnectionConfig;
import com.acme.intake.config.DatabaseConfig;
import com.acme.intake.config.IntakeConfig;
import com.acme.intake.config.SheetLayout;
import com.acme.intake.persistence.jdbc.schema.SchemaBootstrap;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;

/**
 * Base class for H2-based repository integration tests. Each subclass gets its own in-memory
 * database, migrated by {@link SchemaBootstrap} with ledger and target sharing one pool.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class H2RepositoryTestBase {

  protected HikariDataSource dataSource;
  protected IntakeConfig config;

  @BeforeAll
  protected void setupSchema() {
    String url = "jdbc:h2:mem:" + getClass().getSimpleName() + ";DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE";

    HikariConfig hikari = new HikariConfig();
    hikari.setJdbcUrl(url);
    hikari.setDriverClassName("org.h2.Driver");
    hikari.setUsername("sa");
    hikari.setPassword("");
    hikari.setMaximumPoolSize(5);
    dataSource = new HikariDataSource(hikari);

    config = intakeConfig(url);
    new SchemaBootstrap(dataSource, dataSource, config).migrate();
  }

  /** Layout: hawb key, carrier (required text), pieces (number), eta (date). */
  protected IntakeConfig intakeConfig(String url) {
    ConnectionConfig connection = ConnectionConfig.builder().jdbcUrl(url).username("sa").password("").build();
    return IntakeConfig.builder()
        .target(DatabaseConfig.builder().connection(connection).queryTimeoutSeconds(10).build())
        .ledger(connection)
        .layout(SheetLayout.builder()
            .uniqueKey("hawb")
            .column(new ColumnSpec("carrier", ColumnType.TEXT, true))
            .column(new ColumnSpec("pieces", ColumnType.NUMBER, false))
            .column(new ColumnSpec("eta", ColumnType.DATE, false))
            .build())
        .build()
        .validate();
  }

  @BeforeEach
  void cleanTables() throws SQLException {
    execute("DELETE FROM intake_job");
    execute("DELETE FROM intake_content_hash");
    execute("DELETE FROM intake_committed_key");
    execute("DELETE FROM temp_processing.tracking_data_stage");
    execute("DELETE FROM tracking_data");
  }

  @AfterAll
  void tearDown() {
    if (dataSource != null) {
      dataSource.close();
    }
  }

  protected DataSource getDataSource() {
    return dataSource;
  }

  protected void execute(String sql) throws SQLException {
    try (Connection conn = dataSource.getConnection();
        Statement st = conn.createStatement()) {
      st.execute(sql);
    }
  }

  protected long count(String sql) throws SQLException {
    try (Connection conn = dataSource.getConnection();
        Statement st = conn.createStatement();
        ResultSet rs = st.executeQuery(sql)) {
      rs.next();
      return rs.getLong(1);
    }
  }

  protected String queryString(String sql) throws SQLException {
    try (Connection conn = dataSource.getConnection();
        Statement st = conn.createStatement();
        ResultSet rs = st.executeQuery(sql)) {
      return rs.next() ? rs.getString(1) : null;
    }
  }
}
