package com.acme.intake.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.acme.intake.core.ConfigException;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("IntakeConfig validation")
class IntakeConfigTest {

  private static IntakeConfig.IntakeConfigBuilder valid() {
    return IntakeConfig.builder()
        .target(DatabaseConfig.builder()
            .connection(ConnectionConfig.builder()
                .jdbcUrl("jdbc:postgresql://db:5432/tracking")
                .username("intake")
                .build())
            .build())
        .ledger(ConnectionConfig.builder().jdbcUrl("jdbc:h2:file:/tmp/ledger").username("sa").build())
        .layout(SheetLayout.builder()
            .uniqueKey("hawb")
            .column(new ColumnSpec("carrier", ColumnType.TEXT, true))
            .column(new ColumnSpec("pieces", ColumnType.NUMBER, false))
            .build());
  }

  @Test
  @DisplayName("defaults describe a single-worker queue with three attempts")
  void defaults() {
    IntakeConfig config = valid().build().validate();

    assertThat(config.getQueue().getMaxConcurrentJobs()).isEqualTo(1);
    assertThat(config.getQueue().getMaxRetries()).isEqualTo(3);
    assertThat(config.getQueue().getBackoffBase()).isEqualTo(2);
    assertThat(config.getTarget().getStagingSchema()).isEqualTo("temp_processing");
    assertThat(config.getTarget().getTargetTable()).isEqualTo("tracking_data");
    assertThat(config.getTarget().stagingTable()).isEqualTo("temp_processing.tracking_data_stage");
    assertThat(config.getTarget().getConflictPolicy()).isEqualTo(ConflictPolicy.LAST_WRITE_WINS);
    assertThat(config.getStorage().getRetention()).isEqualTo(Duration.ofDays(30));
  }

  @Test
  @DisplayName("dialect is inferred from the JDBC URL")
  void dialectFromUrl() {
    IntakeConfig config = valid().build();

    assertThat(config.getTarget().getConnection().getDialect()).isEqualTo(Dialect.POSTGRESQL);
    assertThat(config.getLedger().getDialect()).isEqualTo(Dialect.H2);
  }

  @Test
  @DisplayName("password is kept out of toString")
  void passwordHidden() {
    ConnectionConfig connection = ConnectionConfig.builder()
        .jdbcUrl("jdbc:h2:mem:x").username("sa").password("s3cret").build();

    assertThat(connection.toString()).doesNotContain("s3cret");
  }

  @Nested
  @DisplayName("rejects")
  class Rejects {

    @Test
    @DisplayName("a target table name that is not an identifier")
    void badTableName() {
      IntakeConfig config = valid()
          .target(DatabaseConfig.builder()
              .connection(ConnectionConfig.builder().jdbcUrl("jdbc:h2:mem:t").build())
              .targetTable("tracking; DROP TABLE x")
              .build())
          .build();

      assertThatThrownBy(config::validate)
          .isInstanceOf(ConfigException.class)
          .hasMessageContaining("target table");
    }

    @Test
    @DisplayName("an unsupported JDBC URL")
    void unsupportedUrl() {
      IntakeConfig config = valid()
          .ledger(ConnectionConfig.builder().jdbcUrl("jdbc:mysql://x/y").build())
          .build();

      assertThatThrownBy(config::validate)
          .isInstanceOf(ConfigException.class)
          .hasMessageContaining("Unsupported JDBC URL");
    }

    @Test
    @DisplayName("a column configured twice")
    void duplicateColumn() {
      IntakeConfig config = valid()
          .layout(SheetLayout.builder()
              .uniqueKey("hawb")
              .column(new ColumnSpec("Carrier", ColumnType.TEXT, false))
              .column(new ColumnSpec("carrier", ColumnType.TEXT, false))
              .build())
          .build();

      assertThatThrownBy(config::validate).hasMessageContaining("configured twice");
    }

    @Test
    @DisplayName("a reserved column name")
    void reservedColumn() {
      IntakeConfig config = valid()
          .layout(SheetLayout.builder()
              .column(new ColumnSpec("processed_at", ColumnType.TIMESTAMP, false))
              .build())
          .build();

      assertThatThrownBy(config::validate).hasMessageContaining("reserved");
    }

    @Test
    @DisplayName("zero retries")
    void zeroRetries() {
      IntakeConfig config = valid().queue(QueueConfig.builder().maxRetries(0).build()).build();

      assertThatThrownBy(config::validate).hasMessageContaining("max retries");
    }
  }
}
