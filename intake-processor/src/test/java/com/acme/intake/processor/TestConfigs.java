package com.acme.intake.processor;

import com.acme.intake.config.ColumnSpec;
import com.acme.intake.config.ColumnType;
import com.acme.intake.config.ConnectionConfig;
import com.acme.intake.config.DatabaseConfig;
import com.acme.intake.config.IntakeConfig;
import com.acme.intake.config.QueueConfig;
import com.acme.intake.config.SheetLayout;
import com.acme.intake.config.StorageConfig;
import java.nio.file.Path;
import java.time.Duration;

public final class TestConfigs {

  public static final SheetLayout LAYOUT = SheetLayout.builder()
      .uniqueKey("hawb")
      .column(new ColumnSpec("carrier", ColumnType.TEXT, true))
      .column(new ColumnSpec("pieces", ColumnType.NUMBER, false))
      .column(new ColumnSpec("eta", ColumnType.DATE, false))
      .build();

  private TestConfigs() {}

  /** hawb key, carrier (required text), pieces (number), eta (date); retries without waiting. */
  public static IntakeConfig intakeConfig(String jdbcUrl, Path baseDir) {
    ConnectionConfig connection = ConnectionConfig.builder().jdbcUrl(jdbcUrl).username("sa").password("").build();
    return IntakeConfig.builder()
        .target(DatabaseConfig.builder().connection(connection).queryTimeoutSeconds(10).build())
        .ledger(connection)
        .layout(LAYOUT)
        .queue(QueueConfig.builder().maxBackoff(Duration.ZERO).shutdownGrace(Duration.ofSeconds(2)).build())
        .storage(StorageConfig.builder().baseDir(baseDir).build())
        .build()
        .validate();
  }

  public static IntakeConfig intakeConfig(Path baseDir) {
    return intakeConfig("jdbc:h2:mem:unused", baseDir);
  }
}
