package com.acme.intake.config;

import lombok.Builder;
import lombok.Value;

/** Target database: connection, staging schema, target table and load behaviour. */
@Value
@Builder(toBuilder = true)
public class DatabaseConfig {

  ConnectionConfig connection;

  @Builder.Default
  String stagingSchema = "temp_processing";

  @Builder.Default
  String targetTable = "tracking_data";

  @Builder.Default
  int queryTimeoutSeconds = 60;

  @Builder.Default
  ConflictPolicy conflictPolicy = ConflictPolicy.LAST_WRITE_WINS;

  public String stagingTable() {
    return stagingSchema + "." + targetTable + "_stage";
  }
}
