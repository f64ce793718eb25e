package com.acme.intake.config;

import com.acme.intake.core.ConfigException;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.Builder;
import lombok.Value;

/**
 * Complete, immutable configuration of the intake service. Built once at startup and handed to
 * every component. {@link #validate()} must pass before any job runs.
 */
@Value
@Builder(toBuilder = true)
public class IntakeConfig {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  DatabaseConfig target;
  ConnectionConfig ledger;
  SheetLayout layout;

  @Builder.Default
  QueueConfig queue = QueueConfig.builder().build();

  @Builder.Default
  StorageConfig storage = StorageConfig.builder().build();

  public IntakeConfig validate() {
    require(target != null && target.getConnection() != null, "target database is not configured");
    require(ledger != null, "job ledger is not configured");
    require(layout != null, "sheet layout is not configured");

    target.getConnection().getDialect();
    ledger.getDialect();

    identifier("staging schema", target.getStagingSchema());
    identifier("target table", target.getTargetTable());
    identifier("unique key", layout.getUniqueKey());
    Set<String> seen = new HashSet<>();
    seen.add(layout.keyColumnName());
    for (ColumnSpec column : layout.getColumns()) {
      identifier("column", column.name());
      require(seen.add(column.name()), "column '" + column.name() + "' is configured twice");
    }
    require(!seen.contains("source_job_id") && !seen.contains("processed_at") && !seen.contains("run_id"),
        "columns source_job_id, processed_at and run_id are reserved");

    require(target.getQueryTimeoutSeconds() > 0, "query timeout must be positive");
    require(queue.getMaxConcurrentJobs() >= 1, "max concurrent jobs must be at least 1");
    require(queue.getMaxRetries() >= 1, "max retries must be at least 1");
    require(queue.getBackoffBase() >= 1, "backoff base must be at least 1");
    require(!queue.getPollInterval().isNegative() && !queue.getPollInterval().isZero(),
        "poll interval must be positive");
    require(!storage.getRetention().isNegative(), "file retention must not be negative");
    return this;
  }

  private static void identifier(String what, String value) {
    if (value == null || !IDENTIFIER.matcher(value).matches()) {
      throw new ConfigException("Invalid " + what + " name: '" + value + "'");
    }
  }

  private static void require(boolean condition, String message) {
    if (!condition) {
      throw new ConfigException("Invalid configuration: " + message);
    }
  }
}
