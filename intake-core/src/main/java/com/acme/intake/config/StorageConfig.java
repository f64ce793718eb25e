package com.acme.intake.config;

import java.nio.file.Path;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Layout of the payload areas under one base directory. */
@Value
@Builder(toBuilder = true)
public class StorageConfig {

  @Builder.Default
  Path baseDir = Path.of("/var/lib/trackandtrace");

  @Builder.Default
  Duration retention = Duration.ofDays(30);

  public Path pendingDir() {
    return baseDir.resolve("pending");
  }

  public Path processedDir() {
    return baseDir.resolve("processed");
  }

  public Path errorsDir() {
    return baseDir.resolve("errors");
  }

  public Path ledgerDir() {
    return baseDir.resolve("ledger");
  }
}
