package com.acme.intake.config;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class QueueConfig {

  @Builder.Default
  int maxConcurrentJobs = 1;

  @Builder.Default
  int maxRetries = 3;

  @Builder.Default
  int backoffBase = 2;

  @Builder.Default
  Duration maxBackoff = Duration.ofMinutes(5);

  @Builder.Default
  Duration jobLease = Duration.ofMinutes(15);

  @Builder.Default
  Duration shutdownGrace = Duration.ofSeconds(30);

  @Builder.Default
  Duration pollInterval = Duration.ofHours(1);

  /** Upper bound on jobs claimed per pass. */
  @Builder.Default
  int batchSize = 100;
}
