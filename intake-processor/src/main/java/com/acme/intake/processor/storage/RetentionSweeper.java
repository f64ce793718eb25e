package com.acme.intake.processor.storage;

import com.acme.intake.config.IntakeConfig;
import com.acme.intake.repository.JobRepository;
import com.acme.intake.spi.PayloadStore;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/** Deletes processed payloads past the retention period unless an open job still points at them. */
@Slf4j
@Singleton
public class RetentionSweeper {

  private final PayloadStore payloads;
  private final JobRepository jobs;
  private final Duration retention;
  private final Clock clock;

  public RetentionSweeper(PayloadStore payloads, JobRepository jobs, IntakeConfig config, Clock clock) {
    this.payloads = payloads;
    this.jobs = jobs;
    this.retention = config.getStorage().getRetention();
    this.clock = clock;
  }

  public int sweep() {
    Instant cutoff = clock.instant().minus(retention);
    Set<Path> retained = jobs.findOpenPayloadPaths().stream()
        .map(p -> Path.of(p).toAbsolutePath().normalize())
        .collect(Collectors.toSet());
    int deleted = payloads.sweepProcessed(cutoff, retained);
    if (deleted > 0) {
      log.info("Retention sweep deleted {} processed payloads older than {}", deleted, cutoff);
    } else {
      log.debug("Retention sweep found nothing older than {}", cutoff);
    }
    return deleted;
  }
}
