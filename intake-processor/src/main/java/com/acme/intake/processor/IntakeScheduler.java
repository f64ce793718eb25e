package com.acme.intake.processor;

import com.acme.intake.processor.queue.QueueProcessor;
import com.acme.intake.processor.storage.RetentionSweeper;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Daemon-mode ticks: one queue pass per poll interval and a daily retention sweep. */
@Singleton
@Requires(property = "intake.mode", value = "daemon")
public class IntakeScheduler {
  private static final Logger LOG = LoggerFactory.getLogger(IntakeScheduler.class);

  private final QueueProcessor processor;
  private final RetentionSweeper sweeper;

  public IntakeScheduler(QueueProcessor processor, RetentionSweeper sweeper) {
    this.processor = processor;
    this.sweeper = sweeper;
  }

  @Scheduled(initialDelay = "1s", fixedDelay = "${intake.queue.poll-interval}")
  public void tick() {
    try {
      var report = processor.runOnce();
      if (report.total() == 0) {
        LOG.debug("Queue tick found no ready jobs");
      }
    } catch (Exception e) {
      LOG.error("Error in queue tick: {}", e.getMessage(), e);
    }
  }

  @Scheduled(initialDelay = "1m", fixedDelay = "${intake.retention.sweep-interval:24h}")
  public void sweepRetention() {
    try {
      sweeper.sweep();
    } catch (Exception e) {
      LOG.error("Error in retention sweep: {}", e.getMessage(), e);
    }
  }
}
