package com.acme.intake.processor.queue;

import com.acme.intake.config.QueueConfig;
import java.time.Duration;

/**
 * Retry schedule: attempt {@code n} waits {@code base^n} seconds, capped at the maximum backoff.
 * A job gets {@code maxRetries} retries after its first attempt, so {@code maxRetries + 1} attempts
 * in all before a retryable failure is dead-lettered.
 */
public class BackoffPolicy {

  private final int base;
  private final Duration maxBackoff;
  private final int maxRetries;

  public BackoffPolicy(int base, Duration maxBackoff, int maxRetries) {
    if (base < 1) {
      throw new IllegalArgumentException("base must be at least 1");
    }
    if (maxBackoff.isNegative()) {
      throw new IllegalArgumentException("maxBackoff must not be negative");
    }
    this.base = base;
    this.maxBackoff = maxBackoff;
    this.maxRetries = maxRetries;
  }

  public static BackoffPolicy from(QueueConfig queue) {
    return new BackoffPolicy(queue.getBackoffBase(), queue.getMaxBackoff(), queue.getMaxRetries());
  }

  /** Wait before the next attempt, after {@code attempt} attempts have been counted. */
  public Duration delay(int attempt) {
    double seconds = Math.pow(base, Math.max(0, attempt));
    if (seconds >= maxBackoff.getSeconds()) {
      return maxBackoff;
    }
    return Duration.ofSeconds((long) seconds);
  }

  /** Whether a retryable failure of attempt number {@code attempt} (1-based) gets another try. */
  public boolean shouldRetry(int attempt) {
    return attempt <= maxRetries;
  }

  public int maxAttempts() {
    return maxRetries + 1;
  }
}
