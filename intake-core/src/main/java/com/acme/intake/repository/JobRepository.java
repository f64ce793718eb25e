package com.acme.intake.repository;

import com.acme.intake.domain.Job;
import com.acme.intake.domain.JobState;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Durable job ledger. Every state change is a compare-and-set on the expected current state, so
 * the boolean results report whether this caller won the transition.
 */
public interface JobRepository {

  /** Insert a new job in PENDING state. Durable when this returns. */
  void insertPending(UUID id, String sourceRef, String payloadPath);

  Optional<Job> findById(UUID id);

  /** Claimable jobs due at {@code now}, in enqueue order. */
  List<Job> findReady(Instant now, int limit);

  /** PENDING or due RETRYING to PROCESSING with a lease. */
  boolean claim(UUID id, String workerId, Instant now, Instant leaseUntil);

  /**
   * Store the content hash unless one is already set.
   *
   * @return the hash held by the ledger after the call
   */
  String assignContentHash(UUID id, String contentHash);

  /** PROCESSING to SUCCEEDED, counting the attempt. */
  boolean markSucceeded(UUID id, String payloadPath);

  /** PROCESSING to RETRYING, counting the attempt. */
  boolean markRetrying(UUID id, String error, Instant nextAttemptAt);

  /** PROCESSING to FAILED, counting the attempt. */
  boolean markFailed(UUID id, String error, String payloadPath);

  /** PROCESSING to RETRYING without counting the attempt (shutdown). */
  boolean release(UUID id, String reason);

  /** Every PROCESSING job to RETRYING. Called once at startup. */
  int recoverInterrupted();

  /** PROCESSING jobs whose lease ran out to RETRYING. */
  int recoverExpiredLeases(Instant now);

  Map<JobState, Long> countByState();

  /** Jobs still PENDING, PROCESSING or RETRYING. */
  long countOpen();

  /** Earliest time a PENDING or RETRYING job becomes claimable. */
  Optional<Instant> nextDueAt();

  /** Most recently enqueued jobs in the given state. */
  List<Job> findRecent(JobState state, int limit);

  /** Payload paths referenced by jobs that are not terminal. */
  Set<String> findOpenPayloadPaths();

  boolean existsByPayloadPath(String payloadPath);
}
