package com.acme.intake.repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only record of committed file contents and unique keys. Successful commits are written by
 * the loader inside its own transaction. This interface covers the lookups plus failure notes.
 */
public interface DedupRepository {

  /** True when a job holding this content hash has committed. */
  boolean isCommitted(String contentHash);

  /** The first job that committed this content. */
  Optional<UUID> findCommittingJob(String contentHash);

  /** Note a failed job for this content. Never makes the content a duplicate. */
  void recordFailure(String contentHash, UUID jobId);

  /** Latest commit time per key, for the keys that were ever committed. */
  Map<String, Instant> lastCommittedAt(Collection<String> uniqueKeys);
}
