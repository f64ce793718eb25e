package com.acme.intake.spi;

import com.acme.intake.domain.IntakeRecord;
import java.util.UUID;

/**
 * Loads one job's records into the target table in a single transaction: staged, upserted and
 * recorded in the dedup index, or not at all.
 */
public interface DatabaseLoader {

  /**
   * @throws com.acme.intake.core.TransientException when the database is unreachable, locked or
   *     slow
   * @throws com.acme.intake.core.PermanentException when retrying cannot help
   */
  LoadResult load(LoadRequest request);

  record LoadRequest(UUID jobId, String contentHash, Iterable<IntakeRecord> records) {}

  record LoadResult(UUID jobId, int committedCount, int overwrittenCount) {}
}
