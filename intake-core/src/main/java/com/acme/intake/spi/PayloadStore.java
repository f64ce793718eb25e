package com.acme.intake.spi;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** File areas a payload moves through: pending, then processed or errors. */
public interface PayloadStore {

  /** Durably write a new payload into the pending area under a unique name. */
  Path admit(byte[] content, String filename, Instant receivedAt);

  byte[] read(Path payload);

  /**
   * Current location of a payload. Falls back to a lookup by file name in the processed and errors
   * areas when it is no longer at {@code payloadPath}.
   */
  Optional<Path> locate(String payloadPath);

  Path moveToProcessed(Path payload, Instant processedAt);

  /** Move to the errors area and write the report next to it as JSON. */
  Path moveToErrors(Path payload, Map<String, Object> errorReport);

  List<Path> listPending();

  /**
   * Delete processed payloads last modified before {@code cutoff}, except the retained ones.
   *
   * @return number of files deleted
   */
  int sweepProcessed(Instant cutoff, Set<Path> retained);

  /** Throws when any area cannot be written. */
  void checkWritable();
}
