package com.acme.intake.processor.admission;

import com.acme.intake.processor.queue.QueueProcessor;
import com.acme.intake.repository.JobRepository;
import com.acme.intake.spi.PayloadStore;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for new files. The payload is durable in the pending area before the job is
 * enqueued; a crash in between leaves an orphan that {@link #adoptOrphans()} picks up.
 */
@Slf4j
@Singleton
public class JobAdmission {

  static final String ORPHAN_PREFIX = "orphan:";

  private final PayloadStore payloads;
  private final QueueProcessor queue;
  private final JobRepository jobs;

  public JobAdmission(PayloadStore payloads, QueueProcessor queue, JobRepository jobs) {
    this.payloads = payloads;
    this.queue = queue;
    this.jobs = jobs;
  }

  public UUID admit(AdmissionRequest request) {
    Path payload = payloads.admit(request.content(), request.filename(), request.receivedAt());
    return queue.enqueue(request.sourceRef(), payload);
  }

  /** Enqueue pending files that no job references. */
  public int adoptOrphans() {
    int adopted = 0;
    for (Path payload : payloads.listPending()) {
      if (!jobs.existsByPayloadPath(payload.toAbsolutePath().toString())) {
        UUID id = queue.enqueue(ORPHAN_PREFIX + payload.getFileName(), payload);
        log.warn("Adopted orphaned payload {} as job {}", payload.getFileName(), id);
        adopted++;
      }
    }
    return adopted;
  }

  public record AdmissionRequest(byte[] content, String sourceRef, Instant receivedAt, String filename) {

    public AdmissionRequest {
      Objects.requireNonNull(content, "content");
      Objects.requireNonNull(sourceRef, "sourceRef");
      Objects.requireNonNull(receivedAt, "receivedAt");
    }
  }
}
