package com.acme.intake.processor.queue;

import com.acme.intake.config.IntakeConfig;
import com.acme.intake.config.QueueConfig;
import com.acme.intake.core.FailureKind;
import com.acme.intake.core.IntakeException;
import com.acme.intake.core.PermanentException;
import com.acme.intake.domain.AttemptOutcome;
import com.acme.intake.domain.IntakeRecord;
import com.acme.intake.domain.Job;
import com.acme.intake.processor.file.FileProcessor;
import com.acme.intake.processor.file.ParsedSheet;
import com.acme.intake.repository.DedupRepository;
import com.acme.intake.repository.JobRepository;
import com.acme.intake.spi.DatabaseLoader;
import com.acme.intake.spi.DatabaseLoader.LoadRequest;
import com.acme.intake.spi.DatabaseLoader.LoadResult;
import com.acme.intake.spi.PayloadStore;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs queued jobs against the ledger: claims them in enqueue order, processes each file and
 * records exactly one outcome per attempt (success, duplicate, retry or dead letter).
 *
 * <p>With one concurrent job, jobs run inline on the calling thread. With more, a dispatcher
 * prepares jobs in order and hands them to a fixed worker pool through a {@link KeySetGate}, so
 * jobs sharing a unique key never load concurrently.
 */
@Singleton
public class QueueProcessor {
  private static final Logger LOG = LoggerFactory.getLogger(QueueProcessor.class);

  public static final String MDC_JOB_ID = "jobId";

  static final Duration IDLE_WAIT = Duration.ofSeconds(1);

  private final JobRepository jobs;
  private final DedupRepository dedup;
  private final FileProcessor files;
  private final DatabaseLoader loader;
  private final PayloadStore payloads;
  private final BackoffPolicy backoff;
  private final QueueConfig queue;
  private final Clock clock;
  private final String workerId = "intake-" + ProcessHandle.current().pid();

  private final ReentrantLock passLock = new ReentrantLock();
  private final KeySetGate gate = new KeySetGate();
  private final Map<UUID, Thread> inFlight = new ConcurrentHashMap<>();
  private final Set<UUID> cancelled = ConcurrentHashMap.newKeySet();
  private volatile boolean stopping;
  private ExecutorService workers;

  public QueueProcessor(
      JobRepository jobs,
      DedupRepository dedup,
      FileProcessor files,
      DatabaseLoader loader,
      PayloadStore payloads,
      BackoffPolicy backoff,
      IntakeConfig config,
      Clock clock) {
    this.jobs = jobs;
    this.dedup = dedup;
    this.files = files;
    this.loader = loader;
    this.payloads = payloads;
    this.backoff = backoff;
    this.queue = config.getQueue();
    this.clock = clock;
  }

  /**
   * Record a new PENDING job for a payload already on disk.
   *
   * @throws IllegalArgumentException when the payload file does not exist
   */
  public UUID enqueue(String sourceRef, Path payload) {
    if (payload == null || !Files.isRegularFile(payload)) {
      throw new IllegalArgumentException("Payload does not exist: " + payload);
    }
    UUID id = UUID.randomUUID();
    jobs.insertPending(id, sourceRef, payload.toAbsolutePath().toString());
    LOG.info("Enqueued job {} from {} ({})", id, sourceRef, payload.getFileName());
    return id;
  }

  /** Startup recovery: jobs left PROCESSING by a previous run become due again. */
  public int recoverInterrupted() {
    int recovered = jobs.recoverInterrupted();
    if (recovered > 0) {
      LOG.warn("Recovered {} jobs interrupted by the previous run", recovered);
    }
    return recovered;
  }

  /**
   * One pass over the queue. Returns once every job claimed in this pass has a recorded outcome.
   * A pass that is already running elsewhere makes this a no-op.
   */
  public DrainReport runOnce() {
    if (stopping) {
      return DrainReport.empty();
    }
    if (!passLock.tryLock()) {
      LOG.debug("Queue pass already running, skipping");
      return DrainReport.empty();
    }
    try {
      Instant now = clock.instant();
      int expired = jobs.recoverExpiredLeases(now);
      if (expired > 0) {
        LOG.warn("Returned {} jobs with expired leases to RETRYING", expired);
      }
      List<Job> ready = jobs.findReady(now, queue.getBatchSize());
      if (ready.isEmpty()) {
        return DrainReport.empty();
      }
      LOG.debug("Queue pass found {} ready jobs", ready.size());
      DrainReport report = queue.getMaxConcurrentJobs() == 1 ? runInline(ready) : runBounded(ready);
      LOG.info("Queue pass done: {} succeeded, {} duplicates, {} retrying, {} failed",
          report.succeeded(), report.duplicates(), report.retried(), report.failed());
      return report;
    } finally {
      passLock.unlock();
    }
  }

  /**
   * Repeats {@link #runOnce()} until no job is open, sleeping until the next retry is due.
   *
   * @return true when drained, false when stopped first
   */
  public boolean runUntilDrained() {
    while (!stopping) {
      DrainReport pass = runOnce();
      if (jobs.countOpen() == 0) {
        LOG.info("Queue drained");
        return true;
      }
      Duration wait = jobs.nextDueAt()
          .map(due -> Duration.between(clock.instant(), due))
          .map(d -> d.isNegative() ? Duration.ZERO : d)
          .orElse(IDLE_WAIT);
      if (wait.isZero() && pass.total() == 0) {
        wait = IDLE_WAIT;
      }
      if (!wait.isZero()) {
        LOG.debug("Waiting {} for the next due job", wait);
        try {
          Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          LOG.warn("Interrupted while waiting for due jobs");
          return false;
        }
      }
    }
    return false;
  }

  /**
   * Stop claiming, give in-flight jobs the shutdown grace to finish, then interrupt the rest and
   * release them back to RETRYING without counting the attempt.
   */
  @PreDestroy
  public void stop() {
    if (stopping) {
      return;
    }
    stopping = true;
    Duration grace = queue.getShutdownGrace();
    LOG.info("Stopping queue processor, waiting up to {} for {} in-flight jobs", grace, inFlight.size());

    long deadline = System.nanoTime() + grace.toNanos();
    try {
      while (!inFlight.isEmpty() && System.nanoTime() < deadline) {
        TimeUnit.MILLISECONDS.sleep(100);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }

    inFlight.forEach((jobId, thread) -> {
      cancelled.add(jobId);
      thread.interrupt();
      try {
        if (jobs.release(jobId, "Released at shutdown")) {
          LOG.warn("Job {} did not finish within the shutdown grace and was released", jobId);
        }
      } catch (RuntimeException e) {
        LOG.error("Failed to release job {}; lease recovery will return it", jobId, e);
      }
    });
    if (workers != null) {
      workers.shutdownNow();
    }
  }

  private DrainReport runInline(List<Job> ready) {
    DrainReport report = DrainReport.empty();
    for (Job job : ready) {
      if (stopping) {
        break;
      }
      if (!claim(job)) {
        continue;
      }
      report = report.plus(inJobContext(job, () -> {
        Prepared prepared = prepare(job, false);
        AttemptOutcome outcome = prepared.outcome() != null ? prepared.outcome() : execute(prepared);
        return recordSafely(prepared, outcome);
      }));
    }
    return report;
  }

  private DrainReport runBounded(List<Job> ready) {
    ExecutorService pool = workers();
    Semaphore slots = new Semaphore(queue.getMaxConcurrentJobs());
    List<Future<DrainReport>> futures = new ArrayList<>();
    DrainReport report = DrainReport.empty();

    for (Job job : ready) {
      if (stopping) {
        break;
      }
      if (!claim(job)) {
        continue;
      }
      Prepared prepared = inJobContext(job, () -> prepare(job, true));
      if (prepared.outcome() != null) {
        report = report.plus(inJobContext(job, () -> recordSafely(prepared, prepared.outcome())));
        continue;
      }
      try {
        slots.acquire();
      } catch (InterruptedException e) {
        releaseUnstarted(job);
        Thread.currentThread().interrupt();
        break;
      }
      try {
        gate.acquire(prepared.keys());
      } catch (InterruptedException e) {
        slots.release();
        releaseUnstarted(job);
        Thread.currentThread().interrupt();
        break;
      }
      try {
        futures.add(pool.submit(() -> {
          try {
            return inJobContext(job, () -> recordSafely(prepared, loadUnlessCommitted(prepared)));
          } finally {
            gate.release(prepared.keys());
            slots.release();
          }
        }));
      } catch (RejectedExecutionException e) {
        gate.release(prepared.keys());
        slots.release();
        releaseUnstarted(job);
        break;
      }
    }

    for (Future<DrainReport> future : futures) {
      report = report.plus(await(future));
    }
    return report;
  }

  private void releaseUnstarted(Job job) {
    try {
      jobs.release(job.getId(), "Released before loading");
    } catch (RuntimeException e) {
      LOG.error("Failed to release job {}; lease recovery will return it", job.getId(), e);
    }
  }

  private boolean claim(Job job) {
    Instant now = clock.instant();
    boolean claimed = jobs.claim(job.getId(), workerId, now, now.plus(queue.getJobLease()));
    if (!claimed) {
      LOG.debug("Job {} was claimed elsewhere", job.getId());
    }
    return claimed;
  }

  /**
   * Everything before the load: locate and fingerprint the payload, check the dedup index and
   * open the sheet. A non-null outcome means the job is settled without loading.
   */
  Prepared prepare(Job job, boolean materialize) {
    Path payload = null;
    String contentHash = null;
    try {
      payload = payloads.locate(job.getPayloadPath())
          .orElseThrow(() -> new PermanentException("Payload not found: " + job.getPayloadPath()));
      byte[] content = payloads.read(payload);
      contentHash = files.fingerprint(content);

      String stored = jobs.assignContentHash(job.getId(), contentHash);
      if (!contentHash.equals(stored)) {
        String changed = contentHash;
        contentHash = stored;
        throw new PermanentException(
            "Payload content changed since the first attempt (was " + stored + ", now " + changed + ")");
      }

      Optional<AttemptOutcome> duplicate = duplicateOf(contentHash);
      if (duplicate.isPresent()) {
        return Prepared.settled(job, payload, contentHash, duplicate.get());
      }

      ParsedSheet sheet = files.parse(content, job.getId());
      if (!materialize) {
        return new Prepared(job, payload, contentHash, sheet, sheet, Set.of(), null);
      }
      try (sheet) {
        List<IntakeRecord> records = sheet.toList();
        Set<String> keys = records.stream().map(IntakeRecord::uniqueKey).collect(Collectors.toSet());
        logDropped(job, sheet);
        return new Prepared(job, payload, contentHash, records, null, keys, null);
      }
    } catch (IntakeException e) {
      return Prepared.settled(job, payload, contentHash, AttemptOutcome.failed(e));
    } catch (RuntimeException e) {
      LOG.warn("Unexpected error preparing job {}", job.getId(), e);
      return Prepared.settled(job, payload, contentHash, AttemptOutcome.failed(FailureKind.TRANSIENT, describe(e)));
    }
  }

  private Optional<AttemptOutcome> duplicateOf(String contentHash) {
    if (!files.isDuplicate(contentHash)) {
      return Optional.empty();
    }
    String detail = dedup.findCommittingJob(contentHash)
        .map(id -> "content already committed by job " + id)
        .orElse("content already committed");
    return Optional.of(AttemptOutcome.duplicate(detail));
  }

  /**
   * Loads a job prepared ahead of time by the dispatcher. Identical content shares its unique
   * keys, so once the key gate is held any earlier copy in the same pass has committed and shows
   * up in the dedup index.
   */
  AttemptOutcome loadUnlessCommitted(Prepared prepared) {
    try {
      Optional<AttemptOutcome> duplicate = duplicateOf(prepared.contentHash());
      if (duplicate.isPresent()) {
        prepared.closeSheet();
        return duplicate.get();
      }
    } catch (IntakeException e) {
      prepared.closeSheet();
      return AttemptOutcome.failed(e);
    } catch (RuntimeException e) {
      LOG.warn("Unexpected error checking job {} for duplicates", prepared.job().getId(), e);
      prepared.closeSheet();
      return AttemptOutcome.failed(FailureKind.TRANSIENT, describe(e));
    }
    return execute(prepared);
  }

  AttemptOutcome execute(Prepared prepared) {
    Job job = prepared.job();
    try {
      LoadResult result = loader.load(new LoadRequest(job.getId(), prepared.contentHash(), prepared.records()));
      if (prepared.sheet() != null) {
        logDropped(job, prepared.sheet());
      }
      if (result.overwrittenCount() > 0) {
        LOG.info("Job {} overwrote {} existing rows", job.getId(), result.overwrittenCount());
      }
      return AttemptOutcome.succeeded(result.committedCount());
    } catch (IntakeException e) {
      return AttemptOutcome.failed(e);
    } catch (RuntimeException e) {
      LOG.warn("Unexpected error loading job {}", job.getId(), e);
      return AttemptOutcome.failed(FailureKind.TRANSIENT, describe(e));
    } finally {
      prepared.closeSheet();
    }
  }

  /**
   * Ledger failures leave the job PROCESSING; lease recovery brings it back. An attempt cut short
   * by {@link #stop()} is not recorded: stop releases it without counting.
   */
  private DrainReport recordSafely(Prepared prepared, AttemptOutcome outcome) {
    UUID id = prepared.job().getId();
    if (stopping && (cancelled.remove(id) || Thread.currentThread().isInterrupted())) {
      LOG.warn("Job {} was interrupted by shutdown, outcome {} not recorded", id, outcome.type());
      return DrainReport.empty();
    }
    try {
      return record(prepared, outcome);
    } catch (RuntimeException e) {
      LOG.error("Failed to record outcome {} for job {}; it stays PROCESSING until its lease expires",
          outcome.type(), prepared.job().getId(), e);
      return DrainReport.empty();
    }
  }

  private DrainReport record(Prepared prepared, AttemptOutcome outcome) {
    Job job = prepared.job();
    UUID id = job.getId();
    switch (outcome.type()) {
      case SUCCEEDED, DUPLICATE -> {
        Path moved = payloads.moveToProcessed(prepared.payload(), clock.instant());
        if (!jobs.markSucceeded(id, moved.toString())) {
          LOG.warn("Job {} was no longer PROCESSING, outcome {} not recorded", id, outcome.type());
          return DrainReport.empty();
        }
        if (outcome.type() == AttemptOutcome.Type.DUPLICATE) {
          LOG.info("Job {} skipped as duplicate: {}", id, outcome.detail());
          return DrainReport.ofDuplicate();
        }
        LOG.info("Job {} succeeded, {} rows committed", id, outcome.committedCount());
        return DrainReport.ofSucceeded();
      }
      default -> {
        int attempts = job.getAttemptCount() + 1;
        if (outcome.isRetryable() && backoff.shouldRetry(attempts)) {
          Instant next = clock.instant().plus(backoff.delay(attempts));
          if (!jobs.markRetrying(id, describe(outcome), next)) {
            LOG.warn("Job {} was no longer PROCESSING, retry not recorded", id);
            return DrainReport.empty();
          }
          LOG.warn("Job {} attempt {}/{} failed ({}), retrying at {}: {}",
              id, attempts, backoff.maxAttempts(), outcome.failureKind(), next, outcome.detail());
          return DrainReport.ofRetried();
        }
        return deadLetter(prepared, outcome, attempts);
      }
    }
  }

  private DrainReport deadLetter(Prepared prepared, AttemptOutcome outcome, int attempts) {
    Job job = prepared.job();
    String error = describe(outcome);
    String location = job.getPayloadPath();
    if (prepared.payload() != null) {
      Map<String, Object> report = new LinkedHashMap<>();
      report.put("jobId", job.getId());
      report.put("sourceRef", job.getSourceRef());
      report.put("attemptCount", attempts);
      report.put("failureKind", outcome.failureKind());
      report.put("error", outcome.detail());
      report.put("contentHash", prepared.contentHash());
      report.put("failedAt", clock.instant());
      location = payloads.moveToErrors(prepared.payload(), report).toString();
    }
    if (!jobs.markFailed(job.getId(), error, location)) {
      LOG.warn("Job {} was no longer PROCESSING, failure not recorded", job.getId());
      return DrainReport.empty();
    }
    LOG.error("Job {} failed after {} attempts: {}", job.getId(), attempts, error);

    if (prepared.contentHash() != null) {
      try {
        dedup.recordFailure(prepared.contentHash(), job.getId());
      } catch (RuntimeException e) {
        LOG.warn("Could not note failed content {} for job {}: {}",
            prepared.contentHash(), job.getId(), e.getMessage());
      }
    }
    return DrainReport.ofFailed();
  }

  private DrainReport await(Future<DrainReport> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn("Interrupted while waiting for a job to finish");
      return DrainReport.empty();
    } catch (ExecutionException e) {
      LOG.error("Worker failed outside job handling", e.getCause());
      return DrainReport.empty();
    }
  }

  private synchronized ExecutorService workers() {
    if (workers == null) {
      AtomicInteger counter = new AtomicInteger();
      workers = Executors.newFixedThreadPool(queue.getMaxConcurrentJobs(), r -> {
        Thread thread = new Thread(r, "intake-worker-" + counter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      });
    }
    return workers;
  }

  /** Runs on the current thread with the job id in the MDC, visible to {@link #stop()}. */
  private <T> T inJobContext(Job job, Supplier<T> work) {
    MDC.put(MDC_JOB_ID, job.getId().toString());
    inFlight.put(job.getId(), Thread.currentThread());
    try {
      return work.get();
    } finally {
      inFlight.remove(job.getId());
      MDC.remove(MDC_JOB_ID);
    }
  }

  private static void logDropped(Job job, ParsedSheet sheet) {
    if (sheet.report().getDropped() > 0) {
      LOG.warn("Job {} dropped {} of {} data rows", job.getId(),
          sheet.report().getDropped(), sheet.report().getDataRows());
    }
  }

  private static String describe(AttemptOutcome outcome) {
    return outcome.failureKind() + ": " + outcome.detail();
  }

  private static String describe(RuntimeException e) {
    return e.getClass().getSimpleName() + ": " + e.getMessage();
  }

  /** A claimed job after preparation. {@code sheet} is set only while a lazy sheet is open. */
  record Prepared(
      Job job,
      Path payload,
      String contentHash,
      Iterable<IntakeRecord> records,
      ParsedSheet sheet,
      Set<String> keys,
      AttemptOutcome outcome) {

    static Prepared settled(Job job, Path payload, String contentHash, AttemptOutcome outcome) {
      return new Prepared(job, payload, contentHash, List.of(), null, Set.of(), outcome);
    }

    void closeSheet() {
      if (sheet != null) {
        try {
          sheet.close();
        } catch (RuntimeException e) {
          LOG.warn("Failed to close sheet for job {}: {}", job.getId(), e.getMessage());
        }
      }
    }
  }
}
