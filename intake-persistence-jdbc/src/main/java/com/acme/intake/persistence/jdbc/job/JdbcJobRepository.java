package com.acme.intake.persistence.jdbc.job;

import com.acme.intake.domain.Job;
import com.acme.intake.domain.JobState;
import com.acme.intake.persistence.jdbc.ExceptionTranslator;
import com.acme.intake.repository.JobRepository;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of JobRepository using Template Method pattern. Statements shared by
 * both dialects live here; subclasses supply the dialect-specific ones.
 *
 * <p>Every transition is guarded by the expected current state in its WHERE clause, so an update
 * count of zero means another worker (or recovery) got there first.
 *
 * <p>Counted outcomes raise {@code attempt_count} by one up to the retry ceiling. The final attempt
 * after the ceiling is recorded without raising it further.
 */
public abstract class JdbcJobRepository implements JobRepository {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcJobRepository.class);

  static final int MAX_ERROR_LENGTH = 4000;

  protected static final String COLUMNS =
      "id, seq, source_ref, payload_path, content_hash, state, attempt_count, last_error, "
          + "next_attempt_at, lease_until, claimed_by, created_at, updated_at";

  protected final DataSource dataSource;
  private final int queryTimeoutSeconds;
  private final int attemptCeiling;

  protected JdbcJobRepository(DataSource dataSource, int queryTimeoutSeconds, int attemptCeiling) {
    this.dataSource = dataSource;
    this.queryTimeoutSeconds = queryTimeoutSeconds;
    this.attemptCeiling = attemptCeiling;
  }

  @Override
  public void insertPending(UUID id, String sourceRef, String payloadPath) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getInsertPendingSql())) {

      ps.setQueryTimeout(queryTimeoutSeconds);
      Timestamp now = Timestamp.from(Instant.now());
      ps.setObject(1, id);
      ps.setString(2, sourceRef);
      ps.setString(3, payloadPath);
      ps.setString(4, JobState.PENDING.name());
      ps.setTimestamp(5, now);
      ps.setTimestamp(6, now);

      ps.executeUpdate();
      LOG.debug("Inserted job: id={}, sourceRef={}", id, sourceRef);

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "insert pending job", LOG);
    }
  }

  @Override
  public Optional<Job> findById(UUID id) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getFindByIdSql())) {

      ps.setQueryTimeout(queryTimeoutSeconds);
      ps.setObject(1, id);
      try (ResultSet rs = ps.executeQuery()) {
        if (rs.next()) {
          return Optional.of(mapJob(rs));
        }
      }
      return Optional.empty();

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "find job by id", LOG);
    }
  }

  @Override
  public List<Job> findReady(Instant now, int limit) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getFindReadySql())) {

      ps.setQueryTimeout(queryTimeoutSeconds);
      ps.setTimestamp(1, Timestamp.from(now));
      ps.setInt(2, limit);
      return mapJobs(ps);

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "find ready jobs", LOG);
    }
  }

  @Override
  public boolean claim(UUID id, String workerId, Instant now, Instant leaseUntil) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getClaimSql())) {

      ps.setQueryTimeout(queryTimeoutSeconds);
      ps.setString(1, workerId);
      ps.setTimestamp(2, Timestamp.from(leaseUntil));
      ps.setTimestamp(3, Timestamp.from(now));
      ps.setObject(4, id);
      ps.setTimestamp(5, Timestamp.from(now));

      boolean claimed = ps.executeUpdate() == 1;
      if (!claimed) {
        LOG.debug("Job already claimed or not due: id={}", id);
      }
      return claimed;

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "claim job", LOG);
    }
  }

  @Override
  public String assignContentHash(UUID id, String contentHash) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getAssignContentHashSql())) {

      ps.setQueryTimeout(queryTimeoutSeconds);
      ps.setString(1, contentHash);
      ps.setTimestamp(2, Timestamp.from(Instant.now()));
      ps.setObject(3, id);

      try (ResultSet rs = ps.executeQuery()) {
        if (rs.next()) {
          return rs.getString(1);
        }
      }
      throw new IllegalStateException("Job not found: " + id);

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "assign content hash", LOG);
    }
  }

  @Override
  public boolean markSucceeded(UUID id, String payloadPath) {
    return transition(getMarkSucceededSql(), "mark job SUCCEEDED", id, ps -> {
      ps.setInt(1, attemptCeiling);
      ps.setString(2, payloadPath);
      ps.setTimestamp(3, Timestamp.from(Instant.now()));
      ps.setObject(4, id);
    });
  }

  @Override
  public boolean markRetrying(UUID id, String error, Instant nextAttemptAt) {
    return transition(getMarkRetryingSql(), "mark job RETRYING", id, ps -> {
      ps.setInt(1, attemptCeiling);
      ps.setString(2, truncate(error));
      ps.setTimestamp(3, Timestamp.from(nextAttemptAt));
      ps.setTimestamp(4, Timestamp.from(Instant.now()));
      ps.setObject(5, id);
    });
  }

  @Override
  public boolean markFailed(UUID id, String error, String payloadPath) {
    return transition(getMarkFailedSql(), "mark job FAILED", id, ps -> {
      ps.setInt(1, attemptCeiling);
      ps.setString(2, truncate(error));
      ps.setString(3, payloadPath);
      ps.setTimestamp(4, Timestamp.from(Instant.now()));
      ps.setObject(5, id);
    });
  }

  @Override
  public boolean release(UUID id, String reason) {
    return transition(getReleaseSql(), "release job", id, ps -> {
      Timestamp now = Timestamp.from(Instant.now());
      ps.setString(1, truncate(reason));
      ps.setTimestamp(2, now);
      ps.setTimestamp(3, now);
      ps.setObject(4, id);
    });
  }

  @Override
  public int recoverInterrupted() {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getRecoverInterruptedSql())) {

      ps.setQueryTimeout(queryTimeoutSeconds);
      Timestamp now = Timestamp.from(Instant.now());
      ps.setString(1, "attempt interrupted before its outcome was recorded");
      ps.setTimestamp(2, now);
      ps.setTimestamp(3, now);
      return ps.executeUpdate();

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "recover interrupted jobs", LOG);
    }
  }

  @Override
  public int recoverExpiredLeases(Instant now) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getRecoverExpiredLeasesSql())) {

      ps.setQueryTimeout(queryTimeoutSeconds);
      Timestamp ts = Timestamp.from(now);
      ps.setString(1, "processing lease expired");
      ps.setTimestamp(2, ts);
      ps.setTimestamp(3, ts);
      ps.setTimestamp(4, ts);
      return ps.executeUpdate();

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "recover expired leases", LOG);
    }
  }

  @Override
  public Map<JobState, Long> countByState() {
    Map<JobState, Long> counts = new EnumMap<>(JobState.class);
    for (JobState state : JobState.values()) {
      counts.put(state, 0L);
    }
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getCountByStateSql())) {

      ps.setQueryTimeout(queryTimeoutSeconds);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          counts.put(JobState.valueOf(rs.getString(1)), rs.getLong(2));
        }
        return counts;
      }

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "count jobs by state", LOG);
    }
  }

  @Override
  public long countOpen() {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getCountOpenSql())) {

      ps.setQueryTimeout(queryTimeoutSeconds);
      try (ResultSet rs = ps.executeQuery()) {
        rs.next();
        return rs.getLong(1);
      }

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "count open jobs", LOG);
    }
  }

  @Override
  public Optional<Instant> nextDueAt() {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getNextDueAtSql())) {

      ps.setQueryTimeout(queryTimeoutSeconds);
      try (ResultSet rs = ps.executeQuery()) {
        if (rs.next()) {
          Timestamp ts = rs.getTimestamp(1);
          return Optional.ofNullable(ts).map(Timestamp::toInstant);
        }
        return Optional.empty();
      }

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "find next due time", LOG);
    }
  }

  @Override
  public List<Job> findRecent(JobState state, int limit) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getFindRecentSql())) {

      ps.setQueryTimeout(queryTimeoutSeconds);
      ps.setString(1, state.name());
      ps.setInt(2, limit);
      return mapJobs(ps);

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "find recent jobs", LOG);
    }
  }

  @Override
  public Set<String> findOpenPayloadPaths() {
    Set<String> paths = new HashSet<>();
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getFindOpenPayloadPathsSql())) {

      ps.setQueryTimeout(queryTimeoutSeconds);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          paths.add(rs.getString(1));
        }
        return paths;
      }

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "find open payload paths", LOG);
    }
  }

  @Override
  public boolean existsByPayloadPath(String payloadPath) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getExistsByPayloadPathSql())) {

      ps.setQueryTimeout(queryTimeoutSeconds);
      ps.setString(1, payloadPath);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "check payload path", LOG);
    }
  }

  private boolean transition(String sql, String operation, UUID id, Binder binder) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {

      ps.setQueryTimeout(queryTimeoutSeconds);
      binder.bind(ps);
      int updated = ps.executeUpdate();
      if (updated == 0) {
        LOG.warn("No rows updated for {}: id={} is no longer PROCESSING", operation, id);
      }
      return updated == 1;

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, operation, LOG);
    }
  }

  private List<Job> mapJobs(PreparedStatement ps) throws SQLException {
    List<Job> jobs = new ArrayList<>();
    try (ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        jobs.add(mapJob(rs));
      }
    }
    return jobs;
  }

  protected Job mapJob(ResultSet rs) throws SQLException {
    Job job = new Job();
    job.setId(rs.getObject("id", UUID.class));
    job.setSeq(rs.getLong("seq"));
    job.setSourceRef(rs.getString("source_ref"));
    job.setPayloadPath(rs.getString("payload_path"));
    job.setContentHash(rs.getString("content_hash"));
    job.setState(JobState.valueOf(rs.getString("state")));
    job.setAttemptCount(rs.getInt("attempt_count"));
    job.setLastError(rs.getString("last_error"));
    job.setNextAttemptAt(toInstant(rs.getTimestamp("next_attempt_at")));
    job.setLeaseUntil(toInstant(rs.getTimestamp("lease_until")));
    job.setClaimedBy(rs.getString("claimed_by"));
    job.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
    job.setUpdatedAt(toInstant(rs.getTimestamp("updated_at")));
    return job;
  }

  private static Instant toInstant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }

  static String truncate(String value) {
    if (value == null || value.length() <= MAX_ERROR_LENGTH) {
      return value;
    }
    return value.substring(0, MAX_ERROR_LENGTH);
  }

  @FunctionalInterface
  private interface Binder {
    void bind(PreparedStatement ps) throws SQLException;
  }

  // SQL shared by both dialects

  protected String getInsertPendingSql() {
    return """
        INSERT INTO intake_job (id, source_ref, payload_path, state, attempt_count, created_at, updated_at)
        VALUES (?, ?, ?, ?, 0, ?, ?)
        """;
  }

  protected String getFindByIdSql() {
    return "SELECT " + COLUMNS + " FROM intake_job WHERE id = ?";
  }

  protected String getFindReadySql() {
    return "SELECT " + COLUMNS + """
         FROM intake_job
        WHERE state IN ('PENDING', 'RETRYING')
          AND (next_attempt_at IS NULL OR next_attempt_at <= ?)
        ORDER BY seq
        LIMIT ?
        """;
  }

  protected String getClaimSql() {
    return """
        UPDATE intake_job
        SET state = 'PROCESSING', claimed_by = ?, lease_until = ?, updated_at = ?
        WHERE id = ? AND state IN ('PENDING', 'RETRYING')
          AND (next_attempt_at IS NULL OR next_attempt_at <= ?)
        """;
  }

  protected String getMarkSucceededSql() {
    return """
        UPDATE intake_job
        SET state = 'SUCCEEDED', attempt_count = LEAST(attempt_count + 1, ?), payload_path = ?,
            next_attempt_at = NULL, lease_until = NULL, claimed_by = NULL, updated_at = ?
        WHERE id = ? AND state = 'PROCESSING'
        """;
  }

  protected String getMarkRetryingSql() {
    return """
        UPDATE intake_job
        SET state = 'RETRYING', attempt_count = LEAST(attempt_count + 1, ?), last_error = ?,
            next_attempt_at = ?, lease_until = NULL, claimed_by = NULL, updated_at = ?
        WHERE id = ? AND state = 'PROCESSING'
        """;
  }

  protected String getMarkFailedSql() {
    return """
        UPDATE intake_job
        SET state = 'FAILED', attempt_count = LEAST(attempt_count + 1, ?), last_error = ?, payload_path = ?,
            next_attempt_at = NULL, lease_until = NULL, claimed_by = NULL, updated_at = ?
        WHERE id = ? AND state = 'PROCESSING'
        """;
  }

  protected String getReleaseSql() {
    return """
        UPDATE intake_job
        SET state = 'RETRYING', last_error = ?, next_attempt_at = ?,
            lease_until = NULL, claimed_by = NULL, updated_at = ?
        WHERE id = ? AND state = 'PROCESSING'
        """;
  }

  protected String getRecoverInterruptedSql() {
    return """
        UPDATE intake_job
        SET state = 'RETRYING', last_error = ?, next_attempt_at = ?,
            lease_until = NULL, claimed_by = NULL, updated_at = ?
        WHERE state = 'PROCESSING'
        """;
  }

  protected String getRecoverExpiredLeasesSql() {
    return """
        UPDATE intake_job
        SET state = 'RETRYING', last_error = ?, next_attempt_at = ?,
            lease_until = NULL, claimed_by = NULL, updated_at = ?
        WHERE state = 'PROCESSING' AND lease_until < ?
        """;
  }

  protected String getCountByStateSql() {
    return "SELECT state, COUNT(*) FROM intake_job GROUP BY state";
  }

  protected String getCountOpenSql() {
    return "SELECT COUNT(*) FROM intake_job WHERE state IN ('PENDING', 'PROCESSING', 'RETRYING')";
  }

  protected String getNextDueAtSql() {
    return """
        SELECT MIN(COALESCE(next_attempt_at, created_at))
        FROM intake_job
        WHERE state IN ('PENDING', 'RETRYING')
        """;
  }

  protected String getFindRecentSql() {
    return "SELECT " + COLUMNS + " FROM intake_job WHERE state = ? ORDER BY seq DESC LIMIT ?";
  }

  protected String getFindOpenPayloadPathsSql() {
    return "SELECT payload_path FROM intake_job WHERE state IN ('PENDING', 'PROCESSING', 'RETRYING')";
  }

  protected String getExistsByPayloadPathSql() {
    return "SELECT 1 FROM intake_job WHERE payload_path = ?";
  }

  // Template methods for database-specific SQL

  /**
   * Sets content_hash only while it is NULL and returns the stored value. Binds hash, updated_at,
   * id.
   */
  protected abstract String getAssignContentHashSql();
}
