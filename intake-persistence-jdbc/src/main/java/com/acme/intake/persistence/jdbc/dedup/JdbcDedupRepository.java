package com.acme.intake.persistence.jdbc.dedup;

import com.acme.intake.domain.JobState;
import com.acme.intake.persistence.jdbc.ExceptionTranslator;
import com.acme.intake.repository.DedupRepository;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of DedupRepository using Template Method pattern. The index lives in
 * the target database so that a successful load can append to it in the same transaction as the
 * upsert (see {@link #recordSuccess(Connection, String, UUID, Instant)}).
 */
public abstract class JdbcDedupRepository implements DedupRepository {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcDedupRepository.class);

  private static final int KEY_CHUNK = 500;

  protected final DataSource dataSource;
  private final int queryTimeoutSeconds;

  protected JdbcDedupRepository(DataSource dataSource, int queryTimeoutSeconds) {
    this.dataSource = dataSource;
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  @Override
  public boolean isCommitted(String contentHash) {
    return findCommittingJob(contentHash).isPresent();
  }

  @Override
  public Optional<UUID> findCommittingJob(String contentHash) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getFindCommittingJobSql())) {

      ps.setQueryTimeout(queryTimeoutSeconds);
      ps.setString(1, contentHash);
      try (ResultSet rs = ps.executeQuery()) {
        if (rs.next()) {
          return Optional.of(rs.getObject(1, UUID.class));
        }
      }
      return Optional.empty();

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "look up content hash", LOG);
    }
  }

  @Override
  public void recordFailure(String contentHash, UUID jobId) {
    try (Connection conn = dataSource.getConnection()) {
      int inserted = insertContentHash(conn, contentHash, jobId, JobState.FAILED, Instant.now());
      LOG.debug("Recorded failed content: hash={}, jobId={}, inserted={}", contentHash, jobId, inserted);
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "record failed content hash", LOG);
    }
  }

  /**
   * Append the SUCCEEDED entry on the caller's connection, inside the caller's transaction. The
   * caller translates any SQLException.
   */
  public void recordSuccess(Connection conn, String contentHash, UUID jobId, Instant committedAt)
      throws SQLException {
    insertContentHash(conn, contentHash, jobId, JobState.SUCCEEDED, committedAt);
  }

  @Override
  public Map<String, Instant> lastCommittedAt(Collection<String> uniqueKeys) {
    if (uniqueKeys.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, Instant> result = new HashMap<>();
    List<String> keys = new ArrayList<>(uniqueKeys);

    try (Connection conn = dataSource.getConnection()) {
      for (int from = 0; from < keys.size(); from += KEY_CHUNK) {
        List<String> chunk = keys.subList(from, Math.min(keys.size(), from + KEY_CHUNK));
        try (PreparedStatement ps = conn.prepareStatement(getLastCommittedAtSql(chunk.size()))) {
          ps.setQueryTimeout(queryTimeoutSeconds);
          for (int i = 0; i < chunk.size(); i++) {
            ps.setString(i + 1, chunk.get(i));
          }
          try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
              result.put(rs.getString(1), rs.getTimestamp(2).toInstant());
            }
          }
        }
      }
      return result;

    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "look up committed keys", LOG);
    }
  }

  private int insertContentHash(
      Connection conn, String contentHash, UUID jobId, JobState state, Instant at)
      throws SQLException {
    String sql = getInsertContentHashSql();
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setQueryTimeout(queryTimeoutSeconds);
      ps.setString(1, contentHash);
      ps.setObject(2, jobId);
      ps.setString(3, state.name());
      ps.setTimestamp(4, Timestamp.from(at));
      if (sql.contains("WHERE NOT EXISTS")) {
        ps.setString(5, contentHash);
        ps.setObject(6, jobId);
      }
      return ps.executeUpdate();
    }
  }

  protected String getFindCommittingJobSql() {
    return """
        SELECT job_id FROM intake_content_hash
        WHERE content_hash = ? AND terminal_state = 'SUCCEEDED'
        ORDER BY recorded_at
        LIMIT 1
        """;
  }

  protected String getLastCommittedAtSql(int keyCount) {
    String placeholders = String.join(", ", Collections.nCopies(keyCount, "?"));
    return "SELECT unique_key, MAX(committed_at) FROM intake_committed_key WHERE unique_key IN ("
        + placeholders + ") GROUP BY unique_key";
  }

  // Template method for database-specific SQL

  /** Insert-if-absent of (content_hash, job_id, terminal_state, recorded_at). */
  protected abstract String getInsertContentHashSql();
}
