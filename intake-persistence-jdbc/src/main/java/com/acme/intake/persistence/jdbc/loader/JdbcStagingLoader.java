package com.acme.intake.persistence.jdbc.loader;

import com.acme.intake.config.ColumnSpec;
import com.acme.intake.config.ConflictPolicy;
import com.acme.intake.config.IntakeConfig;
import com.acme.intake.core.PermanentException;
import com.acme.intake.domain.IntakeRecord;
import com.acme.intake.persistence.jdbc.ExceptionTranslator;
import com.acme.intake.persistence.jdbc.dedup.JdbcDedupRepository;
import com.acme.intake.persistence.jdbc.schema.TableDefinitions;
import com.acme.intake.spi.DatabaseLoader;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC loader using Template Method pattern. One job is loaded on one connection in one
 * transaction:
 *
 * <ol>
 *   <li>batch insert into the staging table under a fresh run id
 *   <li>conflict check when the REJECT policy is configured
 *   <li>set-based upsert from staging into the target table (dialect specific)
 *   <li>dedup index append for the content hash and every committed key
 *   <li>delete the run's staging rows, commit
 * </ol>
 *
 * Any failure rolls everything back, staging rows included.
 */
public abstract class JdbcStagingLoader implements DatabaseLoader {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcStagingLoader.class);

  static final int BATCH_SIZE = 500;
  private static final int CONFLICT_SAMPLE = 5;

  protected final DataSource dataSource;
  protected final TableDefinitions tables;
  private final JdbcDedupRepository dedup;
  private final ConflictPolicy conflictPolicy;
  private final int queryTimeoutSeconds;

  protected JdbcStagingLoader(DataSource dataSource, JdbcDedupRepository dedup, IntakeConfig config) {
    this.dataSource = dataSource;
    this.dedup = dedup;
    this.tables = new TableDefinitions(config.getTarget(), config.getLayout());
    this.conflictPolicy = config.getTarget().getConflictPolicy();
    this.queryTimeoutSeconds = config.getTarget().getQueryTimeoutSeconds();
  }

  @Override
  public LoadResult load(LoadRequest request) {
    String runId = UUID.randomUUID().toString();
    Instant now = Instant.now();

    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      try {
        int staged = stage(conn, runId, request);
        if (conflictPolicy == ConflictPolicy.REJECT) {
          rejectForeignKeys(conn, runId, request.contentHash());
        }
        int overwritten = countOverwrites(conn, runId);
        int upserted = update(conn, getUpsertSql(), ps -> {
          ps.setTimestamp(1, Timestamp.from(now));
          ps.setString(2, runId);
        });
        dedup.recordSuccess(conn, request.contentHash(), request.jobId(), now);
        update(conn, getRecordKeysSql(), ps -> {
          ps.setObject(1, request.jobId());
          ps.setString(2, request.contentHash());
          ps.setTimestamp(3, Timestamp.from(now));
          ps.setString(4, runId);
        });
        update(conn, getClearStageSql(), ps -> ps.setString(1, runId));
        conn.commit();

        LOG.info("Loaded job {} into {}: {} row(s) staged, {} upserted, {} existing key(s) overwritten",
            request.jobId(), tables.targetTable(), staged, upserted, overwritten);
        return new LoadResult(request.jobId(), staged, overwritten);

      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      }
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "load job " + request.jobId(), LOG);
    }
  }

  private int stage(Connection conn, String runId, LoadRequest request) throws SQLException {
    List<ColumnSpec> columns = tables.dataColumns();
    String jobId = request.jobId().toString();
    int staged = 0;

    try (PreparedStatement ps = conn.prepareStatement(getStageInsertSql())) {
      ps.setQueryTimeout(queryTimeoutSeconds);
      for (IntakeRecord record : request.records()) {
        int idx = 1;
        ps.setString(idx++, runId);
        ps.setString(idx++, record.uniqueKey());
        for (ColumnSpec column : columns.subList(1, columns.size())) {
          Object value = record.value(column.name());
          if (value == null) {
            ps.setNull(idx++, column.type().jdbcType());
          } else {
            ps.setObject(idx++, value);
          }
        }
        ps.setString(idx, jobId);
        ps.addBatch();
        if (++staged % BATCH_SIZE == 0) {
          ps.executeBatch();
        }
      }
      if (staged % BATCH_SIZE != 0) {
        ps.executeBatch();
      }
    }
    LOG.debug("Staged {} row(s) for job {} under run {}", staged, request.jobId(), runId);
    return staged;
  }

  private void rejectForeignKeys(Connection conn, String runId, String contentHash) throws SQLException {
    List<String> conflicting = new ArrayList<>();
    try (PreparedStatement ps = conn.prepareStatement(getForeignKeysSql())) {
      ps.setQueryTimeout(queryTimeoutSeconds);
      ps.setString(1, runId);
      ps.setString(2, contentHash);
      ps.setMaxRows(CONFLICT_SAMPLE);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          conflicting.add(rs.getString(1));
        }
      }
    }
    if (!conflicting.isEmpty()) {
      throw new PermanentException("Unique key(s) already committed from another file: "
          + String.join(", ", conflicting));
    }
  }

  private int countOverwrites(Connection conn, String runId) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(getOverwriteCountSql())) {
      ps.setQueryTimeout(queryTimeoutSeconds);
      ps.setString(1, runId);
      try (ResultSet rs = ps.executeQuery()) {
        rs.next();
        return rs.getInt(1);
      }
    }
  }

  private int update(Connection conn, String sql, Binder binder) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setQueryTimeout(queryTimeoutSeconds);
      binder.bind(ps);
      return ps.executeUpdate();
    }
  }

  private void rollback(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException rollbackFailure) {
      cause.addSuppressed(rollbackFailure);
      LOG.warn("Rollback failed after load error: {}", rollbackFailure.getMessage());
    }
  }

  @FunctionalInterface
  private interface Binder {
    void bind(PreparedStatement ps) throws SQLException;
  }

  // SQL shared by both dialects

  /** Binds run_id, the data columns in layout order, then source_job_id. */
  protected String getStageInsertSql() {
    int params = tables.dataColumns().size() + 2;
    return "INSERT INTO " + tables.stagingTable() + " (" + TableDefinitions.RUN_ID + ", "
        + tables.dataColumnList() + ", " + TableDefinitions.SOURCE_JOB_ID + ") VALUES ("
        + String.join(", ", Collections.nCopies(params, "?")) + ")";
  }

  /** Staged keys committed earlier from other content. Binds run_id, content_hash. */
  protected String getForeignKeysSql() {
    return "SELECT DISTINCT s." + tables.keyColumn() + " FROM " + tables.stagingTable() + " s"
        + " JOIN intake_committed_key c ON c.unique_key = s." + tables.keyColumn()
        + " WHERE s." + TableDefinitions.RUN_ID + " = ? AND c.content_hash <> ?";
  }

  /** Binds run_id. */
  protected String getOverwriteCountSql() {
    return "SELECT COUNT(*) FROM " + tables.stagingTable() + " s"
        + " JOIN " + tables.targetTable() + " t ON t." + tables.keyColumn() + " = s." + tables.keyColumn()
        + " WHERE s." + TableDefinitions.RUN_ID + " = ?";
  }

  /** Binds job_id, content_hash, committed_at, run_id. */
  protected String getRecordKeysSql() {
    return "INSERT INTO intake_committed_key (unique_key, job_id, content_hash, committed_at)"
        + " SELECT " + tables.keyColumn()
        + ", CAST(? AS UUID), CAST(? AS VARCHAR(64)), CAST(? AS TIMESTAMP)"
        + " FROM " + tables.stagingTable() + " WHERE " + TableDefinitions.RUN_ID + " = ?";
  }

  /** Binds run_id. */
  protected String getClearStageSql() {
    return "DELETE FROM " + tables.stagingTable() + " WHERE " + TableDefinitions.RUN_ID + " = ?";
  }

  protected String updateAssignments(String sourceAlias) {
    List<String> assignments = new ArrayList<>();
    for (ColumnSpec column : tables.valueColumns()) {
      assignments.add(column.name() + " = " + sourceAlias + "." + column.name());
    }
    assignments.add(TableDefinitions.SOURCE_JOB_ID + " = " + sourceAlias + "." + TableDefinitions.SOURCE_JOB_ID);
    assignments.add(TableDefinitions.PROCESSED_AT + " = " + sourceAlias + "." + TableDefinitions.PROCESSED_AT);
    return String.join(", ", assignments);
  }

  // Template method for database-specific SQL

  /**
   * Upsert every staged row of one run into the target table, overwriting the non-key columns of
   * existing keys. Binds processed_at, run_id.
   */
  protected abstract String getUpsertSql();
}
