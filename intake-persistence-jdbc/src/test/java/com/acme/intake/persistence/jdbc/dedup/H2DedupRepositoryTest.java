package com.acme.intake.persistence.jdbc.dedup;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.intake.persistence.jdbc.H2RepositoryTestBase;
import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("H2 dedup index")
class H2DedupRepositoryTest extends H2RepositoryTestBase {

  private H2DedupRepository repository;

  @BeforeEach
  void setup() {
    repository = new H2DedupRepository(getDataSource(), config);
  }

  @Test
  @DisplayName("unknown content is not committed")
  void unknownHash() {
    assertThat(repository.isCommitted("abc")).isFalse();
    assertThat(repository.findCommittingJob("abc")).isEmpty();
  }

  @Test
  @DisplayName("a recorded success makes the content a duplicate")
  void successCommits() throws Exception {
    UUID jobId = UUID.randomUUID();
    try (Connection conn = getDataSource().getConnection()) {
      repository.recordSuccess(conn, "abc", jobId, Instant.now());
    }

    assertThat(repository.isCommitted("abc")).isTrue();
    assertThat(repository.findCommittingJob("abc")).contains(jobId);
  }

  @Test
  @DisplayName("a recorded failure never makes the content a duplicate")
  void failureDoesNotCommit() throws Exception {
    UUID jobId = UUID.randomUUID();

    repository.recordFailure("abc", jobId);
    repository.recordFailure("abc", jobId);

    assertThat(repository.isCommitted("abc")).isFalse();
    assertThat(count("SELECT COUNT(*) FROM intake_content_hash WHERE content_hash = 'abc'")).isEqualTo(1);
  }

  @Test
  @DisplayName("the first committing job is reported")
  void firstCommitterWins() throws Exception {
    UUID first = UUID.randomUUID();
    UUID second = UUID.randomUUID();
    try (Connection conn = getDataSource().getConnection()) {
      repository.recordSuccess(conn, "abc", first, Instant.now().minusSeconds(10));
      repository.recordSuccess(conn, "abc", second, Instant.now());
    }

    assertThat(repository.findCommittingJob("abc")).contains(first);
  }

  @Test
  @DisplayName("last commit time per key")
  void lastCommittedAt() throws Exception {
    execute("INSERT INTO intake_committed_key VALUES ('HAWB001', RANDOM_UUID(), 'h1', TIMESTAMP '2024-01-01 10:00:00')");
    execute("INSERT INTO intake_committed_key VALUES ('HAWB001', RANDOM_UUID(), 'h2', TIMESTAMP '2024-01-02 10:00:00')");
    execute("INSERT INTO intake_committed_key VALUES ('HAWB002', RANDOM_UUID(), 'h1', TIMESTAMP '2024-01-01 10:00:00')");

    Map<String, Instant> result = repository.lastCommittedAt(List.of("HAWB001", "HAWB003"));

    assertThat(result).containsOnlyKeys("HAWB001");
    assertThat(result.get("HAWB001"))
        .isEqualTo(java.sql.Timestamp.valueOf("2024-01-02 10:00:00").toInstant());
    assertThat(repository.lastCommittedAt(List.of())).isEmpty();
  }
}
