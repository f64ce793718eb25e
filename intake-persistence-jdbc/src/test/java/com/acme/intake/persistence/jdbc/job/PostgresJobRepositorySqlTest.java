package com.acme.intake.persistence.jdbc.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.intake.config.ConnectionConfig;
import com.acme.intake.config.DatabaseConfig;
import com.acme.intake.config.IntakeConfig;
import java.lang.reflect.Method;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** SQL verification for the PostgreSQL job ledger. No database is touched. */
@DisplayName("PostgreSQL Job Repository SQL Verification")
class PostgresJobRepositorySqlTest {

  private PostgresJobRepository repository;

  @BeforeEach
  void setup() {
    repository = new PostgresJobRepository(
        null,
        IntakeConfig.builder()
            .target(DatabaseConfig.builder().connection(ConnectionConfig.builder().build()).build())
            .build());
  }

  @Test
  @DisplayName("content hash assignment uses UPDATE ... RETURNING and never overwrites")
  void assignContentHashSql() {
    String sql = invokeProtectedMethod("getAssignContentHashSql");

    assertThat(sql)
        .contains("UPDATE intake_job")
        .contains("COALESCE(content_hash, ?)")
        .contains("RETURNING content_hash")
        .doesNotContain("FINAL TABLE");
  }

  @Test
  @DisplayName("claim is a compare-and-set on claimable, due jobs")
  void claimSql() {
    String sql = invokeProtectedMethod("getClaimSql");

    assertThat(sql)
        .contains("SET state = 'PROCESSING'")
        .contains("state IN ('PENDING', 'RETRYING')")
        .contains("next_attempt_at <= ?");
  }

  @Test
  @DisplayName("outcome updates only match PROCESSING jobs and count the attempt up to the ceiling")
  void outcomeSql() {
    for (String method : new String[] {"getMarkSucceededSql", "getMarkRetryingSql", "getMarkFailedSql"}) {
      assertThat(invokeProtectedMethod(method))
          .contains("attempt_count = LEAST(attempt_count + 1, ?)")
          .contains("WHERE id = ? AND state = 'PROCESSING'");
    }
    assertThat(invokeProtectedMethod("getReleaseSql"))
        .doesNotContain("attempt_count")
        .contains("WHERE id = ? AND state = 'PROCESSING'");
  }

  private String invokeProtectedMethod(String methodName) {
    try {
      Method method = findMethod(methodName);
      method.setAccessible(true);
      return (String) method.invoke(repository);
    } catch (Exception e) {
      throw new AssertionError("Failed to invoke method: " + methodName, e);
    }
  }

  private Method findMethod(String methodName) throws NoSuchMethodException {
    try {
      return PostgresJobRepository.class.getDeclaredMethod(methodName);
    } catch (NoSuchMethodException e) {
      return JdbcJobRepository.class.getDeclaredMethod(methodName);
    }
  }
}
