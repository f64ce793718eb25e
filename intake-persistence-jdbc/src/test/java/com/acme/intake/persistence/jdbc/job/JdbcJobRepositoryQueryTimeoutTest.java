package com.acme.intake.persistence.jdbc.job;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.acme.intake.config.ConnectionConfig;
import com.acme.intake.config.DatabaseConfig;
import com.acme.intake.config.IntakeConfig;
import com.acme.intake.domain.JobState;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.UUID;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("Job ledger statement timeouts")
class JdbcJobRepositoryQueryTimeoutTest {

  private static final int TIMEOUT_SECONDS = 7;

  @Mock private DataSource dataSource;
  @Mock private Connection connection;
  @Mock private PreparedStatement statement;
  @Mock private ResultSet resultSet;

  private H2JobRepository repository;

  @BeforeEach
  void setup() throws Exception {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString())).thenReturn(statement);
    when(statement.executeQuery()).thenReturn(resultSet);
    when(statement.executeUpdate()).thenReturn(1);
    when(resultSet.next()).thenReturn(false);

    IntakeConfig config = IntakeConfig.builder()
        .target(DatabaseConfig.builder()
            .connection(ConnectionConfig.builder().jdbcUrl("jdbc:h2:mem:unused").build())
            .queryTimeoutSeconds(TIMEOUT_SECONDS)
            .build())
        .build();
    repository = new H2JobRepository(dataSource, config);
  }

  @Test
  void insertAppliesTimeout() throws Exception {
    repository.insertPending(UUID.randomUUID(), "a.xlsx", "/data/pending/a.xlsx");

    verify(statement).setQueryTimeout(TIMEOUT_SECONDS);
  }

  @Test
  void claimAppliesTimeout() throws Exception {
    repository.claim(UUID.randomUUID(), "w", Instant.now(), Instant.now().plusSeconds(60));

    verify(statement).setQueryTimeout(TIMEOUT_SECONDS);
  }

  @Test
  void outcomeTransitionsApplyTimeout() throws Exception {
    UUID id = UUID.randomUUID();
    repository.markSucceeded(id, "/p");
    repository.markRetrying(id, "timeout", Instant.now());
    repository.markFailed(id, "bad", "/p");
    repository.release(id, "shutdown");

    verify(statement, atLeastOnce()).setQueryTimeout(TIMEOUT_SECONDS);
    verify(statement, never()).setQueryTimeout(0);
  }

  @Test
  void queriesApplyTimeout() throws Exception {
    repository.findReady(Instant.now(), 10);
    repository.findRecent(JobState.FAILED, 5);
    repository.nextDueAt();
    repository.findOpenPayloadPaths();
    repository.countByState();
    repository.recoverInterrupted();
    repository.recoverExpiredLeases(Instant.now());

    verify(statement, atLeastOnce()).setQueryTimeout(TIMEOUT_SECONDS);
    verify(statement, never()).setQueryTimeout(0);
  }
}
