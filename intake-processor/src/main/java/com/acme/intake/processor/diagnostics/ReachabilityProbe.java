package com.acme.intake.processor.diagnostics;

import com.acme.intake.config.IntakeConfig;
import com.acme.intake.spi.PayloadStore;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Connectivity and storage checks behind {@code test-config}. Never enqueues or writes rows. */
@Singleton
public class ReachabilityProbe {
  private static final Logger LOG = LoggerFactory.getLogger(ReachabilityProbe.class);

  private final DataSource target;
  private final DataSource ledger;
  private final PayloadStore payloads;
  private final int timeoutSeconds;

  public ReachabilityProbe(
      @Named("target") DataSource target,
      @Named("ledger") DataSource ledger,
      PayloadStore payloads,
      IntakeConfig config) {
    this.target = target;
    this.ledger = ledger;
    this.payloads = payloads;
    this.timeoutSeconds = (int) Math.max(1, config.getTarget().getConnection().getConnectTimeout().toSeconds());
  }

  public List<Check> checkAll() {
    return List.of(checkDatabase("target database", target), checkDatabase("job ledger", ledger), checkStorage());
  }

  Check checkDatabase(String name, DataSource dataSource) {
    try (Connection conn = dataSource.getConnection();
        Statement stmt = conn.createStatement()) {
      stmt.setQueryTimeout(timeoutSeconds);
      try (ResultSet rs = stmt.executeQuery("SELECT 1")) {
        rs.next();
      }
      return Check.passed(name, conn.getMetaData().getDatabaseProductName() + " " + conn.getMetaData().getDatabaseProductVersion());
    } catch (SQLException e) {
      LOG.error("{} is not reachable (SQLState={}): {}", name, e.getSQLState(), e.getMessage());
      return Check.failed(name, e.getMessage());
    }
  }

  Check checkStorage() {
    try {
      payloads.checkWritable();
      return Check.passed("payload storage", "all areas writable");
    } catch (RuntimeException e) {
      LOG.error("Payload storage check failed: {}", e.getMessage());
      return Check.failed("payload storage", e.getMessage());
    }
  }

  public record Check(String name, boolean ok, String detail) {

    static Check passed(String name, String detail) {
      return new Check(name, true, detail);
    }

    static Check failed(String name, String detail) {
      return new Check(name, false, detail);
    }
  }
}
