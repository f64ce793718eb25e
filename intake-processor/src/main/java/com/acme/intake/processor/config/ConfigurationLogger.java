package com.acme.intake.processor.config;

import com.acme.intake.config.ColumnSpec;
import com.acme.intake.config.DatabaseConfig;
import com.acme.intake.config.IntakeConfig;
import com.acme.intake.config.QueueConfig;
import com.acme.intake.config.StorageConfig;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on startup for visibility and troubleshooting. Credentials are
 * never printed.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final IntakeConfig config;

    public ConfigurationLogger(IntakeConfig config) {
        this.config = config;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        DatabaseConfig target = config.getTarget();
        QueueConfig queue = config.getQueue();
        StorageConfig storage = config.getStorage();

        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                      TRACK INTAKE EFFECTIVE CONFIGURATION                      ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");

        LOG.info("━━━ Target Database ━━━");
        LOG.info("  JDBC URL:           {} ({})", target.getConnection().getJdbcUrl(), target.getConnection().getDialect());
        LOG.info("  Username:           {}", target.getConnection().getUsername());
        LOG.info("  Max Pool Size:      {} (HikariCP maximum connections)", target.getConnection().getMaxPoolSize());
        LOG.info("  Connect Timeout:    {} (Wait for a pooled connection)", target.getConnection().getConnectTimeout());
        LOG.info("  Query Timeout:      {}s (Per loader statement)", target.getQueryTimeoutSeconds());
        LOG.info("  Target Table:       {}", target.getTargetTable());
        LOG.info("  Staging Table:      {}", target.stagingTable());
        LOG.info("  Conflict Policy:    {}", target.getConflictPolicy());
        LOG.info("");

        LOG.info("━━━ Sheet Layout ━━━");
        LOG.info("  Unique Key:         {}", config.getLayout().keyColumnName());
        LOG.info("  Columns:            {}", config.getLayout().getColumns().stream()
            .map(ConfigurationLogger::describe)
            .collect(Collectors.joining(", ")));
        LOG.info("");

        LOG.info("━━━ Job Ledger ━━━");
        LOG.info("  JDBC URL:           {} ({})", config.getLedger().getJdbcUrl(), config.getLedger().getDialect());
        LOG.info("");

        LOG.info("━━━ Queue & Retry ━━━");
        LOG.info("  Max Concurrent:     {} (Jobs loading at the same time)", queue.getMaxConcurrentJobs());
        LOG.info("  Max Retries:        {} (Retries after the first attempt before a job is dead-lettered)", queue.getMaxRetries());
        LOG.info("  Backoff:            {}^attempt s, capped at {}", queue.getBackoffBase(), queue.getMaxBackoff());
        LOG.info("  Job Lease:          {} (Claim held before recovery)", queue.getJobLease());
        LOG.info("  Shutdown Grace:     {}", queue.getShutdownGrace());
        LOG.info("  Poll Interval:      {}", queue.getPollInterval());
        LOG.info("");

        LOG.info("━━━ Storage ━━━");
        LOG.info("  Base Directory:     {}", storage.getBaseDir().toAbsolutePath());
        LOG.info("  Retention:          {} (Processed payloads kept)", storage.getRetention());
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    }

    private static String describe(ColumnSpec column) {
        return column.name() + ":" + column.type() + (column.required() ? " (required)" : "");
    }
}
