package com.acme.intake.cli.config;

import com.acme.intake.config.ColumnSpec;
import com.acme.intake.config.ColumnType;
import com.acme.intake.config.ConflictPolicy;
import com.acme.intake.config.ConnectionConfig;
import com.acme.intake.config.DatabaseConfig;
import com.acme.intake.config.IntakeConfig;
import com.acme.intake.config.QueueConfig;
import com.acme.intake.config.SheetLayout;
import com.acme.intake.config.StorageConfig;
import com.acme.intake.core.ConfigException;
import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link IntakeConfig} from environment variables, with a {@code .env} file in the working
 * directory as fallback. Anything missing or malformed raises {@link ConfigException}.
 */
public class EnvironmentConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(EnvironmentConfigLoader.class);

    private final Function<String, String> lookup;

    public EnvironmentConfigLoader(Function<String, String> lookup) {
        this.lookup = lookup;
    }

    /** Process environment first, then {@code .env} when present. */
    public static EnvironmentConfigLoader fromEnvironment() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        return new EnvironmentConfigLoader(dotenv::get);
    }

    public IntakeConfig load() {
        StorageConfig storage = StorageConfig.builder()
                .baseDir(Path.of(get("APP_BASE_DIR", "/var/lib/trackandtrace")))
                .retention(Duration.ofDays(getInt("FILE_RETENTION_DAYS", 30)))
                .build();

        IntakeConfig config = IntakeConfig.builder()
                .target(database())
                .ledger(ledger(storage))
                .layout(layout())
                .queue(queue())
                .storage(storage)
                .build()
                .validate();
        logger.info("Configuration loaded: target={}, ledger={}, {} columns",
                config.getTarget().getConnection().getJdbcUrl(),
                config.getLedger().getJdbcUrl(),
                config.getLayout().getColumns().size());
        return config;
    }

    private DatabaseConfig database() {
        String url = get("DB_URL", null);
        if (url == null) {
            String name = require("DB_NAME", "DB_NAME (or DB_URL) is required");
            url = String.format("jdbc:postgresql://%s:%d/%s", get("DB_HOST", "localhost"), getInt("DB_PORT", 5432), name);
        }
        ConnectionConfig connection = ConnectionConfig.builder()
                .jdbcUrl(url)
                .username(require("DB_USERNAME", "DB_USERNAME is required"))
                .password(get("DB_PASSWORD", ""))
                .maxPoolSize(getInt("DB_POOL_SIZE", 5))
                .connectTimeout(Duration.ofSeconds(getInt("DB_CONNECT_TIMEOUT_SECONDS", 10)))
                .build();
        return DatabaseConfig.builder()
                .connection(connection)
                .stagingSchema(get("DB_TEMP_SCHEMA", "temp_processing"))
                .targetTable(get("DB_TARGET_TABLE", "tracking_data"))
                .queryTimeoutSeconds(getInt("DB_QUERY_TIMEOUT_SECONDS", 60))
                .conflictPolicy(conflictPolicy())
                .build();
    }

    /** Defaults to an H2 file database under the storage base directory. */
    private ConnectionConfig ledger(StorageConfig storage) {
        String url = get("LEDGER_URL", null);
        if (url == null) {
            url = "jdbc:h2:file:" + storage.ledgerDir().resolve("intake-ledger").toAbsolutePath();
        }
        return ConnectionConfig.builder()
                .jdbcUrl(url)
                .username(get("LEDGER_USERNAME", "sa"))
                .password(get("LEDGER_PASSWORD", ""))
                .maxPoolSize(getInt("LEDGER_POOL_SIZE", 3))
                .connectTimeout(Duration.ofSeconds(getInt("DB_CONNECT_TIMEOUT_SECONDS", 10)))
                .build();
    }

    private SheetLayout layout() {
        Set<String> required = split(get("INTAKE_REQUIRED_COLUMNS", "")).stream()
                .map(SheetLayout::normalizeHeader)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        SheetLayout.SheetLayoutBuilder layout = SheetLayout.builder()
                .uniqueKey(get("DB_UNIQUE_KEY", "hawb"));
        Set<String> configured = new LinkedHashSet<>();
        for (String entry : split(get("INTAKE_COLUMNS", ""))) {
            ColumnSpec column = column(entry, required);
            configured.add(column.name());
            layout.column(column);
        }
        required.removeAll(configured);
        if (!required.isEmpty()) {
            throw new ConfigException("INTAKE_REQUIRED_COLUMNS names columns missing from INTAKE_COLUMNS: " + required);
        }
        return layout.build();
    }

    /** {@code name} or {@code name:type}; a bare name is text. */
    private static ColumnSpec column(String entry, Set<String> required) {
        int colon = entry.indexOf(':');
        String name = colon < 0 ? entry : entry.substring(0, colon).trim();
        ColumnType type = colon < 0 ? ColumnType.TEXT : ColumnType.parse(entry.substring(colon + 1).trim());
        return new ColumnSpec(name, type, required.contains(SheetLayout.normalizeHeader(name)));
    }

    private QueueConfig queue() {
        return QueueConfig.builder()
                .maxConcurrentJobs(getInt("MAX_CONCURRENT_JOBS", 1))
                .maxRetries(getInt("MAX_RETRIES", 3))
                .backoffBase(getInt("BACKOFF_BASE", 2))
                .maxBackoff(Duration.ofSeconds(getInt("MAX_BACKOFF_SECONDS", 300)))
                .jobLease(Duration.ofSeconds(getInt("JOB_LEASE_SECONDS", 900)))
                .shutdownGrace(Duration.ofSeconds(getInt("SHUTDOWN_GRACE_SECONDS", 30)))
                .pollInterval(pollInterval())
                .build();
    }

    /** POLL_INTERVAL_SECONDS wins over the older SCHEDULE_INTERVAL_HOURS. */
    private Duration pollInterval() {
        if (get("POLL_INTERVAL_SECONDS", null) != null) {
            return Duration.ofSeconds(getInt("POLL_INTERVAL_SECONDS", 3600));
        }
        if (get("SCHEDULE_INTERVAL_HOURS", null) != null) {
            return Duration.ofHours(getInt("SCHEDULE_INTERVAL_HOURS", 1));
        }
        return Duration.ofHours(1);
    }

    private ConflictPolicy conflictPolicy() {
        String value = get("CONFLICT_POLICY", ConflictPolicy.LAST_WRITE_WINS.name());
        try {
            return ConflictPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("CONFLICT_POLICY must be one of "
                    + Arrays.toString(ConflictPolicy.values()) + ": " + value, e);
        }
    }

    private String get(String key, String defaultValue) {
        String value = lookup.apply(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private String require(String key, String message) {
        String value = get(key, null);
        if (value == null) {
            throw new ConfigException(message);
        }
        return value;
    }

    private int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigException(key + " must be an integer: " + value, e);
        }
    }

    private static List<String> split(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
