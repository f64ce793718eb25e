package com.acme.intake.cli;

import com.acme.intake.cli.config.EnvironmentConfigLoader;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class IntakeCliTest {

    @TempDir
    Path tempDir;

    private final Map<String, String> env = new HashMap<>();
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private String url;

    @BeforeEach
    void setUp() {
        url = "jdbc:h2:mem:cli-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        env.put("DB_URL", url);
        env.put("LEDGER_URL", url);
        env.put("DB_USERNAME", "sa");
        env.put("APP_BASE_DIR", tempDir.resolve("intake").toString());
        env.put("INTAKE_COLUMNS", "carrier:text,pieces:number");
        env.put("INTAKE_REQUIRED_COLUMNS", "carrier");
    }

    private int execute(String... args) {
        CommandLine cmd = IntakeCli.commandLine(new IntakeCli(() -> new EnvironmentConfigLoader(env::get)));
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private Path spreadsheet(String name, Object[]... rows) throws IOException {
        Path file = tempDir.resolve(name);
        try (Workbook workbook = new XSSFWorkbook(); OutputStream stream = Files.newOutputStream(file)) {
            Sheet sheet = workbook.createSheet("Shipments");
            for (int r = 0; r < rows.length; r++) {
                Row row = sheet.createRow(r);
                for (int c = 0; c < rows[r].length; c++) {
                    Object value = rows[r][c];
                    if (value instanceof Number) {
                        row.createCell(c).setCellValue(((Number) value).doubleValue());
                    } else {
                        row.createCell(c).setCellValue(String.valueOf(value));
                    }
                }
            }
            workbook.write(stream);
        }
        return file;
    }

    private long countRows(String table) throws SQLException {
        try (Connection conn = DriverManager.getConnection(url, "sa", "");
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    @Test
    void testIntakeCli_showsHelpWhenNoSubcommand() {
        PrintStream original = System.out;
        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outContent));
        try {
            int exitCode = execute();

            assertThat(exitCode).isEqualTo(0);
            assertThat(outContent.toString()).contains("Usage:");
        } finally {
            System.setOut(original);
        }
    }

    @Test
    void testIntakeCli_hasSubcommands() {
        CommandLine cmd = IntakeCli.commandLine(new IntakeCli());

        assertThat(cmd.getCommandName()).isEqualTo("intake");
        assertThat(cmd.getSubcommands()).containsKeys("run", "run-once", "test-config", "enqueue", "status");
    }

    @Test
    void testIntakeCli_hasVersionOption() {
        int exitCode = execute("--version");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("1.0.0");
    }

    @Test
    void testIntakeCli_configurationErrorExitsWithTwo() {
        env.remove("DB_USERNAME");

        int exitCode = execute("status");

        assertThat(exitCode).isEqualTo(IntakeCli.EXIT_CONFIG_ERROR);
        assertThat(err.toString()).contains("Configuration error").contains("DB_USERNAME");
    }

    @Test
    void testEnqueue_missingFileFails() {
        int exitCode = execute("enqueue", tempDir.resolve("absent.xlsx").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("File not found");
    }

    @Test
    void testTestConfig_reportsAllChecks() {
        int exitCode = execute("test-config");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
                .contains("Configuration is valid")
                .contains("[OK] target database")
                .contains("[OK] job ledger")
                .contains("[OK] payload storage");
    }

    @Test
    void testEnqueueRunOnceAndStatus() throws Exception {
        Path file = spreadsheet("shipments.xlsx",
                new Object[]{"HAWB", "Carrier", "Pieces"},
                new Object[]{"H-1", "DHL", 3},
                new Object[]{"H-2", "UPS", 1});

        assertThat(execute("enqueue", file.toString(), "--source-ref", "mail:test")).isEqualTo(0);
        assertThat(out.toString()).contains("Enqueued job");

        assertThat(execute("run-once")).isEqualTo(0);
        assertThat(out.toString()).contains("Queue drained");
        assertThat(countRows("tracking_data")).isEqualTo(2);

        assertThat(execute("status", "--key", "H-1", "--key", "H-9")).isEqualTo(0);
        assertThat(out.toString())
                .containsPattern("SUCCEEDED\\s+1")
                .contains("No failed jobs.")
                .containsPattern("H-9\\s+never");
    }

    @Test
    void testEnqueueSameFileTwice_secondIsDuplicate() throws Exception {
        Path file = spreadsheet("shipments.xlsx",
                new Object[]{"hawb", "carrier"},
                new Object[]{"H-1", "DHL"});

        assertThat(execute("enqueue", file.toString())).isEqualTo(0);
        assertThat(execute("run-once")).isEqualTo(0);
        assertThat(execute("enqueue", file.toString())).isEqualTo(0);
        assertThat(execute("run-once")).isEqualTo(0);

        assertThat(execute("status", "--json")).isEqualTo(0);
        assertThat(out.toString())
                .containsPattern("\"SUCCEEDED\"\\s*:\\s*2")
                .contains("\"recentFailures\"");
        assertThat(countRows("tracking_data")).isEqualTo(1);
    }

    @Test
    void testRunOnce_invalidFileEndsFailed() throws Exception {
        Path file = spreadsheet("missing-carrier.xlsx",
                new Object[]{"hawb", "pieces"},
                new Object[]{"H-1", 2});

        assertThat(execute("enqueue", file.toString())).isEqualTo(0);
        assertThat(execute("run-once")).isEqualTo(0);

        assertThat(execute("status")).isEqualTo(0);
        assertThat(out.toString())
                .containsPattern("FAILED\\s+1")
                .contains("Recent failures:")
                .contains("VALIDATION");
        try (Stream<Path> errors = Files.list(tempDir.resolve("intake").resolve("errors"))) {
            assertThat(errors).anyMatch(p -> p.getFileName().toString().endsWith(".error.json"));
        }
    }
}
