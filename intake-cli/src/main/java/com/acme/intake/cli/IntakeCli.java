package com.acme.intake.cli;

import com.acme.intake.cli.commands.EnqueueCommand;
import com.acme.intake.cli.commands.RunCommand;
import com.acme.intake.cli.commands.RunOnceCommand;
import com.acme.intake.cli.commands.StatusCommand;
import com.acme.intake.cli.commands.TestConfigCommand;
import com.acme.intake.cli.config.EnvironmentConfigLoader;
import com.acme.intake.core.ConfigException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "intake",
        description = "Track Intake - loads emailed tracking spreadsheets into the tracking database",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        subcommands = {
                RunCommand.class,
                RunOnceCommand.class,
                TestConfigCommand.class,
                EnqueueCommand.class,
                StatusCommand.class
        }
)
public class IntakeCli implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(IntakeCli.class);

    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIG_ERROR = 2;

    private final Supplier<EnvironmentConfigLoader> configLoader;

    public IntakeCli() {
        this(EnvironmentConfigLoader::fromEnvironment);
    }

    public IntakeCli(Supplier<EnvironmentConfigLoader> configLoader) {
        this.configLoader = configLoader;
    }

    public static void main(String[] args) {
        System.exit(commandLine(new IntakeCli()).execute(args));
    }

    /** Command line with the exit code mapping: 2 for configuration errors, 1 for other failures. */
    public static CommandLine commandLine(IntakeCli cli) {
        return new CommandLine(cli)
                .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                    if (e instanceof ConfigException) {
                        cmd.getErr().println("Configuration error: " + e.getMessage());
                        return EXIT_CONFIG_ERROR;
                    }
                    logger.error("Command {} failed", cmd.getCommandName(), e);
                    cmd.getErr().println("Error: " + e.getMessage());
                    return EXIT_FAILURE;
                });
    }

    public EnvironmentConfigLoader configLoader() {
        return configLoader.get();
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }
}
