package com.acme.intake.cli.commands;

import com.acme.intake.cli.IntakeContext;
import com.acme.intake.processor.diagnostics.ReachabilityProbe;
import com.acme.intake.processor.diagnostics.ReachabilityProbe.Check;
import io.micronaut.context.ApplicationContext;
import java.util.List;
import picocli.CommandLine.Command;

@Command(name = "test-config", description = "Validate configuration and check database and storage access")
public class TestConfigCommand extends IntakeCommand {

    @Override
    public Integer call() {
        try (ApplicationContext context = startContext(loadConfig(), IntakeContext.MODE_COMMAND)) {
            out().println("Configuration is valid");
            List<Check> checks = context.getBean(ReachabilityProbe.class).checkAll();
            for (Check check : checks) {
                out().printf("  [%s] %s: %s%n", check.ok() ? "OK" : "FAIL", check.name(), check.detail());
            }
            return checks.stream().allMatch(Check::ok) ? 0 : 1;
        }
    }
}
