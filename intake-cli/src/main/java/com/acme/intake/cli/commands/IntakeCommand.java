package com.acme.intake.cli.commands;

import com.acme.intake.cli.IntakeCli;
import com.acme.intake.cli.IntakeContext;
import com.acme.intake.config.IntakeConfig;
import com.acme.intake.persistence.jdbc.schema.SchemaBootstrap;
import io.micronaut.context.ApplicationContext;
import java.io.PrintWriter;
import java.util.concurrent.Callable;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/** Shared plumbing for subcommands: configuration, context start-up and output streams. */
abstract class IntakeCommand implements Callable<Integer> {

    @ParentCommand
    IntakeCli parent;

    @Spec
    CommandSpec spec;

    protected IntakeConfig loadConfig() {
        return parent.configLoader().load();
    }

    protected ApplicationContext startContext(IntakeConfig config, String mode) {
        return IntakeContext.start(config, mode);
    }

    /** Context with schema migrations applied. */
    protected ApplicationContext startMigrated(IntakeConfig config, String mode) {
        ApplicationContext context = startContext(config, mode);
        try {
            context.getBean(SchemaBootstrap.class).migrate();
            return context;
        } catch (RuntimeException e) {
            context.close();
            throw e;
        }
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
