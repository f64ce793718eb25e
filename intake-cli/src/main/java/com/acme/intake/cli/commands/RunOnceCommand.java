package com.acme.intake.cli.commands;

import com.acme.intake.cli.IntakeContext;
import com.acme.intake.processor.admission.JobAdmission;
import com.acme.intake.processor.queue.QueueProcessor;
import io.micronaut.context.ApplicationContext;
import picocli.CommandLine.Command;

@Command(name = "run-once", description = "Process queued jobs until none is pending or retrying, then exit")
public class RunOnceCommand extends IntakeCommand {

    @Override
    public Integer call() {
        try (ApplicationContext context = startMigrated(loadConfig(), IntakeContext.MODE_COMMAND)) {
            QueueProcessor processor = context.getBean(QueueProcessor.class);
            processor.recoverInterrupted();
            context.getBean(JobAdmission.class).adoptOrphans();
            boolean drained = processor.runUntilDrained();
            out().println(drained ? "Queue drained" : "Stopped before the queue was drained");
            return drained ? 0 : 1;
        }
    }
}
