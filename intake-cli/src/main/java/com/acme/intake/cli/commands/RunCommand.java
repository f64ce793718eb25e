package com.acme.intake.cli.commands;

import com.acme.intake.cli.IntakeContext;
import com.acme.intake.config.IntakeConfig;
import com.acme.intake.processor.admission.JobAdmission;
import com.acme.intake.processor.queue.QueueProcessor;
import io.micronaut.context.ApplicationContext;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

@Command(name = "run", description = "Run as a daemon: process the queue every poll interval until terminated")
public class RunCommand extends IntakeCommand {
    private static final Logger logger = LoggerFactory.getLogger(RunCommand.class);

    @Override
    public Integer call() throws InterruptedException {
        IntakeConfig config = loadConfig();
        ApplicationContext context = startMigrated(config, IntakeContext.MODE_DAEMON);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown requested");
            context.close();
            stopped.countDown();
        }, "intake-shutdown"));

        context.getBean(QueueProcessor.class).recoverInterrupted();
        int adopted = context.getBean(JobAdmission.class).adoptOrphans();
        logger.info("Intake daemon started (poll interval {}, {} orphans adopted)",
                config.getQueue().getPollInterval(), adopted);

        stopped.await();
        return 0;
    }
}
