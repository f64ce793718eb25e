package com.acme.intake.cli.commands;

import com.acme.intake.cli.IntakeContext;
import com.acme.intake.processor.admission.JobAdmission;
import com.acme.intake.processor.admission.JobAdmission.AdmissionRequest;
import io.micronaut.context.ApplicationContext;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "enqueue", description = "Admit a local spreadsheet as a new job")
public class EnqueueCommand extends IntakeCommand {

    @Parameters(index = "0", description = "Spreadsheet file (.xlsx or .xls)")
    private Path file;

    @Option(names = {"-s", "--source-ref"}, description = "Source reference recorded on the job (default: manual:<file name>)")
    private String sourceRef;

    @Override
    public Integer call() throws IOException {
        if (!Files.isRegularFile(file)) {
            err().println("File not found: " + file);
            return 1;
        }
        byte[] content = Files.readAllBytes(file);
        String filename = file.getFileName().toString();
        String ref = sourceRef != null ? sourceRef : "manual:" + filename;

        try (ApplicationContext context = startMigrated(loadConfig(), IntakeContext.MODE_COMMAND)) {
            UUID jobId = context.getBean(JobAdmission.class)
                    .admit(new AdmissionRequest(content, ref, Instant.now(), filename));
            out().println("Enqueued job " + jobId);
            return 0;
        }
    }
}
