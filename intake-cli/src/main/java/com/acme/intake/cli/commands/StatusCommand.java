package com.acme.intake.cli.commands;

import com.acme.intake.cli.IntakeContext;
import com.acme.intake.core.Jsons;
import com.acme.intake.domain.Job;
import com.acme.intake.domain.JobState;
import com.acme.intake.repository.DedupRepository;
import com.acme.intake.repository.JobRepository;
import io.micronaut.context.ApplicationContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show job counts by state and the most recent failures")
public class StatusCommand extends IntakeCommand {

    @Option(names = {"-f", "--failed"}, description = "Number of recent failed jobs to list (default: 10)", defaultValue = "10")
    private int failed;

    @Option(names = {"-k", "--key"}, description = "Unique key to look up the last commit time for (repeatable)")
    private List<String> keys = new ArrayList<>();

    @Option(names = "--json", description = "Print JSON instead of text")
    private boolean json;

    @Override
    public Integer call() {
        try (ApplicationContext context = startMigrated(loadConfig(), IntakeContext.MODE_COMMAND)) {
            JobRepository jobs = context.getBean(JobRepository.class);
            Map<JobState, Long> counts = new EnumMap<>(JobState.class);
            for (JobState state : JobState.values()) {
                counts.put(state, 0L);
            }
            counts.putAll(jobs.countByState());
            List<Job> recentFailures = failed > 0 ? jobs.findRecent(JobState.FAILED, failed) : List.of();
            Map<String, Instant> lastCommitted = keys.isEmpty()
                    ? Map.of()
                    : context.getBean(DedupRepository.class).lastCommittedAt(keys);

            if (json) {
                printJson(counts, recentFailures, lastCommitted);
            } else {
                printText(counts, recentFailures, lastCommitted);
            }
            return 0;
        }
    }

    private void printJson(Map<JobState, Long> counts, List<Job> recentFailures, Map<String, Instant> lastCommitted) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("counts", counts);
        List<Map<String, Object>> failures = new ArrayList<>();
        for (Job job : recentFailures) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", job.getId());
            entry.put("sourceRef", job.getSourceRef());
            entry.put("attemptCount", job.getAttemptCount());
            entry.put("updatedAt", job.getUpdatedAt());
            entry.put("lastError", job.getLastError());
            entry.put("payloadPath", job.getPayloadPath());
            failures.add(entry);
        }
        status.put("recentFailures", failures);
        if (!keys.isEmpty()) {
            Map<String, Instant> byKey = new LinkedHashMap<>();
            for (String key : keys) {
                byKey.put(key, lastCommitted.get(key));
            }
            status.put("lastCommitted", byKey);
        }
        out().println(Jsons.toPrettyJson(status));
    }

    private void printText(Map<JobState, Long> counts, List<Job> recentFailures, Map<String, Instant> lastCommitted) {
        out().println("Jobs by state:");
        counts.forEach((state, count) -> out().printf("  %-11s %d%n", state, count));

        if (failed > 0) {
            out().println();
            if (recentFailures.isEmpty()) {
                out().println("No failed jobs.");
            } else {
                out().println("Recent failures:");
                for (Job job : recentFailures) {
                    out().printf("  %s  %s  attempts=%d  %s%n", job.getId(), job.getSourceRef(),
                            job.getAttemptCount(), job.getUpdatedAt());
                    out().printf("      %s%n", job.getLastError());
                }
            }
        }

        if (!keys.isEmpty()) {
            out().println();
            out().println("Last committed:");
            for (String key : keys) {
                Instant at = lastCommitted.get(key);
                out().printf("  %-20s %s%n", key, at != null ? at : "never");
            }
        }
    }
}
