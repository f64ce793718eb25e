package com.acme.intake.cli;

import com.acme.intake.config.IntakeConfig;
import io.micronaut.context.ApplicationContext;
import java.util.HashMap;
import java.util.Map;

/**
 * Starts the Micronaut context around an already validated {@link IntakeConfig}. Dialect
 * properties select the H2 or PostgreSQL repositories; daemon mode enables the scheduler.
 */
public final class IntakeContext {

    public static final String MODE_DAEMON = "daemon";
    public static final String MODE_COMMAND = "command";

    private IntakeContext() {
    }

    public static ApplicationContext start(IntakeConfig config, String mode) {
        Map<String, Object> properties = new HashMap<>();
        properties.put("intake.db.dialect", config.getTarget().getConnection().getDialect().propertyValue());
        properties.put("intake.ledger.dialect", config.getLedger().getDialect().propertyValue());
        properties.put("intake.mode", mode);
        properties.put("intake.queue.poll-interval", config.getQueue().getPollInterval().toSeconds() + "s");
        return ApplicationContext.builder()
                .properties(properties)
                .singletons(config)
                .start();
    }
}
