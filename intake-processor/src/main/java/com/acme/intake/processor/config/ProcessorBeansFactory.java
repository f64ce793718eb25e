package com.acme.intake.processor.config;

import com.acme.intake.config.IntakeConfig;
import com.acme.intake.processor.queue.BackoffPolicy;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.time.Clock;

@Factory
public class ProcessorBeansFactory {

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Singleton
  public BackoffPolicy backoffPolicy(IntakeConfig config) {
    return BackoffPolicy.from(config.getQueue());
  }
}
