package com.acme.intake.persistence.jdbc.config;

import com.acme.intake.config.IntakeConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

/**
 * Connection pools for the target database and the job ledger. The two may point at the same
 * database; they are still separate pools.
 */
@Factory
public class DataSourceFactory {

  public static final String TARGET = "target";
  public static final String LEDGER = "ledger";

  @Singleton
  @Named(TARGET)
  @Bean(preDestroy = "close")
  public HikariDataSource targetDataSource(IntakeConfig config) {
    int queryTimeout = config.getTarget().getQueryTimeoutSeconds();
    return DataSources.create(config.getTarget().getConnection(), "intake-target", queryTimeout * 2);
  }

  @Singleton
  @Named(LEDGER)
  @Bean(preDestroy = "close")
  public HikariDataSource ledgerDataSource(IntakeConfig config) {
    return DataSources.create(config.getLedger(), "intake-ledger", 60);
  }
}
