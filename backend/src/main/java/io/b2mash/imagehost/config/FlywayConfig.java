package io.b2mash.imagehost.config;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Migrates the global schema (the {@code stores} registry). Store tables are created at runtime
 * by the provisioner and are not tracked by Flyway.
 */
@Configuration
public class FlywayConfig {

  @Bean(initMethod = "migrate")
  public Flyway globalFlyway(DataSource dataSource) {
    return Flyway.configure()
        .dataSource(dataSource)
        .locations("classpath:db/migration/global")
        .baselineOnMigrate(true)
        .load();
  }
}
