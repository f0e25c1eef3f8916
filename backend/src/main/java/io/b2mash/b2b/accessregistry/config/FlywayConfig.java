package io.b2mash.b2b.accessregistry.config;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Migrates the event store, projection tables and sequences into the registry schema. */
@Configuration
public class FlywayConfig {

  @Bean(initMethod = "migrate")
  public Flyway registryFlyway(
      @Qualifier("registryDataSource") DataSource registryDataSource,
      @Value("${registry.schema:registry}") String schema) {
    return Flyway.configure()
        .dataSource(registryDataSource)
        .locations("classpath:db/migration/registry")
        .schemas(schema)
        .defaultSchema(schema)
        .createSchemas(true)
        .baselineOnMigrate(true)
        .load();
  }
}
