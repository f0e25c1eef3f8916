package io.b2mash.b2b.accessregistry.config;

import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Pooled connections for the access registry. Queries use unqualified table names, so every
 * connection starts with its search path pointed at {@code registry.schema}.
 */
@Configuration
public class RegistryDataSourceConfig {

  @Bean(name = "registryDataSource")
  @ConfigurationProperties("spring.datasource.registry")
  public HikariDataSource registryDataSource(
      @Value("${registry.schema:registry}") String schema) {
    var dataSource = new HikariDataSource();
    dataSource.setConnectionInitSql(searchPathSql(schema));
    return dataSource;
  }

  @Bean(name = "registryJdbcClient")
  public JdbcClient registryJdbcClient(
      @Qualifier("registryDataSource") DataSource registryDataSource) {
    return JdbcClient.create(registryDataSource);
  }

  @Bean(name = "registryTransactionManager")
  public PlatformTransactionManager registryTransactionManager(
      @Qualifier("registryDataSource") DataSource registryDataSource) {
    return new DataSourceTransactionManager(registryDataSource);
  }

  static String searchPathSql(String schema) {
    if (schema == null || !schema.matches("[a-z_][a-z0-9_]*")) {
      throw new IllegalArgumentException("Invalid registry schema name: " + schema);
    }
    return "SET search_path TO " + schema;
  }
}
