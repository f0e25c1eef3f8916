package io.b2mash.b2b.accessregistry;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.DynamicPropertyRegistrar;
import org.testcontainers.postgresql.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

@TestConfiguration(proxyBeanMethods = false)
public class TestcontainersConfiguration {

  @SuppressWarnings("resource")
  @Bean
  @ServiceConnection
  PostgreSQLContainer postgresContainer() {
    return new PostgreSQLContainer(DockerImageName.parse("postgres:latest"));
  }

  @Bean
  DynamicPropertyRegistrar datasourceProperties(PostgreSQLContainer container) {
    return registry -> {
      // Registry DataSource: search_path follows registry.schema
      registry.add("spring.datasource.registry.jdbc-url", container::getJdbcUrl);
      registry.add("spring.datasource.registry.username", container::getUsername);
      registry.add("spring.datasource.registry.password", container::getPassword);
    };
  }
}
