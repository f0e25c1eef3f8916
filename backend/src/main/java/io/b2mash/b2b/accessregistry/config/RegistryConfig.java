package io.b2mash.b2b.accessregistry.config;

import io.b2mash.b2b.accessregistry.pagination.ContinuationTokenCodec;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.json.JsonMapper;

@Configuration
@EnableConfigurationProperties(AccessListProperties.class)
public class RegistryConfig {

  @Bean
  public Clock registryClock() {
    return Clock.systemUTC();
  }

  /** Token JSON uses its own mapper so that application-wide Jackson settings cannot change it. */
  @Bean
  public ContinuationTokenCodec continuationTokenCodec() {
    return new ContinuationTokenCodec(JsonMapper.builder().build());
  }
}
