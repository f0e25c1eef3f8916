package io.b2mash.b2b.accessregistry.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RegistryDataSourceConfigTest {

  @Test
  void searchPathFollowsConfiguredSchema() {
    assertThat(RegistryDataSourceConfig.searchPathSql("registry"))
        .isEqualTo("SET search_path TO registry");
    assertThat(RegistryDataSourceConfig.searchPathSql("tenant_42"))
        .isEqualTo("SET search_path TO tenant_42");
  }

  @Test
  void rejectsSchemaNamesThatAreNotPlainIdentifiers() {
    assertThatThrownBy(() -> RegistryDataSourceConfig.searchPathSql("registry; drop table x"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RegistryDataSourceConfig.searchPathSql(null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
