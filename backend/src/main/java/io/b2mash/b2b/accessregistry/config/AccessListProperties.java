package io.b2mash.b2b.accessregistry.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning for access list operations.
 *
 * @param listsPageSize page size when listing the access lists of an owner
 * @param connectionsPageSize page size when listing the resource connections of one list
 * @param membersPageSize page size when listing the members of one list
 * @param createOrLoadMaxAttempts attempts of create-or-load before a creation race is reported
 * @param maxMembersPerReplace largest member set accepted by a full membership replacement
 */
@ConfigurationProperties(prefix = "registry.access-lists")
public record AccessListProperties(
    int listsPageSize,
    int connectionsPageSize,
    int membersPageSize,
    int createOrLoadMaxAttempts,
    int maxMembersPerReplace) {

  public AccessListProperties {
    if (listsPageSize <= 0) {
      listsPageSize = 20;
    }
    if (connectionsPageSize <= 0) {
      connectionsPageSize = 100;
    }
    if (membersPageSize <= 0) {
      membersPageSize = 100;
    }
    if (createOrLoadMaxAttempts <= 0) {
      createOrLoadMaxAttempts = 3;
    }
    if (maxMembersPerReplace <= 0) {
      maxMembersPerReplace = 100;
    }
  }
}
