package io.b2mash.b2b.accessregistry.accesslist;

import io.b2mash.b2b.accessregistry.aggregate.EventId;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Flattened summary of a committed access list, as stored in {@code access_list_state}.
 *
 * @param resourceConnections the list's resource connections when they were requested through
 *     {@link AccessListIncludes}; null when they were not
 */
public record AccessListInfo(
    UUID id,
    String resourceOwner,
    String identifier,
    String name,
    String description,
    Instant createdAt,
    Instant updatedAt,
    EventId version,
    List<AccessListResourceConnection> resourceConnections) {

  public AccessListInfo {
    if (resourceConnections != null) {
      resourceConnections = List.copyOf(resourceConnections);
    }
  }

  public AccessListInfo(
      UUID id,
      String resourceOwner,
      String identifier,
      String name,
      String description,
      Instant createdAt,
      Instant updatedAt,
      EventId version) {
    this(id, resourceOwner, identifier, name, description, createdAt, updatedAt, version, null);
  }

  public AccessListInfo withResourceConnections(List<AccessListResourceConnection> connections) {
    return new AccessListInfo(
        id,
        resourceOwner,
        identifier,
        name,
        description,
        createdAt,
        updatedAt,
        version,
        connections);
  }
}
