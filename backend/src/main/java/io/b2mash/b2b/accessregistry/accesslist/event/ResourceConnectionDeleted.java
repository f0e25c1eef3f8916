package io.b2mash.b2b.accessregistry.accesslist.event;

import io.b2mash.b2b.accessregistry.aggregate.EventId;
import java.time.Instant;
import java.util.UUID;

public record ResourceConnectionDeleted(
    EventId eventId,
    UUID aggregateId,
    Instant eventTime,
    String resourceIdentifier)
    implements AccessListEvent {

  @Override
  public AccessListEventKind kind() {
    return AccessListEventKind.RESOURCE_CONNECTION_DELETED;
  }

  @Override
  public ResourceConnectionDeleted withEventId(EventId eventId) {
    return new ResourceConnectionDeleted(eventId, aggregateId, eventTime, resourceIdentifier);
  }

  @Override
  public <R> R accept(AccessListEventVisitor<R> visitor) {
    return visitor.visitResourceConnectionDeleted(this);
  }
}
