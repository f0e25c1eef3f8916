package io.b2mash.b2b.accessregistry.accesslist.event;

import io.b2mash.b2b.accessregistry.aggregate.EventId;
import java.time.Instant;
import java.util.UUID;

public record AccessListCreated(
    EventId eventId,
    UUID aggregateId,
    Instant eventTime,
    String resourceOwner,
    String identifier,
    String name,
    String description)
    implements AccessListEvent {

  @Override
  public AccessListEventKind kind() {
    return AccessListEventKind.CREATED;
  }

  @Override
  public AccessListCreated withEventId(EventId eventId) {
    return new AccessListCreated(
        eventId, aggregateId, eventTime, resourceOwner, identifier, name, description);
  }

  @Override
  public <R> R accept(AccessListEventVisitor<R> visitor) {
    return visitor.visitCreated(this);
  }
}
