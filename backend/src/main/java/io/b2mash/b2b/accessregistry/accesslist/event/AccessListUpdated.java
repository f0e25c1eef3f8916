package io.b2mash.b2b.accessregistry.accesslist.event;

import io.b2mash.b2b.accessregistry.aggregate.EventId;
import java.time.Instant;
import java.util.UUID;

/** Partial update; a null field is left unchanged. */
public record AccessListUpdated(
    EventId eventId,
    UUID aggregateId,
    Instant eventTime,
    String identifier,
    String name,
    String description)
    implements AccessListEvent {

  @Override
  public AccessListEventKind kind() {
    return AccessListEventKind.UPDATED;
  }

  @Override
  public AccessListUpdated withEventId(EventId eventId) {
    return new AccessListUpdated(eventId, aggregateId, eventTime, identifier, name, description);
  }

  @Override
  public <R> R accept(AccessListEventVisitor<R> visitor) {
    return visitor.visitUpdated(this);
  }
}
