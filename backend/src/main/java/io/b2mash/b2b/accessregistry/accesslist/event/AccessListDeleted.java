package io.b2mash.b2b.accessregistry.accesslist.event;

import io.b2mash.b2b.accessregistry.aggregate.EventId;
import java.time.Instant;
import java.util.UUID;

public record AccessListDeleted(EventId eventId, UUID aggregateId, Instant eventTime)
    implements AccessListEvent {

  @Override
  public AccessListEventKind kind() {
    return AccessListEventKind.DELETED;
  }

  @Override
  public AccessListDeleted withEventId(EventId eventId) {
    return new AccessListDeleted(eventId, aggregateId, eventTime);
  }

  @Override
  public <R> R accept(AccessListEventVisitor<R> visitor) {
    return visitor.visitDeleted(this);
  }
}
