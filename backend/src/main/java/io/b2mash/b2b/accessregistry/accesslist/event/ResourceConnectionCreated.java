package io.b2mash.b2b.accessregistry.accesslist.event;

import io.b2mash.b2b.accessregistry.aggregate.EventId;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public record ResourceConnectionCreated(
    EventId eventId,
    UUID aggregateId,
    Instant eventTime,
    String resourceIdentifier,
    Set<String> actions)
    implements AccessListEvent {

  public ResourceConnectionCreated {
    actions = AccessListEvent.sortedCopy(actions);
  }

  @Override
  public AccessListEventKind kind() {
    return AccessListEventKind.RESOURCE_CONNECTION_CREATED;
  }

  @Override
  public ResourceConnectionCreated withEventId(EventId eventId) {
    return new ResourceConnectionCreated(
        eventId, aggregateId, eventTime, resourceIdentifier, actions);
  }

  @Override
  public <R> R accept(AccessListEventVisitor<R> visitor) {
    return visitor.visitResourceConnectionCreated(this);
  }
}
