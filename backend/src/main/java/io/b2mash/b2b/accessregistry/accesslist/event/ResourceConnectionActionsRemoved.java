package io.b2mash.b2b.accessregistry.accesslist.event;

import io.b2mash.b2b.accessregistry.aggregate.EventId;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/** Carries only the actions that were actually granted before removal. */
public record ResourceConnectionActionsRemoved(
    EventId eventId,
    UUID aggregateId,
    Instant eventTime,
    String resourceIdentifier,
    Set<String> actions)
    implements AccessListEvent {

  public ResourceConnectionActionsRemoved {
    actions = AccessListEvent.sortedCopy(actions);
  }

  @Override
  public AccessListEventKind kind() {
    return AccessListEventKind.RESOURCE_CONNECTION_ACTIONS_REMOVED;
  }

  @Override
  public ResourceConnectionActionsRemoved withEventId(EventId eventId) {
    return new ResourceConnectionActionsRemoved(
        eventId, aggregateId, eventTime, resourceIdentifier, actions);
  }

  @Override
  public <R> R accept(AccessListEventVisitor<R> visitor) {
    return visitor.visitResourceConnectionActionsRemoved(this);
  }
}
