package io.b2mash.b2b.accessregistry.accesslist.event;

import io.b2mash.b2b.accessregistry.aggregate.EventId;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/** Carries only the actions that were not yet granted. */
public record ResourceConnectionActionsAdded(
    EventId eventId,
    UUID aggregateId,
    Instant eventTime,
    String resourceIdentifier,
    Set<String> actions)
    implements AccessListEvent {

  public ResourceConnectionActionsAdded {
    actions = AccessListEvent.sortedCopy(actions);
  }

  @Override
  public AccessListEventKind kind() {
    return AccessListEventKind.RESOURCE_CONNECTION_ACTIONS_ADDED;
  }

  @Override
  public ResourceConnectionActionsAdded withEventId(EventId eventId) {
    return new ResourceConnectionActionsAdded(
        eventId, aggregateId, eventTime, resourceIdentifier, actions);
  }

  @Override
  public <R> R accept(AccessListEventVisitor<R> visitor) {
    return visitor.visitResourceConnectionActionsAdded(this);
  }
}
