package io.b2mash.b2b.accessregistry.accesslist.event;

import io.b2mash.b2b.accessregistry.aggregate.EventId;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public record MembersRemoved(
    EventId eventId,
    UUID aggregateId,
    Instant eventTime,
    Set<UUID> partyIds)
    implements AccessListEvent {

  public MembersRemoved {
    partyIds = AccessListEvent.sortedCopy(partyIds);
  }

  @Override
  public AccessListEventKind kind() {
    return AccessListEventKind.MEMBERS_REMOVED;
  }

  @Override
  public MembersRemoved withEventId(EventId eventId) {
    return new MembersRemoved(eventId, aggregateId, eventTime, partyIds);
  }

  @Override
  public <R> R accept(AccessListEventVisitor<R> visitor) {
    return visitor.visitMembersRemoved(this);
  }
}
