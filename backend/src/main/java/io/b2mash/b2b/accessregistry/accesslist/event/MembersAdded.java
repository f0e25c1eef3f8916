package io.b2mash.b2b.accessregistry.accesslist.event;

import io.b2mash.b2b.accessregistry.aggregate.EventId;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public record MembersAdded(EventId eventId, UUID aggregateId, Instant eventTime, Set<UUID> partyIds)
    implements AccessListEvent {

  public MembersAdded {
    partyIds = AccessListEvent.sortedCopy(partyIds);
  }

  @Override
  public AccessListEventKind kind() {
    return AccessListEventKind.MEMBERS_ADDED;
  }

  @Override
  public MembersAdded withEventId(EventId eventId) {
    return new MembersAdded(eventId, aggregateId, eventTime, partyIds);
  }

  @Override
  public <R> R accept(AccessListEventVisitor<R> visitor) {
    return visitor.visitMembersAdded(this);
  }
}
