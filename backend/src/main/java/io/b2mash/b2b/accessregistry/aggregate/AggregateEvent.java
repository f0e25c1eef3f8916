package io.b2mash.b2b.accessregistry.aggregate;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable fact about one past change to one aggregate. Implementations are records; the
 * persisted id is stamped onto a copy via {@link #withEventId(EventId)} once the log has accepted
 * the event.
 */
public interface AggregateEvent<E extends AggregateEvent<E>> {

  EventId eventId();

  UUID aggregateId();

  Instant eventTime();

  E withEventId(EventId eventId);
}
