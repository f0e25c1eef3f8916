package io.b2mash.b2b.accessregistry.aggregate;

import java.util.UUID;
import org.springframework.dao.OptimisticLockingFailureException;

/**
 * A version-conditioned write against an aggregate's summary row affected zero rows: another writer
 * advanced the aggregate after it was loaded. Thrown inside the transaction so that everything the
 * transaction wrote, including freshly appended events, rolls back.
 */
public class AggregateConcurrencyException extends OptimisticLockingFailureException {

  private final UUID aggregateId;
  private final EventId expectedVersion;

  public AggregateConcurrencyException(UUID aggregateId, EventId expectedVersion) {
    super(
        "Aggregate "
            + aggregateId
            + " was modified concurrently (expected version "
            + expectedVersion
            + ")");
    this.aggregateId = aggregateId;
    this.expectedVersion = expectedVersion;
  }

  public UUID getAggregateId() {
    return aggregateId;
  }

  public EventId getExpectedVersion() {
    return expectedVersion;
  }
}
