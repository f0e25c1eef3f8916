package io.b2mash.b2b.accessregistry.aggregate;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Base class for event-sourced aggregates. State is only ever changed by {@link #apply}, which is
 * used both when replaying persisted history and when a business method raises a new event, so
 * that live mutation and replay produce the same state.
 *
 * <p>Events raised since the last load or commit are buffered until the repository persists them
 * and calls {@link #commit(List)} with the ids the event log assigned.
 */
public abstract class Aggregate<E extends AggregateEvent<E>> {

  private final Clock clock;
  private final UUID id;
  private final List<E> events = new ArrayList<>();
  private int committedCount;
  private EventId committedVersion = EventId.UNSET;
  private Instant createdAt;
  private Instant updatedAt;

  protected Aggregate(Clock clock, UUID id) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.id = Objects.requireNonNull(id, "id");
  }

  public UUID getId() {
    return id;
  }

  /** Id of the last persisted event, or {@link EventId#UNSET} for a never-persisted aggregate. */
  public EventId getCommittedVersion() {
    return committedVersion;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public boolean hasUncommittedEvents() {
    return committedCount < events.size();
  }

  /** Pending events in the order they were raised. */
  public List<E> getUncommittedEvents() {
    return List.copyOf(events.subList(committedCount, events.size()));
  }

  /** Full history known to this instance: committed events followed by pending ones. */
  public List<E> getEvents() {
    return List.copyOf(events);
  }

  /**
   * Marks the pending events as persisted. {@code assignedIds} must hold one id per pending event,
   * in raise order, each greater than the previous one.
   */
  public void commit(List<EventId> assignedIds) {
    int pending = events.size() - committedCount;
    if (assignedIds.size() != pending) {
      throw new IllegalArgumentException(
          "Expected " + pending + " event ids but got " + assignedIds.size());
    }
    EventId previous = committedVersion;
    for (int i = 0; i < pending; i++) {
      EventId assigned = assignedIds.get(i);
      if (!assigned.isSet() || assigned.compareTo(previous) <= 0) {
        throw new IllegalArgumentException(
            "Event ids must be increasing: " + assigned + " after " + previous);
      }
      int index = committedCount + i;
      events.set(index, events.get(index).withEventId(assigned));
      previous = assigned;
    }
    committedCount = events.size();
    committedVersion = previous;
  }

  /** Folds persisted history into this (fresh) instance. */
  protected final void replay(List<E> history) {
    if (!events.isEmpty()) {
      throw new IllegalStateException("Aggregate " + id + " already has events");
    }
    EventId previous = EventId.UNSET;
    for (E event : history) {
      if (!id.equals(event.aggregateId())) {
        throw new IllegalArgumentException(
            "Event for aggregate " + event.aggregateId() + " replayed into " + id);
      }
      if (!event.eventId().isSet() || event.eventId().compareTo(previous) <= 0) {
        throw new IllegalArgumentException(
            "History must be ordered by ascending event id: "
                + event.eventId()
                + " after "
                + previous);
      }
      applyAndTrack(event);
      events.add(event);
      previous = event.eventId();
    }
    committedCount = events.size();
    committedVersion = previous;
  }

  /** Applies a new event to in-memory state and queues it for persistence. */
  protected final void raise(E event) {
    applyAndTrack(event);
    events.add(event);
  }

  /** Event timestamps keep microsecond precision so they survive a round-trip through the log. */
  protected final Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MICROS);
  }

  protected final Clock clock() {
    return clock;
  }

  protected abstract void apply(E event);

  private void applyAndTrack(E event) {
    apply(event);
    if (createdAt == null) {
      createdAt = event.eventTime();
    }
    updatedAt = event.eventTime();
  }
}
