package io.b2mash.b2b.accessregistry.aggregate;

/**
 * Sequence number the event log assigns to an event. Ids are globally ordered and strictly
 * increasing; {@link #UNSET} marks an event (or an aggregate version) that has not been persisted
 * yet.
 */
public record EventId(long value) implements Comparable<EventId> {

  public static final EventId UNSET = new EventId(0);

  public EventId {
    if (value < 0) {
      throw new IllegalArgumentException("Event id must not be negative: " + value);
    }
  }

  public static EventId of(long value) {
    if (value == 0) {
      throw new IllegalArgumentException("Persisted event id must be positive");
    }
    return new EventId(value);
  }

  public boolean isSet() {
    return value != 0;
  }

  /** Value stored in the {@code version} column; an unset id is stored as 0. */
  public long dbValue() {
    return value;
  }

  @Override
  public int compareTo(EventId other) {
    return Long.compare(value, other.value);
  }

  @Override
  public String toString() {
    return isSet() ? Long.toString(value) : "unset";
  }
}
