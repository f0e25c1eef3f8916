package io.b2mash.b2b.accessregistry.accesslist.event;

import io.b2mash.b2b.accessregistry.aggregate.AggregateEvent;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Events of the access list aggregate. Every implementation is an immutable record; collections
 * carried by an event are sorted copies so that two events with the same content are equal no
 * matter how they were built.
 */
public sealed interface AccessListEvent extends AggregateEvent<AccessListEvent>
    permits AccessListCreated,
        AccessListUpdated,
        AccessListDeleted,
        ResourceConnectionCreated,
        ResourceConnectionActionsAdded,
        ResourceConnectionActionsRemoved,
        ResourceConnectionDeleted,
        MembersAdded,
        MembersRemoved {

  AccessListEventKind kind();

  <R> R accept(AccessListEventVisitor<R> visitor);

  static <T extends Comparable<T>> SortedSet<T> sortedCopy(Collection<T> values) {
    return Collections.unmodifiableSortedSet(new TreeSet<>(values));
  }
}
