package io.b2mash.b2b.accessregistry.accesslist;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/** Actions an access list grants on one resource. */
public record AccessListResourceConnection(
    String resourceIdentifier, Set<String> actions, Instant createdAt, Instant modifiedAt) {

  public AccessListResourceConnection {
    actions = Collections.unmodifiableSortedSet(new TreeSet<>(actions));
  }

  AccessListResourceConnection withActions(Set<String> newActions, Instant modified) {
    return new AccessListResourceConnection(resourceIdentifier, newActions, createdAt, modified);
  }
}
