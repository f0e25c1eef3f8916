package io.b2mash.b2b.accessregistry.pagination;

import io.b2mash.b2b.accessregistry.aggregate.EventId;
import java.util.List;

/**
 * Page of a sub-collection of one aggregate, together with the aggregate version it was read at.
 * Every page of one iteration carries the same version.
 */
public record VersionedPage<T>(List<T> items, EventId version, String continuationToken) {

  public VersionedPage {
    items = List.copyOf(items);
  }

  public boolean hasNext() {
    return continuationToken != null;
  }
}
