package io.b2mash.b2b.accessregistry.accesslist;

import java.util.Set;

/** Optional data attached to {@link AccessListInfo} by lookups and owner listings. */
public enum AccessListIncludes {
  /** Resource identifiers of the list's connections, without their actions. */
  RESOURCE_CONNECTIONS,
  /** Resource connections together with their actions. Implies {@link #RESOURCE_CONNECTIONS}. */
  RESOURCE_CONNECTION_ACTIONS;

  static boolean wantsConnections(Set<AccessListIncludes> includes) {
    return includes.contains(RESOURCE_CONNECTIONS)
        || includes.contains(RESOURCE_CONNECTION_ACTIONS);
  }

  static boolean wantsActions(Set<AccessListIncludes> includes) {
    return includes.contains(RESOURCE_CONNECTION_ACTIONS);
  }
}
