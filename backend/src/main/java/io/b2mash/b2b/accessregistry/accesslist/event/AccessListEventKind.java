package io.b2mash.b2b.accessregistry.accesslist.event;

/** Tag stored in the {@code kind} column of the event log. */
public enum AccessListEventKind {
  CREATED("created"),
  UPDATED("updated"),
  DELETED("deleted"),
  RESOURCE_CONNECTION_CREATED("resource_connection_created"),
  RESOURCE_CONNECTION_ACTIONS_ADDED("resource_connection_actions_added"),
  RESOURCE_CONNECTION_ACTIONS_REMOVED("resource_connection_actions_removed"),
  RESOURCE_CONNECTION_DELETED("resource_connection_deleted"),
  MEMBERS_ADDED("members_added"),
  MEMBERS_REMOVED("members_removed");

  private final String dbValue;

  AccessListEventKind(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  /**
   * Resolves a stored tag. An unknown tag means the log was written by code this build does not
   * know about, which is a programming error rather than a recoverable condition.
   */
  public static AccessListEventKind fromDbValue(String dbValue) {
    for (AccessListEventKind kind : values()) {
      if (kind.dbValue.equals(dbValue)) {
        return kind;
      }
    }
    throw new IllegalStateException("Unknown access list event kind: " + dbValue);
  }
}
