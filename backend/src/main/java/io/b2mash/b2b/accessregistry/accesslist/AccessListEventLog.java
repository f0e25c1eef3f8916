package io.b2mash.b2b.accessregistry.accesslist;

import io.b2mash.b2b.accessregistry.accesslist.event.AccessListCreated;
import io.b2mash.b2b.accessregistry.accesslist.event.AccessListDeleted;
import io.b2mash.b2b.accessregistry.accesslist.event.AccessListEvent;
import io.b2mash.b2b.accessregistry.accesslist.event.AccessListEventKind;
import io.b2mash.b2b.accessregistry.accesslist.event.AccessListEventVisitor;
import io.b2mash.b2b.accessregistry.accesslist.event.AccessListUpdated;
import io.b2mash.b2b.accessregistry.accesslist.event.MembersAdded;
import io.b2mash.b2b.accessregistry.accesslist.event.MembersRemoved;
import io.b2mash.b2b.accessregistry.accesslist.event.ResourceConnectionActionsAdded;
import io.b2mash.b2b.accessregistry.accesslist.event.ResourceConnectionActionsRemoved;
import io.b2mash.b2b.accessregistry.accesslist.event.ResourceConnectionCreated;
import io.b2mash.b2b.accessregistry.accesslist.event.ResourceConnectionDeleted;
import io.b2mash.b2b.accessregistry.aggregate.EventId;
import io.b2mash.b2b.accessregistry.persistence.TransactionScope;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Repository;

/**
 * Append-only store of access list events ({@code access_list_events}). Rows are never updated or
 * deleted; {@code eid} is assigned by the database and orders all events globally.
 */
@Repository
public class AccessListEventLog {

  /** Column values of one event row. Fields a kind does not use are null. */
  record EventRow(
      AccessListEventKind kind,
      String identifier,
      String name,
      String description,
      String resourceOwner,
      String[] actions,
      String[] partyIds) {}

  private static final EventRowEncoder ENCODER = new EventRowEncoder();

  /**
   * Inserts the events in order and returns the id assigned to each, in the same order.
   *
   * @param tx the open transaction of the calling operation
   */
  public List<EventId> append(TransactionScope tx, List<AccessListEvent> events) {
    var ids = new ArrayList<EventId>(events.size());
    for (AccessListEvent event : events) {
      ids.add(append(tx, event));
    }
    return ids;
  }

  private EventId append(TransactionScope tx, AccessListEvent event) {
    var row = event.accept(ENCODER);
    Long eid =
        tx.sql(
                """
                INSERT INTO access_list_events
                    (etime, kind, aggregate_id, identifier, name, description, resource_owner,
                     actions, party_ids)
                VALUES (?, CAST(? AS access_list_event_kind), ?, ?, ?, ?, ?,
                        CAST(? AS text[]), CAST(? AS uuid[]))
                RETURNING eid
                """)
            .params(
                Timestamp.from(event.eventTime()),
                row.kind().dbValue(),
                event.aggregateId(),
                row.identifier(),
                row.name(),
                row.description(),
                row.resourceOwner(),
                row.actions(),
                row.partyIds())
            .query(Long.class)
            .single();
    return EventId.of(eid);
  }

  /** Full history of one aggregate, ascending by event id. Includes events of deleted lists. */
  public List<AccessListEvent> loadEvents(TransactionScope tx, UUID aggregateId) {
    return tx.sql(
            """
            SELECT eid, etime, kind, aggregate_id, identifier, name, description,
                   resource_owner, actions, party_ids
            FROM access_list_events
            WHERE aggregate_id = ?
            ORDER BY eid ASC
            """)
        .params(aggregateId)
        .query((rs, rowNum) -> decode(rs))
        .list();
  }

  static AccessListEvent decode(ResultSet rs) throws SQLException {
    var eventId = EventId.of(rs.getLong("eid"));
    var aggregateId = rs.getObject("aggregate_id", UUID.class);
    Instant eventTime = rs.getTimestamp("etime").toInstant();
    var kind = AccessListEventKind.fromDbValue(rs.getString("kind"));

    return switch (kind) {
      case CREATED ->
          new AccessListCreated(
              eventId,
              aggregateId,
              eventTime,
              rs.getString("resource_owner"),
              rs.getString("identifier"),
              rs.getString("name"),
              rs.getString("description"));
      case UPDATED ->
          new AccessListUpdated(
              eventId,
              aggregateId,
              eventTime,
              rs.getString("identifier"),
              rs.getString("name"),
              rs.getString("description"));
      case DELETED -> new AccessListDeleted(eventId, aggregateId, eventTime);
      case RESOURCE_CONNECTION_CREATED ->
          new ResourceConnectionCreated(
              eventId, aggregateId, eventTime, rs.getString("identifier"), readActions(rs));
      case RESOURCE_CONNECTION_ACTIONS_ADDED ->
          new ResourceConnectionActionsAdded(
              eventId, aggregateId, eventTime, rs.getString("identifier"), readActions(rs));
      case RESOURCE_CONNECTION_ACTIONS_REMOVED ->
          new ResourceConnectionActionsRemoved(
              eventId, aggregateId, eventTime, rs.getString("identifier"), readActions(rs));
      case RESOURCE_CONNECTION_DELETED ->
          new ResourceConnectionDeleted(
              eventId, aggregateId, eventTime, rs.getString("identifier"));
      case MEMBERS_ADDED -> new MembersAdded(eventId, aggregateId, eventTime, readPartyIds(rs));
      case MEMBERS_REMOVED ->
          new MembersRemoved(eventId, aggregateId, eventTime, readPartyIds(rs));
    };
  }

  private static Set<String> readActions(ResultSet rs) throws SQLException {
    var result = new LinkedHashSet<String>();
    for (Object value : readArray(rs.getArray("actions"))) {
      result.add((String) value);
    }
    return result;
  }

  private static Set<UUID> readPartyIds(ResultSet rs) throws SQLException {
    var result = new LinkedHashSet<UUID>();
    for (Object value : readArray(rs.getArray("party_ids"))) {
      result.add(value instanceof UUID uuid ? uuid : UUID.fromString(value.toString()));
    }
    return result;
  }

  private static Object[] readArray(Array array) throws SQLException {
    if (array == null) {
      return new Object[0];
    }
    try {
      return (Object[]) array.getArray();
    } finally {
      array.free();
    }
  }

  static String[] textArray(Collection<String> values) {
    return values.toArray(String[]::new);
  }

  static String[] uuidArray(Collection<UUID> values) {
    return values.stream().map(UUID::toString).toArray(String[]::new);
  }

  /** Connection events keep the resource identifier in the {@code identifier} column. */
  private static final class EventRowEncoder implements AccessListEventVisitor<EventRow> {

    @Override
    public EventRow visitCreated(AccessListCreated event) {
      return new EventRow(
          event.kind(),
          event.identifier(),
          event.name(),
          event.description(),
          event.resourceOwner(),
          null,
          null);
    }

    @Override
    public EventRow visitUpdated(AccessListUpdated event) {
      return new EventRow(
          event.kind(), event.identifier(), event.name(), event.description(), null, null, null);
    }

    @Override
    public EventRow visitDeleted(AccessListDeleted event) {
      return new EventRow(event.kind(), null, null, null, null, null, null);
    }

    @Override
    public EventRow visitResourceConnectionCreated(ResourceConnectionCreated event) {
      return connectionRow(event.kind(), event.resourceIdentifier(), event.actions());
    }

    @Override
    public EventRow visitResourceConnectionActionsAdded(ResourceConnectionActionsAdded event) {
      return connectionRow(event.kind(), event.resourceIdentifier(), event.actions());
    }

    @Override
    public EventRow visitResourceConnectionActionsRemoved(ResourceConnectionActionsRemoved event) {
      return connectionRow(event.kind(), event.resourceIdentifier(), event.actions());
    }

    @Override
    public EventRow visitResourceConnectionDeleted(ResourceConnectionDeleted event) {
      return new EventRow(event.kind(), event.resourceIdentifier(), null, null, null, null, null);
    }

    @Override
    public EventRow visitMembersAdded(MembersAdded event) {
      return new EventRow(
          event.kind(), null, null, null, null, null, uuidArray(event.partyIds()));
    }

    @Override
    public EventRow visitMembersRemoved(MembersRemoved event) {
      return new EventRow(
          event.kind(), null, null, null, null, null, uuidArray(event.partyIds()));
    }

    private static EventRow connectionRow(
        AccessListEventKind kind, String resourceIdentifier, Set<String> actions) {
      return new EventRow(kind, resourceIdentifier, null, null, null, textArray(actions), null);
    }
  }
}
