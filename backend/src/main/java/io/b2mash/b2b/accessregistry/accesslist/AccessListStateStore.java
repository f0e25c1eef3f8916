package io.b2mash.b2b.accessregistry.accesslist;

import io.b2mash.b2b.accessregistry.accesslist.event.AccessListCreated;
import io.b2mash.b2b.accessregistry.accesslist.event.AccessListDeleted;
import io.b2mash.b2b.accessregistry.accesslist.event.AccessListEvent;
import io.b2mash.b2b.accessregistry.accesslist.event.AccessListEventVisitor;
import io.b2mash.b2b.accessregistry.accesslist.event.AccessListUpdated;
import io.b2mash.b2b.accessregistry.accesslist.event.MembersAdded;
import io.b2mash.b2b.accessregistry.accesslist.event.MembersRemoved;
import io.b2mash.b2b.accessregistry.accesslist.event.ResourceConnectionActionsAdded;
import io.b2mash.b2b.accessregistry.accesslist.event.ResourceConnectionActionsRemoved;
import io.b2mash.b2b.accessregistry.accesslist.event.ResourceConnectionCreated;
import io.b2mash.b2b.accessregistry.accesslist.event.ResourceConnectionDeleted;
import io.b2mash.b2b.accessregistry.aggregate.AggregateConcurrencyException;
import io.b2mash.b2b.accessregistry.aggregate.EventId;
import io.b2mash.b2b.accessregistry.persistence.TransactionScope;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import org.springframework.stereotype.Repository;

/**
 * Current-state projection of access lists: the summary row in {@code access_list_state} and the
 * resource connection and membership sub-tables. Written only from {@link #project} and {@link
 * #advanceVersion}, in the same transaction that appends the events being projected.
 */
@Repository
public class AccessListStateStore {

  /** Smallest uuid; a membership listing without a token resumes from here. */
  static final UUID FIRST_PARTY_ID = new UUID(0L, 0L);

  /** Sorts before every non-empty resource identifier under the "C" collation. */
  static final String FIRST_KEY = "";

  private static Timestamp toTimestamp(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }

  // ── Projection ──────────────────────────────────────────────────────

  /**
   * Applies one event to the projection tables.
   *
   * @param priorVersion version the aggregate was loaded at; guards the conditional delete
   * @throws AggregateConcurrencyException if a row the event targets was changed or removed by a
   *     concurrent writer
   */
  public void project(TransactionScope tx, AccessListEvent event, EventId priorVersion) {
    event.accept(new Projector(tx, priorVersion));
  }

  /**
   * Moves the summary row from {@code priorVersion} to {@code newVersion}. Zero rows affected means
   * another writer got there first.
   */
  public void advanceVersion(
      TransactionScope tx,
      UUID aggregateId,
      EventId priorVersion,
      EventId newVersion,
      Instant modified) {
    int updated =
        tx.sql(
                """
                UPDATE access_list_state
                SET modified = ?, version = ?
                WHERE aggregate_id = ? AND version = ?
                """)
            .params(
                toTimestamp(modified),
                newVersion.dbValue(),
                aggregateId,
                priorVersion.dbValue())
            .update();
    if (updated == 0) {
      throw new AggregateConcurrencyException(aggregateId, priorVersion);
    }
  }

  private static final class Projector implements AccessListEventVisitor<Void> {

    private final TransactionScope tx;
    private final EventId priorVersion;

    Projector(TransactionScope tx, EventId priorVersion) {
      this.tx = tx;
      this.priorVersion = priorVersion;
    }

    @Override
    public Void visitCreated(AccessListCreated event) {
      tx.sql(
              """
              INSERT INTO access_list_aggregates (aggregate_id, created)
              VALUES (?, ?)
              """)
          .params(event.aggregateId(), toTimestamp(event.eventTime()))
          .update();
      tx.sql(
              """
              INSERT INTO access_list_state
                  (aggregate_id, identifier, resource_owner, name, description,
                   created, modified, version)
              VALUES (?, ?, ?, ?, ?, ?, ?, 0)
              """)
          .params(
              event.aggregateId(),
              event.identifier(),
              event.resourceOwner(),
              event.name(),
              event.description(),
              toTimestamp(event.eventTime()),
              toTimestamp(event.eventTime()))
          .update();
      return null;
    }

    @Override
    public Void visitUpdated(AccessListUpdated event) {
      int updated =
          tx.sql(
                  """
                  UPDATE access_list_state
                  SET identifier = COALESCE(?, identifier),
                      name = COALESCE(?, name),
                      description = COALESCE(?, description)
                  WHERE aggregate_id = ?
                  """)
              .params(event.identifier(), event.name(), event.description(), event.aggregateId())
              .update();
      requireRow(updated, event);
      return null;
    }

    @Override
    public Void visitDeleted(AccessListDeleted event) {
      int deleted =
          tx.sql(
                  """
                  DELETE FROM access_list_state
                  WHERE aggregate_id = ? AND version = ?
                  """)
              .params(event.aggregateId(), priorVersion.dbValue())
              .update();
      requireRow(deleted, event);
      return null;
    }

    @Override
    public Void visitResourceConnectionCreated(ResourceConnectionCreated event) {
      tx.sql(
              """
              INSERT INTO access_list_resource_connections_state
                  (aggregate_id, resource_identifier, actions, created, modified)
              VALUES (?, ?, CAST(? AS text[]), ?, ?)
              """)
          .params(
              event.aggregateId(),
              event.resourceIdentifier(),
              AccessListEventLog.textArray(event.actions()),
              toTimestamp(event.eventTime()),
              toTimestamp(event.eventTime()))
          .update();
      return null;
    }

    @Override
    public Void visitResourceConnectionActionsAdded(ResourceConnectionActionsAdded event) {
      int updated =
          tx.sql(
                  """
                  UPDATE access_list_resource_connections_state
                  SET actions = ARRAY(
                          SELECT DISTINCT a
                          FROM unnest(actions || CAST(? AS text[])) AS a
                          ORDER BY a),
                      modified = ?
                  WHERE aggregate_id = ? AND resource_identifier = ?
                  """)
              .params(
                  AccessListEventLog.textArray(event.actions()),
                  toTimestamp(event.eventTime()),
                  event.aggregateId(),
                  event.resourceIdentifier())
              .update();
      requireRow(updated, event);
      return null;
    }

    @Override
    public Void visitResourceConnectionActionsRemoved(ResourceConnectionActionsRemoved event) {
      // Row lock so that concurrent removals on the same connection cannot overwrite each other.
      var current =
          tx.sql(
                  """
                  SELECT actions
                  FROM access_list_resource_connections_state
                  WHERE aggregate_id = ? AND resource_identifier = ?
                  FOR UPDATE
                  """)
              .params(event.aggregateId(), event.resourceIdentifier())
              .query((rs, rowNum) -> readTextArray(rs.getArray("actions")))
              .optional()
              .orElseThrow(
                  () -> new AggregateConcurrencyException(event.aggregateId(), priorVersion));

      var remaining = new TreeSet<>(current);
      remaining.removeAll(event.actions());

      tx.sql(
              """
              UPDATE access_list_resource_connections_state
              SET actions = CAST(? AS text[]), modified = ?
              WHERE aggregate_id = ? AND resource_identifier = ?
              """)
          .params(
              AccessListEventLog.textArray(remaining),
              toTimestamp(event.eventTime()),
              event.aggregateId(),
              event.resourceIdentifier())
          .update();
      return null;
    }

    @Override
    public Void visitResourceConnectionDeleted(ResourceConnectionDeleted event) {
      int deleted =
          tx.sql(
                  """
                  DELETE FROM access_list_resource_connections_state
                  WHERE aggregate_id = ? AND resource_identifier = ?
                  """)
              .params(event.aggregateId(), event.resourceIdentifier())
              .update();
      requireRow(deleted, event);
      return null;
    }

    @Override
    public Void visitMembersAdded(MembersAdded event) {
      tx.sql(
              """
              INSERT INTO access_list_members_state (aggregate_id, party_id, since)
              SELECT ?, p, ?
              FROM unnest(CAST(? AS uuid[])) AS p
              ON CONFLICT (aggregate_id, party_id) DO NOTHING
              """)
          .params(
              event.aggregateId(),
              toTimestamp(event.eventTime()),
              AccessListEventLog.uuidArray(event.partyIds()))
          .update();
      return null;
    }

    @Override
    public Void visitMembersRemoved(MembersRemoved event) {
      tx.sql(
              """
              DELETE FROM access_list_members_state
              WHERE aggregate_id = ? AND party_id = ANY(CAST(? AS uuid[]))
              """)
          .params(event.aggregateId(), AccessListEventLog.uuidArray(event.partyIds()))
          .update();
      return null;
    }

    private void requireRow(int affected, AccessListEvent event) {
      if (affected == 0) {
        throw new AggregateConcurrencyException(event.aggregateId(), priorVersion);
      }
    }
  }

  // ── Reads ───────────────────────────────────────────────────────────

  public Optional<AccessListInfo> findInfo(TransactionScope tx, AccessListRef ref) {
    if (ref instanceof AccessListRef.ById byId) {
      return tx.sql(
              """
              SELECT aggregate_id, identifier, resource_owner, name, description,
                     created, modified, version
              FROM access_list_state
              WHERE aggregate_id = ?
              """)
          .params(byId.id())
          .query((rs, rowNum) -> mapInfo(rs))
          .optional();
    }
    var byIdentifier = (AccessListRef.ByIdentifier) ref;
    return tx.sql(
            """
            SELECT aggregate_id, identifier, resource_owner, name, description,
                   created, modified, version
            FROM access_list_state
            WHERE resource_owner = ? AND identifier = ?
            """)
        .params(byIdentifier.resourceOwner(), byIdentifier.identifier())
        .query((rs, rowNum) -> mapInfo(rs))
        .optional();
  }

  /** Id of a live access list. Deleted lists have no summary row and resolve to empty. */
  public Optional<UUID> findId(TransactionScope tx, AccessListRef ref) {
    if (ref instanceof AccessListRef.ById byId) {
      return tx.sql("SELECT aggregate_id FROM access_list_state WHERE aggregate_id = ?")
          .params(byId.id())
          .query((rs, rowNum) -> rs.getObject("aggregate_id", UUID.class))
          .optional();
    }
    var byIdentifier = (AccessListRef.ByIdentifier) ref;
    return tx.sql(
            """
            SELECT aggregate_id FROM access_list_state
            WHERE resource_owner = ? AND identifier = ?
            """)
        .params(byIdentifier.resourceOwner(), byIdentifier.identifier())
        .query((rs, rowNum) -> rs.getObject("aggregate_id", UUID.class))
        .optional();
  }

  /** Up to {@code limit} lists of one owner with identifier {@code >= fromIdentifier}. */
  public List<AccessListInfo> findByOwner(
      TransactionScope tx, String resourceOwner, String fromIdentifier, int limit) {
    return tx.sql(
            """
            SELECT aggregate_id, identifier, resource_owner, name, description,
                   created, modified, version
            FROM access_list_state
            WHERE resource_owner = ? AND identifier >= ?
            ORDER BY identifier ASC
            LIMIT ?
            """)
        .params(resourceOwner, fromIdentifier, limit)
        .query((rs, rowNum) -> mapInfo(rs))
        .list();
  }

  public List<AccessListResourceConnection> findResourceConnections(
      TransactionScope tx, UUID aggregateId, String fromResourceIdentifier, int limit) {
    return tx.sql(
            """
            SELECT resource_identifier, actions, created, modified
            FROM access_list_resource_connections_state
            WHERE aggregate_id = ? AND resource_identifier >= ?
            ORDER BY resource_identifier ASC
            LIMIT ?
            """)
        .params(aggregateId, fromResourceIdentifier, limit)
        .query(
            (rs, rowNum) ->
                new AccessListResourceConnection(
                    rs.getString("resource_identifier"),
                    readTextArray(rs.getArray("actions")),
                    rs.getTimestamp("created").toInstant(),
                    rs.getTimestamp("modified").toInstant()))
        .list();
  }

  /**
   * Resource connections of several lists in one query, grouped by list id in resource identifier
   * order. Lists without a matching connection are absent from the map.
   *
   * @param resourceIdentifier only this resource when non-null
   * @param includeActions when false every connection carries an empty action set
   */
  public Map<UUID, List<AccessListResourceConnection>> findResourceConnectionsOf(
      TransactionScope tx,
      Collection<UUID> aggregateIds,
      String resourceIdentifier,
      boolean includeActions) {
    if (aggregateIds.isEmpty()) {
      return Map.of();
    }
    var rows =
        tx.sql(
                """
                SELECT aggregate_id, resource_identifier, actions, created, modified
                FROM access_list_resource_connections_state
                WHERE aggregate_id = ANY(CAST(? AS uuid[]))
                  AND (CAST(? AS text) IS NULL OR resource_identifier = CAST(? AS text))
                ORDER BY aggregate_id, resource_identifier
                """)
            .params(
                AccessListEventLog.uuidArray(aggregateIds), resourceIdentifier, resourceIdentifier)
            .query(
                (rs, rowNum) ->
                    Map.entry(
                        rs.getObject("aggregate_id", UUID.class),
                        new AccessListResourceConnection(
                            rs.getString("resource_identifier"),
                            includeActions ? readTextArray(rs.getArray("actions")) : Set.of(),
                            rs.getTimestamp("created").toInstant(),
                            rs.getTimestamp("modified").toInstant())))
            .list();

    Map<UUID, List<AccessListResourceConnection>> byList = new LinkedHashMap<>();
    for (var row : rows) {
      byList.computeIfAbsent(row.getKey(), id -> new ArrayList<>()).add(row.getValue());
    }
    return byList;
  }

  public List<AccessListMembership> findMemberships(
      TransactionScope tx, UUID aggregateId, UUID fromPartyId, int limit) {
    return tx.sql(
            """
            SELECT party_id, since
            FROM access_list_members_state
            WHERE aggregate_id = ? AND party_id >= ?
            ORDER BY party_id ASC
            LIMIT ?
            """)
        .params(aggregateId, fromPartyId, limit)
        .query(
            (rs, rowNum) ->
                new AccessListMembership(
                    rs.getObject("party_id", UUID.class), rs.getTimestamp("since").toInstant()))
        .list();
  }

  private static AccessListInfo mapInfo(ResultSet rs) throws SQLException {
    return new AccessListInfo(
        rs.getObject("aggregate_id", UUID.class),
        rs.getString("resource_owner"),
        rs.getString("identifier"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getTimestamp("created").toInstant(),
        rs.getTimestamp("modified").toInstant(),
        new EventId(rs.getLong("version")));
  }

  private static Set<String> readTextArray(Array array) throws SQLException {
    if (array == null) {
      return Set.of();
    }
    try {
      return new TreeSet<>(Arrays.asList((String[]) array.getArray()));
    } finally {
      array.free();
    }
  }
}
