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
import io.b2mash.b2b.accessregistry.aggregate.Aggregate;
import io.b2mash.b2b.accessregistry.aggregate.EventId;
import io.b2mash.b2b.accessregistry.exception.InvalidStateException;
import io.b2mash.b2b.accessregistry.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Event-sourced access list. Business methods validate, then raise the events describing the
 * change; all state changes happen in {@link #apply}.
 *
 * <p>Sub-collection operations use delta semantics: they raise an event only for what actually
 * changes, so repeating an operation neither fails nor advances the version.
 */
public final class AccessListAggregate extends Aggregate<AccessListEvent> {

  private boolean initialized;
  private boolean deleted;
  private String resourceOwner;
  private String identifier;
  private String name;
  private String description;

  private final SortedMap<String, AccessListResourceConnection> resourceConnections =
      new TreeMap<>();
  private final Map<UUID, Instant> members = new HashMap<>();

  private final StateFolder folder = new StateFolder();

  private AccessListAggregate(Clock clock, UUID id) {
    super(clock, id);
  }

  /** A brand-new, uninitialized access list. Call {@link #initialize} before anything else. */
  public static AccessListAggregate newAccessList(Clock clock, UUID id) {
    return new AccessListAggregate(clock, id);
  }

  /** Rebuilds an access list from its persisted history, ordered by ascending event id. */
  public static AccessListAggregate fromEvents(
      Clock clock, UUID id, List<AccessListEvent> history) {
    var aggregate = new AccessListAggregate(clock, id);
    aggregate.replay(history);
    return aggregate;
  }

  // ── Queries ─────────────────────────────────────────────────────────

  public boolean isInitialized() {
    return initialized;
  }

  public boolean isDeleted() {
    return deleted;
  }

  public String getResourceOwner() {
    assertInitialized();
    return resourceOwner;
  }

  public String getIdentifier() {
    assertInitialized();
    return identifier;
  }

  public String getName() {
    assertInitialized();
    return name;
  }

  public String getDescription() {
    assertInitialized();
    return description;
  }

  public Optional<AccessListResourceConnection> getResourceConnection(String resourceIdentifier) {
    return Optional.ofNullable(resourceConnections.get(resourceIdentifier));
  }

  /** Resource connections ordered by resource identifier. */
  public List<AccessListResourceConnection> getResourceConnections() {
    return List.copyOf(resourceConnections.values());
  }

  public Set<UUID> getMemberIds() {
    return Set.copyOf(members.keySet());
  }

  public boolean isMember(UUID partyId) {
    return members.containsKey(partyId);
  }

  public Optional<Instant> getMemberSince(UUID partyId) {
    return Optional.ofNullable(members.get(partyId));
  }

  /** Summary of a fully committed aggregate. */
  public AccessListInfo asAccessListInfo() {
    assertInitialized();
    if (hasUncommittedEvents()) {
      throw new IllegalStateException(
          "Access list " + getId() + " has uncommitted events; persist it first");
    }
    return new AccessListInfo(
        getId(),
        resourceOwner,
        identifier,
        name,
        description,
        getCreatedAt(),
        getUpdatedAt(),
        getCommittedVersion());
  }

  // ── Mutations ───────────────────────────────────────────────────────

  public void initialize(
      String resourceOwner, String identifier, String name, String description) {
    if (initialized) {
      throw new InvalidStateException(
          "Access list already initialized", "Access list " + getId() + " already exists");
    }
    requireText("resourceOwner", resourceOwner);
    requireText("identifier", identifier);
    requireText("name", name);

    raise(
        new AccessListCreated(
            EventId.UNSET,
            getId(),
            now(),
            resourceOwner,
            identifier,
            name,
            description == null ? "" : description));
  }

  /**
   * Changes the supplied fields. A null argument, or one equal to the current value, leaves the
   * field unchanged.
   *
   * @return whether an event was raised
   */
  public boolean update(String newIdentifier, String newName, String newDescription) {
    assertLive();
    if (newIdentifier != null) {
      requireText("identifier", newIdentifier);
    }
    if (newName != null) {
      requireText("name", newName);
    }

    String changedIdentifier = changed(identifier, newIdentifier);
    String changedName = changed(name, newName);
    String changedDescription = changed(description, newDescription);
    if (changedIdentifier == null && changedName == null && changedDescription == null) {
      return false;
    }

    raise(
        new AccessListUpdated(
            EventId.UNSET, getId(), now(), changedIdentifier, changedName, changedDescription));
    return true;
  }

  public void delete() {
    assertLive();
    raise(new AccessListDeleted(EventId.UNSET, getId(), now()));
  }

  /**
   * Connects a resource, or grants the missing actions when it is already connected.
   *
   * @return the connection after the change
   */
  public AccessListResourceConnection addResourceConnection(
      String resourceIdentifier, Collection<String> actions) {
    assertLive();
    requireText("resourceIdentifier", resourceIdentifier);
    Set<String> requested = requireActions(actions);

    var existing = resourceConnections.get(resourceIdentifier);
    if (existing == null) {
      raise(
          new ResourceConnectionCreated(
              EventId.UNSET, getId(), now(), resourceIdentifier, requested));
    } else {
      grantMissing(existing, requested);
    }
    return resourceConnections.get(resourceIdentifier);
  }

  public AccessListResourceConnection addResourceConnectionActions(
      String resourceIdentifier, Collection<String> actions) {
    assertLive();
    Set<String> requested = requireActions(actions);
    var existing = requireConnection(resourceIdentifier);

    grantMissing(existing, requested);
    return resourceConnections.get(resourceIdentifier);
  }

  public AccessListResourceConnection removeResourceConnectionActions(
      String resourceIdentifier, Collection<String> actions) {
    assertLive();
    Set<String> requested = requireActions(actions);
    var existing = requireConnection(resourceIdentifier);

    Set<String> granted = new TreeSet<>(requested);
    granted.retainAll(existing.actions());
    if (!granted.isEmpty()) {
      raise(
          new ResourceConnectionActionsRemoved(
              EventId.UNSET, getId(), now(), resourceIdentifier, granted));
    }
    return resourceConnections.get(resourceIdentifier);
  }

  /**
   * Disconnects a resource. Disconnecting a resource that is not connected raises nothing.
   *
   * @return the connection as it was before removal
   */
  public Optional<AccessListResourceConnection> removeResourceConnection(
      String resourceIdentifier) {
    assertLive();
    var existing = resourceConnections.get(resourceIdentifier);
    if (existing != null) {
      raise(new ResourceConnectionDeleted(EventId.UNSET, getId(), now(), resourceIdentifier));
    }
    return Optional.ofNullable(existing);
  }

  /** @return the parties that were not yet members */
  public Set<UUID> addMembers(Collection<UUID> partyIds) {
    assertLive();
    Set<UUID> added = new LinkedHashSet<>(requireParties(partyIds));
    added.removeAll(members.keySet());
    if (!added.isEmpty()) {
      raise(new MembersAdded(EventId.UNSET, getId(), now(), added));
    }
    return added;
  }

  /** @return the parties that were members before the call */
  public Set<UUID> removeMembers(Collection<UUID> partyIds) {
    assertLive();
    Set<UUID> removed = new LinkedHashSet<>(requireParties(partyIds));
    removed.retainAll(members.keySet());
    if (!removed.isEmpty()) {
      raise(new MembersRemoved(EventId.UNSET, getId(), now(), removed));
    }
    return removed;
  }

  /** Makes the membership exactly {@code partyIds}: removals first, then additions. */
  public void replaceMembers(Collection<UUID> partyIds) {
    assertLive();
    Set<UUID> wanted = new LinkedHashSet<>(requireParties(partyIds));

    Set<UUID> toRemove = new LinkedHashSet<>(members.keySet());
    toRemove.removeAll(wanted);
    if (!toRemove.isEmpty()) {
      raise(new MembersRemoved(EventId.UNSET, getId(), now(), toRemove));
    }
    addMembers(wanted);
  }

  // ── Fold ────────────────────────────────────────────────────────────

  @Override
  protected void apply(AccessListEvent event) {
    event.accept(folder);
  }

  private final class StateFolder implements AccessListEventVisitor<Void> {

    @Override
    public Void visitCreated(AccessListCreated event) {
      initialized = true;
      resourceOwner = event.resourceOwner();
      identifier = event.identifier();
      name = event.name();
      description = event.description();
      return null;
    }

    @Override
    public Void visitUpdated(AccessListUpdated event) {
      if (event.identifier() != null) {
        identifier = event.identifier();
      }
      if (event.name() != null) {
        name = event.name();
      }
      if (event.description() != null) {
        description = event.description();
      }
      return null;
    }

    @Override
    public Void visitDeleted(AccessListDeleted event) {
      deleted = true;
      return null;
    }

    @Override
    public Void visitResourceConnectionCreated(ResourceConnectionCreated event) {
      resourceConnections.put(
          event.resourceIdentifier(),
          new AccessListResourceConnection(
              event.resourceIdentifier(), event.actions(), event.eventTime(), event.eventTime()));
      return null;
    }

    @Override
    public Void visitResourceConnectionActionsAdded(ResourceConnectionActionsAdded event) {
      resourceConnections.computeIfPresent(
          event.resourceIdentifier(),
          (key, connection) -> {
            Set<String> actions = new TreeSet<>(connection.actions());
            actions.addAll(event.actions());
            return connection.withActions(actions, event.eventTime());
          });
      return null;
    }

    @Override
    public Void visitResourceConnectionActionsRemoved(ResourceConnectionActionsRemoved event) {
      resourceConnections.computeIfPresent(
          event.resourceIdentifier(),
          (key, connection) -> {
            Set<String> actions = new TreeSet<>(connection.actions());
            actions.removeAll(event.actions());
            return connection.withActions(actions, event.eventTime());
          });
      return null;
    }

    @Override
    public Void visitResourceConnectionDeleted(ResourceConnectionDeleted event) {
      resourceConnections.remove(event.resourceIdentifier());
      return null;
    }

    @Override
    public Void visitMembersAdded(MembersAdded event) {
      for (UUID partyId : event.partyIds()) {
        members.putIfAbsent(partyId, event.eventTime());
      }
      return null;
    }

    @Override
    public Void visitMembersRemoved(MembersRemoved event) {
      event.partyIds().forEach(members::remove);
      return null;
    }
  }

  // ── Guards ──────────────────────────────────────────────────────────

  private void grantMissing(AccessListResourceConnection existing, Set<String> requested) {
    Set<String> missing = new TreeSet<>(requested);
    missing.removeAll(existing.actions());
    if (!missing.isEmpty()) {
      raise(
          new ResourceConnectionActionsAdded(
              EventId.UNSET, getId(), now(), existing.resourceIdentifier(), missing));
    }
  }

  private AccessListResourceConnection requireConnection(String resourceIdentifier) {
    requireText("resourceIdentifier", resourceIdentifier);
    var existing = resourceConnections.get(resourceIdentifier);
    if (existing == null) {
      throw ResourceNotFoundException.resourceConnection(getId(), resourceIdentifier);
    }
    return existing;
  }

  private void assertInitialized() {
    if (!initialized) {
      throw new InvalidStateException(
          "Access list not initialized", "Access list " + getId() + " has not been created");
    }
  }

  private void assertLive() {
    assertInitialized();
    if (deleted) {
      throw new InvalidStateException(
          "Access list deleted", "Access list " + getId() + " has been deleted");
    }
  }

  private static String changed(String current, String requested) {
    return requested == null || requested.equals(current) ? null : requested;
  }

  private static void requireText(String field, String value) {
    if (value == null || value.isBlank()) {
      throw InvalidStateException.invalidField("Invalid access list", field, "must not be blank");
    }
  }

  private static Set<String> requireActions(Collection<String> actions) {
    if (actions == null) {
      throw InvalidStateException.invalidField(
          "Invalid resource connection", "actions", "must be specified");
    }
    Set<String> result = new TreeSet<>();
    for (String action : actions) {
      if (action == null || action.isBlank()) {
        throw InvalidStateException.invalidField(
            "Invalid resource connection", "actions", "must not contain blank values");
      }
      result.add(action);
    }
    return result;
  }

  private static Set<UUID> requireParties(Collection<UUID> partyIds) {
    if (partyIds == null) {
      throw InvalidStateException.invalidField(
          "Invalid membership", "partyIds", "must be specified");
    }
    if (partyIds.stream().anyMatch(Objects::isNull)) {
      throw InvalidStateException.invalidField(
          "Invalid membership", "partyIds", "must not contain null");
    }
    return new LinkedHashSet<>(partyIds);
  }
}
