package io.b2mash.b2b.accessregistry.accesslist;

import io.b2mash.b2b.accessregistry.config.AccessListProperties;
import io.b2mash.b2b.accessregistry.exception.InvalidStateException;
import io.b2mash.b2b.accessregistry.exception.PreconditionFailedException;
import io.b2mash.b2b.accessregistry.pagination.Page;
import io.b2mash.b2b.accessregistry.pagination.VersionedPage;
import io.b2mash.b2b.accessregistry.result.RegistryResult;
import java.util.Collection;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Access list operations as an HTTP layer consumes them: lists are addressed by owner and
 * identifier, failures surface as {@code ErrorResponseException}s, and writes may carry the version
 * the caller last saw (If-Match).
 */
@Service
public class AccessListService {

  private static final Logger log = LoggerFactory.getLogger(AccessListService.class);

  private final AccessListRepository repository;
  private final AccessListProperties properties;

  public AccessListService(AccessListRepository repository, AccessListProperties properties) {
    this.repository = repository;
    this.properties = properties;
  }

  /**
   * Loads the list, creating it if it does not exist. Creation races are retried a bounded number
   * of times before being reported as a precondition failure.
   */
  public AccessListLoadOrCreateResult createOrLoad(
      String resourceOwner, String identifier, String name, String description) {
    int maxAttempts = properties.createOrLoadMaxAttempts();
    RegistryResult<AccessListLoadOrCreateResult> result = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      result = repository.loadOrCreateAccessList(resourceOwner, identifier, name, description);
      if (!(result instanceof RegistryResult.ConcurrencyConflict)) {
        break;
      }
      log.warn(
          "Create-or-load of access list {}/{} conflicted (attempt {} of {})",
          resourceOwner,
          identifier,
          attempt,
          maxAttempts);
    }
    return result.orElseThrow();
  }

  public AccessListInfo getAccessList(String resourceOwner, String identifier) {
    return repository.lookupInfo(ref(resourceOwner, identifier)).orElseThrow();
  }

  public AccessListInfo getAccessList(
      String resourceOwner, String identifier, Set<AccessListIncludes> includes) {
    return repository.lookupInfo(ref(resourceOwner, identifier), includes).orElseThrow();
  }

  public Page<AccessListInfo> getAccessListsByOwner(
      String resourceOwner, String continuationToken) {
    return repository
        .listByOwner(resourceOwner, continuationToken, properties.listsPageSize())
        .orElseThrow();
  }

  /**
   * Lists of one owner with their resource connections attached as {@code includes} asks;
   * {@code resourceIdentifier} narrows the attached connections to one resource.
   */
  public Page<AccessListInfo> getAccessListsByOwner(
      String resourceOwner,
      String continuationToken,
      Set<AccessListIncludes> includes,
      String resourceIdentifier) {
    return repository
        .listByOwner(
            resourceOwner,
            continuationToken,
            properties.listsPageSize(),
            includes,
            resourceIdentifier)
        .orElseThrow();
  }

  public AccessListInfo updateAccessList(
      String resourceOwner,
      String identifier,
      String newIdentifier,
      String newName,
      String newDescription,
      Long expectedVersion) {
    return modify(
        resourceOwner,
        identifier,
        expectedVersion,
        aggregate -> aggregate.update(newIdentifier, newName, newDescription));
  }

  public AccessListInfo deleteAccessList(
      String resourceOwner, String identifier, Long expectedVersion) {
    var info = modify(resourceOwner, identifier, expectedVersion, AccessListAggregate::delete);
    log.info("Deleted access list {}/{}", resourceOwner, identifier);
    return info;
  }

  // ── Resource connections ────────────────────────────────────────────

  public VersionedPage<AccessListResourceConnection> getResourceConnections(
      String resourceOwner, String identifier, String continuationToken) {
    return repository
        .listResourceConnections(
            ref(resourceOwner, identifier), continuationToken, properties.connectionsPageSize())
        .orElseThrow();
  }

  public AccessListResourceConnection upsertResourceConnection(
      String resourceOwner,
      String identifier,
      String resourceIdentifier,
      Collection<String> actions,
      Long expectedVersion) {
    return modifyAggregate(
            resourceOwner,
            identifier,
            expectedVersion,
            aggregate -> aggregate.addResourceConnection(resourceIdentifier, actions))
        .getResourceConnection(resourceIdentifier)
        .orElseThrow();
  }

  public AccessListResourceConnection addResourceConnectionActions(
      String resourceOwner,
      String identifier,
      String resourceIdentifier,
      Collection<String> actions,
      Long expectedVersion) {
    return modifyAggregate(
            resourceOwner,
            identifier,
            expectedVersion,
            aggregate -> aggregate.addResourceConnectionActions(resourceIdentifier, actions))
        .getResourceConnection(resourceIdentifier)
        .orElseThrow();
  }

  public AccessListResourceConnection removeResourceConnectionActions(
      String resourceOwner,
      String identifier,
      String resourceIdentifier,
      Collection<String> actions,
      Long expectedVersion) {
    return modifyAggregate(
            resourceOwner,
            identifier,
            expectedVersion,
            aggregate -> aggregate.removeResourceConnectionActions(resourceIdentifier, actions))
        .getResourceConnection(resourceIdentifier)
        .orElseThrow();
  }

  public AccessListInfo deleteResourceConnection(
      String resourceOwner, String identifier, String resourceIdentifier, Long expectedVersion) {
    return modify(
        resourceOwner,
        identifier,
        expectedVersion,
        aggregate -> aggregate.removeResourceConnection(resourceIdentifier));
  }

  // ── Members ─────────────────────────────────────────────────────────

  public VersionedPage<AccessListMembership> getMembers(
      String resourceOwner, String identifier, String continuationToken) {
    return repository
        .listMemberships(
            ref(resourceOwner, identifier), continuationToken, properties.membersPageSize())
        .orElseThrow();
  }

  public AccessListInfo addMembers(
      String resourceOwner,
      String identifier,
      Collection<UUID> partyIds,
      Long expectedVersion) {
    return modify(
        resourceOwner, identifier, expectedVersion, aggregate -> aggregate.addMembers(partyIds));
  }

  public AccessListInfo removeMembers(
      String resourceOwner,
      String identifier,
      Collection<UUID> partyIds,
      Long expectedVersion) {
    return modify(
        resourceOwner, identifier, expectedVersion, aggregate -> aggregate.removeMembers(partyIds));
  }

  /** Replaces the whole membership. Limited to {@code max-members-per-replace} parties. */
  public AccessListInfo replaceMembers(
      String resourceOwner,
      String identifier,
      Collection<UUID> partyIds,
      Long expectedVersion) {
    if (partyIds != null && partyIds.size() > properties.maxMembersPerReplace()) {
      throw new InvalidStateException(
          "Too many members",
          "At most "
              + properties.maxMembersPerReplace()
              + " members can be set at once, got "
              + partyIds.size());
    }
    return modify(
        resourceOwner,
        identifier,
        expectedVersion,
        aggregate -> aggregate.replaceMembers(partyIds));
  }

  // ── Helpers ─────────────────────────────────────────────────────────

  private AccessListInfo modify(
      String resourceOwner,
      String identifier,
      Long expectedVersion,
      Consumer<AccessListAggregate> mutation) {
    return modifyAggregate(resourceOwner, identifier, expectedVersion, mutation)
        .asAccessListInfo();
  }

  private AccessListAggregate modifyAggregate(
      String resourceOwner,
      String identifier,
      Long expectedVersion,
      Consumer<AccessListAggregate> mutation) {
    return repository
        .modify(
            ref(resourceOwner, identifier),
            aggregate -> {
              checkVersion(aggregate, expectedVersion);
              mutation.accept(aggregate);
            })
        .orElseThrow();
  }

  private static void checkVersion(AccessListAggregate aggregate, Long expectedVersion) {
    if (expectedVersion == null) {
      return;
    }
    long current = aggregate.getCommittedVersion().dbValue();
    if (current != expectedVersion) {
      throw new PreconditionFailedException(
          "Version mismatch",
          "Access list "
              + aggregate.getId()
              + " is at version "
              + current
              + ", expected "
              + expectedVersion);
    }
  }

  private static AccessListRef ref(String resourceOwner, String identifier) {
    return AccessListRef.byIdentifier(resourceOwner, identifier);
  }
}
