package io.b2mash.b2b.accessregistry.accesslist;

import io.b2mash.b2b.accessregistry.accesslist.event.AccessListEvent;
import io.b2mash.b2b.accessregistry.aggregate.EventId;
import io.b2mash.b2b.accessregistry.pagination.ContinuationToken;
import io.b2mash.b2b.accessregistry.pagination.ContinuationTokenCodec;
import io.b2mash.b2b.accessregistry.pagination.Page;
import io.b2mash.b2b.accessregistry.pagination.VersionedPage;
import io.b2mash.b2b.accessregistry.persistence.CancellationSignal;
import io.b2mash.b2b.accessregistry.persistence.TransactionRunner;
import io.b2mash.b2b.accessregistry.persistence.TransactionScope;
import io.b2mash.b2b.accessregistry.result.RegistryResult;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

/**
 * Persistence entry point for access lists. Every operation runs in its own transaction; writes
 * append the pending events, project them and move the summary row's version forward atomically.
 *
 * <p>Expected outcomes (not found, concurrent modification, stale listing token, duplicate
 * identifier) come back as {@link RegistryResult} values. Storage faults propagate as Spring {@code
 * DataAccessException}s.
 */
@Repository
public class AccessListRepository {

  private static final Logger log = LoggerFactory.getLogger(AccessListRepository.class);

  static final String OWNER_IDENTIFIER_CONSTRAINT = "uq_access_list_state_owner_ident";
  private static final String RESOURCE_TYPE = "Access list";

  private final TransactionRunner transactions;
  private final AccessListEventLog eventLog;
  private final AccessListStateStore stateStore;
  private final ContinuationTokenCodec tokenCodec;
  private final Clock clock;

  public AccessListRepository(
      TransactionRunner transactions,
      AccessListEventLog eventLog,
      AccessListStateStore stateStore,
      ContinuationTokenCodec tokenCodec,
      Clock clock) {
    this.transactions = transactions;
    this.eventLog = eventLog;
    this.stateStore = stateStore;
    this.tokenCodec = tokenCodec;
    this.clock = clock;
  }

  /** Aggregate together with the ids its pending events received; committed after the tx ends. */
  private record Staged<T>(T value, AccessListAggregate aggregate, List<EventId> ids) {

    T commit() {
      if (!ids.isEmpty()) {
        aggregate.commit(ids);
      }
      return value;
    }
  }

  // ── Create ──────────────────────────────────────────────────────────

  public RegistryResult<AccessListAggregate> createAccessList(
      String resourceOwner, String identifier, String name, String description) {
    return createAccessList(resourceOwner, identifier, name, description, CancellationSignal.NONE);
  }

  /** Creates a new list. An existing list with the same owner and identifier yields Invalid. */
  public RegistryResult<AccessListAggregate> createAccessList(
      String resourceOwner,
      String identifier,
      String name,
      String description,
      CancellationSignal cancellation) {
    return guard(
        () -> {
          var staged =
              transactions.inTransaction(
                  cancellation,
                  tx -> {
                    var aggregate = AccessListAggregate.newAccessList(clock, UUID.randomUUID());
                    aggregate.initialize(resourceOwner, identifier, name, description);
                    return new Staged<>(aggregate, aggregate, persist(tx, aggregate));
                  });
          var aggregate = staged.commit();
          log.info(
              "Created access list {} ({}/{}) at version {}",
              aggregate.getId(),
              resourceOwner,
              identifier,
              aggregate.getCommittedVersion());
          return RegistryResult.success(aggregate);
        });
  }

  public RegistryResult<AccessListLoadOrCreateResult> loadOrCreateAccessList(
      String resourceOwner, String identifier, String name, String description) {
    return loadOrCreateAccessList(
        resourceOwner, identifier, name, description, CancellationSignal.NONE);
  }

  /**
   * Loads the list with the given owner and identifier, creating it when absent. Losing a creation
   * race to a writer whose row this transaction's snapshot cannot see yields ConcurrencyConflict;
   * retrying in a new transaction will load the winner's list.
   */
  public RegistryResult<AccessListLoadOrCreateResult> loadOrCreateAccessList(
      String resourceOwner,
      String identifier,
      String name,
      String description,
      CancellationSignal cancellation) {
    var ref = AccessListRef.byIdentifier(resourceOwner, identifier);
    return guard(
        () -> {
          Staged<Optional<AccessListLoadOrCreateResult>> staged =
              transactions.inTransaction(
                  cancellation,
                  tx -> {
                    var existing = loadLive(tx, ref);
                    if (existing.isPresent()) {
                      return loaded(existing.get());
                    }

                    var aggregate = AccessListAggregate.newAccessList(clock, UUID.randomUUID());
                    aggregate.initialize(resourceOwner, identifier, name, description);
                    Object savepoint = tx.createSavepoint();
                    try {
                      var ids = persist(tx, aggregate);
                      tx.releaseSavepoint(savepoint);
                      var created =
                          new AccessListLoadOrCreateResult(
                              AccessListLoadOrCreateResult.Mode.CREATED, aggregate);
                      return new Staged<>(Optional.of(created), aggregate, ids);
                    } catch (DuplicateKeyException e) {
                      if (!isOwnerIdentifierConflict(e)) {
                        throw e;
                      }
                      tx.rollbackToSavepoint(savepoint);
                      log.debug(
                          "Access list {}/{} created concurrently, loading it instead",
                          resourceOwner,
                          identifier);
                    }

                    return loadLive(tx, ref)
                        .map(this::loaded)
                        .orElseGet(() -> new Staged<>(Optional.empty(), aggregate, List.of()));
                  });

          var result = staged.commit();
          if (result.isEmpty()) {
            log.warn(
                "Access list {}/{} was created concurrently but is not yet visible",
                resourceOwner,
                identifier);
            return RegistryResult.concurrencyConflict(
                "Access list " + resourceOwner + "/" + identifier + " was created concurrently");
          }
          return RegistryResult.success(result.get());
        });
  }

  private Staged<Optional<AccessListLoadOrCreateResult>> loaded(AccessListAggregate aggregate) {
    var result =
        new AccessListLoadOrCreateResult(AccessListLoadOrCreateResult.Mode.LOADED, aggregate);
    return new Staged<>(Optional.of(result), aggregate, List.of());
  }

  // ── Load ────────────────────────────────────────────────────────────

  public RegistryResult<AccessListAggregate> load(AccessListRef ref) {
    return load(ref, CancellationSignal.NONE);
  }

  /** Rebuilds a live list from its event history. Deleted lists are not found. */
  public RegistryResult<AccessListAggregate> load(
      AccessListRef ref, CancellationSignal cancellation) {
    return guard(
        () ->
            transactions
                .readOnly(cancellation, tx -> loadLive(tx, ref))
                .map(RegistryResult::success)
                .orElseGet(() -> RegistryResult.notFound(RESOURCE_TYPE, ref)));
  }

  public RegistryResult<AccessListInfo> lookupInfo(AccessListRef ref) {
    return lookupInfo(ref, Set.of(), CancellationSignal.NONE);
  }

  public RegistryResult<AccessListInfo> lookupInfo(
      AccessListRef ref, CancellationSignal cancellation) {
    return lookupInfo(ref, Set.of(), cancellation);
  }

  public RegistryResult<AccessListInfo> lookupInfo(
      AccessListRef ref, Set<AccessListIncludes> includes) {
    return lookupInfo(ref, includes, CancellationSignal.NONE);
  }

  /** Reads the summary row without replaying events, plus whatever {@code includes} asks for. */
  public RegistryResult<AccessListInfo> lookupInfo(
      AccessListRef ref, Set<AccessListIncludes> includes, CancellationSignal cancellation) {
    return guard(
        () ->
            transactions
                .readOnly(
                    cancellation,
                    tx ->
                        stateStore
                            .findInfo(tx, ref)
                            .map(info -> attachIncludes(tx, List.of(info), includes, null).get(0)))
                .map(RegistryResult::success)
                .orElseGet(() -> RegistryResult.notFound(RESOURCE_TYPE, ref)));
  }

  public List<AccessListEvent> loadEvents(UUID aggregateId) {
    return loadEvents(aggregateId, CancellationSignal.NONE);
  }

  /** Raw history of a list, deleted or not, ascending by event id. Empty if the id is unknown. */
  public List<AccessListEvent> loadEvents(UUID aggregateId, CancellationSignal cancellation) {
    return transactions.readOnly(cancellation, tx -> eventLog.loadEvents(tx, aggregateId));
  }

  private Optional<AccessListAggregate> loadLive(TransactionScope tx, AccessListRef ref) {
    return stateStore
        .findId(tx, ref)
        .map(id -> AccessListAggregate.fromEvents(clock, id, eventLog.loadEvents(tx, id)))
        .filter(aggregate -> aggregate.isInitialized() && !aggregate.isDeleted());
  }

  // ── Write ───────────────────────────────────────────────────────────

  public RegistryResult<Integer> applyChanges(AccessListAggregate aggregate) {
    return applyChanges(aggregate, CancellationSignal.NONE);
  }

  /**
   * Persists the aggregate's pending events and marks them committed.
   *
   * @return the number of events committed; 0 without touching the database when nothing is
   *     pending
   */
  public RegistryResult<Integer> applyChanges(
      AccessListAggregate aggregate, CancellationSignal cancellation) {
    if (!aggregate.hasUncommittedEvents()) {
      return RegistryResult.success(0);
    }
    return guard(
        () -> {
          var ids = transactions.inTransaction(cancellation, tx -> persist(tx, aggregate));
          aggregate.commit(ids);
          return RegistryResult.success(ids.size());
        });
  }

  public RegistryResult<AccessListAggregate> modify(
      AccessListRef ref, Consumer<AccessListAggregate> mutation) {
    return modify(ref, mutation, CancellationSignal.NONE);
  }

  /**
   * Loads, mutates and persists a list in one transaction. Validation errors thrown by the mutation
   * propagate unchanged.
   */
  public RegistryResult<AccessListAggregate> modify(
      AccessListRef ref, Consumer<AccessListAggregate> mutation, CancellationSignal cancellation) {
    return guard(
        () -> {
          Optional<Staged<AccessListAggregate>> staged =
              transactions.inTransaction(
                  cancellation,
                  tx ->
                      loadLive(tx, ref)
                          .map(
                              aggregate -> {
                                mutation.accept(aggregate);
                                return new Staged<>(aggregate, aggregate, persist(tx, aggregate));
                              }));
          return staged
              .map(Staged::commit)
              .map(RegistryResult::success)
              .orElseGet(() -> RegistryResult.notFound(RESOURCE_TYPE, ref));
        });
  }

  /**
   * Appends, projects and version-checks the pending events. The aggregate itself is left
   * untouched; callers commit it with the returned ids once the transaction has committed.
   */
  private List<EventId> persist(TransactionScope tx, AccessListAggregate aggregate) {
    var pending = aggregate.getUncommittedEvents();
    if (pending.isEmpty()) {
      return List.of();
    }

    EventId priorVersion = aggregate.getCommittedVersion();
    var ids = eventLog.append(tx, pending);
    for (AccessListEvent event : pending) {
      stateStore.project(tx, event, priorVersion);
    }

    var last = pending.get(pending.size() - 1);
    if (!aggregate.isDeleted()) {
      stateStore.advanceVersion(
          tx, aggregate.getId(), priorVersion, ids.get(ids.size() - 1), last.eventTime());
    } else {
      log.info("Deleted access list {} at version {}", aggregate.getId(), priorVersion);
    }

    log.debug(
        "Appended {} events to access list {}: version {} -> {}",
        ids.size(),
        aggregate.getId(),
        priorVersion,
        ids.get(ids.size() - 1));
    return ids;
  }

  // ── Listings ────────────────────────────────────────────────────────

  public RegistryResult<Page<AccessListInfo>> listByOwner(
      String resourceOwner, String continuationToken, int pageSize) {
    return listByOwner(
        resourceOwner, continuationToken, pageSize, Set.of(), null, CancellationSignal.NONE);
  }

  public RegistryResult<Page<AccessListInfo>> listByOwner(
      String resourceOwner,
      String continuationToken,
      int pageSize,
      CancellationSignal cancellation) {
    return listByOwner(resourceOwner, continuationToken, pageSize, Set.of(), null, cancellation);
  }

  public RegistryResult<Page<AccessListInfo>> listByOwner(
      String resourceOwner,
      String continuationToken,
      int pageSize,
      Set<AccessListIncludes> includes,
      String resourceIdentifier) {
    return listByOwner(
        resourceOwner,
        continuationToken,
        pageSize,
        includes,
        resourceIdentifier,
        CancellationSignal.NONE);
  }

  /**
   * Lists of one owner ordered by identifier.
   *
   * @param resourceIdentifier when connections are included, only the connection to this resource
   *     is attached; lists without it get an empty connection list. Ignored otherwise
   */
  public RegistryResult<Page<AccessListInfo>> listByOwner(
      String resourceOwner,
      String continuationToken,
      int pageSize,
      Set<AccessListIncludes> includes,
      String resourceIdentifier,
      CancellationSignal cancellation) {
    requirePageSize(pageSize);
    if (isMalformed(continuationToken)) {
      return invalidToken();
    }
    var token = decodeToken(continuationToken);
    String from = token.map(ContinuationToken::resumeKey).orElse(AccessListStateStore.FIRST_KEY);

    return guard(
        () ->
            transactions.readOnly(
                cancellation,
                tx -> {
                  var rows = stateStore.findByOwner(tx, resourceOwner, from, pageSize + 1);
                  String next = null;
                  if (rows.size() > pageSize) {
                    next =
                        tokenCodec.encode(ContinuationToken.of(rows.get(pageSize).identifier()));
                    rows = rows.subList(0, pageSize);
                  }
                  Page<AccessListInfo> page =
                      new Page<>(attachIncludes(tx, rows, includes, resourceIdentifier), next);
                  return RegistryResult.success(page);
                }));
  }

  /** Loads the included connections of all {@code infos} with one query. */
  private List<AccessListInfo> attachIncludes(
      TransactionScope tx,
      List<AccessListInfo> infos,
      Set<AccessListIncludes> includes,
      String resourceIdentifier) {
    if (!AccessListIncludes.wantsConnections(includes) || infos.isEmpty()) {
      return infos;
    }
    var ids = infos.stream().map(AccessListInfo::id).toList();
    var connections =
        stateStore.findResourceConnectionsOf(
            tx, ids, resourceIdentifier, AccessListIncludes.wantsActions(includes));
    return infos.stream()
        .map(info -> info.withResourceConnections(connections.getOrDefault(info.id(), List.of())))
        .toList();
  }

  public RegistryResult<VersionedPage<AccessListResourceConnection>> listResourceConnections(
      AccessListRef ref, String continuationToken, int pageSize) {
    return listResourceConnections(ref, continuationToken, pageSize, CancellationSignal.NONE);
  }

  /**
   * Resource connections of one list ordered by resource identifier. Fails with PreconditionFailed
   * when the list has changed since the token's first page was served.
   */
  public RegistryResult<VersionedPage<AccessListResourceConnection>> listResourceConnections(
      AccessListRef ref,
      String continuationToken,
      int pageSize,
      CancellationSignal cancellation) {
    requirePageSize(pageSize);
    if (isMalformed(continuationToken)) {
      return invalidToken();
    }
    var token = decodeToken(continuationToken);
    String from = token.map(ContinuationToken::resumeKey).orElse(AccessListStateStore.FIRST_KEY);

    return guard(
        () ->
            transactions.readOnly(
                cancellation,
                tx ->
                    subCollectionPage(
                        tx,
                        ref,
                        token,
                        pageSize,
                        id -> stateStore.findResourceConnections(tx, id, from, pageSize + 1),
                        AccessListResourceConnection::resourceIdentifier)));
  }

  public RegistryResult<VersionedPage<AccessListMembership>> listMemberships(
      AccessListRef ref, String continuationToken, int pageSize) {
    return listMemberships(ref, continuationToken, pageSize, CancellationSignal.NONE);
  }

  /**
   * Members of one list ordered by party id. Fails with PreconditionFailed when the list has
   * changed since the token's first page was served.
   */
  public RegistryResult<VersionedPage<AccessListMembership>> listMemberships(
      AccessListRef ref,
      String continuationToken,
      int pageSize,
      CancellationSignal cancellation) {
    requirePageSize(pageSize);
    if (isMalformed(continuationToken)) {
      return invalidToken();
    }
    var token = decodeToken(continuationToken);
    UUID from;
    try {
      from =
          token
              .map(t -> UUID.fromString(t.resumeKey()))
              .orElse(AccessListStateStore.FIRST_PARTY_ID);
    } catch (IllegalArgumentException e) {
      return invalidToken();
    }

    return guard(
        () ->
            transactions.readOnly(
                cancellation,
                tx ->
                    subCollectionPage(
                        tx,
                        ref,
                        token,
                        pageSize,
                        id -> stateStore.findMemberships(tx, id, from, pageSize + 1),
                        membership -> membership.partyId().toString())));
  }

  private <T> RegistryResult<VersionedPage<T>> subCollectionPage(
      TransactionScope tx,
      AccessListRef ref,
      Optional<ContinuationToken> token,
      int pageSize,
      Function<UUID, List<T>> fetcher,
      Function<T, String> keyExtractor) {
    var info = stateStore.findInfo(tx, ref);
    if (info.isEmpty()) {
      return RegistryResult.notFound(RESOURCE_TYPE, ref);
    }
    EventId version = info.get().version();

    if (token.isPresent()) {
      Long tokenVersion = token.get().version();
      if (tokenVersion == null) {
        return invalidToken();
      }
      if (tokenVersion != version.dbValue()) {
        log.warn(
            "Listing of access list {} is stale: token version {}, current version {}",
            info.get().id(),
            tokenVersion,
            version);
        return RegistryResult.preconditionFailed(
            "Access list "
                + info.get().id()
                + " changed since the listing started (version "
                + tokenVersion
                + " -> "
                + version
                + ")");
      }
    }

    var rows = fetcher.apply(info.get().id());
    if (rows.size() <= pageSize) {
      return RegistryResult.success(new VersionedPage<>(rows, version, null));
    }
    var next =
        tokenCodec.encode(
            ContinuationToken.of(keyExtractor.apply(rows.get(pageSize)), version.dbValue()));
    return RegistryResult.success(new VersionedPage<>(rows.subList(0, pageSize), version, next));
  }

  // ── Helpers ─────────────────────────────────────────────────────────

  private boolean isMalformed(String continuationToken) {
    return continuationToken != null && tokenCodec.decode(continuationToken).isEmpty();
  }

  private Optional<ContinuationToken> decodeToken(String continuationToken) {
    return continuationToken == null ? Optional.empty() : tokenCodec.decode(continuationToken);
  }

  private static <T> RegistryResult<T> invalidToken() {
    return RegistryResult.invalid("Invalid continuation token", "Continuation token is malformed");
  }

  private static void requirePageSize(int pageSize) {
    if (pageSize <= 0) {
      throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
    }
  }

  /**
   * Runs a transactional operation and turns the expected database outcomes into results: a version
   * check that matched no row, a serialization failure, or a duplicate owner/identifier pair.
   */
  private <T> RegistryResult<T> guard(Supplier<RegistryResult<T>> operation) {
    try {
      return operation.get();
    } catch (DuplicateKeyException e) {
      if (isOwnerIdentifierConflict(e)) {
        return RegistryResult.invalid(
            "Duplicate access list", "An access list with this identifier already exists");
      }
      log.warn("Concurrent write to an access list sub-collection: {}", e.getMessage());
      return RegistryResult.concurrencyConflict("Access list was modified concurrently");
    } catch (ConcurrencyFailureException e) {
      log.warn("Concurrent modification of access list: {}", e.getMessage());
      return RegistryResult.concurrencyConflict(e.getMessage());
    }
  }

  static boolean isOwnerIdentifierConflict(DuplicateKeyException e) {
    String message = e.getMostSpecificCause().getMessage();
    return message != null && message.contains(OWNER_IDENTIFIER_CONSTRAINT);
  }
}
