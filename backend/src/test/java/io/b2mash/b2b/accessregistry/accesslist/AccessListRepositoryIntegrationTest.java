package io.b2mash.b2b.accessregistry.accesslist;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.accessregistry.TestcontainersConfiguration;
import io.b2mash.b2b.accessregistry.accesslist.event.AccessListEvent;
import io.b2mash.b2b.accessregistry.accesslist.event.AccessListEventKind;
import io.b2mash.b2b.accessregistry.aggregate.EventId;
import io.b2mash.b2b.accessregistry.exception.OperationCancelledException;
import io.b2mash.b2b.accessregistry.pagination.ContinuationToken;
import io.b2mash.b2b.accessregistry.pagination.ContinuationTokenCodec;
import io.b2mash.b2b.accessregistry.persistence.CancellationSignal;
import io.b2mash.b2b.accessregistry.result.RegistryResult;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class AccessListRepositoryIntegrationTest {

  @Autowired private AccessListRepository repository;
  @Autowired private ContinuationTokenCodec tokenCodec;
  @Autowired private Clock clock;

  @Test
  void createConnectListAndDelete() {
    var aggregate = AccessListAggregate.newAccessList(clock, UUID.randomUUID());
    aggregate.initialize("974761076", "test1", "Test 1", null);
    aggregate.addResourceConnection("resA", List.of("read"));

    assertThat(unwrap(repository.applyChanges(aggregate))).isEqualTo(2);
    assertThat(aggregate.hasUncommittedEvents()).isFalse();

    var history = repository.loadEvents(aggregate.getId());
    assertThat(history).hasSize(2);
    EventId first = history.get(0).eventId();
    assertThat(history.get(1).eventId()).isEqualTo(EventId.of(first.value() + 1));
    assertThat(aggregate.getCommittedVersion()).isEqualTo(history.get(1).eventId());

    var info = unwrap(repository.lookupInfo(AccessListRef.byIdentifier("974761076", "test1")));
    assertThat(info.id()).isEqualTo(aggregate.getId());
    assertThat(info.name()).isEqualTo("Test 1");
    assertThat(info.description()).isEmpty();
    assertThat(info.version()).isEqualTo(aggregate.getCommittedVersion());

    var connections =
        unwrap(repository.listResourceConnections(AccessListRef.byId(aggregate.getId()), null, 10));
    assertThat(connections.items()).hasSize(1);
    assertThat(connections.items().get(0).resourceIdentifier()).isEqualTo("resA");
    assertThat(connections.items().get(0).actions()).containsExactly("read");
    assertThat(connections.hasNext()).isFalse();

    aggregate.delete();
    assertThat(unwrap(repository.applyChanges(aggregate))).isEqualTo(1);

    assertThat(repository.lookupInfo(AccessListRef.byId(aggregate.getId())))
        .isInstanceOf(RegistryResult.NotFound.class);
    assertThat(repository.load(AccessListRef.byIdentifier("974761076", "test1")))
        .isInstanceOf(RegistryResult.NotFound.class);
    assertThat(kinds(repository.loadEvents(aggregate.getId())))
        .containsExactly(
            AccessListEventKind.CREATED,
            AccessListEventKind.RESOURCE_CONNECTION_CREATED,
            AccessListEventKind.DELETED);
  }

  @Test
  void loadReplaysToTheSameState() {
    String owner = randomOwner();
    var created = unwrap(repository.createAccessList(owner, "replay", "Replay", "desc"));
    UUID alice = UUID.randomUUID();
    UUID bob = UUID.randomUUID();

    var modified =
        unwrap(
            repository.modify(
                AccessListRef.byId(created.getId()),
                aggregate -> {
                  aggregate.addResourceConnection("resA", List.of("read", "write"));
                  aggregate.addResourceConnection("resB", List.of("read"));
                  aggregate.addMembers(List.of(alice, bob));
                  aggregate.update(null, "Replayed", null);
                }));

    var loaded = unwrap(repository.load(AccessListRef.byIdentifier(owner, "replay")));

    assertThat(loaded.asAccessListInfo()).isEqualTo(modified.asAccessListInfo());
    assertThat(loaded.getResourceConnections()).isEqualTo(modified.getResourceConnections());
    assertThat(loaded.getMemberIds()).containsExactlyInAnyOrder(alice, bob);
    assertThat(loaded.getName()).isEqualTo("Replayed");
  }

  @Test
  void unchangedAggregateCommitsNothing() {
    String owner = randomOwner();
    UUID party = UUID.randomUUID();
    var created = unwrap(repository.createAccessList(owner, "idem", "Idem", null));
    created.addMembers(List.of(party));
    unwrap(repository.applyChanges(created));
    EventId version = created.getCommittedVersion();

    assertThat(created.addMembers(List.of(party))).isEmpty();
    assertThat(unwrap(repository.applyChanges(created))).isZero();
    assertThat(created.getCommittedVersion()).isEqualTo(version);
    assertThat(repository.loadEvents(created.getId())).hasSize(2);
    var members = unwrap(repository.listMemberships(AccessListRef.byId(created.getId()), null, 10));
    assertThat(members.items()).extracting(AccessListMembership::partyId).containsExactly(party);
  }

  @Test
  void staleWriterConflictsAndRollsBack() {
    String owner = randomOwner();
    var created = unwrap(repository.createAccessList(owner, "race", "Race", null));
    var ref = AccessListRef.byId(created.getId());

    var first = unwrap(repository.load(ref));
    var second = unwrap(repository.load(ref));

    first.addMembers(List.of(UUID.randomUUID()));
    assertThat(unwrap(repository.applyChanges(first))).isEqualTo(1);

    EventId staleVersion = second.getCommittedVersion();
    second.addResourceConnection("resX", List.of("read"));
    second.addMembers(List.of(UUID.randomUUID()));

    assertThat(repository.applyChanges(second))
        .isInstanceOf(RegistryResult.ConcurrencyConflict.class);
    assertThat(second.hasUncommittedEvents()).isTrue();
    assertThat(second.getCommittedVersion()).isEqualTo(staleVersion);

    var history = repository.loadEvents(created.getId());
    assertThat(history)
        .extracting(AccessListEvent::eventId)
        .allSatisfy(id -> assertThat(id.compareTo(first.getCommittedVersion())).isNotPositive());
    assertThat(kinds(history))
        .containsExactly(AccessListEventKind.CREATED, AccessListEventKind.MEMBERS_ADDED);

    assertThat(unwrap(repository.listResourceConnections(ref, null, 10)).items()).isEmpty();
    assertThat(unwrap(repository.listMemberships(ref, null, 10)).items()).hasSize(1);
    assertThat(unwrap(repository.lookupInfo(ref)).version())
        .isEqualTo(first.getCommittedVersion());
  }

  @Test
  void staleDeleteConflicts() {
    String owner = randomOwner();
    var created = unwrap(repository.createAccessList(owner, "doomed", "Doomed", null));
    var ref = AccessListRef.byId(created.getId());

    var writer = unwrap(repository.load(ref));
    var deleter = unwrap(repository.load(ref));

    writer.update(null, "Still here", null);
    unwrap(repository.applyChanges(writer));

    deleter.delete();
    assertThat(repository.applyChanges(deleter))
        .isInstanceOf(RegistryResult.ConcurrencyConflict.class);
    assertThat(unwrap(repository.lookupInfo(ref)).name()).isEqualTo("Still here");
  }

  @Test
  void resourceConnectionsPaginateInResourceOrder() {
    String owner = randomOwner();
    var created = unwrap(repository.createAccessList(owner, "paged", "Paged", null));
    IntStream.range(0, 222)
        .mapToObj(i -> String.format("res-%03d", i))
        .forEach(resource -> created.addResourceConnection(resource, List.of("read")));
    assertThat(unwrap(repository.applyChanges(created))).isEqualTo(222);

    var ref = AccessListRef.byIdentifier(owner, "paged");
    List<String> seen = new ArrayList<>();
    List<Integer> pageSizes = new ArrayList<>();
    String token = null;
    do {
      var page = unwrap(repository.listResourceConnections(ref, token, 100));
      assertThat(page.version()).isEqualTo(created.getCommittedVersion());
      pageSizes.add(page.items().size());
      page.items().forEach(c -> seen.add(c.resourceIdentifier()));
      token = page.continuationToken();
    } while (token != null);

    assertThat(pageSizes).containsExactly(100, 100, 22);
    assertThat(seen).hasSize(222).isSorted().doesNotHaveDuplicates();
    assertThat(seen.get(0)).isEqualTo("res-000");
    assertThat(seen.get(221)).isEqualTo("res-221");
  }

  @Test
  void listingFailsWhenTheListChangesBetweenPages() {
    String owner = randomOwner();
    var created = unwrap(repository.createAccessList(owner, "moving", "Moving", null));
    created.addResourceConnection("res-1", List.of("read"));
    created.addResourceConnection("res-2", List.of("read"));
    created.addResourceConnection("res-3", List.of("read"));
    unwrap(repository.applyChanges(created));
    var ref = AccessListRef.byId(created.getId());

    var firstPage = unwrap(repository.listResourceConnections(ref, null, 2));
    assertThat(firstPage.hasNext()).isTrue();

    unwrap(repository.modify(ref, aggregate -> aggregate.update(null, "Moved", null)));

    assertThat(repository.listResourceConnections(ref, firstPage.continuationToken(), 2))
        .isInstanceOf(RegistryResult.PreconditionFailed.class);
  }

  @Test
  void malformedTokensAreInvalid() {
    String owner = randomOwner();
    var created = unwrap(repository.createAccessList(owner, "tokens", "Tokens", null));
    var ref = AccessListRef.byId(created.getId());

    assertThat(repository.listResourceConnections(ref, "not a token!", 10))
        .isInstanceOf(RegistryResult.Invalid.class);
    assertThat(repository.listMemberships(ref, "%%%", 10))
        .isInstanceOf(RegistryResult.Invalid.class);
    assertThat(repository.listByOwner(owner, "!!", 10))
        .isInstanceOf(RegistryResult.Invalid.class);

    // A sub-collection token must carry the version it was issued at
    String unversioned = tokenCodec.encode(ContinuationToken.of("res-1"));
    assertThat(repository.listResourceConnections(ref, unversioned, 10))
        .isInstanceOf(RegistryResult.Invalid.class);

    String notAPartyId =
        tokenCodec.encode(
            ContinuationToken.of("nope", created.getCommittedVersion().dbValue()));
    assertThat(repository.listMemberships(ref, notAPartyId, 10))
        .isInstanceOf(RegistryResult.Invalid.class);
  }

  @Test
  void duplicateIdentifierIsInvalid() {
    String owner = randomOwner();
    unwrap(repository.createAccessList(owner, "dup", "First", null));

    assertThat(repository.createAccessList(owner, "dup", "Second", null))
        .isInstanceOf(RegistryResult.Invalid.class);
    assertThat(unwrap(repository.lookupInfo(AccessListRef.byIdentifier(owner, "dup"))).name())
        .isEqualTo("First");

    // Same identifier under another owner is fine
    assertThat(repository.createAccessList(randomOwner(), "dup", "Other", null).isSuccess())
        .isTrue();
  }

  @Test
  void renamingOntoAnExistingIdentifierIsInvalid() {
    String owner = randomOwner();
    unwrap(repository.createAccessList(owner, "taken", "Taken", null));
    unwrap(repository.createAccessList(owner, "mine", "Mine", null));

    var result =
        repository.modify(
            AccessListRef.byIdentifier(owner, "mine"),
            aggregate -> aggregate.update("taken", null, null));

    assertThat(result).isInstanceOf(RegistryResult.Invalid.class);
    assertThat(unwrap(repository.lookupInfo(AccessListRef.byIdentifier(owner, "mine"))).name())
        .isEqualTo("Mine");
  }

  @Test
  void loadOrCreateCreatesOnceThenLoads() {
    String owner = randomOwner();

    var first = unwrap(repository.loadOrCreateAccessList(owner, "lazy", "Lazy", "d"));
    assertThat(first.mode()).isEqualTo(AccessListLoadOrCreateResult.Mode.CREATED);
    assertThat(first.aggregate().hasUncommittedEvents()).isFalse();

    var second = unwrap(repository.loadOrCreateAccessList(owner, "lazy", "Ignored", null));
    assertThat(second.mode()).isEqualTo(AccessListLoadOrCreateResult.Mode.LOADED);
    assertThat(second.aggregate().getId()).isEqualTo(first.aggregate().getId());
    assertThat(second.aggregate().getName()).isEqualTo("Lazy");
  }

  @Test
  void listByOwnerPagesByIdentifier() {
    String owner = randomOwner();
    for (String identifier : List.of("delta", "alpha", "charlie", "bravo", "echo")) {
      unwrap(repository.createAccessList(owner, identifier, identifier.toUpperCase(), null));
    }
    unwrap(repository.createAccessList(randomOwner(), "alpha", "Someone else's", null));

    List<String> identifiers = new ArrayList<>();
    String token = null;
    int pages = 0;
    do {
      var page = unwrap(repository.listByOwner(owner, token, 2));
      page.items().forEach(info -> identifiers.add(info.identifier()));
      token = page.continuationToken();
      pages++;
    } while (token != null);

    assertThat(pages).isEqualTo(3);
    assertThat(identifiers).containsExactly("alpha", "bravo", "charlie", "delta", "echo");
  }

  @Test
  void lookupInfoAttachesRequestedConnections() {
    String owner = randomOwner();
    var created = unwrap(repository.createAccessList(owner, "included", "Included", null));
    created.addResourceConnection("resB", List.of("write", "read"));
    created.addResourceConnection("resA", List.of("read"));
    unwrap(repository.applyChanges(created));
    var ref = AccessListRef.byIdentifier(owner, "included");

    assertThat(unwrap(repository.lookupInfo(ref)).resourceConnections()).isNull();

    var withoutActions =
        unwrap(repository.lookupInfo(ref, EnumSet.of(AccessListIncludes.RESOURCE_CONNECTIONS)));
    assertThat(withoutActions.resourceConnections())
        .extracting(AccessListResourceConnection::resourceIdentifier)
        .containsExactly("resA", "resB");
    assertThat(withoutActions.resourceConnections())
        .allSatisfy(connection -> assertThat(connection.actions()).isEmpty());

    var withActions =
        unwrap(
            repository.lookupInfo(
                ref, EnumSet.of(AccessListIncludes.RESOURCE_CONNECTION_ACTIONS)));
    assertThat(withActions.resourceConnections()).hasSize(2);
    assertThat(withActions.resourceConnections().get(1).actions())
        .containsExactly("read", "write");
    assertThat(withActions.version()).isEqualTo(created.getCommittedVersion());
  }

  @Test
  void listByOwnerAttachesConnectionsFilteredByResource() {
    String owner = randomOwner();
    var first = unwrap(repository.createAccessList(owner, "first", "First", null));
    first.addResourceConnection("shared", List.of("read"));
    first.addResourceConnection("only-first", List.of("read"));
    unwrap(repository.applyChanges(first));
    var second = unwrap(repository.createAccessList(owner, "second", "Second", null));
    second.addResourceConnection("shared", List.of("admin"));
    unwrap(repository.applyChanges(second));
    unwrap(repository.createAccessList(owner, "third", "Third", null));

    var all =
        unwrap(
            repository.listByOwner(
                owner, null, 10, EnumSet.of(AccessListIncludes.RESOURCE_CONNECTIONS), null));
    assertThat(all.items())
        .extracting(AccessListInfo::identifier)
        .containsExactly("first", "second", "third");
    assertThat(all.items().get(0).resourceConnections()).hasSize(2);
    assertThat(all.items().get(1).resourceConnections()).hasSize(1);
    assertThat(all.items().get(2).resourceConnections()).isEmpty();

    var filtered =
        unwrap(
            repository.listByOwner(
                owner,
                null,
                10,
                EnumSet.of(AccessListIncludes.RESOURCE_CONNECTION_ACTIONS),
                "shared"));
    assertThat(filtered.items()).hasSize(3);
    assertThat(filtered.items().get(0).resourceConnections())
        .singleElement()
        .satisfies(connection -> assertThat(connection.actions()).containsExactly("read"));
    assertThat(filtered.items().get(1).resourceConnections())
        .singleElement()
        .satisfies(connection -> assertThat(connection.actions()).containsExactly("admin"));
    assertThat(filtered.items().get(2).resourceConnections()).isEmpty();

    var bare = unwrap(repository.listByOwner(owner, null, 10));
    assertThat(bare.items()).allSatisfy(info -> assertThat(info.resourceConnections()).isNull());
  }

  @Test
  void membershipsPaginateInPartyIdOrder() {
    String owner = randomOwner();
    var created = unwrap(repository.createAccessList(owner, "members", "Members", null));
    List<UUID> parties = IntStream.range(0, 7).mapToObj(i -> UUID.randomUUID()).toList();
    created.addMembers(parties);
    unwrap(repository.applyChanges(created));

    var ref = AccessListRef.byId(created.getId());
    List<UUID> seen = new ArrayList<>();
    String token = null;
    do {
      var page = unwrap(repository.listMemberships(ref, token, 3));
      page.items().forEach(m -> seen.add(m.partyId()));
      assertThat(page.items()).allSatisfy(m -> assertThat(m.since()).isNotNull());
      token = page.continuationToken();
    } while (token != null);

    assertThat(seen)
        .containsExactlyElementsOf(
            parties.stream().sorted(Comparator.comparing(UUID::toString)).toList());
  }

  @Test
  void removedActionsAreProjectedAndReplayed() {
    String owner = randomOwner();
    var created = unwrap(repository.createAccessList(owner, "actions", "Actions", null));
    var ref = AccessListRef.byId(created.getId());

    unwrap(
        repository.modify(
            ref,
            aggregate ->
                aggregate.addResourceConnection("resA", List.of("read", "write", "admin"))));
    unwrap(
        repository.modify(
            ref,
            aggregate ->
                aggregate.removeResourceConnectionActions("resA", List.of("admin", "delete"))));
    unwrap(
        repository.modify(
            ref, aggregate -> aggregate.addResourceConnectionActions("resA", List.of("list"))));

    var projected = unwrap(repository.listResourceConnections(ref, null, 10)).items();
    assertThat(projected).hasSize(1);
    assertThat(projected.get(0).actions()).containsExactly("list", "read", "write");

    var replayed = unwrap(repository.load(ref)).getResourceConnection("resA").orElseThrow();
    assertThat(replayed.actions()).isEqualTo(Set.of("list", "read", "write"));

    unwrap(repository.modify(ref, aggregate -> aggregate.removeResourceConnection("resA")));
    assertThat(unwrap(repository.listResourceConnections(ref, null, 10)).items()).isEmpty();
  }

  @Test
  void replaceMembersRemovesThenAdds() {
    String owner = randomOwner();
    UUID keep = UUID.randomUUID();
    UUID drop = UUID.randomUUID();
    UUID join = UUID.randomUUID();
    var created = unwrap(repository.createAccessList(owner, "replace", "Replace", null));
    created.addMembers(List.of(keep, drop));
    unwrap(repository.applyChanges(created));

    var ref = AccessListRef.byId(created.getId());
    unwrap(repository.modify(ref, aggregate -> aggregate.replaceMembers(List.of(keep, join))));

    var members = unwrap(repository.listMemberships(ref, null, 10)).items();
    assertThat(members).extracting(AccessListMembership::partyId).containsOnly(keep, join);
    assertThat(kinds(repository.loadEvents(created.getId())))
        .endsWith(AccessListEventKind.MEMBERS_REMOVED, AccessListEventKind.MEMBERS_ADDED);
  }

  @Test
  void cancelledOperationWritesNothing() {
    String owner = randomOwner();
    var cancellation = CancellationSignal.create();
    cancellation.cancel();

    assertThatThrownBy(
            () -> repository.createAccessList(owner, "cancelled", "Cancelled", null, cancellation))
        .isInstanceOf(OperationCancelledException.class);
    assertThat(unwrap(repository.listByOwner(owner, null, 10)).items()).isEmpty();
  }

  @Test
  void modifyOfMissingListIsNotFound() {
    var result =
        repository.modify(
            AccessListRef.byIdentifier(randomOwner(), "ghost"),
            aggregate -> aggregate.update(null, "Boo", null));

    assertThat(result).isInstanceOf(RegistryResult.NotFound.class);
    assertThat(repository.loadEvents(UUID.randomUUID())).isEmpty();
  }

  private static <T> T unwrap(RegistryResult<T> result) {
    assertThat(result).isInstanceOf(RegistryResult.Success.class);
    return result.toOptional().orElseThrow();
  }

  private static List<AccessListEventKind> kinds(List<AccessListEvent> events) {
    return events.stream().map(AccessListEvent::kind).toList();
  }

  private static String randomOwner() {
    return "owner-" + UUID.randomUUID();
  }
}
