package io.b2mash.b2b.accessregistry.accesslist.event;

/**
 * One method per event kind. Folding and projection are written as visitors so that adding a kind
 * fails to compile until every consumer handles it.
 */
public interface AccessListEventVisitor<R> {

  R visitCreated(AccessListCreated event);

  R visitUpdated(AccessListUpdated event);

  R visitDeleted(AccessListDeleted event);

  R visitResourceConnectionCreated(ResourceConnectionCreated event);

  R visitResourceConnectionActionsAdded(ResourceConnectionActionsAdded event);

  R visitResourceConnectionActionsRemoved(ResourceConnectionActionsRemoved event);

  R visitResourceConnectionDeleted(ResourceConnectionDeleted event);

  R visitMembersAdded(MembersAdded event);

  R visitMembersRemoved(MembersRemoved event);
}
