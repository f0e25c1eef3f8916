package io.b2mash.b2b.accessregistry.accesslist;

import java.util.Objects;
import java.util.UUID;

/** Addresses an access list either by its id or by its owner-scoped identifier. */
public sealed interface AccessListRef {

  static AccessListRef byId(UUID id) {
    return new ById(id);
  }

  static AccessListRef byIdentifier(String resourceOwner, String identifier) {
    return new ByIdentifier(resourceOwner, identifier);
  }

  record ById(UUID id) implements AccessListRef {
    public ById {
      Objects.requireNonNull(id, "id");
    }

    @Override
    public String toString() {
      return "id=" + id;
    }
  }

  record ByIdentifier(String resourceOwner, String identifier) implements AccessListRef {
    public ByIdentifier {
      Objects.requireNonNull(resourceOwner, "resourceOwner");
      Objects.requireNonNull(identifier, "identifier");
    }

    @Override
    public String toString() {
      return "owner=" + resourceOwner + ", identifier=" + identifier;
    }
  }
}
