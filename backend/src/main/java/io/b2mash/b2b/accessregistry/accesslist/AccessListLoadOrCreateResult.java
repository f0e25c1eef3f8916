package io.b2mash.b2b.accessregistry.accesslist;

/** Outcome of a create-or-load: whether the returned aggregate was just created. */
public record AccessListLoadOrCreateResult(Mode mode, AccessListAggregate aggregate) {

  public enum Mode {
    CREATED,
    LOADED
  }

  public boolean isNew() {
    return mode == Mode.CREATED;
  }
}
