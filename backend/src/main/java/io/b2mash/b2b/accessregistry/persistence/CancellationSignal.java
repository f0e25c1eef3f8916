package io.b2mash.b2b.accessregistry.persistence;

import io.b2mash.b2b.accessregistry.exception.OperationCancelledException;

/**
 * Cooperative cancellation flag handed to repository operations. A running transaction checks the
 * flag before each statement and rolls back once it is raised.
 */
public final class CancellationSignal {

  /** Signal that can never be raised. */
  public static final CancellationSignal NONE = new CancellationSignal(false);

  private final boolean cancellable;
  private volatile boolean cancelled;

  private CancellationSignal(boolean cancellable) {
    this.cancellable = cancellable;
  }

  public static CancellationSignal create() {
    return new CancellationSignal(true);
  }

  public void cancel() {
    if (!cancellable) {
      throw new UnsupportedOperationException("CancellationSignal.NONE cannot be cancelled");
    }
    cancelled = true;
  }

  public boolean isCancellationRequested() {
    return cancelled;
  }

  public void throwIfCancellationRequested() {
    if (cancelled) {
      throw new OperationCancelledException("Operation was cancelled");
    }
  }
}
