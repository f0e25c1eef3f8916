package io.b2mash.b2b.accessregistry.result;

import io.b2mash.b2b.accessregistry.exception.InvalidStateException;
import io.b2mash.b2b.accessregistry.exception.PreconditionFailedException;
import io.b2mash.b2b.accessregistry.exception.ResourceNotFoundException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a repository operation. Expected failures are values so that callers can branch on
 * them with {@code instanceof}; storage faults are never represented here and propagate as
 * exceptions.
 */
public sealed interface RegistryResult<T>
    permits RegistryResult.Success,
        RegistryResult.NotFound,
        RegistryResult.ConcurrencyConflict,
        RegistryResult.PreconditionFailed,
        RegistryResult.Invalid {

  record Success<T>(T value) implements RegistryResult<T> {}

  /** The referenced aggregate or sub-entity does not exist. */
  record NotFound<T>(String resourceType, String key) implements RegistryResult<T> {}

  /** A version-conditioned write affected no rows; reload and retry. */
  record ConcurrencyConflict<T>(String detail) implements RegistryResult<T> {}

  /** A listing token no longer matches the aggregate's version. */
  record PreconditionFailed<T>(String detail) implements RegistryResult<T> {}

  /** Business-rule violation, duplicate creation or malformed input. */
  record Invalid<T>(String title, String detail) implements RegistryResult<T> {}

  static <T> RegistryResult<T> success(T value) {
    return new Success<>(value);
  }

  static <T> RegistryResult<T> notFound(String resourceType, Object key) {
    return new NotFound<>(resourceType, String.valueOf(key));
  }

  static <T> RegistryResult<T> concurrencyConflict(String detail) {
    return new ConcurrencyConflict<>(detail);
  }

  static <T> RegistryResult<T> preconditionFailed(String detail) {
    return new PreconditionFailed<>(detail);
  }

  static <T> RegistryResult<T> invalid(String title, String detail) {
    return new Invalid<>(title, detail);
  }

  default boolean isSuccess() {
    return this instanceof Success<T>;
  }

  default Optional<T> toOptional() {
    return this instanceof Success<T> success ? Optional.of(success.value()) : Optional.empty();
  }

  /** Transforms a success value; failures pass through unchanged. */
  default <R> RegistryResult<R> map(Function<? super T, ? extends R> mapper) {
    if (this instanceof Success<T> success) {
      return new Success<>(mapper.apply(success.value()));
    }
    return retype();
  }

  /** Chains another operation on success; failures pass through unchanged. */
  default <R> RegistryResult<R> flatMap(Function<? super T, RegistryResult<R>> mapper) {
    if (this instanceof Success<T> success) {
      return mapper.apply(success.value());
    }
    return retype();
  }

  /** The success value, or the HTTP-ready exception describing the failure. */
  default T orElseThrow() {
    if (this instanceof Success<T> success) {
      return success.value();
    }
    throw toException();
  }

  /** Exception describing a failure; a success has none. */
  default RuntimeException toException() {
    if (this instanceof NotFound<T> notFound) {
      return new ResourceNotFoundException(notFound.resourceType(), notFound.key());
    }
    if (this instanceof ConcurrencyConflict<T> conflict) {
      return new PreconditionFailedException("Concurrent modification", conflict.detail());
    }
    if (this instanceof PreconditionFailed<T> failed) {
      return new PreconditionFailedException("Precondition failed", failed.detail());
    }
    if (this instanceof Invalid<T> invalid) {
      return new InvalidStateException(invalid.title(), invalid.detail());
    }
    throw new IllegalStateException("Success has no exception");
  }

  /** Re-parameterizes a failure, which carries no value of type {@code T}. */
  @SuppressWarnings("unchecked")
  private <R> RegistryResult<R> retype() {
    if (this instanceof Success<T>) {
      throw new IllegalStateException("Cannot retype a success");
    }
    return (RegistryResult<R>) this;
  }
}
