package io.b2mash.b2b.accessregistry.exception;

/** Raised inside a transaction scope when the caller's cancellation signal has fired. */
public class OperationCancelledException extends RuntimeException {

  public OperationCancelledException(String message) {
    super(message);
  }
}
