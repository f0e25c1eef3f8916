package io.b2mash.b2b.accessregistry.persistence;

import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.TransactionStatus;

/**
 * The open transaction of one repository operation. Store functions receive the scope as an
 * argument and issue every statement through {@link #sql(String)}; none of them hold on to it after
 * the operation returns.
 */
public record TransactionScope(
    JdbcClient jdbc, TransactionStatus status, CancellationSignal cancellation) {

  public JdbcClient.StatementSpec sql(String sql) {
    cancellation.throwIfCancellationRequested();
    return jdbc.sql(sql);
  }

  public Object createSavepoint() {
    return status.createSavepoint();
  }

  public void rollbackToSavepoint(Object savepoint) {
    status.rollbackToSavepoint(savepoint);
  }

  public void releaseSavepoint(Object savepoint) {
    status.releaseSavepoint(savepoint);
  }
}
