package io.b2mash.b2b.accessregistry.persistence;

import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs one repository operation in one registry transaction. Transactions use REPEATABLE READ so
 * that every statement of an operation sees the same snapshot and a concurrent update to a row the
 * operation writes surfaces as a serialization failure instead of a lost update. Any exception
 * thrown by the work, or a cancellation observed before commit, rolls the transaction back.
 */
@Component
public class TransactionRunner {

  private static final Logger log = LoggerFactory.getLogger(TransactionRunner.class);

  private final JdbcClient jdbc;
  private final TransactionTemplate writeTxTemplate;
  private final TransactionTemplate readTxTemplate;

  public TransactionRunner(
      @Qualifier("registryJdbcClient") JdbcClient jdbc,
      @Qualifier("registryTransactionManager") PlatformTransactionManager txManager) {
    this.jdbc = jdbc;

    this.writeTxTemplate = new TransactionTemplate(txManager);
    this.writeTxTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.writeTxTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);

    this.readTxTemplate = new TransactionTemplate(txManager);
    this.readTxTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.readTxTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
    this.readTxTemplate.setReadOnly(true);
  }

  public <T> T inTransaction(CancellationSignal cancellation, Function<TransactionScope, T> work) {
    return run(writeTxTemplate, cancellation, work);
  }

  public <T> T readOnly(CancellationSignal cancellation, Function<TransactionScope, T> work) {
    return run(readTxTemplate, cancellation, work);
  }

  private <T> T run(
      TransactionTemplate template,
      CancellationSignal cancellation,
      Function<TransactionScope, T> work) {
    cancellation.throwIfCancellationRequested();
    return template.execute(
        status -> {
          var scope = new TransactionScope(jdbc, status, cancellation);
          T result = work.apply(scope);
          if (cancellation.isCancellationRequested()) {
            log.debug("Cancellation requested before commit, rolling back");
            cancellation.throwIfCancellationRequested();
          }
          return result;
        });
  }
}
