package com.notifyhub.scheduler.service;

import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.SavepointManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

/** No-op transaction manager whose statuses support savepoints and count what happened. */
final class SavepointRecordingTransactionManager implements PlatformTransactionManager {

  final AtomicInteger commits = new AtomicInteger();
  final AtomicInteger rollbacks = new AtomicInteger();
  final AtomicInteger savepointsCreated = new AtomicInteger();
  final AtomicInteger savepointsReleased = new AtomicInteger();
  final AtomicInteger savepointRollbacks = new AtomicInteger();

  @Override
  public TransactionStatus getTransaction(TransactionDefinition definition) {
    return new RecordingStatus();
  }

  @Override
  public void commit(TransactionStatus status) {
    commits.incrementAndGet();
  }

  @Override
  public void rollback(TransactionStatus status) {
    rollbacks.incrementAndGet();
  }

  private final class RecordingStatus extends SimpleTransactionStatus {

    @Override
    protected SavepointManager getSavepointManager() {
      return new SavepointManager() {
        @Override
        public Object createSavepoint() {
          return savepointsCreated.incrementAndGet();
        }

        @Override
        public void rollbackToSavepoint(Object savepoint) {
          savepointRollbacks.incrementAndGet();
        }

        @Override
        public void releaseSavepoint(Object savepoint) {
          savepointsReleased.incrementAndGet();
        }
      };
    }
  }
}
