package bisslog.transactional;

import java.util.Objects;

/**
 * Handle on one open transaction. Closing it ends the transaction on the thread that opened it.
 *
 * <pre>
 * try (TransactionScope tx = transactionManager.begin()) {
 *   tracer.info("order accepted");
 * }
 * </pre>
 */
public final class TransactionScope implements AutoCloseable {

  private final TransactionManager manager;
  private final String transactionId;
  private final Thread owner;
  private boolean closed;

  TransactionScope(TransactionManager manager, String transactionId) {
    this.manager = Objects.requireNonNull(manager, "manager");
    this.transactionId = Objects.requireNonNull(transactionId, "transactionId");
    this.owner = Thread.currentThread();
  }

  public String getTransactionId() {
    return transactionId;
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Ends the transaction. Calling it again, or after {@link TransactionManager#clear()}, is a no-op.
   *
   * @throws IllegalStateException if a transaction opened after this one is still open, or if
   *     called from a thread other than the one that opened the scope
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    if (Thread.currentThread() != owner) {
      throw new IllegalStateException(
          "Transaction "
              + transactionId
              + " was opened on thread "
              + owner.getName()
              + " and cannot be closed from "
              + Thread.currentThread().getName());
    }
    manager.end(this);
    closed = true;
  }

  @Override
  public String toString() {
    return "TransactionScope[" + transactionId + (closed ? ", closed]" : "]");
  }
}
