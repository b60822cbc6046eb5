package bisslog.infrastructure.tracing;

import bisslog.tracing.TraceIds;
import org.slf4j.MDC;

/**
 * Binds trace ids to the SLF4J MDC for the duration of one entry and restores whatever the caller
 * had bound before.
 */
final class TraceMdc implements AutoCloseable {

  static final String TRANSACTION_ID_KEY = "transactionId";
  static final String CHECKPOINT_ID_KEY = "checkpointId";

  private final String previousTransactionId;
  private final String previousCheckpointId;
  private final boolean transactionBound;

  private TraceMdc(String previousTransactionId, String previousCheckpointId, boolean transactionBound) {
    this.previousTransactionId = previousTransactionId;
    this.previousCheckpointId = previousCheckpointId;
    this.transactionBound = transactionBound;
  }

  static TraceMdc bind(TraceIds ids) {
    TraceMdc binding = new TraceMdc(MDC.get(TRANSACTION_ID_KEY), MDC.get(CHECKPOINT_ID_KEY), true);
    MDC.put(TRANSACTION_ID_KEY, ids.transactionId());
    MDC.put(CHECKPOINT_ID_KEY, ids.checkpointId());
    return binding;
  }

  static TraceMdc bindCheckpoint(String checkpointId) {
    TraceMdc binding = new TraceMdc(null, MDC.get(CHECKPOINT_ID_KEY), false);
    MDC.put(CHECKPOINT_ID_KEY, checkpointId == null ? "" : checkpointId);
    return binding;
  }

  @Override
  public void close() {
    if (transactionBound) {
      restore(TRANSACTION_ID_KEY, previousTransactionId);
    }
    restore(CHECKPOINT_ID_KEY, previousCheckpointId);
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }
}
