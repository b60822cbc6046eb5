package bisslog.tracing;

import bisslog.transactional.TransactionContext;
import java.util.Map;
import java.util.Objects;

/**
 * Tracing that threads a transaction id and a checkpoint id through every entry.
 *
 * <p>Besides the five severity levels it separates functional errors (a business rule was violated)
 * from technical errors (infrastructure failed, optionally with the causing {@link Throwable}), and
 * brackets calls to external systems with {@link #reportStartExternal} / {@link
 * #reportEndExternal}.
 *
 * <h3>Id resolution</h3>
 *
 * <p>Callers may omit both ids. Before formatting, a backend calls {@link #resolveWithMain} or
 * {@link #resolveWithCurrent}, which fill a missing transaction id from the {@link
 * TransactionContext} (outermost or innermost open transaction) and turn a missing checkpoint into
 * an empty string. Which helper a backend uses decides whether nested work is reported against the
 * main or the current transaction.
 */
public abstract class TransactionalTracer implements Tracer {

  private final TransactionContext transactionContext;

  protected TransactionalTracer(TransactionContext transactionContext) {
    this.transactionContext = Objects.requireNonNull(transactionContext, "transactionContext");
  }

  /**
   * Resolves ids against the outermost open transaction.
   *
   * @param transactionId explicit transaction id, or null to use the main transaction
   * @param checkpointId checkpoint id, null or empty for none
   * @return normalised id pair, never holding null
   */
  protected final TraceIds resolveWithMain(String transactionId, String checkpointId) {
    if (transactionId == null) {
      transactionId = transactionContext.getMainTransactionId();
    }
    return new TraceIds(transactionId, normalizeCheckpoint(checkpointId));
  }

  /**
   * Resolves ids against the innermost open transaction.
   *
   * @param transactionId explicit transaction id, or null to use the current transaction
   * @param checkpointId checkpoint id, null or empty for none
   * @return normalised id pair, never holding null
   */
  protected final TraceIds resolveWithCurrent(String transactionId, String checkpointId) {
    if (transactionId == null) {
      transactionId = transactionContext.getTransactionId();
    }
    return new TraceIds(transactionId, normalizeCheckpoint(checkpointId));
  }

  private static String normalizeCheckpoint(String checkpointId) {
    return (checkpointId == null || checkpointId.isEmpty()) ? "" : checkpointId;
  }

  // ---- severity levels

  public abstract void info(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args);

  public abstract void debug(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args);

  public abstract void warning(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args);

  public abstract void error(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args);

  public abstract void critical(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args);

  // ---- error reporting

  /**
   * Reports a business-rule violation. Use {@link #techError} for infrastructure failures.
   *
   * @param payload description or data of the violation
   * @param transactionId transaction id, null to resolve from the context
   * @param checkpointId checkpoint where the violation was detected, may be null
   * @param extra supplementary context, may be null
   * @param args backend formatting arguments
   */
  public abstract void funcError(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args);

  /**
   * Reports an infrastructure or runtime failure.
   *
   * @param payload description or data of the failure
   * @param transactionId transaction id, null to resolve from the context
   * @param checkpointId checkpoint where the failure happened, may be null
   * @param error causing throwable, may be null
   * @param extra supplementary context, may be null
   * @param args backend formatting arguments
   */
  public abstract void techError(
      Object payload,
      String transactionId,
      String checkpointId,
      Throwable error,
      Map<String, ?> extra,
      Object... args);

  // ---- external call boundaries

  /** Marks the start of a call to an external system. */
  public abstract void reportStartExternal(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args);

  /** Marks the end of a call started with {@link #reportStartExternal}. */
  public abstract void reportEndExternal(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args);

  // ---- shorthand

  public final void info(Object payload) {
    info(payload, null, null, null);
  }

  public final void info(Object payload, String checkpointId) {
    info(payload, null, checkpointId, null);
  }

  public final void debug(Object payload) {
    debug(payload, null, null, null);
  }

  public final void debug(Object payload, String checkpointId) {
    debug(payload, null, checkpointId, null);
  }

  public final void warning(Object payload) {
    warning(payload, null, null, null);
  }

  public final void warning(Object payload, String checkpointId) {
    warning(payload, null, checkpointId, null);
  }

  public final void error(Object payload) {
    error(payload, null, null, null);
  }

  public final void error(Object payload, String checkpointId) {
    error(payload, null, checkpointId, null);
  }

  public final void critical(Object payload) {
    critical(payload, null, null, null);
  }

  public final void critical(Object payload, String checkpointId) {
    critical(payload, null, checkpointId, null);
  }

  public final void funcError(Object payload) {
    funcError(payload, null, null, null);
  }

  public final void funcError(Object payload, String checkpointId) {
    funcError(payload, null, checkpointId, null);
  }

  public final void techError(Object payload) {
    techError(payload, null, null, null, null);
  }

  public final void techError(Object payload, Throwable error) {
    techError(payload, null, null, error, null);
  }

  public final void reportStartExternal(Object payload) {
    reportStartExternal(payload, null, null, null);
  }

  public final void reportEndExternal(Object payload) {
    reportEndExternal(payload, null, null, null);
  }

  public final void reportStartExternal(Object payload, String checkpointId) {
    reportStartExternal(payload, null, checkpointId, null);
  }

  public final void reportEndExternal(Object payload, String checkpointId) {
    reportEndExternal(payload, null, checkpointId, null);
  }
}
