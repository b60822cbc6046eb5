package bisslog.tracing;

/**
 * Transaction and checkpoint id pair handed to a tracer backend.
 *
 * <p>Both components are never null: a missing value is stored as an empty string.
 *
 * @param transactionId logical unit of work the entry belongs to
 * @param checkpointId named point of the workflow, empty when none was given
 */
public record TraceIds(String transactionId, String checkpointId) {

  public static final TraceIds EMPTY = new TraceIds("", "");

  public TraceIds {
    if (transactionId == null) {
      transactionId = "";
    }
    if (checkpointId == null) {
      checkpointId = "";
    }
  }

  public static TraceIds of(String transactionId, String checkpointId) {
    return new TraceIds(transactionId, checkpointId);
  }

  public boolean hasCheckpoint() {
    return !checkpointId.isEmpty();
  }
}
