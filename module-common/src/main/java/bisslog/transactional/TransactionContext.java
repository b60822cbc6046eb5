package bisslog.transactional;

/**
 * Read access to the transactions active for the caller.
 *
 * <p>"Main" is the outermost open transaction, "current" the innermost. With a single open
 * transaction both are the same id. Tracers only query this interface; opening and closing
 * transactions belongs to the code that owns the unit of work.
 */
public interface TransactionContext {

  /**
   * @return id of the outermost open transaction, or an empty string when none is open
   */
  String getMainTransactionId();

  /**
   * @return id of the innermost open transaction, or an empty string when none is open
   */
  String getTransactionId();
}
