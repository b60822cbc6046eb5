package bisslog.error.exception.external;

/**
 * Root of the failures that originate from calling an external system (network, database,
 * third-party service).
 *
 * <p>The tree carries no fields beyond the message and cause; the category is the concrete type.
 * Handlers catch the most specific type they need, and the intermediate nodes ({@link
 * ErrorExtException}, {@link ExternalDependencyErrorExtException}, {@link
 * OperationalErrorExtException}) let them opt into coarser recovery:
 *
 * <pre>
 * try {
 *   gateway.charge(order);
 * } catch (TimeoutExtException | ConnectionExtException e) {
 *   // transient
 * } catch (OperationalErrorExtException e) {
 *   // auth / delivery
 * } catch (ExternalInteractionError e) {
 *   // anything else from the boundary
 * }
 * </pre>
 *
 * <p>The hierarchy is sealed: the set of categories is fixed at compile time.
 */
public sealed class ExternalInteractionError extends RuntimeException
    permits WarningExtException, ErrorExtException {

  public ExternalInteractionError(String message) {
    super(message);
  }

  public ExternalInteractionError(String message, Throwable cause) {
    super(message, cause);
  }
}
