package bisslog.error.exception.external;

/**
 * The external interaction failed.
 *
 * <p>Catch this to handle every failing exchange alike, regardless of whether the fault lies in the
 * integration, the dependency or the local processing of its answer.
 */
public sealed class ErrorExtException extends ExternalInteractionError
    permits InterfaceExtException, ExternalDependencyErrorExtException, InternalErrorExtException {

  public ErrorExtException(String message) {
    super(message);
  }

  public ErrorExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
