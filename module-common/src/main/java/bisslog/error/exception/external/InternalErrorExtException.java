package bisslog.error.exception.external;

/** Failure on this side of the boundary while preparing a call or handling its answer. */
public sealed class InternalErrorExtException extends ErrorExtException
    permits ProcessingExtException {

  public InternalErrorExtException(String message) {
    super(message);
  }

  public InternalErrorExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
