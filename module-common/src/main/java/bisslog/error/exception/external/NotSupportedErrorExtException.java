package bisslog.error.exception.external;

/** The dependency does not support the requested operation or API. */
public final class NotSupportedErrorExtException extends ExternalDependencyErrorExtException {

  public NotSupportedErrorExtException(String message) {
    super(message);
  }

  public NotSupportedErrorExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
