package bisslog.error.exception.external;

/** The dependency rejected the data: value out of range, division by zero, truncation. */
public final class DataErrorExtException extends ExternalDependencyErrorExtException {

  public DataErrorExtException(String message) {
    super(message);
  }

  public DataErrorExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
