package bisslog.error.exception.external;

/** The dependency answered with data that cannot be interpreted. */
public final class InvalidDataExtException extends ExternalDependencyErrorExtException {

  public InvalidDataExtException(String message) {
    super(message);
  }

  public InvalidDataExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
