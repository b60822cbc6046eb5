package bisslog.error.exception.external;

/** The dependency's integrity constraints were violated (duplicate key, foreign key). */
public final class IntegrityErrorExtException extends ExternalDependencyErrorExtException {

  public IntegrityErrorExtException(String message) {
    super(message);
  }

  public IntegrityErrorExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
