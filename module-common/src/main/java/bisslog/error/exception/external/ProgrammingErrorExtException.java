package bisslog.error.exception.external;

/** The request was malformed: wrong query, unknown table, bad parameter count. */
public final class ProgrammingErrorExtException extends ExternalDependencyErrorExtException {

  public ProgrammingErrorExtException(String message) {
    super(message);
  }

  public ProgrammingErrorExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
