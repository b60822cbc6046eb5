package bisslog.error.exception.external;

/** The caller is known to the dependency but lacks permission for the operation. */
public final class AuthorizationExtException extends OperationalErrorExtException {

  public AuthorizationExtException(String message) {
    super(message);
  }

  public AuthorizationExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
