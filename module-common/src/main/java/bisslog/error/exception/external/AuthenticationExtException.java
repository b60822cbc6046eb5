package bisslog.error.exception.external;

/** The dependency did not accept the caller's identity. */
public final class AuthenticationExtException extends OperationalErrorExtException {

  public AuthenticationExtException(String message) {
    super(message);
  }

  public AuthenticationExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
