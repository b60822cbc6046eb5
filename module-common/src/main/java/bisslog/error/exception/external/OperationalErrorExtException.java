package bisslog.error.exception.external;

/**
 * The dependency could not operate: it was unreachable, slow, refused the caller or lost the
 * message. Not necessarily under the caller's control.
 */
public sealed class OperationalErrorExtException extends ExternalDependencyErrorExtException
    permits ConnectionExtException, TimeoutExtException, AuthenticationExtException,
        AuthorizationExtException, DeliveryExtException {

  public OperationalErrorExtException(String message) {
    super(message);
  }

  public OperationalErrorExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
