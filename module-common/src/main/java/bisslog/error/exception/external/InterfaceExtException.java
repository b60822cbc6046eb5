package bisslog.error.exception.external;

/** The integration itself is wrong: client setup, endpoint contract or adapter wiring. */
public sealed class InterfaceExtException extends ErrorExtException
    permits ConfigurationExtException {

  public InterfaceExtException(String message) {
    super(message);
  }

  public InterfaceExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
