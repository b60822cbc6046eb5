package bisslog.error.exception.external;

/** The external system answered, but flagged the exchange with a warning. */
public final class WarningExtException extends ExternalInteractionError {

  public WarningExtException(String message) {
    super(message);
  }

  public WarningExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
