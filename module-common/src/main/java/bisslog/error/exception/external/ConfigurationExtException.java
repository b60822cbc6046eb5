package bisslog.error.exception.external;

/** The adapter is misconfigured (missing endpoint, bad credentials file, unknown region). */
public final class ConfigurationExtException extends InterfaceExtException {

  public ConfigurationExtException(String message) {
    super(message);
  }

  public ConfigurationExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
