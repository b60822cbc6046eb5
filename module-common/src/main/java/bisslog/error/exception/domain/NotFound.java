package bisslog.error.exception.domain;

/** The requested subject does not exist. */
public final class NotFound extends DomainException {

  public NotFound(String keyname, String message) {
    super(keyname, message);
  }

  public NotFound(String keyname, String message, Throwable cause) {
    super(keyname, message, cause);
  }
}
