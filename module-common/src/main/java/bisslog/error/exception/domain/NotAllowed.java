package bisslog.error.exception.domain;

/** The operation is forbidden for the current actor or state. */
public final class NotAllowed extends DomainException {

  public NotAllowed(String keyname, String message) {
    super(keyname, message);
  }

  public NotAllowed(String keyname, String message, Throwable cause) {
    super(keyname, message, cause);
  }
}
