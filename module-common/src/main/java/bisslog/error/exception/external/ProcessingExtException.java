package bisslog.error.exception.external;

/** The answer of an external call could not be processed locally. */
public final class ProcessingExtException extends InternalErrorExtException {

  public ProcessingExtException(String message) {
    super(message);
  }

  public ProcessingExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
