package bisslog.error.exception.external;

import bisslog.error.exception.marker.TransientFailureMarker;

/** The dependency did not answer in time. */
public final class TimeoutExtException extends OperationalErrorExtException
    implements TransientFailureMarker {

  public TimeoutExtException(String message) {
    super(message);
  }

  public TimeoutExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
