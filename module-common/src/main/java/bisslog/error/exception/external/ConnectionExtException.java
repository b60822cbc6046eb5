package bisslog.error.exception.external;

import bisslog.error.exception.marker.TransientFailureMarker;

/** A connection to the dependency could not be opened or was dropped. */
public final class ConnectionExtException extends OperationalErrorExtException
    implements TransientFailureMarker {

  public ConnectionExtException(String message) {
    super(message);
  }

  public ConnectionExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
