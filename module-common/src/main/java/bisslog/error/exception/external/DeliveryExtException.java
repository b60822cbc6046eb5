package bisslog.error.exception.external;

import bisslog.error.exception.marker.TransientFailureMarker;

/** A message could not be delivered to, or acknowledged by, the dependency. */
public final class DeliveryExtException extends OperationalErrorExtException
    implements TransientFailureMarker {

  public DeliveryExtException(String message) {
    super(message);
  }

  public DeliveryExtException(String message, Throwable cause) {
    super(message, cause);
  }
}
