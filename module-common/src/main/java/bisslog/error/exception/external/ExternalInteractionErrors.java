package bisslog.error.exception.external;

import bisslog.error.exception.marker.TransientFailureMarker;
import java.util.Optional;

/**
 * Classification helpers for {@link ExternalInteractionError}.
 *
 * <p>Wrapped failures (for example an {@code ExecutionException} around a {@link
 * TimeoutExtException}) are inspected through their cause chain.
 */
public final class ExternalInteractionErrors {

  // 순환 참조 cause 체인 방지
  private static final int MAX_CAUSE_DEPTH = 32;

  /**
   * Whether the throwable, or any of its causes, is marked as a transient external failure.
   *
   * @param throwable failure to inspect, may be null
   * @return true when a {@link TransientFailureMarker} is found in the cause chain
   */
  public static boolean isTransient(Throwable throwable) {
    Throwable current = throwable;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (current instanceof TransientFailureMarker) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  /**
   * First {@link ExternalInteractionError} in the cause chain.
   *
   * @param throwable failure to inspect, may be null
   * @return the nearest external interaction error, or empty when none is found
   */
  public static Optional<ExternalInteractionError> find(Throwable throwable) {
    Throwable current = throwable;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (current instanceof ExternalInteractionError error) {
        return Optional.of(error);
      }
      current = current.getCause();
    }
    return Optional.empty();
  }

  private ExternalInteractionErrors() {
    // Utility class
  }
}
