package bisslog.error.exception.marker;

/**
 * Marks external-interaction failures that may succeed when attempted again (connection drops,
 * timeouts, undelivered messages).
 *
 * <p>Classification only: nothing in this library re-attempts a call. Callers that own a retry
 * policy test for this marker instead of enumerating leaf types.
 *
 * @see bisslog.error.exception.external.ExternalInteractionErrors#isTransient(Throwable)
 */
public interface TransientFailureMarker {}
