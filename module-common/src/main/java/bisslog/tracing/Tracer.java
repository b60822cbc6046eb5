package bisslog.tracing;

/**
 * Root tracing capability shared by {@link ServiceTracer} and {@link TransactionalTracer}.
 *
 * <p>Backends (console, file, remote collector, no-op) implement one of the specialisations; this
 * interface only lets callers skip building expensive payloads for disabled levels.
 */
public interface Tracer {

  /**
   * @param level severity about to be traced
   * @return whether entries of this level reach the backend's output
   */
  boolean isEnabled(TraceLevel level);
}
