package bisslog.infrastructure.tracing;

import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * SLF4J markers attached by the tracer backends, so appenders and filters can route entries that
 * plain SLF4J levels cannot tell apart.
 */
public final class TraceMarkers {

  /** {@code critical} entries, logged at ERROR. */
  public static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

  /** Business-rule violations reported with {@code funcError}. */
  public static final Marker FUNC_ERROR = MarkerFactory.getMarker("FUNC_ERROR");

  /** Infrastructure failures reported with {@code techError}. */
  public static final Marker TECH_ERROR = MarkerFactory.getMarker("TECH_ERROR");

  /** External call boundaries. */
  public static final Marker EXTERNAL = MarkerFactory.getMarker("EXTERNAL");

  private TraceMarkers() {}
}
