package bisslog.infrastructure.tracing;

import bisslog.tracing.TraceLevel;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.Marker;

/** Maps {@link TraceLevel} onto an SLF4J logger. CRITICAL has no SLF4J level and logs at ERROR. */
final class TraceEmitter {

  private final Logger logger;

  TraceEmitter(Logger logger) {
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  boolean isEnabled(TraceLevel level) {
    return switch (level) {
      case DEBUG -> logger.isDebugEnabled();
      case INFO -> logger.isInfoEnabled();
      case WARNING -> logger.isWarnEnabled();
      case ERROR, CRITICAL -> logger.isErrorEnabled();
    };
  }

  void emit(TraceLevel level, Marker marker, String message, Throwable error) {
    switch (level) {
      case DEBUG -> logger.debug(marker, message, error);
      case INFO -> logger.info(marker, message, error);
      case WARNING -> logger.warn(marker, message, error);
      case ERROR -> logger.error(marker, message, error);
      case CRITICAL -> logger.error(marker == null ? TraceMarkers.CRITICAL : marker, message, error);
    }
  }
}
