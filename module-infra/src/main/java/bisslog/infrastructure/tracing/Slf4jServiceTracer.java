package bisslog.infrastructure.tracing;

import bisslog.tracing.ServiceTracer;
import bisslog.tracing.TraceLevel;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * {@link ServiceTracer} writing to an SLF4J logger.
 *
 * <p>The checkpoint id is exposed as MDC key {@code checkpointId} while the entry is logged.
 */
public class Slf4jServiceTracer implements ServiceTracer {

  private final TraceEmitter emitter;
  private final TracePayloadRenderer renderer;

  public Slf4jServiceTracer(Logger logger, TracePayloadRenderer renderer) {
    this.emitter = new TraceEmitter(logger);
    this.renderer = Objects.requireNonNull(renderer, "renderer");
  }

  @Override
  public boolean isEnabled(TraceLevel level) {
    return emitter.isEnabled(level);
  }

  @Override
  public void info(Object payload, String checkpointId, Map<String, ?> extra, Object... args) {
    trace(TraceLevel.INFO, payload, checkpointId, extra, args);
  }

  @Override
  public void debug(Object payload, String checkpointId, Map<String, ?> extra, Object... args) {
    trace(TraceLevel.DEBUG, payload, checkpointId, extra, args);
  }

  @Override
  public void warning(Object payload, String checkpointId, Map<String, ?> extra, Object... args) {
    trace(TraceLevel.WARNING, payload, checkpointId, extra, args);
  }

  @Override
  public void error(Object payload, String checkpointId, Map<String, ?> extra, Object... args) {
    trace(TraceLevel.ERROR, payload, checkpointId, extra, args);
  }

  @Override
  public void critical(Object payload, String checkpointId, Map<String, ?> extra, Object... args) {
    trace(TraceLevel.CRITICAL, payload, checkpointId, extra, args);
  }

  private void trace(
      TraceLevel level, Object payload, String checkpointId, Map<String, ?> extra, Object[] args) {
    if (!emitter.isEnabled(level)) return;

    String message = renderer.render(payload, extra, args);
    try (TraceMdc ignored = TraceMdc.bindCheckpoint(checkpointId)) {
      emitter.emit(level, null, message, null);
    }
  }
}
