package bisslog.tracing;

import java.util.Map;

/**
 * Severity-leveled tracing for service-level code that runs outside any transaction.
 *
 * <p>Every level has one abstract operation taking the full argument list; the shorter overloads
 * delegate to it with absent values. A backend therefore implements exactly five methods.
 *
 * <ul>
 *   <li>{@code payload}: message or structured data, opaque to the contract
 *   <li>{@code checkpointId}: named point of the workflow, may be null
 *   <li>{@code extra}: supplementary context, may be null
 *   <li>{@code args}: backend formatting arguments (for example {@code {}} placeholders)
 * </ul>
 */
public interface ServiceTracer extends Tracer {

  void info(Object payload, String checkpointId, Map<String, ?> extra, Object... args);

  void debug(Object payload, String checkpointId, Map<String, ?> extra, Object... args);

  void warning(Object payload, String checkpointId, Map<String, ?> extra, Object... args);

  void error(Object payload, String checkpointId, Map<String, ?> extra, Object... args);

  void critical(Object payload, String checkpointId, Map<String, ?> extra, Object... args);

  default void info(Object payload) {
    info(payload, null, null);
  }

  default void info(Object payload, String checkpointId) {
    info(payload, checkpointId, null);
  }

  default void debug(Object payload) {
    debug(payload, null, null);
  }

  default void debug(Object payload, String checkpointId) {
    debug(payload, checkpointId, null);
  }

  default void warning(Object payload) {
    warning(payload, null, null);
  }

  default void warning(Object payload, String checkpointId) {
    warning(payload, checkpointId, null);
  }

  default void error(Object payload) {
    error(payload, null, null);
  }

  default void error(Object payload, String checkpointId) {
    error(payload, checkpointId, null);
  }

  default void critical(Object payload) {
    critical(payload, null, null);
  }

  default void critical(Object payload, String checkpointId) {
    critical(payload, checkpointId, null);
  }
}
