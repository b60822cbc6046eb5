package bisslog.tracing;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ServiceTracer 기본 오버로드")
class ServiceTracerTest {

  private final List<String> calls = new ArrayList<>();

  private final ServiceTracer tracer =
      new ServiceTracer() {
        @Override
        public boolean isEnabled(TraceLevel level) {
          return true;
        }

        @Override
        public void info(Object payload, String checkpointId, Map<String, ?> extra, Object... args) {
          capture("info", payload, checkpointId, extra, args);
        }

        @Override
        public void debug(Object payload, String checkpointId, Map<String, ?> extra, Object... args) {
          capture("debug", payload, checkpointId, extra, args);
        }

        @Override
        public void warning(
            Object payload, String checkpointId, Map<String, ?> extra, Object... args) {
          capture("warning", payload, checkpointId, extra, args);
        }

        @Override
        public void error(Object payload, String checkpointId, Map<String, ?> extra, Object... args) {
          capture("error", payload, checkpointId, extra, args);
        }

        @Override
        public void critical(
            Object payload, String checkpointId, Map<String, ?> extra, Object... args) {
          capture("critical", payload, checkpointId, extra, args);
        }
      };

  private void capture(
      String level, Object payload, String checkpointId, Map<String, ?> extra, Object[] args) {
    calls.add(level + "|" + payload + "|" + checkpointId + "|" + extra + "|" + args.length);
  }

  @Test
  void payloadOnlyDelegatesWithoutCheckpoint() {
    tracer.info("service started");
    tracer.debug("cache size 10");

    assertThat(calls)
        .containsExactly("info|service started|null|null|0", "debug|cache size 10|null|null|0");
  }

  @Test
  void checkpointIsForwarded() {
    tracer.warning("slow query", "load-orders");
    tracer.error("query failed", "load-orders");
    tracer.critical("cache unavailable", "warmup");

    assertThat(calls)
        .containsExactly(
            "warning|slow query|load-orders|null|0",
            "error|query failed|load-orders|null|0",
            "critical|cache unavailable|warmup|null|0");
  }
}
