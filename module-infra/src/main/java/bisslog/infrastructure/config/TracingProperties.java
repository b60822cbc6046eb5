package bisslog.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tracing Properties
 *
 * <h2>설정</h2>
 *
 * <pre>{@code
 * bisslog:
 *   tracing:
 *     enabled: true                                # 기본값: true
 *     service-logger-name: bisslog.service         # ServiceTracer 출력 로거
 *     transactional-logger-name: bisslog.transactional
 *     external-slow-threshold-ms: 1000             # 0 이하: SLOW 승격 비활성
 * }</pre>
 *
 * @see TracingAutoConfiguration
 */
@ConfigurationProperties(prefix = "bisslog.tracing")
public record TracingProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("bisslog.service") String serviceLoggerName,
    @DefaultValue("bisslog.transactional") String transactionalLoggerName,
    @DefaultValue("1000") long externalSlowThresholdMs) {

  public TracingProperties {
    if (serviceLoggerName == null || serviceLoggerName.isBlank()) {
      throw new IllegalArgumentException("bisslog.tracing.service-logger-name must not be blank");
    }
    if (transactionalLoggerName == null || transactionalLoggerName.isBlank()) {
      throw new IllegalArgumentException(
          "bisslog.tracing.transactional-logger-name must not be blank");
    }
  }
}
