package bisslog.infrastructure.config;

import bisslog.infrastructure.tracing.Slf4jServiceTracer;
import bisslog.infrastructure.tracing.Slf4jTransactionalTracer;
import bisslog.infrastructure.tracing.TracePayloadRenderer;
import bisslog.tracing.ServiceTracer;
import bisslog.tracing.TransactionalTracer;
import bisslog.transactional.TransactionContext;
import bisslog.transactional.TransactionManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Exports the transaction context and the SLF4J tracer backends.
 *
 * <ul>
 *   <li>Every bean backs off when the application defines its own.
 *   <li>{@code bisslog.tracing.enabled=false} disables the whole configuration.
 *   <li>The application's {@link ObjectMapper} and {@link MeterRegistry} are reused when present.
 * </ul>
 */
@Slf4j
@AutoConfiguration
@ConditionalOnProperty(
    prefix = "bisslog.tracing",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
@EnableConfigurationProperties(TracingProperties.class)
public class TracingAutoConfiguration {

  // "transactionManager" 는 스프링 트랜잭션 빈 이름과 충돌하므로 사용하지 않음
  @Bean
  @ConditionalOnMissingBean(TransactionContext.class)
  public TransactionManager bisslogTransactionManager() {
    return new TransactionManager();
  }

  @Bean
  @ConditionalOnMissingBean
  public TracePayloadRenderer tracePayloadRenderer(ObjectProvider<ObjectMapper> objectMapper) {
    ObjectMapper mapper = objectMapper.getIfAvailable();
    return (mapper != null) ? new TracePayloadRenderer(mapper) : TracePayloadRenderer.withDefaults();
  }

  @Bean
  @ConditionalOnMissingBean
  public ServiceTracer serviceTracer(TracingProperties properties, TracePayloadRenderer renderer) {
    return new Slf4jServiceTracer(
        LoggerFactory.getLogger(properties.serviceLoggerName()), renderer);
  }

  @Bean
  @ConditionalOnMissingBean
  public TransactionalTracer transactionalTracer(
      TransactionContext transactionContext,
      TracingProperties properties,
      TracePayloadRenderer renderer,
      ObjectProvider<MeterRegistry> meterRegistry) {
    MeterRegistry registry = meterRegistry.getIfAvailable();
    if (registry == null) {
      log.debug("No MeterRegistry in context, tracer metrics stay local");
      registry = new SimpleMeterRegistry();
    }
    return new Slf4jTransactionalTracer(
        transactionContext,
        LoggerFactory.getLogger(properties.transactionalLoggerName()),
        renderer,
        registry,
        properties.externalSlowThresholdMs());
  }
}
