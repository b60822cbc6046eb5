package bisslog.infrastructure.config;

import static org.assertj.core.api.Assertions.assertThat;

import bisslog.infrastructure.tracing.Slf4jServiceTracer;
import bisslog.infrastructure.tracing.Slf4jTransactionalTracer;
import bisslog.infrastructure.tracing.TracePayloadRenderer;
import bisslog.tracing.ServiceTracer;
import bisslog.tracing.TransactionalTracer;
import bisslog.transactional.TransactionContext;
import bisslog.transactional.TransactionManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

/**
 * TracingAutoConfiguration Test.
 *
 * <h3>Test Coverage</h3>
 *
 * <ul>
 *   <li>TransactionManager, ServiceTracer, TransactionalTracer beans auto-exported
 *   <li>Conditional activation via bisslog.tracing.enabled
 *   <li>User-defined beans take precedence
 * </ul>
 */
class TracingAutoConfigurationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(TracingAutoConfiguration.class));

  @Test
  @DisplayName("기본 빈이 등록된다")
  void beansAutoConfigured() {
    contextRunner.run(
        context -> {
          assertThat(context).hasSingleBean(TransactionManager.class);
          assertThat(context).hasSingleBean(TracePayloadRenderer.class);
          assertThat(context).getBean(ServiceTracer.class).isInstanceOf(Slf4jServiceTracer.class);
          assertThat(context)
              .getBean(TransactionalTracer.class)
              .isInstanceOf(Slf4jTransactionalTracer.class);
          assertThat(context.getBean(TracingProperties.class).externalSlowThresholdMs())
              .isEqualTo(1000L);
        });
  }

  @Test
  @DisplayName("bisslog.tracing.enabled=false 이면 등록하지 않는다")
  void disabledByProperty() {
    contextRunner
        .withPropertyValues("bisslog.tracing.enabled=false")
        .run(
            context -> {
              assertThat(context).doesNotHaveBean(TransactionalTracer.class);
              assertThat(context).doesNotHaveBean(ServiceTracer.class);
              assertThat(context).doesNotHaveBean(TransactionManager.class);
            });
  }

  @Test
  @DisplayName("사용자 TransactionContext 가 있으면 TransactionManager 를 만들지 않는다")
  void customTransactionContextWins() {
    TransactionContext fixed =
        new TransactionContext() {
          @Override
          public String getMainTransactionId() {
            return "tx-main";
          }

          @Override
          public String getTransactionId() {
            return "tx-current";
          }
        };

    contextRunner
        .withBean(TransactionContext.class, () -> fixed)
        .run(
            context -> {
              assertThat(context).doesNotHaveBean(TransactionManager.class);
              assertThat(context).hasSingleBean(TransactionalTracer.class);
            });
  }

  @Test
  @DisplayName("컨텍스트의 MeterRegistry 에 메트릭을 등록한다")
  void usesContextMeterRegistry() {
    contextRunner
        .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
        .run(
            context -> {
              context.getBean(TransactionalTracer.class).funcError("rule violated");

              assertThat(
                      context
                          .getBean(MeterRegistry.class)
                          .get(Slf4jTransactionalTracer.ERROR_COUNTER)
                          .tag("type", "functional")
                          .counter()
                          .count())
                  .isEqualTo(1.0);
            });
  }

  @Test
  @DisplayName("빈 로거 이름은 기동을 실패시킨다")
  void blankLoggerNameFailsStartup() {
    contextRunner
        .withPropertyValues("bisslog.tracing.transactional-logger-name= ")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void propertiesAreBound() {
    contextRunner
        .withPropertyValues(
            "bisslog.tracing.service-logger-name=app.service",
            "bisslog.tracing.external-slow-threshold-ms=250")
        .run(
            context -> {
              TracingProperties properties = context.getBean(TracingProperties.class);
              assertThat(properties.serviceLoggerName()).isEqualTo("app.service");
              assertThat(properties.transactionalLoggerName()).isEqualTo("bisslog.transactional");
              assertThat(properties.externalSlowThresholdMs()).isEqualTo(250L);
            });
  }
}
