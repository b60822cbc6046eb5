package bisslog.infrastructure.tracing;

import static bisslog.infrastructure.tracing.TraceLogTags.*;

import bisslog.tracing.TraceIds;
import bisslog.tracing.TraceLevel;
import bisslog.tracing.TransactionalTracer;
import bisslog.transactional.TransactionContext;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.Marker;

/**
 * {@link TransactionalTracer} writing to an SLF4J logger.
 *
 * <h3>Id resolution</h3>
 *
 * <ul>
 *   <li>severity levels and external boundaries: current (innermost) transaction
 *   <li>{@code funcError} / {@code techError}: main (outermost) transaction
 * </ul>
 *
 * <p>Resolved ids are exposed as MDC keys {@code transactionId} and {@code checkpointId} while the
 * entry is logged.
 *
 * <h3>External calls</h3>
 *
 * <p>{@code reportStartExternal} queues a start time under the resolved (transaction, checkpoint)
 * pair; {@code reportEndExternal} pairs with the oldest queued start of that pair, logs the elapsed
 * time and records it in timer {@value #EXTERNAL_TIMER}. Ends slower than the threshold are
 * promoted to WARN. Starts that never see an end expire after {@link #PENDING_EXTERNAL_TTL}.
 *
 * <h3>Metrics</h3>
 *
 * <ul>
 *   <li>{@value #ERROR_COUNTER}{type=functional|technical}
 *   <li>{@value #EXTERNAL_TIMER}{checkpoint=...}
 * </ul>
 */
@Slf4j
public class Slf4jTransactionalTracer extends TransactionalTracer {

  public static final String ERROR_COUNTER = "bisslog.trace.errors";
  public static final String EXTERNAL_TIMER = "bisslog.external.calls";

  private static final long MAX_SLOW_MS = 60_000L;
  static final Duration PENDING_EXTERNAL_TTL = Duration.ofMinutes(5);
  static final int MAX_PENDING_PAIRS = 10_000;
  static final int MAX_STARTS_PER_PAIR = 64;
  private static final String NO_CHECKPOINT_TAG = "none";

  private final TraceEmitter emitter;
  private final TracePayloadRenderer renderer;
  private final MeterRegistry meterRegistry;
  private final LongSupplier nanoClock;
  private final Counter functionalErrors;
  private final Counter technicalErrors;
  private final boolean slowEnabled;
  private final long slowThresholdMs;
  private final long slowThresholdNanos;
  private final long pendingTtlNanos = PENDING_EXTERNAL_TTL.toNanos();
  private final Cache<TraceIds, Deque<Long>> pendingExternal;

  public Slf4jTransactionalTracer(
      TransactionContext transactionContext,
      Logger logger,
      TracePayloadRenderer renderer,
      MeterRegistry meterRegistry,
      long externalSlowThresholdMs) {
    this(
        transactionContext,
        logger,
        renderer,
        meterRegistry,
        externalSlowThresholdMs,
        System::nanoTime);
  }

  Slf4jTransactionalTracer(
      TransactionContext transactionContext,
      Logger logger,
      TracePayloadRenderer renderer,
      MeterRegistry meterRegistry,
      long externalSlowThresholdMs,
      LongSupplier nanoClock) {
    super(transactionContext);
    this.emitter = new TraceEmitter(logger);
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    this.functionalErrors = errorCounter("functional");
    this.technicalErrors = errorCounter("technical");

    // 음수는 0(비활성), 과도한 값은 상한으로 클램프
    long clamped = Math.max(0L, Math.min(externalSlowThresholdMs, MAX_SLOW_MS));
    this.slowThresholdMs = clamped;
    this.slowEnabled = clamped > 0;
    this.slowThresholdNanos = slowEnabled ? TimeUnit.MILLISECONDS.toNanos(clamped) : Long.MAX_VALUE;

    this.pendingExternal =
        Caffeine.newBuilder()
            .ticker(nanoClock::getAsLong)
            .executor(Runnable::run)
            .expireAfterWrite(PENDING_EXTERNAL_TTL)
            .maximumSize(MAX_PENDING_PAIRS)
            .build();
  }

  private Counter errorCounter(String type) {
    return Counter.builder(ERROR_COUNTER)
        .description("Errors reported through the transactional tracer")
        .tag("type", type)
        .register(meterRegistry);
  }

  @Override
  public boolean isEnabled(TraceLevel level) {
    return emitter.isEnabled(level);
  }

  @Override
  public void info(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args) {
    trace(TraceLevel.INFO, resolveWithCurrent(transactionId, checkpointId), payload, extra, args);
  }

  @Override
  public void debug(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args) {
    trace(TraceLevel.DEBUG, resolveWithCurrent(transactionId, checkpointId), payload, extra, args);
  }

  @Override
  public void warning(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args) {
    trace(TraceLevel.WARNING, resolveWithCurrent(transactionId, checkpointId), payload, extra, args);
  }

  @Override
  public void error(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args) {
    trace(TraceLevel.ERROR, resolveWithCurrent(transactionId, checkpointId), payload, extra, args);
  }

  @Override
  public void critical(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args) {
    trace(TraceLevel.CRITICAL, resolveWithCurrent(transactionId, checkpointId), payload, extra, args);
  }

  @Override
  public void funcError(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args) {
    functionalErrors.increment();
    if (!emitter.isEnabled(TraceLevel.ERROR)) return;

    TraceIds ids = resolveWithMain(transactionId, checkpointId);
    String message = TAG_FUNC_ERROR + " " + renderer.render(payload, extra, args);
    emit(TraceLevel.ERROR, TraceMarkers.FUNC_ERROR, ids, message, null);
  }

  @Override
  public void techError(
      Object payload,
      String transactionId,
      String checkpointId,
      Throwable error,
      Map<String, ?> extra,
      Object... args) {
    technicalErrors.increment();
    if (!emitter.isEnabled(TraceLevel.ERROR)) return;

    TraceIds ids = resolveWithMain(transactionId, checkpointId);
    String errorType = (error != null) ? error.getClass().getSimpleName() : "none";
    String message =
        TAG_TECH_ERROR + " " + renderer.render(payload, extra, args) + ", errorType=" + errorType;
    emit(TraceLevel.ERROR, TraceMarkers.TECH_ERROR, ids, message, error);
  }

  @Override
  public void reportStartExternal(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args) {
    TraceIds ids = resolveWithCurrent(transactionId, checkpointId);
    rememberStart(ids);
    if (!emitter.isEnabled(TraceLevel.INFO)) return;

    String message = TAG_EXTERNAL_START + " " + renderer.render(payload, extra, args);
    emit(TraceLevel.INFO, TraceMarkers.EXTERNAL, ids, message, null);
  }

  @Override
  public void reportEndExternal(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args) {
    TraceIds ids = resolveWithCurrent(transactionId, checkpointId);
    Long startedAt = takeStart(ids);

    if (startedAt == null) {
      if (!emitter.isEnabled(TraceLevel.INFO)) return;
      String message = TAG_EXTERNAL_END + " " + renderer.render(payload, extra, args);
      emit(TraceLevel.INFO, TraceMarkers.EXTERNAL, ids, message, null);
      return;
    }

    long elapsedNanos = Math.max(0L, nanoClock.getAsLong() - startedAt);
    externalTimer(ids).record(elapsedNanos, TimeUnit.NANOSECONDS);

    boolean slow = slowEnabled && elapsedNanos >= slowThresholdNanos;
    TraceLevel level = slow ? TraceLevel.WARNING : TraceLevel.INFO;
    if (!emitter.isEnabled(level)) return;

    String rendered = renderer.render(payload, extra, args);
    String elapsed = formatDuration(elapsedNanos);
    String message =
        slow
            ? TAG_EXTERNAL_SLOW
                + " "
                + rendered
                + ", elapsed="
                + elapsed
                + ", threshold="
                + slowThresholdMs
                + "ms"
            : TAG_EXTERNAL_END + " " + rendered + ", elapsed=" + elapsed;
    emit(level, TraceMarkers.EXTERNAL, ids, message, null);
  }

  /** Number of external calls started, not yet ended and not expired. */
  public int pendingExternalCalls() {
    pendingExternal.cleanUp();
    return pendingExternal.asMap().values().stream().mapToInt(Deque::size).sum();
  }

  private void rememberStart(TraceIds ids) {
    long now = nanoClock.getAsLong();
    pendingExternal
        .asMap()
        .compute(
            ids,
            (key, starts) -> {
              Deque<Long> queue = (starts == null) ? new ArrayDeque<>() : starts;
              if (queue.size() >= MAX_STARTS_PER_PAIR) {
                queue.pollFirst();
                log.debug("Too many open external calls for {}, oldest start dropped", key);
              }
              queue.addLast(now);
              return queue;
            });
  }

  // 가장 오래된 유효 start 와 짝을 맞춘다. TTL 을 넘긴 start 는 버린다
  private Long takeStart(TraceIds ids) {
    long now = nanoClock.getAsLong();
    Long[] taken = new Long[1];
    pendingExternal
        .asMap()
        .computeIfPresent(
            ids,
            (key, starts) -> {
              Long startedAt;
              while ((startedAt = starts.pollFirst()) != null) {
                if (now - startedAt < pendingTtlNanos) {
                  taken[0] = startedAt;
                  break;
                }
              }
              return starts.isEmpty() ? null : starts;
            });
    return taken[0];
  }

  private Timer externalTimer(TraceIds ids) {
    String checkpoint = ids.hasCheckpoint() ? ids.checkpointId() : NO_CHECKPOINT_TAG;
    return Timer.builder(EXTERNAL_TIMER)
        .description("Duration of external calls bracketed by the transactional tracer")
        .tag("checkpoint", checkpoint)
        .register(meterRegistry);
  }

  private void trace(
      TraceLevel level, TraceIds ids, Object payload, Map<String, ?> extra, Object[] args) {
    if (!emitter.isEnabled(level)) return;
    emit(level, null, ids, renderer.render(payload, extra, args), null);
  }

  private void emit(TraceLevel level, Marker marker, TraceIds ids, String message, Throwable error) {
    try (TraceMdc ignored = TraceMdc.bind(ids)) {
      emitter.emit(level, marker, message, error);
    }
  }

  private static String formatDuration(long elapsedNanos) {
    double millis = elapsedNanos / 1_000_000d;
    return String.format(Locale.ROOT, "%.3fms", millis);
  }
}
