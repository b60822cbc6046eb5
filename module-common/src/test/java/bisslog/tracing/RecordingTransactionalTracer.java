package bisslog.tracing;

import bisslog.transactional.TransactionContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/** Test backend that keeps the raw arguments of every call. */
class RecordingTransactionalTracer extends TransactionalTracer {

  record Call(
      String operation,
      Object payload,
      String transactionId,
      String checkpointId,
      Throwable error,
      Map<String, ?> extra,
      List<Object> args) {}

  final List<Call> calls = new ArrayList<>();

  RecordingTransactionalTracer(TransactionContext transactionContext) {
    super(transactionContext);
  }

  TraceIds main(String transactionId, String checkpointId) {
    return resolveWithMain(transactionId, checkpointId);
  }

  TraceIds current(String transactionId, String checkpointId) {
    return resolveWithCurrent(transactionId, checkpointId);
  }

  Call lastCall() {
    return calls.get(calls.size() - 1);
  }

  private void capture(
      String operation,
      Object payload,
      String transactionId,
      String checkpointId,
      Throwable error,
      Map<String, ?> extra,
      Object... args) {
    calls.add(
        new Call(operation, payload, transactionId, checkpointId, error, extra, Arrays.asList(args)));
  }

  @Override
  public boolean isEnabled(TraceLevel level) {
    return true;
  }

  @Override
  public void info(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args) {
    capture("info", payload, transactionId, checkpointId, null, extra, args);
  }

  @Override
  public void debug(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args) {
    capture("debug", payload, transactionId, checkpointId, null, extra, args);
  }

  @Override
  public void warning(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args) {
    capture("warning", payload, transactionId, checkpointId, null, extra, args);
  }

  @Override
  public void error(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args) {
    capture("error", payload, transactionId, checkpointId, null, extra, args);
  }

  @Override
  public void critical(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args) {
    capture("critical", payload, transactionId, checkpointId, null, extra, args);
  }

  @Override
  public void funcError(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args) {
    capture("funcError", payload, transactionId, checkpointId, null, extra, args);
  }

  @Override
  public void techError(
      Object payload,
      String transactionId,
      String checkpointId,
      Throwable error,
      Map<String, ?> extra,
      Object... args) {
    capture("techError", payload, transactionId, checkpointId, error, extra, args);
  }

  @Override
  public void reportStartExternal(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args) {
    capture("reportStartExternal", payload, transactionId, checkpointId, null, extra, args);
  }

  @Override
  public void reportEndExternal(
      Object payload, String transactionId, String checkpointId, Map<String, ?> extra, Object... args) {
    capture("reportEndExternal", payload, transactionId, checkpointId, null, extra, args);
  }
}
