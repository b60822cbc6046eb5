package bisslog.tracing;

/** Severity of a trace entry, lowest first. */
public enum TraceLevel {
  DEBUG,
  INFO,
  WARNING,
  ERROR,
  CRITICAL
}
