package bisslog.infrastructure.tracing;

/**
 * 트레이서 로그 태그 상수
 *
 * <p>같은 패키지의 백엔드에서만 사용합니다.
 */
final class TraceLogTags {

  /** 기능(비즈니스) 오류 */
  static final String TAG_FUNC_ERROR = "[Trace:FUNC_ERROR]";

  /** 기술(인프라) 오류 */
  static final String TAG_TECH_ERROR = "[Trace:TECH_ERROR]";

  /** 외부 호출 시작 */
  static final String TAG_EXTERNAL_START = "[External:START]";

  /** 외부 호출 종료 */
  static final String TAG_EXTERNAL_END = "[External:END]";

  /** 외부 호출 종료 (임계치 초과) */
  static final String TAG_EXTERNAL_SLOW = "[External:SLOW]";

  private TraceLogTags() {}
}
