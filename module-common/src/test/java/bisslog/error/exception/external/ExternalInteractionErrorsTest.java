package bisslog.error.exception.external;

import static org.assertj.core.api.Assertions.assertThat;

import bisslog.error.exception.marker.TransientFailureMarker;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExternalInteractionErrorsTest {

  @Test
  @DisplayName("Connection, Timeout, Delivery 만 일시적 장애로 표시된다")
  void transientMarkerIsOnOperationalLeaves() {
    assertThat(new ConnectionExtException("refused")).isInstanceOf(TransientFailureMarker.class);
    assertThat(new TimeoutExtException("read timed out")).isInstanceOf(TransientFailureMarker.class);
    assertThat(new DeliveryExtException("nack")).isInstanceOf(TransientFailureMarker.class);
    assertThat(new AuthenticationExtException("expired"))
        .isNotInstanceOf(TransientFailureMarker.class);
    assertThat(new ProgrammingErrorExtException("bad sql"))
        .isNotInstanceOf(TransientFailureMarker.class);
  }

  @Test
  @DisplayName("래핑된 TimeoutExtException 도 일시적 장애로 판정한다")
  void wrappedTimeoutIsTransient() {
    ExecutionException wrapped =
        new ExecutionException(new CompletionException(new TimeoutExtException("read timed out")));

    assertThat(ExternalInteractionErrors.isTransient(wrapped)).isTrue();
  }

  @Test
  void permanentFailureIsNotTransient() {
    assertThat(ExternalInteractionErrors.isTransient(new AuthorizationExtException("denied")))
        .isFalse();
    assertThat(ExternalInteractionErrors.isTransient(new IllegalStateException("local bug")))
        .isFalse();
    assertThat(ExternalInteractionErrors.isTransient(null)).isFalse();
  }

  @Test
  @DisplayName("cause 체인에서 가장 가까운 ExternalInteractionError 를 찾는다")
  void findsNearestExternalError() {
    InvalidDataExtException inner = new InvalidDataExtException("unexpected field");
    ProcessingExtException outer = new ProcessingExtException("could not map answer", inner);
    RuntimeException wrapper = new RuntimeException(outer);

    assertThat(ExternalInteractionErrors.find(wrapper)).containsSame(outer);
    assertThat(ExternalInteractionErrors.find(new RuntimeException("plain"))).isEmpty();
  }

  @Test
  @DisplayName("순환 cause 체인에서도 종료된다")
  void terminatesOnCyclicCauseChain() {
    RuntimeException first = new RuntimeException("first");
    RuntimeException second = new RuntimeException("second", first);
    first.initCause(second);

    assertThat(ExternalInteractionErrors.isTransient(first)).isFalse();
    assertThat(ExternalInteractionErrors.find(first)).isEmpty();
  }
}
