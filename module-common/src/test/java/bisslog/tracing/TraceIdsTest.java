package bisslog.tracing;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void nullComponentsBecomeEmpty() {
    TraceIds ids = new TraceIds(null, null);

    assertThat(ids.transactionId()).isEmpty();
    assertThat(ids.checkpointId()).isEmpty();
    assertThat(ids.hasCheckpoint()).isFalse();
    assertThat(ids).isEqualTo(TraceIds.EMPTY);
  }

  @Test
  void keepsGivenValues() {
    TraceIds ids = TraceIds.of("tx-1", "payment-authorised");

    assertThat(ids.transactionId()).isEqualTo("tx-1");
    assertThat(ids.checkpointId()).isEqualTo("payment-authorised");
    assertThat(ids.hasCheckpoint()).isTrue();
  }
}
