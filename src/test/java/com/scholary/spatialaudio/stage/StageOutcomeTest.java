package com.scholary.spatialaudio.stage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class StageOutcomeTest {

  @Test
  void ok_shouldExposePayloadAndCacheHit() {
    StageOutcome<String> outcome = StageOutcome.ok("payload", true);

    assertThat(outcome.isOk()).isTrue();
    assertThat(outcome.payload()).isEqualTo("payload");
    assertThat(outcome.cacheHit()).isTrue();
    assertThat(outcome.errorKind()).isNull();
  }

  @Test
  void failed_shouldCarryKindAndRefusePayload() {
    StageOutcome<String> outcome =
        StageOutcome.failed(StageErrorKind.MALFORMED_RESPONSE, "missing words");

    assertThat(outcome.isOk()).isFalse();
    assertThat(outcome.errorKind()).isEqualTo(StageErrorKind.MALFORMED_RESPONSE);
    assertThat(outcome.errorMessage()).isEqualTo("missing words");
    assertThatThrownBy(outcome::payload).isInstanceOf(IllegalStateException.class);
  }
}
