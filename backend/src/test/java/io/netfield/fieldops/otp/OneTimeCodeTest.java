package io.netfield.fieldops.otp;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class OneTimeCodeTest {

  private static final Instant NOW = Instant.parse("2026-01-10T08:00:00Z");

  private static OneTimeCode newCode(Instant expiresAt) {
    return new OneTimeCode("628123456789", CodePurpose.REGISTER, "h", expiresAt, NOW);
  }

  @Test
  void attempts_increment_per_call() {
    var code = newCode(NOW.plusSeconds(600));

    assertThat(code.registerAttempt()).isEqualTo(1);
    assertThat(code.registerAttempt()).isEqualTo(2);
    assertThat(code.getAttempts()).isEqualTo(2);
  }

  @Test
  void expired_at_exact_expiry_instant() {
    var expiresAt = NOW.plusSeconds(600);
    var code = newCode(expiresAt);

    assertThat(code.isExpired(expiresAt.minusMillis(1))).isFalse();
    assertThat(code.isExpired(expiresAt)).isTrue();
  }

  @Test
  void consumed_once_marked() {
    var code = newCode(NOW.plusSeconds(600));
    assertThat(code.isConsumed()).isFalse();

    code.markConsumed(NOW);

    assertThat(code.isConsumed()).isTrue();
    assertThat(code.getConsumedAt()).isEqualTo(NOW);
  }
}
