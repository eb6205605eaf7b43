package com.codeheadsystems.sessionkey.model;

import static com.codeheadsystems.sessionkey.testing.SessionKeys.CONTRACT;
import static com.codeheadsystems.sessionkey.testing.SessionKeys.METHOD;
import static com.codeheadsystems.sessionkey.testing.SessionKeys.NOW;
import static com.codeheadsystems.sessionkey.testing.SessionKeys.amount;
import static com.codeheadsystems.sessionkey.testing.SessionKeys.config;
import static com.codeheadsystems.sessionkey.testing.SessionKeys.state;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * The type Session key model test.
 */
class SessionKeyModelTest {

  @Test
  void tier_highValueRequiresConfirmation() {
    SessionKeyConfig config = SessionKeyTier.HIGH_VALUE.toConfig(NOW, Duration.ofHours(1), Set.of(CONTRACT));

    assertThat(config.requireUserConfirmation()).isTrue();
    assertThat(config.emergencyRevocation()).isTrue();
    assertThat(config.maxTransactionCount()).isEqualTo(5);
    assertThat(config.maxDailyAmount()).isEqualTo(new BigInteger("100000000000000000000000"));
    assertThat(SessionKeyTier.MICRO.maxTransactionAmount()).isEqualTo(BigInteger.TEN.pow(18));
  }

  @Test
  void tier_fromName_caseInsensitive() {
    assertThat(SessionKeyTier.fromName("high_value")).isEqualTo(SessionKeyTier.HIGH_VALUE);
    assertThatThrownBy(() -> SessionKeyTier.fromName("mega")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void limits_remainingClampedAtZero() {
    SessionKeyLimits limits = SessionKeyLimits.denied(DenialReason.DAILY_AMOUNT_LIMIT_EXCEEDED,
        new DailyTotals(amount(300), 5), config(100, 250, 3));

    assertThat(limits.remainingDailyAmount()).isZero();
    assertThat(limits.remainingTransactionCount()).isZero();
    assertThat(limits.denialReason()).contains(DenialReason.DAILY_AMOUNT_LIMIT_EXCEEDED);
  }

  @Test
  void denialReason_categories() {
    assertThat(DenialReason.EXPIRED.category()).isEqualTo(DenialReason.Category.CREDENTIAL);
    assertThat(DenialReason.METHOD_NOT_ALLOWED.category()).isEqualTo(DenialReason.Category.SCOPE);
    assertThat(DenialReason.DAILY_COUNT_LIMIT_EXCEEDED.category()).isEqualTo(DenialReason.Category.QUOTA);
  }

  @Test
  void proposedAction_rejectsNegativeAmountAndCopiesPayload() {
    assertThatThrownBy(() -> ProposedAction.of(CONTRACT, METHOD, BigInteger.valueOf(-1)))
        .isInstanceOf(IllegalArgumentException.class);
    byte[] payload = {1, 2};
    ProposedAction action = new ProposedAction(CONTRACT, METHOD, BigInteger.ONE, payload, null);
    payload[0] = 9;

    assertThat(action.payload()).containsExactly(1, 2);
    assertThat(action.gasLimit()).isZero();
  }

  @Test
  void state_revokedStaysRevokedThroughExpiry() {
    SessionKeyState revoked = state("sk_1", config(1, 1, 1)).revoke(NOW, "r").deactivate();

    assertThat(revoked.revoked()).isTrue();
    assertThat(revoked.statusAt(NOW.plus(Duration.ofDays(5)))).isEqualTo(SessionKeyStatus.REVOKED);
  }

  @Test
  void state_withoutUnknownReservation_returnsSameSnapshot() {
    SessionKeyState state = state("sk_1", config(1, 1, 1));

    assertThat(state.withoutReservation("nope")).isSameAs(state);
  }

  @Test
  void config_contractsNormalized() {
    SessionKeyConfig config = config(1, 1, 1);

    assertThat(config.allowsContract(CONTRACT.toUpperCase().replace("0X", "0x"))).isTrue();
    assertThat(config.allowsContract(" ")).isFalse();
    assertThat(config.allowsMethod("Transfer")).isFalse();
  }
}
