/*
 * どこで: Password expiry 期限計算のユニットテスト
 * 何を: 基準日の選択/無期限ポリシー/ハイブリッド上書き/切り上げを検証する
 * なぜ: 誤った期限判定で通知漏れや誤通知が起きないようにするため
 */
package com.example.password_expiry.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.password_expiry.model.DirectoryUser;
import com.example.password_expiry.model.ExpiryState;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ExpiryCalculatorTest {

  private static final Instant NOW = Instant.parse("2024-03-31T00:00:00Z");
  private static final String NEVER_EXPIRES = "DisablePasswordExpiration";

  private final ExpiryCalculator calculator = new ExpiryCalculator();

  @Test
  void expiryFallsOnTodayNinetyDaysAfterLastChange() {
    final ExpiryState state =
        calculator.computeExpiry(user("2024-01-01T00:00:00Z", null, false, null), 90, NOW);

    assertThat(state.neverExpires()).isFalse();
    assertThat(state.expiresAt()).isEqualTo(Instant.parse("2024-03-31T00:00:00Z"));
    assertThat(state.daysRemaining()).isZero();
  }

  @Test
  void partialDaysRoundUp() {
    final ExpiryState state =
        calculator.computeExpiry(
            user("2024-01-01T00:00:00Z", null, false, null),
            90,
            Instant.parse("2024-03-30T12:00:00Z"));

    assertThat(state.daysRemaining()).isEqualTo(1);
  }

  @Test
  void expiredPasswordsReportNegativeDays() {
    final ExpiryState state =
        calculator.computeExpiry(user("2023-12-01T00:00:00Z", null, false, null), 90, NOW);

    assertThat(state.expiresAt()).isEqualTo(Instant.parse("2024-02-29T00:00:00Z"));
    assertThat(state.daysRemaining()).isEqualTo(-31);
  }

  @Test
  void createdTimestampIsUsedWhenPasswordNeverChanged() {
    final ExpiryState state =
        calculator.computeExpiry(user(null, "2024-03-01T00:00:00Z", false, null), 30, NOW);

    assertThat(state.referenceAt()).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
    assertThat(state.daysRemaining()).isZero();
  }

  @Test
  void missingBaselineNeverReportsExpiredNow() {
    final ExpiryState state =
        calculator.computeExpiry(user(null, null, false, null), 90, NOW);

    assertThat(state.neverExpires()).isTrue();
    assertThat(state.daysRemaining()).isEqualTo(ExpiryState.NEVER_EXPIRES_DAYS);
    assertThat(state.expiresAt()).isNull();
  }

  @Test
  void cloudOnlyUserRespectsNeverExpirePolicy() {
    final ExpiryState state =
        calculator.computeExpiry(
            user("2024-01-01T00:00:00Z", null, false, NEVER_EXPIRES + ", DisableStrongPassword"),
            90,
            NOW);

    assertThat(state.neverExpires()).isTrue();
    assertThat(state.daysRemaining()).isEqualTo(999);
  }

  @Test
  void hybridUserIgnoresCloudNeverExpirePolicy() {
    final ExpiryState state =
        calculator.computeExpiry(user("2024-01-08T00:00:00Z", null, true, NEVER_EXPIRES), 90, NOW);

    assertThat(state.neverExpires()).isFalse();
    assertThat(state.daysRemaining()).isEqualTo(7);
  }

  private DirectoryUser user(
      String lastChange, String created, boolean onPremisesSync, String policies) {
    return new DirectoryUser(
        "u-1",
        "Alice",
        "alice@example.com",
        true,
        lastChange == null ? null : Instant.parse(lastChange),
        created == null ? null : Instant.parse(created),
        onPremisesSync,
        policies);
  }
}
