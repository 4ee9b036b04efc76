/*
 * どこで: Password expiry ドメインモデル
 * 何を: ユーザー単位で算出したパスワード期限の状態
 * なぜ: 「今日」でずれる残日数を毎回計算し直し、キャッシュしないため
 */
package com.example.password_expiry.model;

import java.time.Instant;

public record ExpiryState(
    Instant referenceAt, boolean neverExpires, Instant expiresAt, int daysRemaining) {

  /** Days-remaining value reported for accounts whose password never expires. */
  public static final int NEVER_EXPIRES_DAYS = 999;

  public static ExpiryState neverExpiring(Instant referenceAt) {
    return new ExpiryState(referenceAt, true, null, NEVER_EXPIRES_DAYS);
  }

  public static ExpiryState expiring(Instant referenceAt, Instant expiresAt, int daysRemaining) {
    return new ExpiryState(referenceAt, false, expiresAt, daysRemaining);
  }
}
