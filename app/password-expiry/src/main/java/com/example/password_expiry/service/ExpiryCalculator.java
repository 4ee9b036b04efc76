/*
 * どこで: Password expiry サービス層
 * 何を: ディレクトリ属性からパスワード期限と残日数を算出する
 * なぜ: 同じ入力から常に同じ結果を得られる純粋関数として判定の土台にするため
 */
package com.example.password_expiry.service;

import com.example.password_expiry.model.DirectoryUser;
import com.example.password_expiry.model.ExpiryState;
import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Component;

@Component
public class ExpiryCalculator {

  static final String DISABLE_EXPIRATION_POLICY = "DisablePasswordExpiration";
  private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

  public ExpiryState computeExpiry(DirectoryUser user, int defaultWindowDays, Instant now) {
    final Instant referenceAt =
        user.lastPasswordChangeAt() != null ? user.lastPasswordChangeAt() : user.createdAt();
    if (referenceAt == null) {
      // 基準日不明を「今日期限切れ」と誤判定しない
      return ExpiryState.neverExpiring(null);
    }
    final boolean policyNeverExpires =
        user.passwordPolicies().contains(DISABLE_EXPIRATION_POLICY);
    // オンプレ同期ユーザーではクラウド側の無期限フラグが実際のポリシーを表さない
    if (policyNeverExpires && !user.onPremisesSyncEnabled()) {
      return ExpiryState.neverExpiring(referenceAt);
    }
    final Instant expiresAt = referenceAt.plus(Duration.ofDays(defaultWindowDays));
    final long remainingMillis = Duration.between(now, expiresAt).toMillis();
    final int daysRemaining = (int) Math.ceil(remainingMillis / MILLIS_PER_DAY);
    return ExpiryState.expiring(referenceAt, expiresAt, daysRemaining);
  }
}
