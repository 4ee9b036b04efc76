/*
 * どこで: Password expiry アプリの設定バインド
 * 何を: 配信キューのポーリング間隔とリトライ上限を保持する
 * なぜ: 運用パラメータを外部化し、起動時に妥当性を検証するため
 */
package com.example.password_expiry.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "password-expiry.queue")
@Validated
public record QueueWorkerProperties(
    boolean enabled, @NotNull Duration pollInterval, @Positive int maxRetries) {

  @AssertTrue(message = "password-expiry.queue.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    // Duration には @Positive が使えないため明示的に弾く。
    return pollInterval != null && !pollInterval.isZero() && !pollInterval.isNegative();
  }
}
