/*
 * どこで: Password expiry ドメインモデル
 * 何を: (日付, 宛先, プロファイル) ごとの送信結果
 * なぜ: 同日に同じ通知を二重送信しないための判定キーにするため
 */
package com.example.password_expiry.model;

import java.time.Instant;
import java.time.LocalDate;

public record AuditEntry(
    LocalDate dateKey,
    String recipientAddress,
    String profileId,
    AuditOutcome outcome,
    Instant timestamp) {

  public boolean isSentFor(String recipient, String profile, LocalDate date) {
    return outcome == AuditOutcome.SENT
        && dateKey != null
        && dateKey.equals(date)
        && recipientAddress != null
        && recipientAddress.equalsIgnoreCase(recipient)
        && profileId != null
        && profileId.equals(profile);
  }
}
