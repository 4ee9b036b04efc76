/*
 * どこで: Password expiry ドメインモデル
 * 何を: 監査エントリの結果を表す列挙
 * なぜ: 重複送信判定で SENT だけを数えるため
 */
package com.example.password_expiry.model;

public enum AuditOutcome {
  SENT,
  SKIPPED
}
