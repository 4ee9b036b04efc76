/*
 * どこで: Password expiry ドメインモデル
 * 何を: ディレクトリから取得したユーザーのスナップショット
 * なぜ: 期限計算とジョブ処理でディレクトリ固有の形に依存しないため
 */
package com.example.password_expiry.model;

import java.time.Instant;

public record DirectoryUser(
    String id,
    String displayName,
    String principalName,
    boolean accountEnabled,
    Instant lastPasswordChangeAt,
    Instant createdAt,
    boolean onPremisesSyncEnabled,
    String passwordPolicies) {

  public DirectoryUser {
    passwordPolicies = passwordPolicies == null ? "" : passwordPolicies;
  }
}
