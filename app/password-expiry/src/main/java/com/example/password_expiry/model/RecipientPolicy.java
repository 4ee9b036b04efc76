/*
 * どこで: Password expiry ドメインモデル
 * 何を: 通知プロファイルの宛先ポリシー
 * なぜ: 本人/上長/固定 CC/開封確認の指定をまとめて扱うため
 */
package com.example.password_expiry.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record RecipientPolicy(
    boolean toUser, boolean toManagerLookup, Set<String> ccAddresses, boolean requestReadReceipt) {

  public RecipientPolicy {
    final Set<String> normalized = new LinkedHashSet<>();
    if (ccAddresses != null) {
      for (String address : ccAddresses) {
        if (address != null && !address.isBlank()) {
          normalized.add(address.trim());
        }
      }
    }
    ccAddresses = Collections.unmodifiableSet(normalized);
  }

  public static RecipientPolicy userOnly() {
    return new RecipientPolicy(true, false, Set.of(), false);
  }
}
