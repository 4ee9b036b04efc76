/*
 * どこで: Password expiry アプリの設定バインド
 * 何を: ジョブの対象ユーザー解決に使う設定を保持する
 * なぜ: 「全ユーザー」を表すグループ名を環境で変えられるようにするため
 */
package com.example.password_expiry.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "password-expiry.job")
public record JobProperties(String allUsersGroup) {

  public JobProperties {
    allUsersGroup =
        allUsersGroup == null || allUsersGroup.isBlank() ? "All Users" : allUsersGroup.trim();
  }

  public boolean isAllUsers(String groupName) {
    return groupName != null && groupName.trim().equalsIgnoreCase(allUsersGroup);
  }
}
