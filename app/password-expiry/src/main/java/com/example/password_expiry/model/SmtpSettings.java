/*
 * どこで: Password expiry 実行時設定
 * 何を: SMTP 接続設定と項目単位のマージ規則
 * なぜ: 部分更新やマスク値で保存済みの秘密情報を消さないため
 */
package com.example.password_expiry.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record SmtpSettings(
    String host,
    Integer port,
    Boolean secure,
    String username,
    String password,
    String fromEmail) {

  public static final int DEFAULT_PORT = 587;

  public static SmtpSettings defaults() {
    return new SmtpSettings("", DEFAULT_PORT, Boolean.TRUE, "", "", "");
  }

  @JsonIgnore
  public boolean isConfigured() {
    return host != null && !host.isBlank();
  }

  /**
   * Applies {@code update} on top of this value. A {@code null} field keeps the current value and
   * a masked password keeps the stored password.
   */
  public SmtpSettings mergedWith(SmtpSettings update) {
    if (update == null) {
      return this;
    }
    return new SmtpSettings(
        AppSettings.pick(update.host(), host),
        update.port() != null ? update.port() : port,
        update.secure() != null ? update.secure() : secure,
        AppSettings.pick(update.username(), username),
        AppSettings.pickSecret(update.password(), password),
        AppSettings.pick(update.fromEmail(), fromEmail));
  }

  public SmtpSettings masked() {
    return new SmtpSettings(
        host, port, secure, username, AppSettings.mask(password), fromEmail);
  }
}
