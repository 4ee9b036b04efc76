/*
 * どこで: Password expiry 実行時設定
 * 何を: 運用者が画面/API から変更するディレクトリ接続・SMTP・既定有効期限の設定
 * なぜ: 全フィールドの上書き規則を型で明示し、暗黙のマージを避けるため
 */
package com.example.password_expiry.model;

public record AppSettings(
    String tenantId,
    String clientId,
    String clientSecret,
    Integer defaultExpiryDays,
    SmtpSettings smtp) {

  /** Placeholder returned instead of stored secrets; sending it back keeps the stored value. */
  public static final String MASKED_SECRET = "********";

  public static final int DEFAULT_EXPIRY_DAYS = 90;

  public static AppSettings defaults() {
    return new AppSettings("", "", "", DEFAULT_EXPIRY_DAYS, SmtpSettings.defaults());
  }

  public boolean hasDirectoryCredentials() {
    return notBlank(tenantId) && notBlank(clientId) && notBlank(clientSecret);
  }

  public int effectiveExpiryDays() {
    return defaultExpiryDays == null || defaultExpiryDays <= 0
        ? DEFAULT_EXPIRY_DAYS
        : defaultExpiryDays;
  }

  public AppSettings mergedWith(AppSettings update) {
    if (update == null) {
      return this;
    }
    final SmtpSettings baseSmtp = smtp == null ? SmtpSettings.defaults() : smtp;
    return new AppSettings(
        pick(update.tenantId(), tenantId),
        pick(update.clientId(), clientId),
        pickSecret(update.clientSecret(), clientSecret),
        update.defaultExpiryDays() != null ? update.defaultExpiryDays() : defaultExpiryDays,
        baseSmtp.mergedWith(update.smtp()));
  }

  public AppSettings masked() {
    return new AppSettings(
        tenantId,
        clientId,
        mask(clientSecret),
        defaultExpiryDays,
        smtp == null ? null : smtp.masked());
  }

  static String pick(String candidate, String current) {
    return candidate != null ? candidate.trim() : current;
  }

  static String pickSecret(String candidate, String current) {
    if (candidate == null || MASKED_SECRET.equals(candidate)) {
      return current;
    }
    return candidate;
  }

  static String mask(String secret) {
    return notBlank(secret) ? MASKED_SECRET : "";
  }

  private static boolean notBlank(String value) {
    return value != null && !value.isBlank();
  }
}
