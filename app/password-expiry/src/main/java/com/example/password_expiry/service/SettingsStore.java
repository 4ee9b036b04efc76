/*
 * どこで: Password expiry サービス層
 * 何を: 実行時設定の読み込み/部分更新/マスク表示
 * なぜ: 既定値と保存値の合成規則を 1 箇所にまとめ、秘密情報を API に返さないため
 */
package com.example.password_expiry.service;

import com.example.password_expiry.model.AppSettings;
import com.example.password_expiry.repository.CollectionStore;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SettingsStore {

  static final String COLLECTION = "app-settings";
  private static final Logger logger = LoggerFactory.getLogger(SettingsStore.class);
  private static final TypeReference<AppSettings> SETTINGS = new TypeReference<>() {};

  private final CollectionStore store;

  /** Stored settings layered over defaults. Never null. */
  public AppSettings load() {
    return AppSettings.defaults().mergedWith(store.load(COLLECTION, SETTINGS, () -> null));
  }

  public AppSettings masked() {
    return load().masked();
  }

  /**
   * Merges a partial update into the stored settings. Null fields and masked secrets keep the
   * stored values.
   */
  public synchronized AppSettings update(AppSettings update) {
    if (update != null
        && update.defaultExpiryDays() != null
        && update.defaultExpiryDays() <= 0) {
      throw new IllegalArgumentException("defaultExpiryDays must be positive");
    }
    if (update != null
        && update.smtp() != null
        && update.smtp().port() != null
        && (update.smtp().port() <= 0 || update.smtp().port() > 65535)) {
      throw new IllegalArgumentException("smtp.port must be between 1 and 65535");
    }
    final AppSettings merged = load().mergedWith(update);
    store.save(COLLECTION, merged);
    logger.info(
        "runtime settings saved directoryConfigured={} smtpConfigured={}",
        merged.hasDirectoryCredentials(),
        merged.smtp().isConfigured());
    return merged;
  }
}
