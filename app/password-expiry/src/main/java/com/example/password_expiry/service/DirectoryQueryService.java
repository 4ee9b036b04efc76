/*
 * どこで: Password expiry サービス層
 * 何を: 運用画面向けにディレクトリユーザーと期限状態、接続権限を返す
 * なぜ: ジョブを実行せずに期限の状況と Graph 権限を確認できるようにするため
 */
package com.example.password_expiry.service;

import com.example.password_expiry.directory.DirectoryClientFactory;
import com.example.password_expiry.directory.PermissionCheck;
import com.example.password_expiry.model.AppSettings;
import com.example.password_expiry.model.DirectoryUser;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DirectoryQueryService {

  private final SettingsStore settingsStore;
  private final DirectoryClientFactory directoryClientFactory;
  private final ExpiryCalculator expiryCalculator;
  private final Clock clock;

  public List<DirectoryUserView> listUsersWithExpiry() {
    final AppSettings settings = settingsStore.load();
    final List<DirectoryUser> users = directoryClientFactory.create(settings).listUsers();
    final Instant now = Instant.now(clock);
    return users.stream()
        .map(
            user ->
                new DirectoryUserView(
                    user,
                    expiryCalculator.computeExpiry(user, settings.effectiveExpiryDays(), now)))
        .toList();
  }

  public PermissionCheck checkPermissions() {
    return directoryClientFactory.create(settingsStore.load()).verifyAccess();
  }
}
