/*
 * どこで: Password expiry ドメインモデル
 * 何を: queue コレクションに保存する遅延配信メール
 * なぜ: 配信ワーカーと運用 API で同じ形を共有するため
 */
package com.example.password_expiry.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * 遅延配信メール。
 *
 * <p>{@code auditRecipient} と {@code auditDateKey} はジョブが enqueue 時に決めた監査キー。
 * live 実行で積まれた項目だけが持ち、test 実行や test 送信の項目では null。
 */
public record QueueItem(
    String id,
    Instant scheduledFor,
    String recipientAddress,
    List<String> ccAddresses,
    String subject,
    String body,
    String profileId,
    String profileName,
    QueueItemStatus status,
    int retryCount,
    boolean requestReadReceipt,
    Instant createdAt,
    String auditRecipient,
    LocalDate auditDateKey) {

  public QueueItem {
    ccAddresses = ccAddresses == null ? List.of() : List.copyOf(ccAddresses);
    status = status == null ? QueueItemStatus.PENDING : status;
  }

  public QueueItem withId(String newId) {
    return new QueueItem(
        newId,
        scheduledFor,
        recipientAddress,
        ccAddresses,
        subject,
        body,
        profileId,
        profileName,
        status,
        retryCount,
        requestReadReceipt,
        createdAt,
        auditRecipient,
        auditDateKey);
  }

  public QueueItem withState(QueueItemStatus newStatus, int newRetryCount) {
    return new QueueItem(
        id,
        scheduledFor,
        recipientAddress,
        ccAddresses,
        subject,
        body,
        profileId,
        profileName,
        newStatus,
        newRetryCount,
        requestReadReceipt,
        createdAt,
        auditRecipient,
        auditDateKey);
  }

  public boolean isDue(Instant now) {
    return status == QueueItemStatus.PENDING
        && scheduledFor != null
        && !scheduledFor.isAfter(now);
  }

  public boolean isAudited() {
    return auditRecipient != null && auditDateKey != null;
  }
}
