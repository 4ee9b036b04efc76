/*
 * どこで: Password expiry サービス層
 * 何を: 配信予定時刻を過ぎたキュー項目を送信し、リトライ/失敗確定を処理する
 * なぜ: 予約配信の最終状態を 1 箇所で制御し、失敗を運用者が確認できる形で残すため
 */
package com.example.password_expiry.service;

import com.example.password_expiry.mail.MailTransport;
import com.example.password_expiry.mail.MailTransportFactory;
import com.example.password_expiry.mail.OutgoingMail;
import com.example.password_expiry.model.AppSettings;
import com.example.password_expiry.model.QueueItem;
import com.example.password_expiry.model.QueueItemStatus;
import com.example.password_expiry.repository.PersistenceException;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class QueueDeliveryService {

  private static final Logger logger = LoggerFactory.getLogger(QueueDeliveryService.class);

  private final DeliveryQueue deliveryQueue;
  private final AuditLedger auditLedger;
  private final SettingsStore settingsStore;
  private final MailTransportFactory mailTransportFactory;
  private final ExpiryNotificationMetrics metrics;
  private final Clock clock;

  public void processDueBatch() {
    final AppSettings settings = settingsStore.load();
    final Instant now = Instant.now(clock);
    final List<QueueItem> due = deliveryQueue.dequeueDue(now);
    try {
      if (due.isEmpty()) {
        return;
      }
      if (!settings.smtp().isConfigured()) {
        // 設定されるまで pending のまま残し、リトライ回数も消費しない
        logger.error("queue delivery skipped because SMTP host is not configured due={}", due.size());
        return;
      }
      logger.info("queue delivery started due={}", due.size());
      final MailTransport transport = mailTransportFactory.create(settings.smtp());
      for (QueueItem item : due) {
        try {
          deliver(item, transport, settings.smtp().fromEmail());
        } catch (RuntimeException ex) {
          logger.error("queue item handling failed id={} to={}", item.id(), item.recipientAddress(), ex);
        }
      }
    } finally {
      metrics.updateBacklogCurrent(deliveryQueue.countPending());
    }
  }

  /** Returns items left in sending by a previous process to pending. */
  public void recoverInterrupted() {
    final int requeued = deliveryQueue.requeueInterrupted();
    if (requeued > 0) {
      logger.warn("queue recovered interrupted deliveries count={}", requeued);
    }
  }

  @VisibleForTesting
  void deliver(QueueItem item, MailTransport transport, String from) {
    if (!deliveryQueue.markSending(item.id())) {
      // 取得後に運用者が取り消した
      logger.info("queue item no longer pending id={}", item.id());
      return;
    }
    try {
      transport.send(
          new OutgoingMail(
              from,
              item.recipientAddress(),
              item.ccAddresses(),
              item.subject(),
              item.body(),
              item.requestReadReceipt()));
    } catch (RuntimeException ex) {
      handleFailure(item, ex);
      return;
    }
    final Instant sentAt = Instant.now(clock);
    deliveryQueue.markSent(item.id());
    metrics.recordDeliveryResult("sent");
    logger.info(
        "queue item delivered id={} to={} profileId={}",
        item.id(),
        item.recipientAddress(),
        item.profileId());
    if (!item.isAudited()) {
      return;
    }
    // ジョブが enqueue 時に決めたキーで記録する。配信日で記録すると翌日の判定を抑止してしまう
    try {
      auditLedger.recordSent(item.auditRecipient(), item.profileId(), item.auditDateKey(), sentAt);
    } catch (PersistenceException ex) {
      logger.error(
          "audit write failed after queued delivery id={} to={}",
          item.id(),
          item.recipientAddress(),
          ex);
    }
  }

  @VisibleForTesting
  void handleFailure(QueueItem item, RuntimeException ex) {
    final Optional<QueueItem> updated = deliveryQueue.markRetry(item.id());
    if (updated.isEmpty()) {
      logger.warn("queue item disappeared during delivery id={}", item.id(), ex);
      return;
    }
    if (updated.get().status() == QueueItemStatus.FAILED) {
      metrics.recordDeliveryResult("failed");
      logger.error(
          "queue item failed permanently id={} to={} retryCount={}",
          item.id(),
          item.recipientAddress(),
          updated.get().retryCount(),
          ex);
      return;
    }
    metrics.recordDeliveryResult("retry");
    logger.error(
        "queue delivery failed, will retry id={} to={} retryCount={}",
        item.id(),
        item.recipientAddress(),
        updated.get().retryCount(),
        ex);
  }
}
