/*
 * どこで: Password expiry 配信キューのユニットテスト
 * 何を: 取り出し条件/状態遷移/リトライ上限での失敗確定を検証する
 * なぜ: 失敗したメールが無限に再送されたり復活したりしないことを保証するため
 */
package com.example.password_expiry.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.password_expiry.config.QueueWorkerProperties;
import com.example.password_expiry.model.QueueItem;
import com.example.password_expiry.model.QueueItemStatus;
import com.example.password_expiry.repository.InMemoryCollectionStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DeliveryQueueTest {

  private static final Instant NOW = Instant.parse("2024-03-31T09:00:00Z");

  private DeliveryQueue queue;

  @BeforeEach
  void setUp() {
    queue =
        new DeliveryQueue(
            new InMemoryCollectionStore(),
            new QueueWorkerProperties(true, Duration.ofSeconds(30), 3),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void enqueueAssignsIdAndPendingStatus() {
    final QueueItem stored = queue.enqueue(item(null, NOW.plusSeconds(60)));

    assertThat(stored.id()).isNotBlank();
    assertThat(stored.status()).isEqualTo(QueueItemStatus.PENDING);
    assertThat(stored.createdAt()).isEqualTo(NOW);
    assertThat(queue.list()).containsExactly(stored);
  }

  @Test
  void dequeueDueReturnsOnlyDuePendingItemsOldestFirst() {
    queue.enqueue(item("later", NOW.minusSeconds(10)));
    queue.enqueue(item("future", NOW.plusSeconds(10)));
    queue.enqueue(item("earlier", NOW.minusSeconds(60)));
    queue.enqueue(item("exact", NOW));
    queue.enqueue(item("sending", NOW.minusSeconds(120)));
    queue.markSending("sending");

    final List<QueueItem> due = queue.dequeueDue(NOW);

    assertThat(due).extracting(QueueItem::id).containsExactly("earlier", "later", "exact");
  }

  @Test
  void markSendingOnlyMovesPendingItems() {
    queue.enqueue(item("a", NOW));

    assertThat(queue.markSending("a")).isTrue();
    assertThat(queue.markSending("a")).isFalse();
    assertThat(queue.markSending("missing")).isFalse();
  }

  @Test
  void itemFailsExactlyWhenRetryCountReachesLimit() {
    queue.enqueue(item("a", NOW));

    assertThat(queue.markRetry("a"))
        .hasValueSatisfying(
            updated -> {
              assertThat(updated.retryCount()).isEqualTo(1);
              assertThat(updated.status()).isEqualTo(QueueItemStatus.PENDING);
            });
    assertThat(queue.markRetry("a"))
        .hasValueSatisfying(
            updated -> {
              assertThat(updated.retryCount()).isEqualTo(2);
              assertThat(updated.status()).isEqualTo(QueueItemStatus.PENDING);
            });
    assertThat(queue.markRetry("a"))
        .hasValueSatisfying(
            updated -> {
              assertThat(updated.retryCount()).isEqualTo(3);
              assertThat(updated.status()).isEqualTo(QueueItemStatus.FAILED);
            });
  }

  @Test
  void failedItemsAreNeverResurrected() {
    queue.enqueue(item("a", NOW));
    queue.markRetry("a");
    queue.markRetry("a");
    queue.markRetry("a");

    assertThat(queue.markRetry("a"))
        .hasValueSatisfying(
            updated -> {
              assertThat(updated.retryCount()).isEqualTo(3);
              assertThat(updated.status()).isEqualTo(QueueItemStatus.FAILED);
            });
    assertThat(queue.markSending("a")).isFalse();
    assertThat(queue.requeueInterrupted()).isZero();
    assertThat(queue.dequeueDue(NOW.plusSeconds(3600))).isEmpty();
  }

  @Test
  void markSentRemovesItem() {
    queue.enqueue(item("a", NOW));
    queue.markSending("a");

    assertThat(queue.markSent("a")).isTrue();
    assertThat(queue.list()).isEmpty();
  }

  @Test
  void removeAndClear() {
    queue.enqueue(item("a", NOW));
    queue.enqueue(item("b", NOW));

    assertThat(queue.remove("a")).isTrue();
    assertThat(queue.remove("a")).isFalse();
    queue.clear();

    assertThat(queue.list()).isEmpty();
  }

  @Test
  void interruptedSendsReturnToPending() {
    queue.enqueue(item("a", NOW));
    queue.enqueue(item("b", NOW));
    queue.markSending("a");

    assertThat(queue.requeueInterrupted()).isEqualTo(1);
    assertThat(queue.countPending()).isEqualTo(2);
  }

  static QueueItem item(String id, Instant scheduledFor) {
    return auditedItem(id, scheduledFor, null, null);
  }

  static QueueItem auditedItem(
      String id, Instant scheduledFor, String auditRecipient, LocalDate auditDateKey) {
    return new QueueItem(
        id,
        scheduledFor,
        "alice@example.com",
        List.of(),
        "subject",
        "body",
        "p-1",
        "Expiry warning",
        null,
        0,
        false,
        null,
        auditRecipient,
        auditDateKey);
  }
}
