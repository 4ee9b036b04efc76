/*
 * どこで: Password expiry サービス層
 * 何を: 遅延配信メールの永続キューとリトライ状態を管理する
 * なぜ: ジョブ実行とワーカーの読み書きを直列化し、更新の取りこぼしを防ぐため
 */
package com.example.password_expiry.service;

import com.example.password_expiry.config.QueueWorkerProperties;
import com.example.password_expiry.model.QueueItem;
import com.example.password_expiry.model.QueueItemStatus;
import com.example.password_expiry.repository.CollectionStore;
import com.fasterxml.jackson.core.type.TypeReference;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeliveryQueue {

  static final String COLLECTION = "queue";
  private static final Logger logger = LoggerFactory.getLogger(DeliveryQueue.class);
  private static final TypeReference<List<QueueItem>> ITEM_LIST = new TypeReference<>() {};

  private final CollectionStore store;
  private final QueueWorkerProperties properties;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  public QueueItem enqueue(QueueItem item) {
    lock.lock();
    try {
      QueueItem stored = item.withState(QueueItemStatus.PENDING, item.retryCount());
      if (stored.id() == null || stored.id().isBlank()) {
        stored = stored.withId(UUID.randomUUID().toString());
      }
      if (stored.createdAt() == null) {
        stored =
            new QueueItem(
                stored.id(),
                stored.scheduledFor(),
                stored.recipientAddress(),
                stored.ccAddresses(),
                stored.subject(),
                stored.body(),
                stored.profileId(),
                stored.profileName(),
                stored.status(),
                stored.retryCount(),
                stored.requestReadReceipt(),
                Instant.now(clock),
                stored.auditRecipient(),
                stored.auditDateKey());
      }
      final List<QueueItem> items = load();
      items.add(stored);
      store.save(COLLECTION, items);
      return stored;
    } finally {
      lock.unlock();
    }
  }

  /** Pending items whose schedule has arrived, earliest first. */
  public List<QueueItem> dequeueDue(Instant now) {
    lock.lock();
    try {
      return load().stream()
          .filter(item -> item.isDue(now))
          .sorted(Comparator.comparing(QueueItem::scheduledFor))
          .toList();
    } finally {
      lock.unlock();
    }
  }

  /** Moves a pending item to sending. Returns false when the item is gone or not pending. */
  public boolean markSending(String id) {
    lock.lock();
    try {
      final List<QueueItem> items = load();
      final int index = indexOf(items, id);
      if (index < 0 || items.get(index).status() != QueueItemStatus.PENDING) {
        return false;
      }
      final QueueItem item = items.get(index);
      items.set(index, item.withState(QueueItemStatus.SENDING, item.retryCount()));
      store.save(COLLECTION, items);
      return true;
    } finally {
      lock.unlock();
    }
  }

  public boolean markSent(String id) {
    return remove(id);
  }

  /**
   * Counts a failed attempt. The item returns to pending until its retry count reaches the
   * configured maximum, then it is parked as failed and never picked up again.
   */
  public Optional<QueueItem> markRetry(String id) {
    lock.lock();
    try {
      final List<QueueItem> items = load();
      final int index = indexOf(items, id);
      if (index < 0) {
        return Optional.empty();
      }
      final QueueItem item = items.get(index);
      if (item.status() == QueueItemStatus.FAILED) {
        return Optional.of(item);
      }
      final int nextRetryCount = item.retryCount() + 1;
      final QueueItemStatus nextStatus =
          nextRetryCount >= properties.maxRetries()
              ? QueueItemStatus.FAILED
              : QueueItemStatus.PENDING;
      final QueueItem updated = item.withState(nextStatus, nextRetryCount);
      items.set(index, updated);
      store.save(COLLECTION, items);
      return Optional.of(updated);
    } finally {
      lock.unlock();
    }
  }

  public boolean remove(String id) {
    lock.lock();
    try {
      final List<QueueItem> items = load();
      final int index = indexOf(items, id);
      if (index < 0) {
        return false;
      }
      items.remove(index);
      store.save(COLLECTION, items);
      return true;
    } finally {
      lock.unlock();
    }
  }

  public void clear() {
    lock.lock();
    try {
      store.save(COLLECTION, List.of());
    } finally {
      lock.unlock();
    }
  }

  public List<QueueItem> list() {
    lock.lock();
    try {
      return List.copyOf(load());
    } finally {
      lock.unlock();
    }
  }

  public int countPending() {
    lock.lock();
    try {
      return (int)
          load().stream().filter(item -> item.status() == QueueItemStatus.PENDING).count();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns items left in sending by an interrupted process to pending. Their delivery outcome is
   * unknown, so this may resend a message that already went out.
   */
  public int requeueInterrupted() {
    lock.lock();
    try {
      final List<QueueItem> items = load();
      int requeued = 0;
      for (int i = 0; i < items.size(); i++) {
        final QueueItem item = items.get(i);
        if (item.status() == QueueItemStatus.SENDING) {
          items.set(i, item.withState(QueueItemStatus.PENDING, item.retryCount()));
          requeued++;
        }
      }
      if (requeued > 0) {
        store.save(COLLECTION, items);
        logger.warn("queue items left in sending were requeued count={}", requeued);
      }
      return requeued;
    } finally {
      lock.unlock();
    }
  }

  private List<QueueItem> load() {
    return new ArrayList<>(store.load(COLLECTION, ITEM_LIST, List::of));
  }

  private int indexOf(List<QueueItem> items, String id) {
    for (int i = 0; i < items.size(); i++) {
      if (items.get(i).id() != null && items.get(i).id().equals(id)) {
        return i;
      }
    }
    return -1;
  }
}
