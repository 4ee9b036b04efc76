/*
 * Where: Password expiry service layer
 * What: Records one outcome per (recipient, profile, day) and prunes old entries
 * Why: Prevent duplicate live sends within a day without unbounded history growth
 */
package com.example.password_expiry.service;

import com.example.password_expiry.config.AuditProperties;
import com.example.password_expiry.model.AuditEntry;
import com.example.password_expiry.model.AuditOutcome;
import com.example.password_expiry.repository.CollectionStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.annotations.VisibleForTesting;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AuditLedger {

  static final String COLLECTION = "history";
  private static final Logger logger = LoggerFactory.getLogger(AuditLedger.class);
  private static final TypeReference<List<AuditEntry>> ENTRY_LIST = new TypeReference<>() {};

  private final CollectionStore store;
  private final AuditProperties properties;
  private final ReentrantLock lock = new ReentrantLock();

  public boolean wasAlreadySent(String recipient, String profileId, LocalDate dateKey) {
    lock.lock();
    try {
      return load().stream().anyMatch(entry -> entry.isSentFor(recipient, profileId, dateKey));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Appends a {@code sent} entry unless one already exists for the same key, then prunes and
   * persists.
   *
   * @throws com.example.password_expiry.repository.PersistenceException when the write fails
   */
  public void recordSent(String recipient, String profileId, LocalDate dateKey, Instant timestamp) {
    lock.lock();
    try {
      final List<AuditEntry> entries = load();
      if (entries.stream().anyMatch(entry -> entry.isSentFor(recipient, profileId, dateKey))) {
        logger.debug(
            "audit sent entry already present recipient={} profileId={} date={}",
            recipient,
            profileId,
            dateKey);
        return;
      }
      entries.add(new AuditEntry(dateKey, recipient, profileId, AuditOutcome.SENT, timestamp));
      store.save(COLLECTION, prune(entries, dateKey));
    } finally {
      lock.unlock();
    }
  }

  public void recordSkipped(
      String recipient, String profileId, LocalDate dateKey, Instant timestamp) {
    lock.lock();
    try {
      final List<AuditEntry> entries = load();
      entries.add(new AuditEntry(dateKey, recipient, profileId, AuditOutcome.SKIPPED, timestamp));
      store.save(COLLECTION, prune(entries, dateKey));
    } finally {
      lock.unlock();
    }
  }

  /** Returns all retained entries, newest first. */
  public List<AuditEntry> history() {
    lock.lock();
    try {
      final List<AuditEntry> entries = load();
      entries.sort(
          Comparator.comparing(
                  AuditEntry::timestamp, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
              .reversed());
      return entries;
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  List<AuditEntry> prune(List<AuditEntry> entries, LocalDate today) {
    final LocalDate threshold = today.minusDays(properties.retentionDays());
    final List<AuditEntry> retained = new ArrayList<>(entries.size());
    for (AuditEntry entry : entries) {
      if (entry.dateKey() != null && !entry.dateKey().isBefore(threshold)) {
        retained.add(entry);
      }
    }
    final int pruned = entries.size() - retained.size();
    if (pruned > 0) {
      logger.info("audit ledger pruned entries count={} threshold={}", pruned, threshold);
    }
    return retained;
  }

  private List<AuditEntry> load() {
    return new ArrayList<>(store.load(COLLECTION, ENTRY_LIST, List::of));
  }
}
