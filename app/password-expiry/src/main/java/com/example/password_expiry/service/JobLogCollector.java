package com.example.password_expiry.service;

import com.example.password_expiry.model.JobLogEntry;
import com.example.password_expiry.model.JobLogLevel;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Collects the log lines returned to the caller of one job run and mirrors them to SLF4J. */
class JobLogCollector {

  private static final Logger logger = LoggerFactory.getLogger(JobLogCollector.class);

  private final Clock clock;
  private final List<JobLogEntry> entries = new ArrayList<>();

  JobLogCollector(Clock clock) {
    this.clock = clock;
  }

  void info(String message) {
    append(JobLogLevel.INFO, message, null);
  }

  void warn(String message, String details) {
    append(JobLogLevel.WARN, message, details);
  }

  void error(String message, String details) {
    append(JobLogLevel.ERROR, message, details);
  }

  void success(String message) {
    append(JobLogLevel.SUCCESS, message, null);
  }

  void skip(String message) {
    append(JobLogLevel.SKIP, message, null);
  }

  void queue(String message) {
    append(JobLogLevel.QUEUE, message, null);
  }

  List<JobLogEntry> entries() {
    return List.copyOf(entries);
  }

  private void append(JobLogLevel level, String message, String details) {
    entries.add(new JobLogEntry(Instant.now(clock), level, message, details));
    switch (level) {
      case ERROR -> logger.error("job {} {} details={}", level, message, details);
      case WARN -> logger.warn("job {} {} details={}", level, message, details);
      default -> logger.info("job {} {}", level, message);
    }
  }
}
