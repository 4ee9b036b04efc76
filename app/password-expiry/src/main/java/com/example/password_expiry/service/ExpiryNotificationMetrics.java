/*
 * どこで: Password expiry サービス層
 * 何を: 配信結果/ジョブ実行結果/キュー滞留のアプリ固有メトリクスを記録する
 * なぜ: 通知が止まっていないかを actuator 経由で観測できるようにするため
 */
package com.example.password_expiry.service;

import com.example.password_expiry.model.JobMode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ExpiryNotificationMetrics {

  static final String METRIC_DELIVERY_TOTAL = "password_expiry.delivery.total";
  static final String METRIC_JOB_TOTAL = "password_expiry.job.total";
  static final String METRIC_BACKLOG_CURRENT = "password_expiry.queue.backlog.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> jobCounters = new ConcurrentHashMap<>();

  public ExpiryNotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Current number of pending queued notifications")
        .register(meterRegistry);
  }

  /** result: sent, retry or failed. */
  public void recordDeliveryResult(String result) {
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Queued notification delivery outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordJobRun(JobMode mode, boolean success) {
    final String modeTag = mode == null ? "unknown" : mode.name().toLowerCase(Locale.ROOT);
    final String result = success ? "success" : "failure";
    jobCounters
        .computeIfAbsent(
            modeTag + ":" + result,
            ignored ->
                Counter.builder(METRIC_JOB_TOTAL)
                    .description("Expiry notification job runs")
                    .tags(Tags.of("mode", modeTag, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }
}
