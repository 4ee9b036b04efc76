/*
 * どこで: Password expiry 配信ワーカー
 * 何を: 固定間隔でキュー配信処理を起動する
 * なぜ: 予約時刻を過ぎたメールを一定間隔で送り、停止時は処理中の tick を完了させるため
 */
package com.example.password_expiry.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "password-expiry.queue.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class QueueDeliveryWorker {

  private final QueueDeliveryService deliveryService;

  @EventListener(ApplicationReadyEvent.class)
  public void recover() {
    deliveryService.recoverInterrupted();
  }

  @Scheduled(fixedDelayString = "${password-expiry.queue.poll-interval}")
  public void run() {
    deliveryService.processDueBatch();
  }
}
