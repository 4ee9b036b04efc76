/*
 * どこで: Password expiry ドメインモデル
 * 何を: 配信キュー項目の状態を表す列挙
 * なぜ: 送信中の二重取得と失敗項目の再送を防ぐため
 */
package com.example.password_expiry.model;

public enum QueueItemStatus {
  PENDING,
  SENDING,
  FAILED
}
