/*
 * どこで: Password expiry ジョブ
 * 何を: ジョブの実行モード
 * なぜ: プレビュー/テスト送信/本番送信で副作用の範囲を切り替えるため
 */
package com.example.password_expiry.model;

public enum JobMode {
  PREVIEW,
  TEST,
  LIVE
}
