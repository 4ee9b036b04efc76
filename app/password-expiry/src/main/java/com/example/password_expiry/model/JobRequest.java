/*
 * どこで: Password expiry ジョブ
 * 何を: ジョブ実行の入力
 * なぜ: プロファイル/モード/テスト宛先/明示配信時刻をまとめて受け渡すため
 */
package com.example.password_expiry.model;

import java.time.Instant;

public record JobRequest(
    NotificationProfile profile, JobMode mode, String testRecipient, Instant scheduleAt) {}
