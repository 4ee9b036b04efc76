/*
 * どこで: Password expiry ジョブ
 * 何を: ジョブ実行ログの 1 行
 * なぜ: 運用者がログ収集なしに実行結果を確認できるようにするため
 */
package com.example.password_expiry.model;

import java.time.Instant;

public record JobLogEntry(Instant timestamp, JobLogLevel level, String message, String details) {}
