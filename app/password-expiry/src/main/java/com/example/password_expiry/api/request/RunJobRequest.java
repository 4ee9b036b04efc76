/*
 * どこで: Password expiry API リクエスト DTO
 * 何を: ジョブ実行 API の入力を定義する
 * なぜ: 保存済みプロファイルの id 指定と未保存プロファイルの直接指定の両方を受けるため
 */
package com.example.password_expiry.api.request;

import com.example.password_expiry.model.JobMode;
import com.example.password_expiry.model.NotificationProfile;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record RunJobRequest(
    String profileId,
    NotificationProfile profile,
    JobMode mode,
    String testEmail,
    Instant scheduleTime) {}
