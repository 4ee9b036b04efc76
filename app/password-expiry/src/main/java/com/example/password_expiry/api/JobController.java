/*
 * どこで: Password expiry API
 * 何を: 通知ジョブを同期実行し、実行ログとプレビュー行を返す
 * なぜ: 運用者がプレビュー/テスト送信/本番送信を同じ入口から起動できるようにするため
 */
package com.example.password_expiry.api;

import com.example.password_expiry.api.request.RunJobRequest;
import com.example.password_expiry.model.JobMode;
import com.example.password_expiry.model.JobRequest;
import com.example.password_expiry.model.JobResult;
import com.example.password_expiry.model.NotificationProfile;
import com.example.password_expiry.service.ExpiryNotificationJobService;
import com.example.password_expiry.service.ProfileService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class JobController {

  private final ExpiryNotificationJobService jobService;
  private final ProfileService profileService;

  @PostMapping({"/api/jobs/run", "/api/run-job"})
  public JobResult run(@RequestBody RunJobRequest request) {
    final NotificationProfile profile = resolveProfile(request);
    final JobMode mode = request.mode() == null ? JobMode.PREVIEW : request.mode();
    return jobService.runJob(
        new JobRequest(profile, mode, request.testEmail(), request.scheduleTime()));
  }

  private NotificationProfile resolveProfile(RunJobRequest request) {
    if (request.profile() != null) {
      return request.profile();
    }
    if (request.profileId() == null || request.profileId().isBlank()) {
      throw new IllegalArgumentException("profileId or profile is required");
    }
    return profileService.get(request.profileId());
  }
}
