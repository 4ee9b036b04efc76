/*
 * どこで: Password expiry サービス層
 * 何を: 明示指定または希望時刻から配信予定時刻を決める
 * なぜ: ライブ実行を営業時間帯の指定時刻にまとめて送れるようにするため
 */
package com.example.password_expiry.service;

import com.example.password_expiry.model.JobMode;
import com.example.password_expiry.model.NotificationProfile;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeliveryScheduleResolver {

  private final ZoneId businessZone;

  /**
   * Resolves the effective delivery time. An explicit time always wins. Otherwise a live run of a
   * profile with a preferred time of day is scheduled at the next occurrence of that time: today if
   * it has not passed yet, tomorrow otherwise. Empty means send immediately.
   */
  public Optional<Instant> resolve(
      Instant explicitScheduleAt, NotificationProfile profile, JobMode mode, Instant now) {
    if (explicitScheduleAt != null) {
      return Optional.of(explicitScheduleAt);
    }
    if (mode != JobMode.LIVE || profile.preferredTimeOfDay() == null) {
      return Optional.empty();
    }
    final ZonedDateTime current = now.atZone(businessZone);
    ZonedDateTime candidate =
        current.toLocalDate().atTime(profile.preferredTimeOfDay()).atZone(businessZone);
    if (candidate.isBefore(current)) {
      candidate =
          current.toLocalDate().plusDays(1).atTime(profile.preferredTimeOfDay()).atZone(businessZone);
    }
    return Optional.of(candidate.toInstant());
  }
}
