/*
 * どこで: Password expiry ドメインモデル
 * 何を: 通知プロファイル(テンプレート/送信日/宛先/対象グループ)
 * なぜ: 運用者が定義した通知ルールを全置換で保存し、ジョブに渡すため
 */
package com.example.password_expiry.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.time.LocalTime;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

public record NotificationProfile(
    String id,
    String name,
    String description,
    String subjectTemplate,
    String emailTemplate,
    Set<Integer> cadence,
    RecipientPolicy recipientPolicy,
    List<String> assignedGroupNames,
    @JsonFormat(pattern = "HH:mm") LocalTime preferredTimeOfDay) {

  public NotificationProfile {
    // 重複した送信日は 1 つにまとめる
    final SortedSet<Integer> days = new TreeSet<>();
    if (cadence != null) {
      for (Integer day : cadence) {
        if (day != null) {
          days.add(day);
        }
      }
    }
    cadence = Collections.unmodifiableSortedSet(days);
    recipientPolicy = recipientPolicy == null ? RecipientPolicy.userOnly() : recipientPolicy;
    assignedGroupNames =
        assignedGroupNames == null
            ? List.of()
            : assignedGroupNames.stream()
                .filter(group -> group != null && !group.isBlank())
                .map(String::trim)
                .toList();
    subjectTemplate = subjectTemplate == null ? "" : subjectTemplate;
    emailTemplate = emailTemplate == null ? "" : emailTemplate;
  }

  public NotificationProfile withId(String newId) {
    return new NotificationProfile(
        newId,
        name,
        description,
        subjectTemplate,
        emailTemplate,
        cadence,
        recipientPolicy,
        assignedGroupNames,
        preferredTimeOfDay);
  }
}
