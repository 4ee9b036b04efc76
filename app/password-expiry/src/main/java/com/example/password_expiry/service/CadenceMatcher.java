/*
 * どこで: Password expiry サービス層
 * 何を: 残日数がプロファイルの送信日に一致するかを判定する
 * なぜ: 閾値を過ぎた後に毎日再送しないよう完全一致で判定するため
 */
package com.example.password_expiry.service;

import com.example.password_expiry.model.ExpiryState;
import com.example.password_expiry.model.NotificationProfile;
import org.springframework.stereotype.Component;

@Component
public class CadenceMatcher {

  public boolean matches(ExpiryState state, NotificationProfile profile) {
    return !state.neverExpires() && profile.cadence().contains(state.daysRemaining());
  }
}
