/*
 * どこで: Common 共通設定
 * 何を: Clock と業務タイムゾーンを DI 可能にする
 * なぜ: 「今日」の判定と時刻計算を各コンポーネントで揃えるため
 */
package com.example.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ZoneId businessZone(@Value("${app.time.zone:}") String zone) {
    // 未指定ならホストのローカルタイムゾーンを使う
    if (zone == null || zone.isBlank()) {
      return ZoneId.systemDefault();
    }
    return ZoneId.of(zone.trim());
  }
}
