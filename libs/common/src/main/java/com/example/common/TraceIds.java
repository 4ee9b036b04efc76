/*
 * どこで: 共通ユーティリティ
 * 何を: トレース ID を発行し MDC へ一時的に載せる
 * なぜ: ジョブ実行単位でログを突き合わせられるようにするため
 */
package com.example.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** Puts {@code key=value} into the MDC until the returned scope is closed. */
  public static MdcScope putScoped(String key, String value) {
    MDC.put(key, value);
    return () -> MDC.remove(key);
  }

  @FunctionalInterface
  public interface MdcScope extends AutoCloseable {
    @Override
    void close();
  }
}
