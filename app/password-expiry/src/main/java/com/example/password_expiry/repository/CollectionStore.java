/*
 * どこで: Password expiry データアクセス
 * 何を: 名前付きコレクションを丸ごと読み書きする抽象
 * なぜ: 設定/キュー/履歴をトランザクションなしの KV として扱うため
 */
package com.example.password_expiry.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import java.util.function.Supplier;

public interface CollectionStore {

  /**
   * Loads a whole collection. A missing or unreadable collection yields {@code defaultValue};
   * read failures never propagate.
   */
  <T> T load(String name, TypeReference<T> type, Supplier<T> defaultValue);

  /**
   * Replaces a whole collection.
   *
   * @throws PersistenceException when the collection could not be written
   */
  void save(String name, Object value);
}
