/*
 * どこで: Password expiry データアクセス
 * 何を: コレクションを <directory>/<name>.json として保存する
 * なぜ: DB を持たない単一インスタンス構成で状態を永続化するため
 */
package com.example.password_expiry.repository;

import com.example.password_expiry.config.StorageProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

@Repository
public class JsonFileCollectionStore implements CollectionStore {

  private static final Logger logger = LoggerFactory.getLogger(JsonFileCollectionStore.class);
  private static final String EXTENSION = ".json";

  private final ObjectMapper objectMapper;
  private final Path directory;

  public JsonFileCollectionStore(ObjectMapper objectMapper, StorageProperties properties) {
    this.objectMapper = objectMapper;
    this.directory = Paths.get(properties.directory()).toAbsolutePath().normalize();
  }

  @Override
  public <T> T load(String name, TypeReference<T> type, Supplier<T> defaultValue) {
    final Path file = resolve(name);
    if (!Files.exists(file)) {
      return defaultValue.get();
    }
    try {
      final T value = objectMapper.readValue(file.toFile(), type);
      return value == null ? defaultValue.get() : value;
    } catch (IOException | RuntimeException ex) {
      // 破損ファイルでシステム全体を止めないよう既定値で続行するが、データ欠損として ERROR を残す
      logger.error("collection read failed; falling back to default name={} file={}", name, file, ex);
      return defaultValue.get();
    }
  }

  @Override
  public void save(String name, Object value) {
    final Path file = resolve(name);
    final Path tmp = file.resolveSibling(file.getFileName().toString() + ".tmp");
    try {
      Files.createDirectories(directory);
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
      move(tmp, file);
    } catch (IOException | RuntimeException ex) {
      throw new PersistenceException("collection write failed name=" + name, ex);
    }
  }

  Path resolve(String name) {
    if (name == null || name.isBlank() || name.contains("/") || name.contains("\\")) {
      throw new IllegalArgumentException("invalid collection name: " + name);
    }
    return directory.resolve(name + EXTENSION);
  }

  private void move(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
