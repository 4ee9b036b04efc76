/*
 * どこで: Password expiry サービス層
 * 何を: 通知プロファイルの一覧/取得/保存/削除
 * なぜ: 保存前にテンプレートと送信日を検証し、壊れたプロファイルでジョブが止まらないようにするため
 */
package com.example.password_expiry.service;

import com.example.password_expiry.model.NotificationProfile;
import com.example.password_expiry.repository.CollectionStore;
import com.fasterxml.jackson.core.type.TypeReference;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ProfileService {

  static final String COLLECTION = "profiles";
  private static final Logger logger = LoggerFactory.getLogger(ProfileService.class);
  private static final TypeReference<List<NotificationProfile>> PROFILE_LIST =
      new TypeReference<>() {};

  private final CollectionStore store;
  private final MessageTemplateRenderer renderer;

  public synchronized List<NotificationProfile> list() {
    return List.copyOf(load());
  }

  public synchronized Optional<NotificationProfile> find(String id) {
    return load().stream().filter(profile -> id != null && id.equals(profile.id())).findFirst();
  }

  public NotificationProfile get(String id) {
    return find(id).orElseThrow(() -> new ProfileNotFoundException(id));
  }

  public synchronized NotificationProfile create(NotificationProfile profile) {
    validate(profile);
    final NotificationProfile created = profile.withId(UUID.randomUUID().toString());
    final List<NotificationProfile> profiles = load();
    profiles.add(created);
    store.save(COLLECTION, profiles);
    logger.info("notification profile created id={} name={}", created.id(), created.name());
    return created;
  }

  public synchronized NotificationProfile replace(String id, NotificationProfile profile) {
    validate(profile);
    final List<NotificationProfile> profiles = load();
    for (int i = 0; i < profiles.size(); i++) {
      if (id.equals(profiles.get(i).id())) {
        final NotificationProfile replaced = profile.withId(id);
        profiles.set(i, replaced);
        store.save(COLLECTION, profiles);
        logger.info("notification profile replaced id={} name={}", id, replaced.name());
        return replaced;
      }
    }
    throw new ProfileNotFoundException(id);
  }

  public synchronized void delete(String id) {
    final List<NotificationProfile> profiles = load();
    if (!profiles.removeIf(profile -> id.equals(profile.id()))) {
      throw new ProfileNotFoundException(id);
    }
    store.save(COLLECTION, profiles);
    logger.info("notification profile deleted id={}", id);
  }

  /**
   * @throws IllegalArgumentException for a missing name or an invalid cadence
   * @throws TemplateRenderException for an unknown placeholder
   */
  public void validate(NotificationProfile profile) {
    if (profile == null) {
      throw new IllegalArgumentException("profile is required");
    }
    if (profile.name() == null || profile.name().isBlank()) {
      throw new IllegalArgumentException("profile name is required");
    }
    if (profile.cadence().isEmpty()) {
      throw new IllegalArgumentException("profile cadence must contain at least one day");
    }
    if (profile.cadence().stream().anyMatch(day -> day < 0)) {
      throw new IllegalArgumentException("profile cadence days must not be negative");
    }
    renderer.validate(profile.subjectTemplate());
    renderer.validate(profile.emailTemplate());
  }

  private List<NotificationProfile> load() {
    return new ArrayList<>(store.load(COLLECTION, PROFILE_LIST, List::of));
  }
}
