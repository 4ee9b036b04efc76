package com.example.password_expiry.api;

import com.example.password_expiry.model.NotificationProfile;
import com.example.password_expiry.service.ProfileService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/profiles")
@RequiredArgsConstructor
public class ProfileController {

  private final ProfileService profileService;

  @GetMapping
  public List<NotificationProfile> list() {
    return profileService.list();
  }

  @GetMapping("/{id}")
  public NotificationProfile get(@PathVariable("id") String id) {
    return profileService.get(id);
  }

  @PostMapping
  public ResponseEntity<NotificationProfile> create(@RequestBody NotificationProfile profile) {
    return ResponseEntity.status(HttpStatus.CREATED).body(profileService.create(profile));
  }

  @PutMapping("/{id}")
  public NotificationProfile replace(
      @PathVariable("id") String id, @RequestBody NotificationProfile profile) {
    return profileService.replace(id, profile);
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable("id") String id) {
    profileService.delete(id);
    return ResponseEntity.noContent().build();
  }
}
