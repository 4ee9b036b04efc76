package com.example.password_expiry.api;

import com.example.password_expiry.api.response.DirectoryUserResponse;
import com.example.password_expiry.directory.PermissionCheck;
import com.example.password_expiry.service.DirectoryQueryService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class DirectoryController {

  private final DirectoryQueryService directoryQueryService;

  @GetMapping("/api/users")
  public List<DirectoryUserResponse> users() {
    return directoryQueryService.listUsersWithExpiry().stream()
        .map(DirectoryUserResponse::from)
        .toList();
  }

  @PostMapping("/api/validate-permissions")
  public PermissionCheck validatePermissions() {
    return directoryQueryService.checkPermissions();
  }
}
