package com.example.password_expiry.api.response;

import com.example.password_expiry.service.DirectoryUserView;
import java.time.Instant;

public record DirectoryUserResponse(
    String id,
    String displayName,
    String userPrincipalName,
    boolean accountEnabled,
    boolean onPremisesSyncEnabled,
    Instant passwordLastSetAt,
    boolean neverExpires,
    int daysRemaining,
    Instant expiresAt) {

  public static DirectoryUserResponse from(DirectoryUserView view) {
    return new DirectoryUserResponse(
        view.user().id(),
        view.user().displayName(),
        view.user().principalName(),
        view.user().accountEnabled(),
        view.user().onPremisesSyncEnabled(),
        view.expiry().referenceAt(),
        view.expiry().neverExpires(),
        view.expiry().daysRemaining(),
        view.expiry().expiresAt());
  }
}
