package com.example.password_expiry.service;

import com.example.password_expiry.model.DirectoryUser;
import com.example.password_expiry.model.ExpiryState;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/** Placeholders accepted in subject and body templates, written as {@code {{token}}}. */
public enum TemplatePlaceholder {
  USER_DISPLAY_NAME("user.displayName"),
  USER_PRINCIPAL_NAME("user.userPrincipalName"),
  DAYS_UNTIL_EXPIRY("daysUntilExpiry"),
  EXPIRY_DATE("expiryDate");

  static final String NEVER = "Never";

  private final String token;

  TemplatePlaceholder(String token) {
    this.token = token;
  }

  public String token() {
    return token;
  }

  static Optional<TemplatePlaceholder> fromToken(String token) {
    for (TemplatePlaceholder placeholder : values()) {
      if (placeholder.token.equals(token)) {
        return Optional.of(placeholder);
      }
    }
    return Optional.empty();
  }

  String resolve(DirectoryUser user, ExpiryState state, DateTimeFormatter dateFormat) {
    return switch (this) {
      case USER_DISPLAY_NAME -> nullToEmpty(user.displayName());
      case USER_PRINCIPAL_NAME -> nullToEmpty(user.principalName());
      case DAYS_UNTIL_EXPIRY -> String.valueOf(state.daysRemaining());
      case EXPIRY_DATE ->
          state.neverExpires() || state.expiresAt() == null
              ? NEVER
              : dateFormat.format(state.expiresAt());
    };
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
