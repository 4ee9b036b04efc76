package com.example.password_expiry.model;

import java.time.Instant;

public record PreviewRow(
    String displayName,
    String principalName,
    int daysRemaining,
    Instant expiresAt,
    String groupLabel) {}
