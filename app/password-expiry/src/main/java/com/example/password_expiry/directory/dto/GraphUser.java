package com.example.password_expiry.directory.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphUser(
    String id,
    String displayName,
    String userPrincipalName,
    Boolean accountEnabled,
    String passwordPolicies,
    Instant lastPasswordChangeDateTime,
    Instant createdDateTime,
    Boolean onPremisesSyncEnabled) {}
