/*
 * Where: Password expiry configuration binding
 * What: Holds the audit ledger retention window
 * Why: Keep the de-duplication history bounded per environment
 */
package com.example.password_expiry.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "password-expiry.audit")
@Validated
public record AuditProperties(@Positive int retentionDays) {}
