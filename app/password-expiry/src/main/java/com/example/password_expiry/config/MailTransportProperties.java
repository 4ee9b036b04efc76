package com.example.password_expiry.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "password-expiry.mail")
public record MailTransportProperties(Duration connectionTimeout, Duration timeout) {

  public MailTransportProperties {
    connectionTimeout = connectionTimeout == null ? Duration.ofSeconds(10) : connectionTimeout;
    timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
  }
}
