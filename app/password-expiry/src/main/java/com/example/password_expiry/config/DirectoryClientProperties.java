package com.example.password_expiry.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "password-expiry.directory")
public record DirectoryClientProperties(
    String graphBaseUrl,
    String loginBaseUrl,
    String scope,
    int pageSize,
    Duration connectTimeout,
    Duration readTimeout) {

  public DirectoryClientProperties {
    graphBaseUrl =
        graphBaseUrl == null || graphBaseUrl.isBlank()
            ? "https://graph.microsoft.com/v1.0"
            : stripTrailingSlash(graphBaseUrl);
    loginBaseUrl =
        loginBaseUrl == null || loginBaseUrl.isBlank()
            ? "https://login.microsoftonline.com"
            : stripTrailingSlash(loginBaseUrl);
    scope = scope == null || scope.isBlank() ? "https://graph.microsoft.com/.default" : scope;
    pageSize = pageSize <= 0 ? 999 : pageSize;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
