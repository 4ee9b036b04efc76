package com.example.password_expiry.directory;

import com.example.password_expiry.config.DirectoryClientProperties;
import com.example.password_expiry.model.AppSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
@RequiredArgsConstructor
public class GraphDirectoryClientFactory implements DirectoryClientFactory {

  private final RestClient directoryRestClient;
  private final DirectoryClientProperties properties;

  @Override
  public DirectoryClient create(AppSettings settings) {
    if (settings == null || !settings.hasDirectoryCredentials()) {
      throw new DirectoryIntegrationException(
          DirectoryIntegrationException.Reason.NOT_CONFIGURED,
          "directory credentials (tenant id, client id, client secret) are not configured");
    }
    return new GraphDirectoryClient(
        directoryRestClient,
        properties,
        settings.tenantId(),
        settings.clientId(),
        settings.clientSecret());
  }
}
