package com.example.password_expiry.directory;

import com.example.password_expiry.model.AppSettings;

public interface DirectoryClientFactory {

  /**
   * @throws DirectoryIntegrationException with {@code NOT_CONFIGURED} when credentials are missing
   */
  DirectoryClient create(AppSettings settings);
}
