package com.example.password_expiry.directory;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Outcome of probing the directory with the configured application credentials. */
public record PermissionCheck(
    boolean authenticated, boolean canReadUsers, boolean canReadGroups, String message) {

  @JsonProperty("success")
  public boolean success() {
    return authenticated && canReadUsers && canReadGroups;
  }
}
