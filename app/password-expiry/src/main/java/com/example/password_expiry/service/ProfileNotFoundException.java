package com.example.password_expiry.service;

public class ProfileNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ProfileNotFoundException(String profileId) {
    super("profile not found: " + profileId);
  }
}
