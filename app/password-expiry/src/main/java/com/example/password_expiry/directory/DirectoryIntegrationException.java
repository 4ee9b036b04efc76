package com.example.password_expiry.directory;

public class DirectoryIntegrationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public enum Reason {
    NOT_CONFIGURED,
    UNAUTHORIZED,
    FORBIDDEN,
    NOT_FOUND,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public DirectoryIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public DirectoryIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
