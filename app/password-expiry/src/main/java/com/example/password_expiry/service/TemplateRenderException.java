package com.example.password_expiry.service;

/** Raised when a template references a placeholder that cannot be resolved. */
public class TemplateRenderException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public TemplateRenderException(String message) {
    super(message);
  }
}
