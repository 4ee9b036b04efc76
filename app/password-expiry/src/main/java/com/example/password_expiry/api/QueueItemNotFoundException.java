package com.example.password_expiry.api;

public class QueueItemNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public QueueItemNotFoundException(String id) {
    super("queue item not found: " + id);
  }
}
