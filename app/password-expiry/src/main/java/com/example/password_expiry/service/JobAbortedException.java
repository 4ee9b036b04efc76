package com.example.password_expiry.service;

/** Stops a job run before or during processing; reported as the single fatal log entry. */
class JobAbortedException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  JobAbortedException(String message) {
    super(message);
  }

  JobAbortedException(String message, Throwable cause) {
    super(message, cause);
  }
}
