package com.example.password_expiry.model;

public enum JobLogLevel {
  INFO,
  WARN,
  ERROR,
  SUCCESS,
  SKIP,
  QUEUE
}
