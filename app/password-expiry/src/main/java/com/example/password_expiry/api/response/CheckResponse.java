package com.example.password_expiry.api.response;

public record CheckResponse(boolean success, String message) {}
