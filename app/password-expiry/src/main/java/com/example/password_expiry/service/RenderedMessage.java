package com.example.password_expiry.service;

public record RenderedMessage(String subject, String body) {}
