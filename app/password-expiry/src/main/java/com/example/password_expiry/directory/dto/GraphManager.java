package com.example.password_expiry.directory.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphManager(String id, String mail, String userPrincipalName) {}
