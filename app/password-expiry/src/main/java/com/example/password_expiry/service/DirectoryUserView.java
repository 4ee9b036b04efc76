package com.example.password_expiry.service;

import com.example.password_expiry.model.DirectoryUser;
import com.example.password_expiry.model.ExpiryState;

public record DirectoryUserView(DirectoryUser user, ExpiryState expiry) {}
