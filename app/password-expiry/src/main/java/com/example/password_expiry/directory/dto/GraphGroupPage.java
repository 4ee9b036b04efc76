package com.example.password_expiry.directory.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphGroupPage(List<GraphGroup> value) {}
