package com.example.securechat.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateSessionRequest(@JsonProperty("title") String title) {
}
