package com.example.securechat.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SessionHistoryDto(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("history") List<ChatMessageDto> history) {
}
