package com.example.securechat.api.dto;

import com.example.securechat.store.SessionSummary;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Session row for the session list: no message content, only the count.
 */
public record ChatSessionDto(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("updated_at") String updatedAt,
        @JsonProperty("message_count") long messageCount) {

    public static ChatSessionDto from(SessionSummary s) {
        String created = s.createdAt() != null ? s.createdAt().toString() : null;
        String updated = s.updatedAt() != null ? s.updatedAt().toString() : created;
        return new ChatSessionDto(
                s.id().toString(),
                s.title(),
                created,
                updated,
                s.messageCount() == null ? 0L : s.messageCount());
    }
}
