package com.example.securechat.api.dto;

import com.example.securechat.crypto.Base64Fields;
import com.example.securechat.domain.EncryptionMetadata;
import com.example.securechat.domain.MessageRole;
import com.example.securechat.store.StoredMessage;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ChatMessageDto(
        @JsonProperty("id") String id,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("sender_type") MessageRole senderType,
        @JsonProperty("encrypted_content") String encryptedContent,
        @JsonProperty("encryption_metadata") EncryptionMetadata encryptionMetadata,
        @JsonProperty("content_hash") String contentHash,
        @JsonProperty("message_data") Map<String, Object> messageData,
        @JsonProperty("created_at") String createdAt) {

    public static ChatMessageDto from(StoredMessage m) {
        return new ChatMessageDto(
                String.valueOf(m.id()),
                m.sessionId().toString(),
                m.role(),
                Base64Fields.encode(m.ciphertext()),
                m.metadata(),
                m.contentHash(),
                m.messageData(),
                m.createdAt() == null ? null : m.createdAt().toString());
    }
}
