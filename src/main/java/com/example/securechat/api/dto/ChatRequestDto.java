package com.example.securechat.api.dto;

import com.example.securechat.domain.EncryptionMetadata;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * One encrypted user turn. {@code session_id} is omitted to start a new session.
 */
public record ChatRequestDto(
        @JsonProperty("encrypted_message") @NotBlank String encryptedMessage,
        @JsonProperty("encryption_metadata") @NotNull EncryptionMetadata encryptionMetadata,
        @JsonProperty("content_hash") @NotBlank String contentHash,
        @JsonProperty("session_id") String sessionId) {
}
