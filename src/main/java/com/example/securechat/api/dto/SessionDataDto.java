package com.example.securechat.api.dto;

import com.example.securechat.domain.EncryptionMetadata;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Session-level encrypted blob, base64 on the wire.
 */
public record SessionDataDto(
        @JsonProperty("encrypted_session_data") @NotBlank String encryptedSessionData,
        @JsonProperty("session_encryption_metadata") @NotNull EncryptionMetadata sessionEncryptionMetadata) {
}
