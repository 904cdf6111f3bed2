package com.example.securechat.api.dto;

import com.example.securechat.crypto.Base64Fields;
import com.example.securechat.domain.EncryptionMetadata;
import com.example.securechat.service.ChatTurnResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ChatResponseDto(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("encrypted_response") String encryptedResponse,
        @JsonProperty("encryption_metadata") EncryptionMetadata encryptionMetadata,
        @JsonProperty("content_hash") String contentHash,
        @JsonProperty("sources") List<String> sources) {

    public static ChatResponseDto from(ChatTurnResult result) {
        return new ChatResponseDto(
                result.sessionId().toString(),
                Base64Fields.encode(result.ciphertext()),
                result.metadata(),
                result.contentHash(),
                result.sources());
    }
}
