package com.example.securechat.store;

import com.example.securechat.domain.EncryptionMetadata;
import com.example.securechat.domain.MessageRole;

import java.util.Map;

/**
 * A message about to be appended.
 *
 * @param titleCandidate title derived from the decrypted text by the caller, or {@code null}
 */
public record NewMessage(
        MessageRole role,
        byte[] ciphertext,
        EncryptionMetadata metadata,
        String contentHash,
        Map<String, Object> messageData,
        String titleCandidate) {

    public NewMessage {
        if (role == null || ciphertext == null || metadata == null || contentHash == null) {
            throw new IllegalArgumentException("role, ciphertext, metadata and contentHash are required");
        }
    }
}
