package com.example.securechat.store;

import com.example.securechat.domain.EncryptionMetadata;
import com.example.securechat.domain.MessageRole;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A message as written. Ciphertext is copied in and out, so a stored message
 * cannot be changed through a reference handed to a caller.
 */
public record StoredMessage(
        Long id,
        UUID sessionId,
        MessageRole role,
        byte[] ciphertext,
        EncryptionMetadata metadata,
        String contentHash,
        Map<String, Object> messageData,
        Instant createdAt) {

    public StoredMessage {
        ciphertext = ciphertext == null ? null : ciphertext.clone();
        messageData = messageData == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(messageData));
    }

    @Override
    public byte[] ciphertext() {
        return ciphertext == null ? null : ciphertext.clone();
    }
}
