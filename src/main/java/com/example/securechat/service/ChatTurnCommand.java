package com.example.securechat.service;

import com.example.securechat.domain.EncryptionMetadata;

import java.util.UUID;

/**
 * One user turn as handed over by the routing layer.
 *
 * @param sessionId {@code null} to start a new session
 */
public record ChatTurnCommand(
        String ownerId,
        UUID sessionId,
        byte[] ciphertext,
        EncryptionMetadata metadata,
        String contentHash) {
}
