package com.example.securechat.service;

import com.example.securechat.domain.EncryptionMetadata;

import java.util.List;
import java.util.UUID;

/**
 * The stored, encrypted bot reply of a turn.
 */
public record ChatTurnResult(
        UUID sessionId,
        byte[] ciphertext,
        EncryptionMetadata metadata,
        String contentHash,
        List<String> sources) {
}
