package com.example.securechat.crypto;

import com.example.securechat.domain.EncryptionMetadata;

/**
 * Ciphertext plus the metadata required to open it again.
 */
public record EncryptedPayload(byte[] ciphertext, EncryptionMetadata metadata) {
}
