package com.example.securechat.store;

import com.example.securechat.domain.EncryptionMetadata;

/**
 * Session-level encrypted blob; both parts are {@code null} until a client stores one.
 */
public record SessionData(byte[] encryptedData, EncryptionMetadata metadata) {

    public SessionData {
        encryptedData = encryptedData == null ? null : encryptedData.clone();
    }

    @Override
    public byte[] encryptedData() {
        return encryptedData == null ? null : encryptedData.clone();
    }
}
