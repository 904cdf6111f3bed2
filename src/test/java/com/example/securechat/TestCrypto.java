package com.example.securechat;

import com.example.securechat.config.ChatProperties;
import com.example.securechat.crypto.ConfiguredKeyProvider;
import com.example.securechat.crypto.ContentHasher;
import com.example.securechat.crypto.EncryptedPayload;
import com.example.securechat.crypto.EncryptionCodec;
import com.example.securechat.domain.EncryptionAlgorithm;
import com.example.securechat.domain.EncryptionMetadata;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Plays the client side in tests: encrypts and hashes user turns with the
 * default key table.
 */
public final class TestCrypto {

    public static final String CLIENT_KEY_ID = "flutter_app_key";
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2025-09-01T12:00:00Z"), ZoneOffset.UTC);

    private TestCrypto() {
    }

    public static ChatProperties properties() {
        return new ChatProperties();
    }

    public static EncryptionCodec codec() {
        return new EncryptionCodec(new ConfiguredKeyProvider(properties()), CLOCK);
    }

    public static ContentHasher hasher() {
        return new ContentHasher();
    }

    /** Metadata shape a client sends before it has a nonce of its own. */
    public static EncryptionMetadata clientMetadata() {
        return new EncryptionMetadata(EncryptionAlgorithm.AES_256_GCM, CLIENT_KEY_ID, null, "2025-09-01T11:59:00Z");
    }

    public static EncryptedPayload encrypt(String plaintext) {
        return codec().encrypt(plaintext, clientMetadata());
    }
}
