package com.example.securechat.domain;

import com.example.securechat.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of ciphers the codec can open. The wire tag is what clients send
 * in {@code encryption_metadata.algorithm}.
 */
public enum EncryptionAlgorithm {

    AES_256_GCM("AES-256-GCM", "AES/GCM/NoPadding", 32, 12, 128);

    private final String tag;
    private final String transformation;
    private final int keyLength;
    private final int nonceLength;
    private final int tagBits;

    EncryptionAlgorithm(String tag, String transformation, int keyLength, int nonceLength, int tagBits) {
        this.tag = tag;
        this.transformation = transformation;
        this.keyLength = keyLength;
        this.nonceLength = nonceLength;
        this.tagBits = tagBits;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public String transformation() {
        return transformation;
    }

    /** Key length in bytes. */
    public int keyLength() {
        return keyLength;
    }

    /** Nonce length in bytes. */
    public int nonceLength() {
        return nonceLength;
    }

    public int tagBits() {
        return tagBits;
    }

    @JsonCreator
    public static EncryptionAlgorithm fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new ValidationException("algorithm", "Encryption algorithm is required");
        }
        for (EncryptionAlgorithm a : values()) {
            if (a.tag.equalsIgnoreCase(tag.trim())) {
                return a;
            }
        }
        throw new ValidationException("algorithm", "Unsupported encryption algorithm: " + tag);
    }
}
