package com.example.securechat.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Everything needed to open one ciphertext besides the key itself.
 *
 * @param algorithm cipher tag; unknown tags are rejected while binding
 * @param keyId     selects the key through {@link com.example.securechat.crypto.KeyProvider}
 * @param iv        base64 nonce, unique per encryption under a key
 * @param createdAt provenance timestamp (ISO-8601)
 */
public record EncryptionMetadata(
        @JsonProperty("algorithm") EncryptionAlgorithm algorithm,
        @JsonProperty("key_id") String keyId,
        @JsonProperty("iv") String iv,
        @JsonProperty("created_at") String createdAt) {

    @JsonIgnore
    public boolean hasIv() {
        return iv != null && !iv.isBlank();
    }
}
