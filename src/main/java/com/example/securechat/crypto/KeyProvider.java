package com.example.securechat.crypto;

import javax.crypto.SecretKey;

/**
 * Resolves the symmetric key behind a {@code key_id}. Swap the implementation
 * to plug in a real key-management service.
 */
public interface KeyProvider {

    /**
     * @param keyId opaque id from the message metadata, may be {@code null}
     * @return a key of the length the cipher expects, never {@code null}
     */
    SecretKey resolve(String keyId);
}
