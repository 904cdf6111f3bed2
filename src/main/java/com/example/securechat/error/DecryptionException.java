package com.example.securechat.error;

/**
 * Ciphertext could not be opened: missing or malformed nonce, wrong key, or a
 * failed authentication tag.
 */
public class DecryptionException extends SecureChatException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "decryption_error";
    }
}
