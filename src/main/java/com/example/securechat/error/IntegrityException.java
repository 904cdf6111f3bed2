package com.example.securechat.error;

/**
 * SHA-256 over the ciphertext does not match the hash that travels with it.
 */
public class IntegrityException extends SecureChatException {

    public IntegrityException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "integrity_error";
    }
}
