package com.example.securechat.error;

/**
 * The request arrived without an authenticated owner id.
 */
public class MissingOwnerException extends SecureChatException {

    public MissingOwnerException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "unauthenticated";
    }
}
