package com.example.securechat.error;

/**
 * Base type for the failures the chat store reports to its callers.
 * Each subtype carries the stable error code the REST layer exposes.
 */
public abstract class SecureChatException extends RuntimeException {

    protected SecureChatException(String message) {
        super(message);
    }

    protected SecureChatException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getCode();
}
