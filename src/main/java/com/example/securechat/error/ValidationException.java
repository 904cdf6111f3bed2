package com.example.securechat.error;

/**
 * Malformed input: bad base64, bad identifier format, unsupported algorithm tag,
 * blank required fields.
 */
public class ValidationException extends SecureChatException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public String getCode() {
        return "validation_failed";
    }
}
