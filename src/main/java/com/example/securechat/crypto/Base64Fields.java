package com.example.securechat.crypto;

import com.example.securechat.error.ValidationException;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.Base64;

/**
 * Base64 transport encoding for binary request fields.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Base64Fields {

    public static String encode(byte[] data) {
        return data == null ? null : Base64.getEncoder().encodeToString(data);
    }

    /**
     * @throws ValidationException when {@code value} is blank or not base64
     */
    public static byte[] decode(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " is required");
        }
        try {
            return Base64.getDecoder().decode(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field, field + " is not valid base64", e);
        }
    }
}
