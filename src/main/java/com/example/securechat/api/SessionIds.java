package com.example.securechat.api;

import com.example.securechat.error.ValidationException;

import java.util.UUID;

final class SessionIds {

    private SessionIds() {
    }

    static UUID parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("session_id", "session_id is required");
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("session_id", "Invalid session id format: " + raw, e);
        }
    }

    /** {@code null} for an absent id, meaning "start a new session". */
    static UUID parseOptional(String raw) {
        return raw == null || raw.isBlank() ? null : parse(raw);
    }
}
