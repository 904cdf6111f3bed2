package com.example.securechat.error;

import java.util.UUID;

/**
 * The session does not exist or belongs to someone else.
 * Both cases are reported the same way.
 */
public class SessionAccessDeniedException extends SecureChatException {

    public static final String MESSAGE = "Session not found or access denied";

    private final UUID sessionId;

    public SessionAccessDeniedException(UUID sessionId) {
        super(MESSAGE);
        this.sessionId = sessionId;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    @Override
    public String getCode() {
        return "forbidden";
    }
}
