package com.example.securechat.store;

import com.example.securechat.domain.ChatSession;
import com.example.securechat.error.SessionAccessDeniedException;
import com.example.securechat.error.ValidationException;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * Argument rules shared by the store implementations.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class SessionStoreSupport {

    static final int MAX_TITLE_LENGTH = ChatSession.MAX_TITLE_LENGTH;
    static final int MAX_PAGE_SIZE = 100;

    static String requireOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("owner_id", "Owner id is required");
        }
        if (ownerId.length() > ChatSession.MAX_OWNER_ID_LENGTH) {
            throw new ValidationException("owner_id",
                    "Owner id must be at most " + ChatSession.MAX_OWNER_ID_LENGTH + " characters");
        }
        return ownerId;
    }

    static String initialTitle(String title, String defaultTitle) {
        if (title == null || title.isBlank()) {
            return defaultTitle;
        }
        return requireTitle(title);
    }

    static String requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("title", "Title must not be blank");
        }
        String trimmed = title.trim();
        if (trimmed.length() > MAX_TITLE_LENGTH) {
            throw new ValidationException("title", "Title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        return trimmed;
    }

    static void requireWindow(int limit, int offset) {
        if (limit <= 0) {
            throw new ValidationException("limit", "limit must be positive");
        }
        if (offset < 0) {
            throw new ValidationException("offset", "offset must not be negative");
        }
    }

    static int cap(int limit) {
        return Math.min(limit, MAX_PAGE_SIZE);
    }

    static SessionAccessDeniedException denied(UUID sessionId, String ownerId) {
        log.debug("Session {} not found or not owned by {}", sessionId, ownerId);
        return new SessionAccessDeniedException(sessionId);
    }
}
