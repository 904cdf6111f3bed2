package com.example.securechat.web;

import com.example.securechat.domain.ChatSession;
import com.example.securechat.error.MissingOwnerException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Reads the authenticated owner id that the upstream gateway places on every
 * request. The value is trusted as-is; this service does no authentication of
 * its own.
 */
@Component
public class OwnerIdResolver {

    public static final String HEADER_NAME = "X-User-Id";

    public String resolveOwnerId(HttpServletRequest req) {
        String fromHeader = req.getHeader(HEADER_NAME);
        if (fromHeader == null || fromHeader.isBlank()) {
            throw new MissingOwnerException("Missing " + HEADER_NAME + " header");
        }
        String ownerId = fromHeader.trim();
        if (ownerId.length() > ChatSession.MAX_OWNER_ID_LENGTH) {
            throw new MissingOwnerException(HEADER_NAME + " is too long");
        }
        return ownerId;
    }
}
