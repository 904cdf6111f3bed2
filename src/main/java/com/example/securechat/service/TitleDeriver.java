package com.example.securechat.service;

import com.example.securechat.config.ChatProperties;
import com.example.securechat.domain.ChatSession;
import org.springframework.stereotype.Component;

/**
 * Builds a session title from the first user message.
 */
@Component
public class TitleDeriver {

    static final String ELLIPSIS = "...";
    static final int MAX_DERIVED_LENGTH = ChatSession.MAX_TITLE_LENGTH - ELLIPSIS.length();

    private final int maxLength;

    public TitleDeriver(ChatProperties properties) {
        // derived titles must still fit the title column
        this.maxLength = Math.max(1, Math.min(properties.getTitle().getMaxLength(), MAX_DERIVED_LENGTH));
    }

    /**
     * @return the collapsed text, cut to the maximum length with {@value #ELLIPSIS}
     *         appended when longer, or {@code null} for blank text
     */
    public String derive(String plaintext) {
        if (plaintext == null) {
            return null;
        }
        String collapsed = plaintext.strip().replaceAll("\\s+", " ");
        if (collapsed.isEmpty()) {
            return null;
        }
        if (collapsed.length() <= maxLength) {
            return collapsed;
        }
        int end = maxLength;
        // do not split a surrogate pair
        if (Character.isHighSurrogate(collapsed.charAt(end - 1))) {
            end--;
        }
        return collapsed.substring(0, end).stripTrailing() + ELLIPSIS;
    }
}
