package com.example.securechat.domain;

import com.example.securechat.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageRole {
    USER("user"),
    BOT("bot");

    private final String wireName;

    MessageRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static MessageRole fromWireName(String value) {
        if (value != null) {
            for (MessageRole r : values()) {
                if (r.wireName.equalsIgnoreCase(value.trim())) {
                    return r;
                }
            }
        }
        throw new ValidationException("sender_type", "Unknown sender role: " + value);
    }
}
