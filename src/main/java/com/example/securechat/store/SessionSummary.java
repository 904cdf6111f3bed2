package com.example.securechat.store;

import java.time.Instant;
import java.util.UUID;

public record SessionSummary(
        UUID id,
        String title,
        Instant createdAt,
        Instant updatedAt,
        Long messageCount) {
}
