package com.example.securechat.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One conversation thread. Owned by exactly one user; its messages share that
 * owner and are removed together with it by the session store.
 */
@Entity
@Table(name = "chat_sessions", indexes = {
        @Index(name = "ix_chat_sessions_owner_updated", columnList = "owner_id, updated_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatSession {

    public static final int MAX_OWNER_ID_LENGTH = 128;
    public static final int MAX_TITLE_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false, length = MAX_OWNER_ID_LENGTH)
    private String ownerId;

    @Column(nullable = false, length = MAX_TITLE_LENGTH)
    private String title;

    /** Optional client-encrypted blob describing the whole session. */
    @Lob
    @Column(name = "encrypted_session_data")
    private byte[] encryptedSessionData;

    @Convert(converter = EncryptionMetadataConverter.class)
    @Column(name = "session_encryption_metadata", length = 1024)
    private EncryptionMetadata sessionEncryptionMetadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public ChatSession(String ownerId, String title, Instant now) {
        this.ownerId = ownerId;
        this.title = title;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public void touch(Instant now) {
        this.updatedAt = now;
    }
}
