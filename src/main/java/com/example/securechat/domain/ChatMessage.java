package com.example.securechat.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Map;

/**
 * One encrypted turn. Rows are append-only: nothing is updated after insert.
 */
@Entity
@Table(name = "chat_messages", indexes = {
        @Index(name = "ix_chat_messages_content_hash", columnList = "content_hash"),
        @Index(name = "ix_chat_messages_session_created", columnList = "session_id, created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class ChatMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false, updatable = false)
    private ChatSession session;

    @Column(name = "sender_type", nullable = false, updatable = false, length = 20)
    private MessageRole role;

    @Lob
    @Column(name = "encrypted_content", nullable = false, updatable = false)
    private byte[] encryptedContent;

    @Convert(converter = EncryptionMetadataConverter.class)
    @Column(name = "encryption_metadata", nullable = false, updatable = false, length = 1024)
    private EncryptionMetadata encryptionMetadata;

    @Column(name = "content_hash", nullable = false, updatable = false, length = 64)
    private String contentHash;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "message_data", updatable = false, length = 8192)
    private Map<String, Object> messageData;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
