package com.example.securechat.store;

import com.example.securechat.domain.EncryptionMetadata;
import com.example.securechat.error.SessionAccessDeniedException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable, ownership-scoped storage of sessions and encrypted messages.
 *
 * <p>Implementations never see plaintext. A session that exists but belongs to
 * another owner is treated exactly like a session that does not exist, and every
 * mutation performs its ownership check in the same transaction as the write.</p>
 */
public interface SessionStore {

    /**
     * @param title optional; blank means the default placeholder title
     * @return id of the new session
     */
    UUID createSession(String ownerId, String title);

    Optional<SessionSummary> getSession(UUID sessionId, String ownerId);

    /**
     * Sessions of {@code ownerId}, most recently updated first, each with its
     * message count.
     */
    List<SessionSummary> listSessions(String ownerId, int limit, int offset);

    /**
     * Removes the session and all its messages.
     *
     * @return {@code false} when the session is missing or not owned
     */
    boolean deleteSession(UUID sessionId, String ownerId);

    /**
     * @return {@code false} when the session is missing or not owned
     */
    boolean updateTitle(UUID sessionId, String ownerId, String title);

    /**
     * Appends one message and bumps the session's update time. The message's
     * title candidate is applied only to the first user message of a session
     * that still carries the default title.
     *
     * @throws SessionAccessDeniedException when the session is missing or not owned
     */
    StoredMessage appendMessage(UUID sessionId, String ownerId, NewMessage message);

    /**
     * @return messages in insertion order
     * @throws SessionAccessDeniedException when the session is missing or not owned
     */
    List<StoredMessage> listMessages(UUID sessionId, String ownerId);

    /**
     * Replaces the session-level encrypted blob.
     *
     * @return {@code false} when the session is missing or not owned
     */
    boolean updateSessionData(UUID sessionId, String ownerId, byte[] encryptedData, EncryptionMetadata metadata);

    Optional<SessionData> getSessionData(UUID sessionId, String ownerId);
}
