package com.example.securechat.store;

import com.example.securechat.config.ChatProperties;
import com.example.securechat.domain.ChatMessage;
import com.example.securechat.domain.ChatSession;
import com.example.securechat.domain.EncryptionMetadata;
import com.example.securechat.domain.MessageRole;
import com.example.securechat.repository.ChatMessageRepository;
import com.example.securechat.repository.ChatSessionRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.example.securechat.store.SessionStoreSupport.*;

/**
 * Relational {@link SessionStore} on Spring Data JPA.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "chat.store", name = "type", havingValue = "jpa", matchIfMissing = true)
public class JpaSessionStore implements SessionStore {

    private static final String SUMMARY_SELECT =
            "select new com.example.securechat.store.SessionSummary("
                    + "s.id, s.title, s.createdAt, s.updatedAt, count(m.id)) "
                    + "from ChatSession s left join ChatMessage m on m.session = s ";
    private static final String SUMMARY_GROUP = " group by s.id, s.title, s.createdAt, s.updatedAt";

    private final ChatSessionRepository sessionRepository;
    private final ChatMessageRepository messageRepository;
    private final String defaultTitle;
    private final Clock clock;

    @PersistenceContext
    private EntityManager entityManager;

    public JpaSessionStore(ChatSessionRepository sessionRepository,
                           ChatMessageRepository messageRepository,
                           ChatProperties properties,
                           Clock clock) {
        this.sessionRepository = sessionRepository;
        this.messageRepository = messageRepository;
        this.defaultTitle = properties.getTitle().getDefaultTitle();
        this.clock = clock;
    }

    /* -------------------- Session life-cycle -------------------- */

    @Override
    @Transactional
    public UUID createSession(String ownerId, String title) {
        requireOwner(ownerId);
        ChatSession session = sessionRepository.save(
                new ChatSession(ownerId, initialTitle(title, defaultTitle), clock.instant()));
        log.info("Owner {} started session {} (title='{}')", ownerId, session.getId(), session.getTitle());
        return session.getId();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SessionSummary> getSession(UUID sessionId, String ownerId) {
        if (sessionId == null || ownerId == null) {
            return Optional.empty();
        }
        return entityManager.createQuery(
                        SUMMARY_SELECT + "where s.id = :id and s.ownerId = :ownerId" + SUMMARY_GROUP,
                        SessionSummary.class)
                .setParameter("id", sessionId)
                .setParameter("ownerId", ownerId)
                .getResultStream()
                .findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SessionSummary> listSessions(String ownerId, int limit, int offset) {
        requireOwner(ownerId);
        requireWindow(limit, offset);
        return entityManager.createQuery(
                        SUMMARY_SELECT + "where s.ownerId = :ownerId" + SUMMARY_GROUP
                                + " order by s.updatedAt desc, s.createdAt desc",
                        SessionSummary.class)
                .setParameter("ownerId", ownerId)
                .setFirstResult(offset)
                .setMaxResults(cap(limit))
                .getResultList();
    }

    @Override
    @Transactional
    public boolean deleteSession(UUID sessionId, String ownerId) {
        Optional<ChatSession> session = lockOwned(sessionId, ownerId);
        if (session.isEmpty()) {
            return false;
        }
        int removed = messageRepository.deleteAllBySessionId(sessionId);
        sessionRepository.delete(session.get());
        log.info("Session {} deleted by owner {} ({} messages)", sessionId, ownerId, removed);
        return true;
    }

    @Override
    @Transactional
    public boolean updateTitle(UUID sessionId, String ownerId, String title) {
        String newTitle = requireTitle(title);
        Optional<ChatSession> session = lockOwned(sessionId, ownerId);
        if (session.isEmpty()) {
            return false;
        }
        session.get().setTitle(newTitle);
        session.get().touch(clock.instant());
        return true;
    }

    /* -------------------- Messages -------------------- */

    @Override
    @Transactional
    public StoredMessage appendMessage(UUID sessionId, String ownerId, NewMessage message) {
        ChatSession session = lockOwned(sessionId, ownerId)
                .orElseThrow(() -> denied(sessionId, ownerId));

        boolean firstUserTurn = message.role() == MessageRole.USER
                && messageRepository.countBySession_IdAndRole(sessionId, MessageRole.USER) == 0;

        Instant now = clock.instant();
        ChatMessage saved = messageRepository.save(ChatMessage.builder()
                .session(session)
                .role(message.role())
                .encryptedContent(message.ciphertext())
                .encryptionMetadata(message.metadata())
                .contentHash(message.contentHash())
                .messageData(message.messageData())
                .createdAt(now)
                .build());

        session.touch(now);
        if (firstUserTurn && message.titleCandidate() != null && defaultTitle.equals(session.getTitle())) {
            session.setTitle(message.titleCandidate());
            log.debug("Session {}: title derived from first user message", sessionId);
        }
        log.debug("Session {}: stored {} message {} ({} bytes)",
                sessionId, message.role().wireName(), saved.getId(), message.ciphertext().length);
        return toStored(saved, sessionId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoredMessage> listMessages(UUID sessionId, String ownerId) {
        if (sessionId == null || ownerId == null || sessionRepository.findByIdAndOwnerId(sessionId, ownerId).isEmpty()) {
            throw denied(sessionId, ownerId);
        }
        return messageRepository.findBySession_IdOrderByCreatedAtAscIdAsc(sessionId).stream()
                .map(m -> toStored(m, sessionId))
                .toList();
    }

    /* -------------------- Session data -------------------- */

    @Override
    @Transactional
    public boolean updateSessionData(UUID sessionId, String ownerId, byte[] encryptedData, EncryptionMetadata metadata) {
        Optional<ChatSession> session = lockOwned(sessionId, ownerId);
        if (session.isEmpty()) {
            return false;
        }
        session.get().setEncryptedSessionData(encryptedData);
        session.get().setSessionEncryptionMetadata(metadata);
        session.get().touch(clock.instant());
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SessionData> getSessionData(UUID sessionId, String ownerId) {
        if (sessionId == null || ownerId == null) {
            return Optional.empty();
        }
        return sessionRepository.findByIdAndOwnerId(sessionId, ownerId)
                .map(s -> new SessionData(s.getEncryptedSessionData(), s.getSessionEncryptionMetadata()));
    }

    private Optional<ChatSession> lockOwned(UUID sessionId, String ownerId) {
        if (sessionId == null || ownerId == null) {
            return Optional.empty();
        }
        return sessionRepository.findOwnedForUpdate(sessionId, ownerId);
    }

    private static StoredMessage toStored(ChatMessage m, UUID sessionId) {
        return new StoredMessage(
                m.getId(),
                sessionId,
                m.getRole(),
                m.getEncryptedContent(),
                m.getEncryptionMetadata(),
                m.getContentHash(),
                m.getMessageData(),
                m.getCreatedAt());
    }
}
