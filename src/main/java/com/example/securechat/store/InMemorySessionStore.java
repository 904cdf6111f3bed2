package com.example.securechat.store;

import com.example.securechat.config.ChatProperties;
import com.example.securechat.domain.EncryptionMetadata;
import com.example.securechat.domain.MessageRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import static com.example.securechat.store.SessionStoreSupport.*;

/**
 * Non-durable {@link SessionStore} kept in a {@link ConcurrentHashMap}.
 * Each session entry is its own monitor, so the ownership check and the write
 * happen under one lock, mirroring the row lock of the JPA store.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "chat.store", name = "type", havingValue = "memory")
public class InMemorySessionStore implements SessionStore {

    private final ConcurrentHashMap<UUID, Entry> sessions = new ConcurrentHashMap<>();
    private final AtomicLong messageIds = new AtomicLong();
    private final String defaultTitle;
    private final Clock clock;

    public InMemorySessionStore(ChatProperties properties, Clock clock) {
        this.defaultTitle = properties.getTitle().getDefaultTitle();
        this.clock = clock;
    }

    private static final class Entry {
        final UUID id;
        final String ownerId;
        final Instant createdAt;
        final List<StoredMessage> messages = new ArrayList<>();
        String title;
        Instant updatedAt;
        byte[] encryptedData;
        EncryptionMetadata dataMetadata;
        boolean deleted;

        Entry(UUID id, String ownerId, String title, Instant now) {
            this.id = id;
            this.ownerId = ownerId;
            this.title = title;
            this.createdAt = now;
            this.updatedAt = now;
        }

        SessionSummary summary() {
            return new SessionSummary(id, title, createdAt, updatedAt, (long) messages.size());
        }
    }

    private Entry owned(UUID sessionId, String ownerId) {
        if (sessionId == null || ownerId == null) {
            return null;
        }
        Entry entry = sessions.get(sessionId);
        return entry != null && entry.ownerId.equals(ownerId) ? entry : null;
    }

    @Override
    public UUID createSession(String ownerId, String title) {
        requireOwner(ownerId);
        UUID id = UUID.randomUUID();
        sessions.put(id, new Entry(id, ownerId, initialTitle(title, defaultTitle), clock.instant()));
        log.info("Owner {} started session {}", ownerId, id);
        return id;
    }

    @Override
    public Optional<SessionSummary> getSession(UUID sessionId, String ownerId) {
        Entry entry = owned(sessionId, ownerId);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            return entry.deleted ? Optional.empty() : Optional.of(entry.summary());
        }
    }

    @Override
    public List<SessionSummary> listSessions(String ownerId, int limit, int offset) {
        requireOwner(ownerId);
        requireWindow(limit, offset);
        List<SessionSummary> all = new ArrayList<>();
        for (Entry entry : sessions.values()) {
            if (!entry.ownerId.equals(ownerId)) {
                continue;
            }
            synchronized (entry) {
                if (!entry.deleted) {
                    all.add(entry.summary());
                }
            }
        }
        return all.stream()
                .sorted(Comparator.comparing(SessionSummary::updatedAt).reversed()
                        .thenComparing(Comparator.comparing(SessionSummary::createdAt).reversed()))
                .skip(offset)
                .limit(cap(limit))
                .toList();
    }

    @Override
    public boolean deleteSession(UUID sessionId, String ownerId) {
        Entry entry = owned(sessionId, ownerId);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            if (entry.deleted) {
                return false;
            }
            entry.deleted = true;
            entry.messages.clear();
            sessions.remove(sessionId, entry);
        }
        log.info("Session {} deleted by owner {}", sessionId, ownerId);
        return true;
    }

    @Override
    public boolean updateTitle(UUID sessionId, String ownerId, String title) {
        String newTitle = requireTitle(title);
        Entry entry = owned(sessionId, ownerId);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            if (entry.deleted) {
                return false;
            }
            entry.title = newTitle;
            entry.updatedAt = clock.instant();
            return true;
        }
    }

    @Override
    public StoredMessage appendMessage(UUID sessionId, String ownerId, NewMessage message) {
        Entry entry = owned(sessionId, ownerId);
        if (entry == null) {
            throw denied(sessionId, ownerId);
        }
        synchronized (entry) {
            if (entry.deleted) {
                throw denied(sessionId, ownerId);
            }
            boolean firstUserTurn = message.role() == MessageRole.USER
                    && entry.messages.stream().noneMatch(m -> m.role() == MessageRole.USER);
            Instant now = clock.instant();
            StoredMessage stored = new StoredMessage(
                    messageIds.incrementAndGet(),
                    sessionId,
                    message.role(),
                    message.ciphertext(),
                    message.metadata(),
                    message.contentHash(),
                    message.messageData(),
                    now);
            entry.messages.add(stored);
            entry.updatedAt = now;
            if (firstUserTurn && message.titleCandidate() != null && defaultTitle.equals(entry.title)) {
                entry.title = message.titleCandidate();
            }
            return stored;
        }
    }

    @Override
    public List<StoredMessage> listMessages(UUID sessionId, String ownerId) {
        Entry entry = owned(sessionId, ownerId);
        if (entry == null) {
            throw denied(sessionId, ownerId);
        }
        synchronized (entry) {
            if (entry.deleted) {
                throw denied(sessionId, ownerId);
            }
            return List.copyOf(entry.messages);
        }
    }

    @Override
    public boolean updateSessionData(UUID sessionId, String ownerId, byte[] encryptedData, EncryptionMetadata metadata) {
        Entry entry = owned(sessionId, ownerId);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            if (entry.deleted) {
                return false;
            }
            entry.encryptedData = encryptedData == null ? null : encryptedData.clone();
            entry.dataMetadata = metadata;
            entry.updatedAt = clock.instant();
            return true;
        }
    }

    @Override
    public Optional<SessionData> getSessionData(UUID sessionId, String ownerId) {
        Entry entry = owned(sessionId, ownerId);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            return entry.deleted
                    ? Optional.empty()
                    : Optional.of(new SessionData(entry.encryptedData, entry.dataMetadata));
        }
    }
}
