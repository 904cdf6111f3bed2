package com.example.securechat.service;

import com.example.securechat.config.ChatProperties;
import com.example.securechat.crypto.ContentHasher;
import com.example.securechat.crypto.EncryptedPayload;
import com.example.securechat.crypto.EncryptionCodec;
import com.example.securechat.domain.MessageRole;
import com.example.securechat.error.GenerationUnavailableException;
import com.example.securechat.error.ValidationException;
import com.example.securechat.generation.GenerationClient;
import com.example.securechat.generation.GenerationRequest;
import com.example.securechat.generation.GenerationRequest.HistoryTurn;
import com.example.securechat.generation.GenerationResult;
import com.example.securechat.store.NewMessage;
import com.example.securechat.store.SessionStore;
import com.example.securechat.store.StoredMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs one chat turn: verify and store the encrypted user turn, rebuild the
 * plaintext transcript, ask the generation backend, then encrypt, hash and
 * store the reply.
 *
 * <p>This is the only place plaintext exists, and only for the duration of a
 * call. Each store call is its own transaction, so a stored user turn survives
 * a failed or cancelled generation step. A generation failure never fails the
 * turn: the configured fallback text is encrypted and stored instead.</p>
 */
@Slf4j
@Service
public class ChatTurnService {

    static final String SOURCES_KEY = "sources";

    private final SessionStore sessionStore;
    private final EncryptionCodec codec;
    private final ContentHasher hasher;
    private final GenerationClient generationClient;
    private final TitleDeriver titleDeriver;
    private final String fallbackMessage;
    private final int maxTokens;

    public ChatTurnService(SessionStore sessionStore,
                           EncryptionCodec codec,
                           ContentHasher hasher,
                           GenerationClient generationClient,
                           TitleDeriver titleDeriver,
                           ChatProperties properties) {
        this.sessionStore = sessionStore;
        this.codec = codec;
        this.hasher = hasher;
        this.generationClient = generationClient;
        this.titleDeriver = titleDeriver;
        this.fallbackMessage = properties.getFallbackMessage();
        this.maxTokens = properties.getGeneration().getMaxTokens();
    }

    public ChatTurnResult handleTurn(ChatTurnCommand command) {
        if (command.ciphertext() == null || command.ciphertext().length == 0) {
            throw new ValidationException("encrypted_message", "encrypted_message is required");
        }
        if (command.metadata() == null) {
            throw new ValidationException("encryption_metadata", "encryption_metadata is required");
        }

        // 1) Received: reject tampered or undecryptable input before anything is written
        hasher.requireValid(command.ciphertext(), command.contentHash(), "inbound message");
        String userText = codec.decrypt(command.ciphertext(), command.metadata());

        // 2) Stored(user-turn)
        UUID sessionId = command.sessionId();
        if (sessionId == null) {
            sessionId = sessionStore.createSession(command.ownerId(), null);
        }
        StoredMessage userTurn = sessionStore.appendMessage(sessionId, command.ownerId(), new NewMessage(
                MessageRole.USER,
                command.ciphertext(),
                command.metadata(),
                hasher.computeHash(command.ciphertext()),
                null,
                titleDeriver.derive(userText)));

        // 3) ContextBuilt
        List<HistoryTurn> history = buildHistory(sessionId, command.ownerId(), userTurn.id());

        // 4) GenerationAttempted
        GenerationResult reply = generateOrFallback(sessionId, userText, history);

        // 5) Stored(bot-turn): same key id and algorithm as the request, fresh nonce
        EncryptedPayload encrypted = codec.encrypt(reply.answer(), command.metadata());
        String hash = hasher.computeHash(encrypted.ciphertext());
        Map<String, Object> messageData = reply.sources().isEmpty()
                ? null
                : Map.of(SOURCES_KEY, reply.sources());
        sessionStore.appendMessage(sessionId, command.ownerId(), new NewMessage(
                MessageRole.BOT, encrypted.ciphertext(), encrypted.metadata(), hash, messageData, null));

        // 6) Returned
        log.info("Session {}: turn complete ({} history turns, {} sources)",
                sessionId, history.size(), reply.sources().size());
        return new ChatTurnResult(sessionId, encrypted.ciphertext(), encrypted.metadata(), hash, reply.sources());
    }

    /**
     * Encrypted messages of a session for display, each checked against its
     * stored hash.
     */
    public List<StoredMessage> history(UUID sessionId, String ownerId) {
        List<StoredMessage> messages = sessionStore.listMessages(sessionId, ownerId);
        for (StoredMessage m : messages) {
            hasher.requireValid(m.ciphertext(), m.contentHash(), "stored message " + m.id());
        }
        return messages;
    }

    /**
     * Decrypts every message stored before the current user turn with its own
     * metadata; turns appended later by a concurrent request are left out. Any failure aborts
     * the turn; a partial transcript is never sent.
     */
    private List<HistoryTurn> buildHistory(UUID sessionId, String ownerId, Long currentMessageId) {
        List<HistoryTurn> history = new ArrayList<>();
        for (StoredMessage m : sessionStore.listMessages(sessionId, ownerId)) {
            if (m.id().equals(currentMessageId)) {
                break;
            }
            if (m.metadata() == null) {
                continue;
            }
            hasher.requireValid(m.ciphertext(), m.contentHash(), "stored message " + m.id());
            history.add(new HistoryTurn(m.role().wireName(), codec.decrypt(m.ciphertext(), m.metadata())));
        }
        return history;
    }

    private GenerationResult generateOrFallback(UUID sessionId, String query, List<HistoryTurn> history) {
        try {
            return generationClient.generate(new GenerationRequest(query, history, maxTokens));
        } catch (GenerationUnavailableException e) {
            log.warn("Session {}: generation unavailable (status={}): {} - using fallback reply",
                    sessionId, e.getStatus(), e.getMessage());
            return new GenerationResult(fallbackMessage, List.of());
        }
    }
}
