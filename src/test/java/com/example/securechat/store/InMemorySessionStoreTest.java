package com.example.securechat.store;

import com.example.securechat.MutableClock;
import com.example.securechat.TestCrypto;
import com.example.securechat.domain.ChatSession;
import com.example.securechat.domain.EncryptionAlgorithm;
import com.example.securechat.domain.EncryptionMetadata;
import com.example.securechat.domain.MessageRole;
import com.example.securechat.error.SessionAccessDeniedException;
import com.example.securechat.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySessionStoreTest {

    private static final EncryptionMetadata META =
            new EncryptionMetadata(EncryptionAlgorithm.AES_256_GCM, "flutter_app_key", "AAAAAAAAAAAAAAAA", null);

    private MutableClock clock;
    private InMemorySessionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-09-01T12:00:00Z"));
        store = new InMemorySessionStore(TestCrypto.properties(), clock);
    }

    private static NewMessage message(MessageRole role, String body, String titleCandidate) {
        return new NewMessage(role, body.getBytes(StandardCharsets.UTF_8), META, "ab".repeat(32), null, titleCandidate);
    }

    @Test
    void createWithoutTitleUsesDefault() {
        UUID id = store.createSession("alice", null);

        SessionSummary summary = store.getSession(id, "alice").orElseThrow();
        assertThat(summary.title()).isEqualTo("New Chat Session");
        assertThat(summary.messageCount()).isZero();
        assertThat(summary.createdAt()).isEqualTo(summary.updatedAt());
    }

    @Test
    void createRejectsBlankOwnerAndOverlongTitle() {
        assertThatThrownBy(() -> store.createSession(" ", null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.createSession("alice", "x".repeat(256)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void sessionsAreInvisibleToOtherOwners() {
        UUID id = store.createSession("alice", "mine");

        assertThat(store.getSession(id, "bob")).isEmpty();
        assertThat(store.listSessions("bob", 50, 0)).isEmpty();
        assertThat(store.updateTitle(id, "bob", "stolen")).isFalse();
        assertThat(store.deleteSession(id, "bob")).isFalse();
        assertThat(store.getSessionData(id, "bob")).isEmpty();
        assertThatThrownBy(() -> store.listMessages(id, "bob")).isInstanceOf(SessionAccessDeniedException.class);
        assertThatThrownBy(() -> store.appendMessage(id, "bob", message(MessageRole.USER, "x", null)))
                .isInstanceOf(SessionAccessDeniedException.class);

        assertThat(store.getSession(id, "alice").orElseThrow().title()).isEqualTo("mine");
    }

    @Test
    void unknownSessionBehavesLikeForeignSession() {
        UUID unknown = UUID.randomUUID();

        assertThat(store.getSession(unknown, "alice")).isEmpty();
        assertThatThrownBy(() -> store.listMessages(unknown, "alice"))
                .isInstanceOf(SessionAccessDeniedException.class);
    }

    @Test
    void messagesComeBackInInsertionOrderAndTouchTheSession() {
        UUID id = store.createSession("alice", null);
        clock.advance(Duration.ofSeconds(1));
        store.appendMessage(id, "alice", message(MessageRole.USER, "one", null));
        clock.advance(Duration.ofSeconds(1));
        StoredMessage second = store.appendMessage(id, "alice", message(MessageRole.BOT, "two", null));

        List<StoredMessage> messages = store.listMessages(id, "alice");
        assertThat(messages).extracting(m -> new String(m.ciphertext(), StandardCharsets.UTF_8))
                .containsExactly("one", "two");
        assertThat(messages.get(0).id()).isLessThan(messages.get(1).id());
        assertThat(store.getSession(id, "alice").orElseThrow().updatedAt()).isEqualTo(second.createdAt());
    }

    @Test
    void storedCiphertextIsACopy() {
        UUID id = store.createSession("alice", null);
        byte[] body = "hello".getBytes(StandardCharsets.UTF_8);
        store.appendMessage(id, "alice", new NewMessage(MessageRole.USER, body, META, "ab".repeat(32), null, null));

        body[0] = 'X';

        assertThat(new String(store.listMessages(id, "alice").get(0).ciphertext(), StandardCharsets.UTF_8))
                .isEqualTo("hello");
    }

    @Test
    void firstUserMessageReplacesOnlyTheDefaultTitle() {
        UUID fresh = store.createSession("alice", null);
        UUID named = store.createSession("alice", "Named");

        store.appendMessage(fresh, "alice", message(MessageRole.USER, "a", "Derived"));
        store.appendMessage(fresh, "alice", message(MessageRole.USER, "b", "Later"));
        store.appendMessage(named, "alice", message(MessageRole.USER, "a", "Derived"));

        assertThat(store.getSession(fresh, "alice").orElseThrow().title()).isEqualTo("Derived");
        assertThat(store.getSession(named, "alice").orElseThrow().title()).isEqualTo("Named");
    }

    @Test
    void listIsNewestFirstAndPaged() {
        UUID first = store.createSession("alice", "first");
        clock.advance(Duration.ofMinutes(1));
        UUID second = store.createSession("alice", "second");
        clock.advance(Duration.ofMinutes(1));
        UUID third = store.createSession("alice", "third");
        clock.advance(Duration.ofMinutes(1));
        store.appendMessage(first, "alice", message(MessageRole.USER, "bump", null));

        assertThat(store.listSessions("alice", 50, 0)).extracting(SessionSummary::id)
                .containsExactly(first, third, second);
        assertThat(store.listSessions("alice", 1, 1)).extracting(SessionSummary::id).containsExactly(third);
        assertThat(store.listSessions("alice", 50, 5)).isEmpty();
        assertThatThrownBy(() -> store.listSessions("alice", 0, 0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.listSessions("alice", 10, -1)).isInstanceOf(ValidationException.class);
    }

    @Test
    void deleteRemovesSessionAndMessages() {
        UUID id = store.createSession("alice", null);
        store.appendMessage(id, "alice", message(MessageRole.USER, "x", null));

        assertThat(store.deleteSession(id, "alice")).isTrue();

        assertThat(store.getSession(id, "alice")).isEmpty();
        assertThat(store.deleteSession(id, "alice")).isFalse();
        assertThatThrownBy(() -> store.listMessages(id, "alice")).isInstanceOf(SessionAccessDeniedException.class);
    }

    @Test
    void updateTitleTrimsAndRejectsBlank() {
        UUID id = store.createSession("alice", null);

        assertThat(store.updateTitle(id, "alice", "  Renamed  ")).isTrue();
        assertThat(store.getSession(id, "alice").orElseThrow().title()).isEqualTo("Renamed");
        assertThatThrownBy(() -> store.updateTitle(id, "alice", "   ")).isInstanceOf(ValidationException.class);
    }

    @Test
    void sessionDataRoundTripsForOwnerOnly() {
        UUID id = store.createSession("alice", null);
        assertThat(store.getSessionData(id, "alice").orElseThrow().encryptedData()).isNull();

        byte[] blob = {1, 2, 3};
        assertThat(store.updateSessionData(id, "alice", blob, META)).isTrue();
        assertThat(store.updateSessionData(id, "bob", blob, META)).isFalse();

        SessionData data = store.getSessionData(id, "alice").orElseThrow();
        assertThat(data.encryptedData()).containsExactly(1, 2, 3);
        assertThat(data.metadata()).isEqualTo(META);
    }

    @Test
    void messageDataIsKeptAsGiven() {
        UUID id = store.createSession("alice", null);
        store.appendMessage(id, "alice", new NewMessage(MessageRole.BOT, new byte[]{1}, META, "ab".repeat(32),
                Map.of("sources", List.of("a.md")), null));

        assertThat(store.listMessages(id, "alice").get(0).messageData()).containsEntry("sources", List.of("a.md"));
    }

    @Test
    void concurrentAppendsAreAllKept() throws Exception {
        UUID id = store.createSession("alice", null);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<StoredMessage>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 200; i++) {
                String body = "m" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return store.appendMessage(id, "alice", message(MessageRole.USER, body, null));
                }));
            }
            start.countDown();
            for (Future<StoredMessage> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<StoredMessage> messages = store.listMessages(id, "alice");
        assertThat(messages).hasSize(200);
        assertThat(messages).extracting(StoredMessage::id).doesNotHaveDuplicates().isSorted();
        assertThat(store.getSession(id, "alice").orElseThrow().messageCount()).isEqualTo(200L);
    }

    @Test
    void returnedCiphertextCannotRewriteStoredMessage() {
        UUID id = store.createSession("alice", null);
        StoredMessage returned = store.appendMessage(id, "alice", message(MessageRole.USER, "hello", null));

        returned.ciphertext()[0] = 'X';
        store.listMessages(id, "alice").get(0).ciphertext()[1] = 'Y';

        StoredMessage reread = store.listMessages(id, "alice").get(0);
        assertThat(new String(reread.ciphertext(), StandardCharsets.UTF_8)).isEqualTo("hello");
    }

    @Test
    void returnedSessionDataCannotRewriteStoredBlob() {
        UUID id = store.createSession("alice", null);
        store.updateSessionData(id, "alice", new byte[]{1, 2, 3}, META);

        store.getSessionData(id, "alice").orElseThrow().encryptedData()[0] = 9;

        assertThat(store.getSessionData(id, "alice").orElseThrow().encryptedData()).containsExactly(1, 2, 3);
    }

    @Test
    void messageDataIsDetachedFromCallersMap() {
        UUID id = store.createSession("alice", null);
        Map<String, Object> data = new HashMap<>();
        data.put("sources", List.of("a.md"));
        store.appendMessage(id, "alice", new NewMessage(MessageRole.BOT, new byte[]{1}, META, "ab".repeat(32),
                data, null));

        data.put("sources", List.of("tampered.md"));

        Map<String, Object> stored = store.listMessages(id, "alice").get(0).messageData();
        assertThat(stored).containsEntry("sources", List.of("a.md"));
        assertThatThrownBy(() -> stored.put("extra", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void overlongOwnerIdIsRejected() {
        String owner = "o".repeat(ChatSession.MAX_OWNER_ID_LENGTH + 1);

        assertThatThrownBy(() -> store.createSession(owner, null)).isInstanceOf(ValidationException.class);
        assertThat(store.createSession("o".repeat(ChatSession.MAX_OWNER_ID_LENGTH), null)).isNotNull();
    }
}
