package me.golemcore.support.adapter.outbound.store;

import me.golemcore.support.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.support.domain.model.Conversation;
import me.golemcore.support.domain.model.ConversationStatus;
import me.golemcore.support.domain.model.Message;
import me.golemcore.support.infrastructure.config.AutoConfiguration;
import me.golemcore.support.infrastructure.config.SupportProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LocalConversationStoreAdapterTest {

    private static final String CONVERSATION_ID = "conv-1";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private SupportProperties properties;
    private LocalConversationStoreAdapter store;

    @BeforeEach
    void setUp() {
        properties = new SupportProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        store = newStore(storage);
    }

    @Test
    void getOrCreateConversation_createsActiveConversationOnce() {
        Conversation created = store.getOrCreateConversation(CONVERSATION_ID);
        Conversation again = store.getOrCreateConversation(CONVERSATION_ID);

        assertEquals(ConversationStatus.ACTIVE, created.getStatus());
        assertEquals(NOW, created.getCreatedAt());
        assertEquals(created.getId(), again.getId());
        assertTrue(Files.exists(tempDir.resolve("conversations").resolve(CONVERSATION_ID)
                .resolve("conversation.json")));
    }

    @Test
    void findConversation_missingIsEmpty() {
        assertTrue(store.findConversation("unknown").isEmpty());
    }

    @Test
    void saveConversation_persistsStatusAndCustomer() {
        Conversation conversation = store.getOrCreateConversation(CONVERSATION_ID);
        conversation.setStatus(ConversationStatus.ESCALATED);
        conversation.setCustomerId("cust-001");

        store.saveConversation(conversation);

        Conversation loaded = store.findConversation(CONVERSATION_ID).orElseThrow();
        assertEquals(ConversationStatus.ESCALATED, loaded.getStatus());
        assertEquals("cust-001", loaded.getCustomerId());
    }

    @Test
    void insertMessage_assignsIncreasingSequence() {
        Message first = store.insertMessage(CONVERSATION_ID, Message.ROLE_USER, "hello", Map.of());
        Message second = store.insertMessage(CONVERSATION_ID, Message.ROLE_ASSISTANT, "hi",
                Map.of(Message.META_AGENT_TYPE, "faq"));

        assertEquals(1, first.getSequence());
        assertEquals(2, second.getSequence());
        assertEquals(2, store.countMessages(CONVERSATION_ID));
    }

    @Test
    void loadRecentMessages_returnsNewestInChronologicalOrder() {
        for (int i = 1; i <= 5; i++) {
            store.insertMessage(CONVERSATION_ID, Message.ROLE_USER, "message " + i, null);
        }

        List<Message> recent = store.loadRecentMessages(CONVERSATION_ID, 2);

        assertEquals(List.of("message 4", "message 5"), recent.stream().map(Message::getContent).toList());
        assertTrue(store.loadRecentMessages(CONVERSATION_ID, 0).isEmpty());
    }

    @Test
    void insertMessage_sequenceSurvivesRestart() {
        store.insertMessage(CONVERSATION_ID, Message.ROLE_USER, "before restart", Map.of());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        LocalConversationStoreAdapter restarted = newStore(storage);

        Message next = restarted.insertMessage(CONVERSATION_ID, Message.ROLE_ASSISTANT, "after restart", Map.of());

        assertEquals(2, next.getSequence());
        assertEquals("before restart", restarted.loadRecentMessages(CONVERSATION_ID, 10).get(0).getContent());
    }

    @Test
    void loadRecentMessages_skipsTornLine() throws Exception {
        store.insertMessage(CONVERSATION_ID, Message.ROLE_USER, "intact", Map.of());
        Path messages = tempDir.resolve("conversations").resolve(CONVERSATION_ID).resolve("messages.jsonl");
        Files.writeString(messages, "{\"id\":\"broken", java.nio.file.StandardOpenOption.APPEND);

        List<Message> loaded = store.loadRecentMessages(CONVERSATION_ID, 10);

        assertEquals(1, loaded.size());
        assertEquals("intact", loaded.get(0).getContent());
    }

    @Test
    void insertMessage_afterTornLineKeepsNewMessage() throws Exception {
        store.insertMessage(CONVERSATION_ID, Message.ROLE_USER, "first", Map.of());
        Path messages = tempDir.resolve("conversations").resolve(CONVERSATION_ID).resolve("messages.jsonl");
        Files.writeString(messages, "{\"id\":\"broken", java.nio.file.StandardOpenOption.APPEND);

        Message second = store.insertMessage(CONVERSATION_ID, Message.ROLE_USER, "second", Map.of());

        assertEquals(2, second.getSequence());
        List<String> contents = store.loadRecentMessages(CONVERSATION_ID, 10).stream()
                .map(Message::getContent)
                .toList();
        assertEquals(List.of("first", "second"), contents);
    }

    @Test
    void insertMessage_sequenceCacheStaysBoundedAcrossConversations() {
        int conversations = LocalConversationStoreAdapter.SEQUENCE_CACHE_SIZE + 20;
        for (int i = 0; i < conversations; i++) {
            store.insertMessage("conv-" + i, Message.ROLE_USER, "hello", Map.of());
        }

        assertEquals(LocalConversationStoreAdapter.SEQUENCE_CACHE_SIZE, store.cachedSequenceCount());
        Message next = store.insertMessage("conv-0", Message.ROLE_ASSISTANT, "hi", Map.of());
        assertEquals(2, next.getSequence());
    }

    @Test
    void deleteMessages_resetsHistory() {
        store.insertMessage(CONVERSATION_ID, Message.ROLE_USER, "hello", Map.of());

        store.deleteMessages(CONVERSATION_ID);

        assertEquals(0, store.countMessages(CONVERSATION_ID));
        assertEquals(1, store.insertMessage(CONVERSATION_ID, Message.ROLE_USER, "again", Map.of()).getSequence());
        assertEquals(1, store.cachedSequenceCount());
    }

    @Test
    void insertMessage_concurrentWritersGetDistinctSequences() throws Exception {
        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int i = 0; i < writers; i++) {
                int n = i;
                executor.submit(() -> {
                    start.await();
                    return store.insertMessage(CONVERSATION_ID, Message.ROLE_USER, "writer " + n, Map.of());
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }

        List<Message> all = store.loadRecentMessages(CONVERSATION_ID, 100);
        assertEquals(writers, all.size());
        assertEquals(writers, all.stream().map(Message::getSequence).distinct().count());
    }

    @Test
    void rejectsInvalidConversationId() {
        assertThrows(IllegalArgumentException.class, () -> store.getOrCreateConversation("../escape"));
    }

    private LocalConversationStoreAdapter newStore(LocalStorageAdapter storage) {
        return new LocalConversationStoreAdapter(storage, properties, AutoConfiguration.objectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
