package me.golemcore.support.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.support.adapter.outbound.cache.InMemoryCacheAdapter;
import me.golemcore.support.domain.exception.StorageUnavailableException;
import me.golemcore.support.domain.model.Conversation;
import me.golemcore.support.domain.model.ConversationStatus;
import me.golemcore.support.domain.model.Message;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.port.outbound.CachePort;
import me.golemcore.support.port.outbound.ConversationStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ConversationMemoryServiceTest {

    private static final String CONVERSATION_ID = "conv-1";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ConversationStorePort store;
    private CachePort cache;
    private SupportProperties properties;
    private ConversationMemoryService service;

    @BeforeEach
    void setUp() {
        store = mock(ConversationStorePort.class);
        cache = spy(new InMemoryCacheAdapter(Clock.fixed(NOW, ZoneOffset.UTC)));
        properties = new SupportProperties();
        properties.getMemory().setWindowSize(3);
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        service = new ConversationMemoryService(store, cache, properties, objectMapper);
    }

    @Test
    void getContext_returnsWindowInChronologicalOrder() {
        when(store.loadRecentMessages(CONVERSATION_ID, 3)).thenReturn(new ArrayList<>(List.of(
                message(5, Message.ROLE_ASSISTANT), message(3, Message.ROLE_ASSISTANT), message(4, Message.ROLE_USER))));

        List<Message> context = service.getContext(CONVERSATION_ID);

        assertEquals(List.of(3L, 4L, 5L), context.stream().map(Message::getSequence).toList());
    }

    @Test
    void getContext_servesSecondReadFromCache() {
        when(store.loadRecentMessages(CONVERSATION_ID, 3)).thenReturn(List.of(message(1, Message.ROLE_USER)));

        service.getContext(CONVERSATION_ID);
        List<Message> cached = service.getContext(CONVERSATION_ID);

        assertEquals(1, cached.size());
        assertEquals("message 1", cached.get(0).getContent());
        verify(store, times(1)).loadRecentMessages(CONVERSATION_ID, 3);
    }

    @Test
    void getContext_limitNeverExceedsWindow() {
        when(store.loadRecentMessages(CONVERSATION_ID, 3)).thenReturn(List.of(
                message(1, Message.ROLE_USER), message(2, Message.ROLE_ASSISTANT), message(3, Message.ROLE_USER)));

        assertEquals(3, service.getContext(CONVERSATION_ID, 50).size());
        assertEquals(List.of(2L, 3L),
                service.getContext(CONVERSATION_ID, 2).stream().map(Message::getSequence).toList());
        assertTrue(service.getContext(CONVERSATION_ID, 0).isEmpty());
    }

    @Test
    void getContext_emptyConversationIsEmpty() {
        when(store.loadRecentMessages(CONVERSATION_ID, 3)).thenReturn(List.of());

        assertTrue(service.getContext(CONVERSATION_ID).isEmpty());
    }

    @Test
    void getContext_rejectsInvalidId() {
        assertThrows(IllegalArgumentException.class, () -> service.getContext("bad id!"));
        verifyNoInteractions(store);
    }

    @Test
    void getContext_ignoresEntryCachedForDifferentWindow() {
        when(store.loadRecentMessages(eq(CONVERSATION_ID), anyInt())).thenReturn(List.of(message(1, Message.ROLE_USER)));
        service.getContext(CONVERSATION_ID);

        properties.getMemory().setWindowSize(5);
        service.getContext(CONVERSATION_ID);

        verify(store).loadRecentMessages(CONVERSATION_ID, 3);
        verify(store).loadRecentMessages(CONVERSATION_ID, 5);
    }

    @Test
    void getContext_unreadableCacheEntryIsAMiss() {
        cache.set(service.cacheKey(CONVERSATION_ID), "not json", java.time.Duration.ofMinutes(5));
        when(store.loadRecentMessages(CONVERSATION_ID, 3)).thenReturn(List.of(message(1, Message.ROLE_USER)));

        assertEquals(1, service.getContext(CONVERSATION_ID).size());
    }

    @Test
    void append_writesStoreThenInvalidatesCache() {
        when(store.loadRecentMessages(CONVERSATION_ID, 3)).thenReturn(List.of(message(1, Message.ROLE_USER)));
        service.getContext(CONVERSATION_ID);
        when(store.insertMessage(CONVERSATION_ID, Message.ROLE_ASSISTANT, "hi", Map.of()))
                .thenReturn(message(2, Message.ROLE_ASSISTANT));

        service.append(CONVERSATION_ID, Message.ROLE_ASSISTANT, "hi", Map.of());

        assertTrue(cache.get(service.cacheKey(CONVERSATION_ID)).isEmpty());
        var inOrder = inOrder(store, cache);
        inOrder.verify(store).insertMessage(CONVERSATION_ID, Message.ROLE_ASSISTANT, "hi", Map.of());
        inOrder.verify(cache).delete(service.cacheKey(CONVERSATION_ID));
    }

    @Test
    void append_storeFailureLeavesCacheUntouched() {
        when(store.insertMessage(anyString(), anyString(), anyString(), any()))
                .thenThrow(new StorageUnavailableException("down", null));

        assertThrows(StorageUnavailableException.class,
                () -> service.append(CONVERSATION_ID, Message.ROLE_USER, "hello", Map.of()));
        verify(cache, never()).delete(anyString());
    }

    @Test
    void append_rejectsUnknownRoleAndNullContent() {
        assertThrows(IllegalArgumentException.class,
                () -> service.append(CONVERSATION_ID, "robot", "hello", Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> service.append(CONVERSATION_ID, Message.ROLE_USER, null, Map.of()));
        verifyNoInteractions(store);
    }

    @Test
    void linkCustomer_keepsExistingLink() {
        Conversation conversation = Conversation.builder()
                .id(CONVERSATION_ID)
                .status(ConversationStatus.ACTIVE)
                .customerId("cust-001")
                .build();
        when(store.getOrCreateConversation(CONVERSATION_ID)).thenReturn(conversation);

        service.linkCustomer(CONVERSATION_ID, "cust-002", "other@example.com");

        assertEquals("cust-001", conversation.getCustomerId());
        verify(store, never()).saveConversation(any());
    }

    @Test
    void linkCustomer_linksUnlinkedConversation() {
        Conversation conversation = Conversation.builder().id(CONVERSATION_ID).status(ConversationStatus.ACTIVE)
                .build();
        when(store.getOrCreateConversation(CONVERSATION_ID)).thenReturn(conversation);

        service.linkCustomer(CONVERSATION_ID, "cust-001", "john.smith@techstartup.com");

        assertEquals("cust-001", conversation.getCustomerId());
        verify(store).saveConversation(conversation);
    }

    @Test
    void updateStatus_skipsWriteWhenUnchanged() {
        Conversation conversation = Conversation.builder().id(CONVERSATION_ID).status(ConversationStatus.ACTIVE)
                .build();
        when(store.getOrCreateConversation(CONVERSATION_ID)).thenReturn(conversation);

        service.updateStatus(CONVERSATION_ID, ConversationStatus.ACTIVE);
        verify(store, never()).saveConversation(any());

        service.closeConversation(CONVERSATION_ID);
        assertEquals(ConversationStatus.CLOSED, conversation.getStatus());
        verify(store).saveConversation(conversation);
    }

    @Test
    void getSummary_countsMessages() {
        Conversation conversation = Conversation.builder()
                .id(CONVERSATION_ID)
                .status(ConversationStatus.ESCALATED)
                .createdAt(NOW.minusSeconds(60))
                .updatedAt(NOW.minusSeconds(60))
                .build();
        when(store.findConversation(CONVERSATION_ID)).thenReturn(Optional.of(conversation));
        when(store.loadRecentMessages(CONVERSATION_ID, 1)).thenReturn(List.of(message(4, Message.ROLE_ASSISTANT)));
        when(store.countMessages(CONVERSATION_ID)).thenReturn(4L);

        var summary = service.getSummary(CONVERSATION_ID).orElseThrow();

        assertEquals(4L, summary.getMessageCount());
        assertEquals(ConversationStatus.ESCALATED, summary.getStatus());
        assertEquals(NOW, summary.getUpdatedAt());
    }

    @Test
    void clear_deletesMessagesAndCache() {
        cache.set(service.cacheKey(CONVERSATION_ID), "{}", java.time.Duration.ofMinutes(5));

        service.clear(CONVERSATION_ID);

        verify(store).deleteMessages(CONVERSATION_ID);
        assertTrue(cache.get(service.cacheKey(CONVERSATION_ID)).isEmpty());
    }

    private static Message message(long sequence, String role) {
        return Message.builder()
                .id("m" + sequence)
                .conversationId(CONVERSATION_ID)
                .role(role)
                .content("message " + sequence)
                .timestamp(NOW)
                .sequence(sequence)
                .build();
    }
}
