/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.support.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.domain.model.Conversation;
import me.golemcore.support.domain.model.ConversationStatus;
import me.golemcore.support.domain.model.ConversationSummary;
import me.golemcore.support.domain.model.Message;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.port.outbound.CachePort;
import me.golemcore.support.port.outbound.ConversationStorePort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sliding-window conversation memory over a durable store and a volatile
 * cache.
 *
 * <p>
 * Reads go cache first; a miss loads the most recent {@code window-size}
 * messages from the store and caches them for {@code cache-ttl}. Every write
 * goes to the store and then deletes the cache entry; the cache is never
 * patched in place.
 *
 * <p>
 * Store failures surface as
 * {@link me.golemcore.support.domain.exception.StorageUnavailableException}.
 * Cache failures are treated as misses.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationMemoryService {

    private static final String CONTEXT_SUFFIX = ":context";

    private final ConversationStorePort conversationStore;
    private final CachePort cache;
    private final SupportProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Returns the configured window of recent messages in chronological order.
     */
    public List<Message> getContext(String conversationId) {
        return getContext(conversationId, windowSize());
    }

    /**
     * Returns up to {@code limit} most recent messages in chronological order.
     * The result never exceeds the configured window size.
     */
    public List<Message> getContext(String conversationId, int limit) {
        String id = ConversationIdValidator.normalizeOrThrow(conversationId);
        int window = windowSize();
        int effectiveLimit = Math.min(limit, window);
        if (effectiveLimit <= 0) {
            return List.of();
        }

        String key = cacheKey(id);
        List<Message> messages = readCachedWindow(key, window)
                .orElseGet(() -> loadAndCache(id, key, window));
        return tail(messages, effectiveLimit);
    }

    /**
     * Appends a message to durable storage and invalidates the cached window.
     *
     * @return the stored message
     */
    public Message append(String conversationId, String role, String content, Map<String, Object> metadata) {
        String id = ConversationIdValidator.normalizeOrThrow(conversationId);
        if (!Message.isValidRole(role)) {
            throw new IllegalArgumentException("Unsupported message role: " + role);
        }
        if (content == null) {
            throw new IllegalArgumentException("Message content must not be null");
        }

        Message stored = conversationStore.insertMessage(id, role, content, metadata);
        cache.delete(cacheKey(id));
        log.debug("[Memory] Appended {} message #{} to {}", role, stored.getSequence(), id);
        return stored;
    }

    public Conversation getOrCreateConversation(String conversationId) {
        return conversationStore.getOrCreateConversation(ConversationIdValidator.normalizeOrThrow(conversationId));
    }

    public Optional<Conversation> findConversation(String conversationId) {
        return conversationStore.findConversation(ConversationIdValidator.normalizeOrThrow(conversationId));
    }

    /**
     * Links the conversation to a customer if it is not linked yet.
     */
    public void linkCustomer(String conversationId, String customerId, String customerEmail) {
        Conversation conversation = getOrCreateConversation(conversationId);
        if (customerId == null || customerId.equals(conversation.getCustomerId())) {
            return;
        }
        if (conversation.getCustomerId() != null) {
            log.warn("[Memory] Conversation {} already linked to customer {}, keeping it", conversation.getId(),
                    conversation.getCustomerId());
            return;
        }
        conversation.setCustomerId(customerId);
        conversation.setCustomerEmail(customerEmail);
        conversationStore.saveConversation(conversation);
        log.info("[Memory] Linked conversation {} to customer {}", conversation.getId(), customerId);
    }

    public void updateStatus(String conversationId, ConversationStatus status) {
        Conversation conversation = getOrCreateConversation(conversationId);
        if (conversation.getStatus() == status) {
            return;
        }
        log.info("[Memory] Conversation {} status {} -> {}", conversation.getId(), conversation.getStatus(), status);
        conversation.setStatus(status);
        conversationStore.saveConversation(conversation);
    }

    public void closeConversation(String conversationId) {
        updateStatus(conversationId, ConversationStatus.CLOSED);
    }

    public Optional<ConversationSummary> getSummary(String conversationId) {
        return findConversation(conversationId).map(conversation -> {
            List<Message> last = conversationStore.loadRecentMessages(conversation.getId(), 1);
            Instant updatedAt = conversation.getUpdatedAt();
            if (!last.isEmpty() && last.get(0).getTimestamp() != null
                    && (updatedAt == null || last.get(0).getTimestamp().isAfter(updatedAt))) {
                updatedAt = last.get(0).getTimestamp();
            }
            return ConversationSummary.builder()
                    .conversationId(conversation.getId())
                    .status(conversation.getStatus())
                    .customerId(conversation.getCustomerId())
                    .messageCount(conversationStore.countMessages(conversation.getId()))
                    .createdAt(conversation.getCreatedAt())
                    .updatedAt(updatedAt)
                    .build();
        });
    }

    /**
     * Deletes every message of the conversation. The conversation itself stays.
     */
    public void clear(String conversationId) {
        String id = ConversationIdValidator.normalizeOrThrow(conversationId);
        conversationStore.deleteMessages(id);
        cache.delete(cacheKey(id));
        log.info("[Memory] Cleared history of {}", id);
    }

    String cacheKey(String conversationId) {
        return properties.getMemory().getCacheKeyPrefix() + conversationId + CONTEXT_SUFFIX;
    }

    private Optional<List<Message>> readCachedWindow(String key, int window) {
        Optional<String> cached = cache.get(key);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        try {
            CachedWindow value = objectMapper.readValue(cached.get(), CachedWindow.class);
            if (value.windowSize() != window || value.messages() == null) {
                return Optional.empty();
            }
            log.trace("[Memory] Cache hit for {}", key);
            return Optional.of(value.messages());
        } catch (JsonProcessingException e) {
            log.warn("[Memory] Dropping unreadable cache entry {}: {}", key, e.getOriginalMessage());
            cache.delete(key);
            return Optional.empty();
        }
    }

    private List<Message> loadAndCache(String id, String key, int window) {
        List<Message> loaded = new ArrayList<>(conversationStore.loadRecentMessages(id, window));
        loaded.sort(Message.CHRONOLOGICAL);
        try {
            String json = objectMapper.writeValueAsString(new CachedWindow(window, loaded));
            cache.set(key, json, Duration.ofSeconds(properties.getMemory().getCacheTtlSeconds()));
        } catch (JsonProcessingException e) {
            log.warn("[Memory] Failed to cache context window for {}: {}", id, e.getOriginalMessage());
        }
        return loaded;
    }

    private int windowSize() {
        return Math.max(1, properties.getMemory().getWindowSize());
    }

    private static List<Message> tail(List<Message> messages, int limit) {
        int from = Math.max(0, messages.size() - limit);
        return List.copyOf(messages.subList(from, messages.size()));
    }

    /**
     * Cached value: the window size it was loaded for and the messages.
     */
    record CachedWindow(int windowSize, List<Message> messages) {
    }
}
