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

package me.golemcore.support.adapter.outbound.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.domain.exception.StorageUnavailableException;
import me.golemcore.support.domain.model.Conversation;
import me.golemcore.support.domain.model.ConversationStatus;
import me.golemcore.support.domain.model.Message;
import me.golemcore.support.domain.service.ConversationIdValidator;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.port.outbound.ConversationStorePort;
import me.golemcore.support.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Conversation store on top of {@link StoragePort}.
 *
 * <p>
 * Layout per conversation:
 * <ul>
 * <li>{@code conversations/{id}/conversation.json} - header, written
 * atomically
 * <li>{@code conversations/{id}/messages.jsonl} - one message per line,
 * append-only
 * </ul>
 *
 * <p>
 * Writes to the same conversation are serialized in-process on one of a fixed
 * set of lock stripes; sequence numbers continue from the last stored message
 * after a restart or a cache eviction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalConversationStoreAdapter implements ConversationStorePort {

    private static final String CONVERSATION_FILE = "conversation.json";
    private static final String MESSAGES_FILE = "messages.jsonl";
    private static final long IO_TIMEOUT_SECONDS = 10;
    private static final int LOCK_STRIPES = 64;
    static final int SEQUENCE_CACHE_SIZE = 512;

    private final StoragePort storagePort;
    private final SupportProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Object[] locks = newLocks();
    // Least recently used entries fall out; a miss re-reads the message log.
    private final Map<String, Long> lastSequence = Collections.synchronizedMap(
            new LinkedHashMap<String, Long>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Long> eldest) {
                    return size() > SEQUENCE_CACHE_SIZE;
                }
            });

    @Override
    public Optional<Conversation> findConversation(String conversationId) {
        String id = ConversationIdValidator.normalizeOrThrow(conversationId);
        String json = await(storagePort.getText(directory(), path(id, CONVERSATION_FILE)), id);
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Conversation.class));
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("Corrupted conversation header: " + id,
                    Map.of("conversationId", id), e);
        }
    }

    @Override
    public Conversation getOrCreateConversation(String conversationId) {
        String id = ConversationIdValidator.normalizeOrThrow(conversationId);
        synchronized (lockFor(id)) {
            Optional<Conversation> existing = findConversation(id);
            if (existing.isPresent()) {
                return existing.get();
            }
            Instant now = clock.instant();
            Conversation created = Conversation.builder()
                    .id(id)
                    .status(ConversationStatus.ACTIVE)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            writeHeader(created);
            log.debug("[Store] Created conversation {}", id);
            return created;
        }
    }

    @Override
    public void saveConversation(Conversation conversation) {
        String id = ConversationIdValidator.normalizeOrThrow(conversation.getId());
        synchronized (lockFor(id)) {
            conversation.setUpdatedAt(clock.instant());
            writeHeader(conversation);
        }
    }

    @Override
    public List<Message> loadRecentMessages(String conversationId, int limit) {
        String id = ConversationIdValidator.normalizeOrThrow(conversationId);
        if (limit <= 0) {
            return List.of();
        }
        List<Message> all = readAll(id);
        all.sort(Message.CHRONOLOGICAL);
        int from = Math.max(0, all.size() - limit);
        return new ArrayList<>(all.subList(from, all.size()));
    }

    @Override
    public Message insertMessage(String conversationId, String role, String content, Map<String, Object> metadata) {
        String id = ConversationIdValidator.normalizeOrThrow(conversationId);
        synchronized (lockFor(id)) {
            long sequence = nextSequence(id);
            Message message = Message.builder()
                    .id(UUID.randomUUID().toString())
                    .conversationId(id)
                    .role(role)
                    .content(content)
                    .metadata(metadata != null ? new LinkedHashMap<>(metadata) : Collections.emptyMap())
                    .timestamp(clock.instant())
                    .sequence(sequence)
                    .build();
            try {
                String line = objectMapper.writeValueAsString(message) + "\n";
                await(storagePort.appendText(directory(), path(id, MESSAGES_FILE), line), id);
            } catch (JsonProcessingException e) {
                throw new StorageUnavailableException("Failed to serialize message for " + id,
                        Map.of("conversationId", id), e);
            }
            lastSequence.put(id, sequence);
            return message;
        }
    }

    @Override
    public long countMessages(String conversationId) {
        return readAll(ConversationIdValidator.normalizeOrThrow(conversationId)).size();
    }

    @Override
    public void deleteMessages(String conversationId) {
        String id = ConversationIdValidator.normalizeOrThrow(conversationId);
        synchronized (lockFor(id)) {
            await(storagePort.deleteObject(directory(), path(id, MESSAGES_FILE)), id);
            lastSequence.remove(id);
        }
    }

    private long nextSequence(String id) {
        Long last = lastSequence.get(id);
        if (last == null) {
            last = readAll(id).stream().mapToLong(Message::getSequence).max().orElse(0L);
        }
        return last + 1;
    }

    private List<Message> readAll(String id) {
        String text = await(storagePort.getText(directory(), path(id, MESSAGES_FILE)), id);
        List<Message> messages = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return messages;
        }
        for (String line : text.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                messages.add(objectMapper.readValue(line, Message.class));
            } catch (JsonProcessingException e) {
                // A torn trailing line from a crash mid-append is skipped
                log.warn("[Store] Skipping unreadable message line in {}: {}", id, e.getOriginalMessage());
            }
        }
        return messages;
    }

    private void writeHeader(Conversation conversation) {
        String id = conversation.getId();
        try {
            String json = objectMapper.writeValueAsString(conversation);
            await(storagePort.putTextAtomic(directory(), path(id, CONVERSATION_FILE), json), id);
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("Failed to serialize conversation " + id,
                    Map.of("conversationId", id), e);
        }
    }

    private <T> T await(Future<T> future, String conversationId) {
        try {
            return future.get(IO_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("Interrupted while accessing conversation store",
                    Map.of("conversationId", conversationId), e);
        } catch (ExecutionException | CompletionException | TimeoutException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Store] Storage failure for conversation {}: {}", conversationId, cause.getMessage());
            throw new StorageUnavailableException("Conversation store unavailable",
                    Map.of("conversationId", conversationId), cause);
        }
    }

    int cachedSequenceCount() {
        return lastSequence.size();
    }

    private Object lockFor(String id) {
        return locks[Math.floorMod(id.hashCode(), LOCK_STRIPES)];
    }

    private static Object[] newLocks() {
        Object[] stripes = new Object[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new Object();
        }
        return stripes;
    }

    private String directory() {
        return properties.getStorage().getDirectories().getConversations();
    }

    private static String path(String id, String file) {
        return id + "/" + file;
    }
}
