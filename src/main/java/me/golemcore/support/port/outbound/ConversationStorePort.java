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

package me.golemcore.support.port.outbound;

import me.golemcore.support.domain.model.Conversation;
import me.golemcore.support.domain.model.Message;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store for conversations and their messages.
 *
 * <p>
 * All methods throw
 * {@link me.golemcore.support.domain.exception.StorageUnavailableException}
 * when the store cannot be reached.
 */
public interface ConversationStorePort {

    Optional<Conversation> findConversation(String conversationId);

    /**
     * Returns the conversation, creating an active one if it does not exist yet.
     */
    Conversation getOrCreateConversation(String conversationId);

    void saveConversation(Conversation conversation);

    /**
     * Loads the most recent {@code limit} messages in chronological order.
     */
    List<Message> loadRecentMessages(String conversationId, int limit);

    /**
     * Appends a message and returns it with id, timestamp and sequence assigned.
     */
    Message insertMessage(String conversationId, String role, String content, Map<String, Object> metadata);

    long countMessages(String conversationId);

    void deleteMessages(String conversationId);
}
