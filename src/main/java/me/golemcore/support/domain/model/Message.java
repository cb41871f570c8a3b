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

package me.golemcore.support.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;

/**
 * A single stored message of a conversation. Messages are immutable once
 * written and are ordered by timestamp, then by the store-assigned sequence
 * number.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";

    public static final String META_AGENT_TYPE = "agent_type";
    public static final String META_TOOL_INVOCATIONS = "tool_invocations";
    public static final String META_ROUTE = "route";
    public static final String META_ROUTING_CONFIDENCE = "routing_confidence";
    public static final String META_ROUTING_SOURCE = "routing_source";
    public static final String META_CORRELATION_ID = "correlation_id";
    public static final String META_TURN_STATE = "turn_state";

    public static final Comparator<Message> CHRONOLOGICAL = Comparator
            .comparing(Message::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingLong(Message::getSequence);

    private String id;
    private String conversationId;
    private String role; // user, assistant, system
    private String content;
    private Map<String, Object> metadata;
    private Instant timestamp;
    private long sequence;

    @JsonIgnore
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    @JsonIgnore
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    @JsonIgnore
    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    /**
     * Specialist that produced this message, if recorded.
     */
    @JsonIgnore
    public Optional<AgentType> getProducingAgent() {
        if (metadata == null) {
            return Optional.empty();
        }
        Object value = metadata.get(META_AGENT_TYPE);
        return value != null ? AgentType.fromId(value.toString()) : Optional.empty();
    }

    public static boolean isValidRole(String role) {
        return ROLE_USER.equals(role) || ROLE_ASSISTANT.equals(role) || ROLE_SYSTEM.equals(role);
    }
}
