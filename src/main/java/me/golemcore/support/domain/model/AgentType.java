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

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of specialist agents a message can be routed to. Routing output is
 * resolved against this enum, so a route that is not listed here can never
 * reach dispatch.
 */
public enum AgentType {

    /**
     * Product questions answered from the knowledge base.
     */
    FAQ("faq"),

    /**
     * Subscription, billing and account questions answered from account records.
     */
    ORDER("order"),

    /**
     * Requests that need a human; always produces a support ticket.
     */
    ESCALATION("escalation");

    private final String id;

    AgentType(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Resolves a route label (case-insensitive, surrounding whitespace ignored).
     */
    public static Optional<AgentType> fromId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AgentType type : values()) {
            if (type.id.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
