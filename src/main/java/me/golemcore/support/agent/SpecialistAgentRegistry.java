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

package me.golemcore.support.agent;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.domain.model.AgentType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Closed mapping from {@link AgentType} to its specialist. Every type must
 * have exactly one specialist.
 */
@Component
@Slf4j
public class SpecialistAgentRegistry {

    private final Map<AgentType, SpecialistAgent> agents = new EnumMap<>(AgentType.class);

    public SpecialistAgentRegistry(List<SpecialistAgent> specialists) {
        for (SpecialistAgent agent : specialists) {
            SpecialistAgent previous = agents.put(agent.getType(), agent);
            if (previous != null) {
                throw new IllegalStateException("Duplicate specialist for " + agent.getType() + ": "
                        + previous.getClass().getSimpleName() + " and " + agent.getClass().getSimpleName());
            }
        }
        for (AgentType type : AgentType.values()) {
            if (!agents.containsKey(type)) {
                throw new IllegalStateException("No specialist registered for " + type);
            }
        }
        log.info("[Agents] Registered specialists: {}", agents.keySet());
    }

    public SpecialistAgent get(AgentType type) {
        return agents.get(type);
    }
}
