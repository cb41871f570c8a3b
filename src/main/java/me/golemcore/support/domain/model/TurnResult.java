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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of one orchestration turn as returned to the caller.
 */
@Data
@Builder
public class TurnResult {

    private String conversationId;
    private String correlationId;
    private TurnState state;
    private String content;
    private AgentType agentType;
    private RoutingDecision routing;
    private List<ToolInvocation> toolInvocations;
    private String failureReason;

    public boolean isSuccessful() {
        return state == TurnState.COMPLETED || state == TurnState.ESCALATED;
    }

    public List<String> getToolsUsed() {
        if (toolInvocations == null) {
            return List.of();
        }
        return toolInvocations.stream().map(ToolInvocation::getName).toList();
    }
}
