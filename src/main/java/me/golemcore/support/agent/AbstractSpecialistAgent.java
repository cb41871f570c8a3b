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
import me.golemcore.support.domain.component.ToolRequest;
import me.golemcore.support.domain.model.AgentReply;
import me.golemcore.support.domain.model.LlmRequest;
import me.golemcore.support.domain.model.Message;
import me.golemcore.support.domain.model.ToolInvocation;
import me.golemcore.support.domain.model.ToolResult;
import me.golemcore.support.domain.service.LlmCompletionService;
import me.golemcore.support.domain.service.ToolRegistry;
import me.golemcore.support.infrastructure.config.SupportProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for specialists: tool calls through the registry with invocation
 * tracking, and a single grounded model call over the conversation window.
 */
@Slf4j
public abstract class AbstractSpecialistAgent implements SpecialistAgent {

    protected final LlmCompletionService completionService;
    protected final ToolRegistry toolRegistry;
    protected final SupportProperties properties;

    protected AbstractSpecialistAgent(LlmCompletionService completionService, ToolRegistry toolRegistry,
            SupportProperties properties) {
        this.completionService = completionService;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
    }

    /**
     * Invokes a tool and records the invocation. Never throws.
     */
    protected ToolResult callTool(ToolRequest request, List<ToolInvocation> invocations) {
        ToolResult result = toolRegistry.invoke(request);
        invocations.add(ToolInvocation.of(request.toolName(), request.toArguments(), result));
        if (!result.isSuccess()) {
            log.info("[{}] Tool {} failed ({}): {}", getType().getId(), request.toolName(),
                    result.getFailureKind(), result.getError());
        }
        return result;
    }

    /**
     * Asks the model to answer with the conversation window followed by the
     * prepared prompt as the latest user turn.
     */
    protected String generate(String systemPrompt, SpecialistRequest request, String prompt) {
        List<Message> messages = new ArrayList<>();
        if (request.getContext() != null) {
            for (Message message : request.getContext()) {
                if (message.isUserMessage() || message.isAssistantMessage()) {
                    messages.add(message);
                }
            }
        }
        messages.add(Message.builder()
                .role(Message.ROLE_USER)
                .content(prompt)
                .build());

        LlmRequest llmRequest = LlmRequest.builder()
                .systemPrompt(systemPrompt)
                .messages(messages)
                .temperature(properties.getAgents().getTemperature())
                .build();
        return completionService.complete(llmRequest);
    }

    /**
     * Builds the reply, stripping the handoff marker when present.
     */
    protected AgentReply reply(String content, List<ToolInvocation> invocations) {
        String text = content != null ? content : "";
        boolean handoff = text.contains(SupportPrompts.ESCALATE_MARKER);
        if (handoff) {
            text = text.replace(SupportPrompts.ESCALATE_MARKER, "").strip();
            log.info("[{}] Handoff to escalation requested", getType().getId());
        }
        return AgentReply.builder()
                .content(text)
                .agentType(getType())
                .toolInvocations(invocations)
                .handoffRequested(handoff)
                .build();
    }
}
