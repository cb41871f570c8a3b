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
import me.golemcore.support.domain.model.AgentReply;
import me.golemcore.support.domain.model.AgentType;
import me.golemcore.support.domain.model.KnowledgeMatch;
import me.golemcore.support.domain.model.ToolInvocation;
import me.golemcore.support.domain.model.ToolResult;
import me.golemcore.support.domain.service.LlmCompletionService;
import me.golemcore.support.domain.service.ToolRegistry;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.tools.KnowledgeSearchTool;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Retrieval-augmented answers from the knowledge base.
 *
 * <p>
 * One search per turn. With no passages (or a failed search) the model is told
 * there is no matching documentation, and a blank answer is replaced by
 * {@link #NO_ANSWER_REPLY}, so the turn always has content.
 */
@Component
@Slf4j
public class FaqAgent extends AbstractSpecialistAgent {

    static final String NO_ANSWER_REPLY = "I couldn't find documentation that answers your question. "
            + "Could you share a bit more detail, or would you like me to connect you with our support team?";

    public FaqAgent(LlmCompletionService completionService, ToolRegistry toolRegistry,
            SupportProperties properties) {
        super(completionService, toolRegistry, properties);
    }

    @Override
    public AgentType getType() {
        return AgentType.FAQ;
    }

    @Override
    public AgentReply handle(SpecialistRequest request) {
        List<ToolInvocation> invocations = new ArrayList<>();
        int topK = properties.getAgents().getFaq().getTopK();
        ToolResult search = callTool(new KnowledgeSearchTool.Request(request.getMessage(), topK, null), invocations);

        String prompt;
        if (hasPassages(search)) {
            prompt = "Knowledge base results:\n" + search.getOutput()
                    + "\n\nCustomer question:\n" + request.getMessage();
        } else {
            log.info("[faq] No knowledge passages for conversation {}", request.getConversationId());
            prompt = "No matching documentation was found in the knowledge base"
                    + (search.isSuccess() ? "" : " (the search is temporarily unavailable)")
                    + ". Say so honestly and answer only with general guidance.\n\nCustomer question:\n"
                    + request.getMessage();
        }

        String answer = generate(SupportPrompts.FAQ, request, prompt);
        AgentReply reply = reply(answer, invocations);
        if (reply.getContent().isBlank()) {
            reply.setContent(NO_ANSWER_REPLY);
        }
        return reply;
    }

    private static boolean hasPassages(ToolResult search) {
        return search.isSuccess() && search.getData() instanceof List<?> matches && !matches.isEmpty()
                && matches.get(0) instanceof KnowledgeMatch;
    }
}
