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
import me.golemcore.support.domain.exception.ModelUnavailableException;
import me.golemcore.support.domain.model.AgentReply;
import me.golemcore.support.domain.model.AgentType;
import me.golemcore.support.domain.model.Message;
import me.golemcore.support.domain.model.RoutingDecision;
import me.golemcore.support.domain.model.TicketCategory;
import me.golemcore.support.domain.model.ToolInvocation;
import me.golemcore.support.domain.model.ToolResult;
import me.golemcore.support.domain.service.EmailAddresses;
import me.golemcore.support.domain.service.LlmCompletionService;
import me.golemcore.support.domain.service.ToolRegistry;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.tools.CreateTicketTool;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Hands the customer over to a human by always creating a support ticket.
 *
 * <p>
 * A failed ticket creation yields {@link #TICKET_FAILED_REPLY}. Once the
 * ticket exists the turn does not fail: if the model cannot phrase the
 * confirmation, the ticket summary is returned as is.
 */
@Component
@Slf4j
public class EscalationAgent extends AbstractSpecialistAgent {

    static final String TICKET_FAILED_REPLY = "I'm sorry, I wasn't able to create a support ticket right now. "
            + "Please try again in a few minutes, or contact support@cloudflow.example directly and mention "
            + "this conversation.";

    private static final int SUBJECT_MAX_CHARS = 100;
    private static final int CONTEXT_LINE_MAX_CHARS = 200;

    private static final Pattern BILLING = Pattern.compile(
            "\\b(?:billing|invoice|payment|charge|refund|price|subscription|plan)", Pattern.CASE_INSENSITIVE);
    private static final Pattern BUG = Pattern.compile("\\b(?:bug|error|crash|broken|exception)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ACCOUNT = Pattern.compile("\\b(?:login|log in|password|locked|access|account)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FEATURE = Pattern.compile("\\b(?:feature|suggest|would be nice|wish)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TECHNICAL = Pattern.compile(
            "\\b(?:not working|slow|integration|sync|api|outage|down)\\b", Pattern.CASE_INSENSITIVE);

    public EscalationAgent(LlmCompletionService completionService, ToolRegistry toolRegistry,
            SupportProperties properties) {
        super(completionService, toolRegistry, properties);
    }

    @Override
    public AgentType getType() {
        return AgentType.ESCALATION;
    }

    @Override
    public AgentReply handle(SpecialistRequest request) {
        List<ToolInvocation> invocations = new ArrayList<>();
        String email = EmailAddresses.normalize(request.getCustomerEmail());
        if (email == null) {
            email = EmailAddresses.findIn(request.getMessage()).orElse(null);
        }

        CreateTicketTool.Request ticketRequest = new CreateTicketTool.Request(
                subject(request),
                description(request),
                inferCategory(request.getMessage()),
                request.getConversationId(),
                email);
        ToolResult ticket = callTool(ticketRequest, invocations);
        if (!ticket.isSuccess()) {
            log.error("[escalation] Ticket creation failed for conversation {}: {}", request.getConversationId(),
                    ticket.getError());
            return AgentReply.builder()
                    .content(TICKET_FAILED_REPLY)
                    .agentType(getType())
                    .toolInvocations(invocations)
                    .build();
        }

        String prompt = "Ticket details:\n" + ticket.getOutput() + "\n\nCustomer message:\n" + request.getMessage();
        String content;
        try {
            content = generate(SupportPrompts.ESCALATION, request, prompt);
        } catch (ModelUnavailableException e) {
            log.warn("[escalation] Model unavailable after ticket creation ({}), returning ticket summary",
                    e.getReasonCode());
            content = "";
        }
        if (content == null || content.isBlank()) {
            content = "I've escalated your issue to our support team.\n\n" + ticket.getOutput();
        }

        AgentReply reply = reply(content, invocations);
        reply.setHandoffRequested(false);
        reply.setTicketCreated(true);
        return reply;
    }

    static TicketCategory inferCategory(String message) {
        String text = message != null ? message.toLowerCase(Locale.ROOT) : "";
        if (BILLING.matcher(text).find()) {
            return TicketCategory.BILLING;
        }
        if (BUG.matcher(text).find()) {
            return TicketCategory.BUG_REPORT;
        }
        if (ACCOUNT.matcher(text).find()) {
            return TicketCategory.ACCOUNT;
        }
        if (FEATURE.matcher(text).find()) {
            return TicketCategory.FEATURE_REQUEST;
        }
        if (TECHNICAL.matcher(text).find()) {
            return TicketCategory.TECHNICAL;
        }
        return TicketCategory.OTHER;
    }

    private static String subject(SpecialistRequest request) {
        RoutingDecision routing = request.getRouting();
        if (routing != null && routing.getSummary() != null && !routing.getSummary().isBlank()) {
            return truncate(routing.getSummary().strip(), SUBJECT_MAX_CHARS);
        }
        String message = request.getMessage() != null ? request.getMessage().strip() : "";
        return message.isEmpty() ? "Customer support request" : truncate(message, SUBJECT_MAX_CHARS);
    }

    private String description(SpecialistRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("Customer message:\n").append(request.getMessage());
        RoutingDecision routing = request.getRouting();
        if (routing != null && routing.getReasoning() != null) {
            sb.append("\n\nRouting reasoning: ").append(routing.getReasoning());
        }
        List<Message> context = request.getContext();
        if (context != null && !context.isEmpty()) {
            int limit = properties.getAgents().getEscalation().getContextMessages();
            sb.append("\n\nRecent conversation:");
            for (int i = Math.max(0, context.size() - limit); i < context.size(); i++) {
                Message message = context.get(i);
                sb.append("\n- ").append(message.getRole()).append(": ")
                        .append(truncate(message.getContent(), CONTEXT_LINE_MAX_CHARS));
            }
        }
        return sb.toString();
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLen ? text : text.substring(0, maxLen) + "...";
    }
}
