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

package me.golemcore.support.tools;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.domain.component.ToolComponent;
import me.golemcore.support.domain.component.ToolRequest;
import me.golemcore.support.domain.exception.StorageUnavailableException;
import me.golemcore.support.domain.model.CustomerRecord;
import me.golemcore.support.domain.model.SupportTicket;
import me.golemcore.support.domain.model.TicketCategory;
import me.golemcore.support.domain.model.TicketPriority;
import me.golemcore.support.domain.model.ToolDefinition;
import me.golemcore.support.domain.model.ToolFailureKind;
import me.golemcore.support.domain.model.ToolResult;
import me.golemcore.support.port.outbound.AccountStorePort;
import me.golemcore.support.port.outbound.TicketStorePort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Creates a support ticket for human follow-up.
 *
 * <p>
 * Priority is derived from the subject and description (urgent and high
 * keywords) and from the category. A ticket is created even when the email
 * does not match a customer; such tickets carry
 * {@code customer_verified=false} in their metadata. Not idempotent: every
 * call creates a new ticket.
 *
 * <p>
 * Structured data: {@link SupportTicket}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CreateTicketTool implements ToolComponent<CreateTicketTool.Request> {

    public static final String NAME = "create_support_ticket";

    static final String META_CUSTOMER_VERIFIED = "customer_verified";

    private static final List<String> URGENT_KEYWORDS = List.of(
            "urgent", "critical", "emergency", "down", "outage", "not working at all");
    private static final List<String> HIGH_KEYWORDS = List.of(
            "cannot access", "blocked", "important", "deadline", "losing data", "security");

    private final TicketStorePort ticketStore;
    private final AccountStorePort accountStore;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Create a support ticket for issues that need human attention: complex problems, "
                        + "complaints or explicit requests to talk to a person.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "subject", Map.of("type", "string",
                                        "description", "Brief summary of the issue"),
                                "description", Map.of("type", "string",
                                        "description", "Detailed description including relevant context"),
                                "category", Map.of("type", "string",
                                        "enum", List.of("billing", "technical", "account", "feature_request",
                                                "bug_report", "other")),
                                "conversation_id", Map.of("type", "string"),
                                "customer_email", Map.of("type", "string")),
                        "required", List.of("subject", "description")))
                .build();
    }

    @Override
    public Class<Request> requestType() {
        return Request.class;
    }

    @Override
    public Request parseArguments(Map<String, Object> arguments) {
        return new Request(
                ToolArguments.requireString(arguments, "subject"),
                ToolArguments.requireString(arguments, "description"),
                TicketCategory.fromValue(ToolArguments.optionalString(arguments, "category")),
                ToolArguments.optionalString(arguments, "conversation_id"),
                ToolArguments.normalizeEmail(ToolArguments.optionalString(arguments, "customer_email")));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Request request) {
        try {
            Optional<CustomerRecord> customer = request.email() != null
                    ? accountStore.findCustomer(request.email())
                    : Optional.empty();
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(META_CUSTOMER_VERIFIED, customer.isPresent());

            SupportTicket ticket = SupportTicket.builder()
                    .customerId(customer.map(CustomerRecord::getId).orElse(null))
                    .customerEmail(request.email())
                    .subject(request.subject())
                    .description(request.description())
                    .category(request.category())
                    .priority(determinePriority(request.subject(), request.description(), request.category()))
                    .conversationId(request.conversationId())
                    .metadata(metadata)
                    .build();
            SupportTicket created = ticketStore.createTicket(ticket);
            if (customer.isEmpty()) {
                log.info("[Tickets] Ticket {} created without a verified customer", created.getId());
            }
            return CompletableFuture.completedFuture(ToolResult.success(confirmation(created), created));
        } catch (StorageUnavailableException e) {
            log.error("[Tickets] Ticket creation failed: {}", e.getMessage());
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Failed to create support ticket"));
        }
    }

    static TicketPriority determinePriority(String subject, String description, TicketCategory category) {
        String text = (subject + " " + description).toLowerCase(Locale.ROOT);
        if (URGENT_KEYWORDS.stream().anyMatch(text::contains)) {
            return TicketPriority.URGENT;
        }
        if (HIGH_KEYWORDS.stream().anyMatch(text::contains)) {
            return TicketPriority.HIGH;
        }
        if (category == TicketCategory.BUG_REPORT || category == TicketCategory.BILLING) {
            return TicketPriority.HIGH;
        }
        return TicketPriority.MEDIUM;
    }

    private static String confirmation(SupportTicket ticket) {
        return "Support Ticket Created Successfully\n"
                + "- Ticket ID: " + ticket.getId() + "\n"
                + "- Subject: " + ticket.getSubject() + "\n"
                + "- Category: " + ticket.getCategory().getValue() + "\n"
                + "- Priority: " + ticket.getPriority().getValue() + "\n"
                + "- Expected Response: Within " + ticket.getPriority().getResponseTimeLabel();
    }

    public record Request(String subject, String description, TicketCategory category, String conversationId,
            String email) implements ToolRequest {

        @Override
        public String toolName() {
            return NAME;
        }

        @Override
        public Map<String, Object> toArguments() {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("subject", subject);
            args.put("description", description);
            args.put("category", category != null ? category.getValue() : TicketCategory.OTHER.getValue());
            if (conversationId != null) {
                args.put("conversation_id", conversationId);
            }
            if (email != null) {
                args.put("customer_email", email);
            }
            return args;
        }
    }
}
