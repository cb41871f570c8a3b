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
import me.golemcore.support.domain.model.Message;
import me.golemcore.support.domain.model.ToolInvocation;
import me.golemcore.support.domain.model.ToolResult;
import me.golemcore.support.domain.service.EmailAddresses;
import me.golemcore.support.domain.service.LlmCompletionService;
import me.golemcore.support.domain.service.ToolRegistry;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.tools.CustomerLookupTool;
import me.golemcore.support.tools.InvoiceLookupTool;
import me.golemcore.support.tools.SubscriptionLookupTool;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Account, subscription and billing inquiries.
 *
 * <p>
 * Lookups run in a fixed order: customer profile, subscriptions, invoices. An
 * unknown customer ends the turn with a deterministic "no customer found"
 * reply and no further lookups. Any other lookup failure is reported to the
 * model as unavailable data.
 */
@Component
@Slf4j
public class OrderAgent extends AbstractSpecialistAgent {

    static final String UNAVAILABLE = "(information temporarily unavailable)";

    public OrderAgent(LlmCompletionService completionService, ToolRegistry toolRegistry,
            SupportProperties properties) {
        super(completionService, toolRegistry, properties);
    }

    @Override
    public AgentType getType() {
        return AgentType.ORDER;
    }

    @Override
    public AgentReply handle(SpecialistRequest request) {
        List<ToolInvocation> invocations = new ArrayList<>();
        Optional<String> email = resolveEmail(request);
        if (email.isEmpty()) {
            log.info("[order] No customer email for conversation {}", request.getConversationId());
            String prompt = "No email address is known for this customer, so no account data was looked up. "
                    + "Ask the customer for the email address on their account.\n\nCustomer message:\n"
                    + request.getMessage();
            return reply(generate(SupportPrompts.ORDER, request, prompt), invocations);
        }

        ToolResult customer = callTool(new CustomerLookupTool.Request(email.get()), invocations);
        if (customer.isNotFound()) {
            return AgentReply.builder()
                    .content(customer.getError() + ". Please double-check the address, or share the email "
                            + "used for your CloudFlow account.")
                    .agentType(getType())
                    .toolInvocations(invocations)
                    .build();
        }

        SupportProperties.OrderAgentProperties limits = properties.getAgents().getOrder();
        ToolResult subscriptions = callTool(
                new SubscriptionLookupTool.Request(email.get(), limits.getSubscriptionLimit()), invocations);
        ToolResult invoices = callTool(
                new InvoiceLookupTool.Request(email.get(), limits.getInvoiceLimit()), invocations);

        String prompt = "Account data for " + email.get() + ":\n\n"
                + section("Customer", customer) + "\n\n"
                + section("Subscriptions", subscriptions) + "\n\n"
                + section("Invoices", invoices)
                + "\n\nCustomer message:\n" + request.getMessage();
        return reply(generate(SupportPrompts.ORDER, request, prompt), invocations);
    }

    /**
     * Email from the customer identity, else from the current message, else
     * from the most recent user message that mentions one.
     */
    Optional<String> resolveEmail(SpecialistRequest request) {
        String identity = EmailAddresses.normalize(request.getCustomerEmail());
        if (identity != null) {
            return Optional.of(identity);
        }
        Optional<String> inMessage = EmailAddresses.findIn(request.getMessage());
        if (inMessage.isPresent() || request.getContext() == null) {
            return inMessage;
        }
        List<Message> context = request.getContext();
        for (int i = context.size() - 1; i >= 0; i--) {
            Message message = context.get(i);
            if (message.isUserMessage()) {
                Optional<String> found = EmailAddresses.findIn(message.getContent());
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private static String section(String title, ToolResult result) {
        return "## " + title + "\n" + (result.isSuccess() ? result.getOutput() : UNAVAILABLE);
    }
}
