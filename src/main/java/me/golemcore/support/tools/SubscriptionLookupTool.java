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

import me.golemcore.support.domain.component.ToolRequest;
import me.golemcore.support.domain.model.SubscriptionRecord;
import me.golemcore.support.domain.model.ToolDefinition;
import me.golemcore.support.domain.model.ToolResult;
import me.golemcore.support.port.outbound.AccountStorePort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lists the most recent subscriptions of a customer (by default the
 * {@value #DEFAULT_LIMIT} newest). Structured data:
 * {@code List<SubscriptionRecord>}.
 */
@Component
public class SubscriptionLookupTool extends AbstractAccountTool<SubscriptionLookupTool.Request> {

    public static final String NAME = "get_subscription_details";

    static final int DEFAULT_LIMIT = 3;
    static final int MAX_LIMIT = 10;
    private static final int MAX_FEATURES = 5;

    public SubscriptionLookupTool(AccountStorePort accountStore) {
        super(accountStore);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get subscription details for a customer: plan, status, billing cycle and seats.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                EMAIL_ARGUMENT, emailSchema(),
                                "limit", Map.of(
                                        "type", "integer",
                                        "description", "Maximum number of subscriptions (1-10, default 3)")),
                        "required", List.of(EMAIL_ARGUMENT)))
                .build();
    }

    @Override
    public Class<Request> requestType() {
        return Request.class;
    }

    @Override
    public Request parseArguments(Map<String, Object> arguments) {
        return new Request(
                ToolArguments.normalizeEmail(ToolArguments.requireString(arguments, EMAIL_ARGUMENT)),
                ToolArguments.optionalInt(arguments, "limit", DEFAULT_LIMIT, 1, MAX_LIMIT));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Request request) {
        return withCustomer(request.email(), (customer, email) -> {
            List<SubscriptionRecord> subscriptions = limit(accountStore.findSubscriptions(customer.getId()),
                    request.limit());
            if (subscriptions.isEmpty()) {
                return ToolResult.success("No subscriptions found for " + email, List.of());
            }

            StringBuilder sb = new StringBuilder("Subscriptions for ").append(customer.getFullName()).append('\n');
            for (SubscriptionRecord sub : subscriptions) {
                sb.append('\n').append(titleCase(sub.getPlan())).append(" Plan\n")
                        .append("- Status: ").append(titleCase(sub.getStatus())).append('\n')
                        .append("- Billing: ").append(titleCase(sub.getBillingCycle())).append(" at ")
                        .append(money(sub.getPrice())).append('\n')
                        .append("- Seats: ").append(sub.getSeats()).append('\n')
                        .append("- Start Date: ").append(date(sub.getStartDate())).append('\n')
                        .append("- End Date: ").append(date(sub.getEndDate())).append('\n')
                        .append("- Trial Ends: ").append(date(sub.getTrialEndDate())).append('\n');
                if (sub.getFeatures() != null && !sub.getFeatures().isEmpty()) {
                    sb.append("- Features: ").append(String.join(", ", limit(sub.getFeatures(), MAX_FEATURES)))
                            .append('\n');
                }
            }
            return ToolResult.success(sb.toString().stripTrailing(), subscriptions);
        });
    }

    public record Request(String email, int limit) implements ToolRequest {

        public Request(String email) {
            this(email, DEFAULT_LIMIT);
        }

        @Override
        public String toolName() {
            return NAME;
        }

        @Override
        public Map<String, Object> toArguments() {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put(EMAIL_ARGUMENT, email);
            args.put("limit", limit);
            return args;
        }
    }
}
