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
import me.golemcore.support.domain.model.CustomerRecord;
import me.golemcore.support.domain.model.ToolDefinition;
import me.golemcore.support.domain.model.ToolResult;
import me.golemcore.support.port.outbound.AccountStorePort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Looks up a customer profile by email. Structured data: {@link CustomerRecord}.
 */
@Component
public class CustomerLookupTool extends AbstractAccountTool<CustomerLookupTool.Request> {

    public static final String NAME = "get_customer_info";

    public CustomerLookupTool(AccountStorePort accountStore) {
        super(accountStore);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Look up customer information by email address to verify identity "
                        + "and get basic account information.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(EMAIL_ARGUMENT, emailSchema()),
                        "required", List.of(EMAIL_ARGUMENT)))
                .build();
    }

    @Override
    public Class<Request> requestType() {
        return Request.class;
    }

    @Override
    public Request parseArguments(Map<String, Object> arguments) {
        return new Request(ToolArguments.normalizeEmail(ToolArguments.requireString(arguments, EMAIL_ARGUMENT)));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Request request) {
        return withCustomer(request.email(), (customer, email) -> {
            String member = customer.getCreatedAt() != null
                    ? customer.getCreatedAt().toString().substring(0, 10)
                    : "N/A";
            String text = "Customer Information\n"
                    + "- Name: " + customer.getFullName() + "\n"
                    + "- Email: " + customer.getEmail() + "\n"
                    + "- Company: " + orNa(customer.getCompany()) + "\n"
                    + "- Phone: " + orNa(customer.getPhone()) + "\n"
                    + "- Account Status: " + (customer.isActive() ? "Active" : "Inactive") + "\n"
                    + "- Member Since: " + member;
            return ToolResult.success(text, customer);
        });
    }

    private static String orNa(String value) {
        return value != null && !value.isBlank() ? value : "N/A";
    }

    public record Request(String email) implements ToolRequest {

        @Override
        public String toolName() {
            return NAME;
        }

        @Override
        public Map<String, Object> toArguments() {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put(EMAIL_ARGUMENT, email);
            return args;
        }
    }
}
