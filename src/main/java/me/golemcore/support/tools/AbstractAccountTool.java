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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.domain.component.ToolComponent;
import me.golemcore.support.domain.component.ToolRequest;
import me.golemcore.support.domain.exception.StorageUnavailableException;
import me.golemcore.support.domain.model.CustomerRecord;
import me.golemcore.support.domain.model.ToolFailureKind;
import me.golemcore.support.domain.model.ToolResult;
import me.golemcore.support.port.outbound.AccountStorePort;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;

/**
 * Shared plumbing of the account lookup tools: customer resolution by
 * normalized email, the "not found" result and store failure handling.
 */
@Slf4j
abstract class AbstractAccountTool<R extends ToolRequest> implements ToolComponent<R> {

    static final String EMAIL_ARGUMENT = "customer_email";

    protected final AccountStorePort accountStore;

    protected AbstractAccountTool(AccountStorePort accountStore) {
        this.accountStore = accountStore;
    }

    /**
     * Result text used when no customer matches the email.
     */
    public static String notFoundMessage(String email) {
        return "No customer found with email: " + email;
    }

    protected static Map<String, Object> emailSchema() {
        return Map.of(
                "type", "string",
                "description", "The customer's email address");
    }

    protected CompletableFuture<ToolResult> withCustomer(String email,
            BiFunction<CustomerRecord, String, ToolResult> action) {
        try {
            Optional<CustomerRecord> customer = accountStore.findCustomer(email);
            if (customer.isEmpty()) {
                log.info("[Accounts] Customer not found: {}", email);
                return CompletableFuture.completedFuture(
                        ToolResult.failure(ToolFailureKind.NOT_FOUND, notFoundMessage(email)));
            }
            return CompletableFuture.completedFuture(action.apply(customer.get(), email));
        } catch (StorageUnavailableException e) {
            log.warn("[Accounts] {} failed for {}: {}", getToolName(), email, e.getMessage());
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Account information is temporarily unavailable"));
        }
    }

    protected static String money(BigDecimal amount) {
        BigDecimal value = amount != null ? amount : BigDecimal.ZERO;
        return "$" + value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    protected static String date(LocalDate date) {
        return date != null ? date.toString() : "N/A";
    }

    protected static String titleCase(String value) {
        if (value == null || value.isBlank()) {
            return "N/A";
        }
        StringBuilder sb = new StringBuilder();
        for (String part : value.replace('_', ' ').split(" ")) {
            if (part.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    protected static <T> List<T> limit(List<T> items, int limit) {
        return items.size() <= limit ? items : items.subList(0, limit);
    }
}
