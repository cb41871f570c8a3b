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
import me.golemcore.support.domain.model.InvoiceRecord;
import me.golemcore.support.domain.model.ToolDefinition;
import me.golemcore.support.domain.model.ToolResult;
import me.golemcore.support.port.outbound.AccountStorePort;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lists recent invoices of a customer with paid and outstanding totals over
 * the listed invoices. Structured data: {@code List<InvoiceRecord>}.
 */
@Component
public class InvoiceLookupTool extends AbstractAccountTool<InvoiceLookupTool.Request> {

    public static final String NAME = "get_invoices";

    static final int DEFAULT_LIMIT = 5;
    static final int MAX_LIMIT = 20;

    public InvoiceLookupTool(AccountStorePort accountStore) {
        super(accountStore);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get invoice history for a customer: payment status and outstanding balances.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                EMAIL_ARGUMENT, emailSchema(),
                                "limit", Map.of(
                                        "type", "integer",
                                        "description", "Maximum number of invoices (1-20, default 5)")),
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
            List<InvoiceRecord> invoices = limit(accountStore.findInvoices(customer.getId()), request.limit());
            if (invoices.isEmpty()) {
                return ToolResult.success("No invoices found for " + email, List.of());
            }

            BigDecimal totalPaid = BigDecimal.ZERO;
            BigDecimal outstanding = BigDecimal.ZERO;
            for (InvoiceRecord invoice : invoices) {
                BigDecimal total = invoice.getTotal() != null ? invoice.getTotal() : BigDecimal.ZERO;
                if (InvoiceRecord.STATUS_PAID.equals(invoice.getStatus())) {
                    totalPaid = totalPaid.add(total);
                } else if (invoice.isOutstanding()) {
                    outstanding = outstanding.add(total);
                }
            }

            StringBuilder sb = new StringBuilder("Invoice History for ").append(customer.getFullName()).append('\n')
                    .append("Total Paid: ").append(money(totalPaid)).append('\n')
                    .append("Outstanding: ").append(money(outstanding)).append('\n');
            for (InvoiceRecord invoice : invoices) {
                sb.append("\nInvoice #").append(invoice.getInvoiceNumber()).append('\n')
                        .append("- Status: ").append(titleCase(invoice.getStatus())).append('\n')
                        .append("- Total: ").append(money(invoice.getTotal())).append(' ')
                        .append(invoice.getCurrency() != null ? invoice.getCurrency() : "USD").append('\n')
                        .append("- Due Date: ").append(date(invoice.getDueDate())).append('\n')
                        .append("- Paid Date: ").append(date(invoice.getPaidDate())).append('\n');
            }
            return ToolResult.success(sb.toString().stripTrailing(), invoices);
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
