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

package me.golemcore.support.adapter.outbound.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.domain.exception.StorageUnavailableException;
import me.golemcore.support.domain.model.CustomerRecord;
import me.golemcore.support.domain.model.InvoiceRecord;
import me.golemcore.support.domain.model.SubscriptionRecord;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.port.outbound.AccountStorePort;
import me.golemcore.support.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Account records read from JSON arrays in the {@code accounts/} storage
 * directory ({@code customers.json}, {@code subscriptions.json},
 * {@code invoices.json}). Files are re-read on every lookup so edits are
 * picked up without a restart.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalAccountStoreAdapter implements AccountStorePort {

    static final String CUSTOMERS_FILE = "customers.json";
    static final String SUBSCRIPTIONS_FILE = "subscriptions.json";
    static final String INVOICES_FILE = "invoices.json";

    private static final long IO_TIMEOUT_SECONDS = 10;

    private final StoragePort storagePort;
    private final SupportProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<CustomerRecord> findCustomer(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        return readList(CUSTOMERS_FILE, new TypeReference<List<CustomerRecord>>() {
        }).stream()
                .filter(c -> c.getEmail() != null && normalized.equals(c.getEmail().trim().toLowerCase(Locale.ROOT)))
                .findFirst();
    }

    @Override
    public List<SubscriptionRecord> findSubscriptions(String customerId) {
        return readList(SUBSCRIPTIONS_FILE, new TypeReference<List<SubscriptionRecord>>() {
        }).stream()
                .filter(s -> customerId != null && customerId.equals(s.getCustomerId()))
                .sorted(Comparator.comparing(SubscriptionRecord::getStartDate,
                        Comparator.nullsLast(Comparator.<LocalDate>naturalOrder())).reversed())
                .toList();
    }

    @Override
    public List<InvoiceRecord> findInvoices(String customerId) {
        return readList(INVOICES_FILE, new TypeReference<List<InvoiceRecord>>() {
        }).stream()
                .filter(i -> customerId != null && customerId.equals(i.getCustomerId()))
                .sorted(Comparator.comparing(InvoiceRecord::getIssueDate,
                        Comparator.nullsLast(Comparator.<LocalDate>naturalOrder())).reversed())
                .toList();
    }

    private <T> List<T> readList(String file, TypeReference<List<T>> type) {
        String directory = properties.getStorage().getDirectories().getAccounts();
        try {
            String json = storagePort.getText(directory, file).get(IO_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (json == null || json.isBlank()) {
                return List.of();
            }
            return objectMapper.readValue(json, type);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("Interrupted while reading " + file, e);
        } catch (ExecutionException | TimeoutException | IOException e) {
            log.error("[Accounts] Failed to read {}/{}: {}", directory, file, e.getMessage());
            throw new StorageUnavailableException("Account store unavailable", Map.of("file", file), e);
        }
    }
}
