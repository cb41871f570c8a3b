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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.domain.exception.StorageUnavailableException;
import me.golemcore.support.domain.model.SupportTicket;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.port.outbound.StoragePort;
import me.golemcore.support.port.outbound.TicketStorePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Appends created tickets to {@code tickets/tickets.jsonl}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalTicketStoreAdapter implements TicketStorePort {

    static final String TICKETS_FILE = "tickets.jsonl";

    private static final long IO_TIMEOUT_SECONDS = 10;

    private final StoragePort storagePort;
    private final SupportProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public SupportTicket createTicket(SupportTicket ticket) {
        ticket.setId("TCK-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT));
        ticket.setCreatedAt(clock.instant());
        String directory = properties.getStorage().getDirectories().getTickets();
        try {
            String line = objectMapper.writeValueAsString(ticket) + "\n";
            storagePort.appendText(directory, TICKETS_FILE, line).get(IO_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("Interrupted while creating ticket", e);
        } catch (JsonProcessingException | ExecutionException | TimeoutException e) {
            log.error("[Tickets] Failed to persist ticket {}: {}", ticket.getId(), e.getMessage());
            throw new StorageUnavailableException("Ticket store unavailable", e);
        }
        log.info("[Tickets] Created ticket {} (priority={}, category={}, conversation={})",
                ticket.getId(), ticket.getPriority(), ticket.getCategory(), ticket.getConversationId());
        return ticket;
    }
}
