package me.golemcore.support.adapter.outbound.store;

import me.golemcore.support.domain.exception.StorageUnavailableException;
import me.golemcore.support.domain.model.SupportTicket;
import me.golemcore.support.domain.model.TicketCategory;
import me.golemcore.support.domain.model.TicketPriority;
import me.golemcore.support.infrastructure.config.AutoConfiguration;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LocalTicketStoreAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private StoragePort storagePort;
    private LocalTicketStoreAdapter store;

    @BeforeEach
    void setUp() {
        storagePort = mock(StoragePort.class);
        store = new LocalTicketStoreAdapter(storagePort, new SupportProperties(), AutoConfiguration.objectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createTicket_assignsIdAndAppendsJsonLine() {
        when(storagePort.appendText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));

        SupportTicket ticket = store.createTicket(SupportTicket.builder()
                .subject("Cannot log in")
                .description("Locked out")
                .category(TicketCategory.ACCOUNT)
                .priority(TicketPriority.HIGH)
                .conversationId("conv-1")
                .build());

        assertTrue(ticket.getId().matches("TCK-[0-9A-F]{8}"));
        assertEquals(NOW, ticket.getCreatedAt());
        assertEquals("open", ticket.getStatus());

        ArgumentCaptor<String> line = ArgumentCaptor.forClass(String.class);
        verify(storagePort).appendText(eq("tickets"), eq(LocalTicketStoreAdapter.TICKETS_FILE), line.capture());
        assertTrue(line.getValue().endsWith("\n"));
        assertTrue(line.getValue().contains("\"subject\":\"Cannot log in\""));
    }

    @Test
    void createTicket_writeFailureIsStorageUnavailable() {
        when(storagePort.appendText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IOException("disk full")));

        assertThrows(StorageUnavailableException.class,
                () -> store.createTicket(SupportTicket.builder().subject("s").description("d").build()));
    }
}
