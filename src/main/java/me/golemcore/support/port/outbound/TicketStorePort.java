package me.golemcore.support.port.outbound;

import me.golemcore.support.domain.model.SupportTicket;

/**
 * Durable store for support tickets.
 */
public interface TicketStorePort {

    /**
     * Persists the ticket and returns it with id and creation time assigned.
     */
    SupportTicket createTicket(SupportTicket ticket);
}
