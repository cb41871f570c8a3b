package me.golemcore.support.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Ticket handed to the human support team.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SupportTicket {

    private String id;
    private String customerId;
    private String customerEmail;
    private String subject;
    private String description;
    private TicketCategory category;
    private TicketPriority priority;

    @Builder.Default
    private String status = "open";

    private String conversationId;
    private Map<String, Object> metadata;
    private Instant createdAt;
}
