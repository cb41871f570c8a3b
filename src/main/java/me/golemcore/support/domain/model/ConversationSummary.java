package me.golemcore.support.domain.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Lightweight view of a conversation for operators.
 */
@Data
@Builder
public class ConversationSummary {

    private String conversationId;
    private ConversationStatus status;
    private String customerId;
    private long messageCount;
    private Instant createdAt;
    private Instant updatedAt;
}
