package me.golemcore.support.domain.model;

/**
 * Lifecycle status of a conversation.
 */
public enum ConversationStatus {
    ACTIVE, ESCALATED, CLOSED
}
