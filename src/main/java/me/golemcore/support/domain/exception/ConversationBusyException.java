package me.golemcore.support.domain.exception;

import java.time.Duration;
import java.util.Map;

/**
 * Another turn holds the conversation lock and did not release it in time.
 * The inbound message was not accepted.
 */
public class ConversationBusyException extends SupportException {

    public ConversationBusyException(String conversationId, Duration waited) {
        super(SupportErrorCode.CONVERSATION_BUSY,
                "Conversation " + conversationId + " is busy",
                Map.of("conversationId", conversationId, "waitedMs", waited.toMillis()),
                null);
    }
}
