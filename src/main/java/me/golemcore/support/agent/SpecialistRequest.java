package me.golemcore.support.agent;

import lombok.Builder;
import lombok.Data;
import me.golemcore.support.domain.model.Message;
import me.golemcore.support.domain.model.RoutingDecision;

import java.util.List;

/**
 * Everything a specialist needs to answer one customer message.
 */
@Data
@Builder
public class SpecialistRequest {

    private String conversationId;
    private String correlationId;
    private String message;

    /**
     * Recent conversation history, oldest first, excluding {@link #message}.
     */
    private List<Message> context;
    private RoutingDecision routing;

    /**
     * Normalized customer email, {@code null} when unknown.
     */
    private String customerEmail;
}
