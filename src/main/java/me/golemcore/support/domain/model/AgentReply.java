package me.golemcore.support.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * What a specialist agent produced for one turn.
 */
@Data
@Builder
public class AgentReply {

    private String content;
    private AgentType agentType;

    @Builder.Default
    private List<ToolInvocation> toolInvocations = new ArrayList<>();

    /**
     * The specialist asked to hand the turn over to the escalation agent.
     */
    private boolean handoffRequested;

    /**
     * A support ticket was actually created during this turn.
     */
    private boolean ticketCreated;
}
