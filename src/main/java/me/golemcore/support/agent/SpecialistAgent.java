package me.golemcore.support.agent;

import me.golemcore.support.domain.model.AgentReply;
import me.golemcore.support.domain.model.AgentType;

/**
 * A response generator scoped to one intent domain.
 *
 * <p>
 * Tool failures are folded into the reply. Only model and storage failures
 * propagate, as {@link me.golemcore.support.domain.exception.ModelUnavailableException}
 * or {@link me.golemcore.support.domain.exception.StorageUnavailableException}.
 */
public interface SpecialistAgent {

    AgentType getType();

    AgentReply handle(SpecialistRequest request);
}
