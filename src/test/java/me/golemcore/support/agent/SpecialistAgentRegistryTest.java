package me.golemcore.support.agent;

import me.golemcore.support.domain.model.AgentType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SpecialistAgentRegistryTest {

    @Test
    void get_returnsSpecialistForEachType() {
        SpecialistAgent faq = agent(AgentType.FAQ);
        SpecialistAgent order = agent(AgentType.ORDER);
        SpecialistAgent escalation = agent(AgentType.ESCALATION);

        SpecialistAgentRegistry registry = new SpecialistAgentRegistry(List.of(faq, order, escalation));

        assertSame(faq, registry.get(AgentType.FAQ));
        assertSame(order, registry.get(AgentType.ORDER));
        assertSame(escalation, registry.get(AgentType.ESCALATION));
    }

    @Test
    void constructor_rejectsMissingType() {
        List<SpecialistAgent> agents = List.of(agent(AgentType.FAQ), agent(AgentType.ORDER));

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> new SpecialistAgentRegistry(agents));
        assertTrue(error.getMessage().contains("ESCALATION"));
    }

    @Test
    void constructor_rejectsDuplicateType() {
        List<SpecialistAgent> agents = List.of(agent(AgentType.FAQ), agent(AgentType.FAQ),
                agent(AgentType.ORDER), agent(AgentType.ESCALATION));

        assertThrows(IllegalStateException.class, () -> new SpecialistAgentRegistry(agents));
    }

    private static SpecialistAgent agent(AgentType type) {
        SpecialistAgent agent = mock(SpecialistAgent.class);
        when(agent.getType()).thenReturn(type);
        return agent;
    }
}
