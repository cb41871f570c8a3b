package me.golemcore.support.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AgentTypeTest {

    @Test
    void fromId_isCaseInsensitiveAndTrimmed() {
        assertEquals(Optional.of(AgentType.ORDER), AgentType.fromId(" Order "));
        assertEquals(Optional.of(AgentType.ESCALATION), AgentType.fromId("ESCALATION"));
        assertEquals(Optional.of(AgentType.FAQ), AgentType.fromId("faq"));
    }

    @Test
    void fromId_returnsEmptyForUnknownOrNull() {
        assertTrue(AgentType.fromId("billing").isEmpty());
        assertTrue(AgentType.fromId(null).isEmpty());
        assertTrue(AgentType.fromId("").isEmpty());
    }
}
