package me.golemcore.support.routing;

import me.golemcore.support.domain.model.AgentType;
import me.golemcore.support.domain.model.RoutingDecision;
import me.golemcore.support.domain.model.RoutingSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class KeywordIntentMatcherTest {

    private final KeywordIntentMatcher matcher = new KeywordIntentMatcher();

    @Test
    void billingTermsRouteToOrder() {
        RoutingDecision decision = matcher.match("Why was my billing amount different this month?");

        assertEquals(AgentType.ORDER, decision.getTarget());
        assertEquals(0.75, decision.getConfidence());
        assertEquals(RoutingSource.FALLBACK, decision.getSource());
    }

    @Test
    void escalationBeatsOrderWhenBothMatch() {
        RoutingDecision decision = matcher.match("I am angry about this invoice, get me a manager");

        assertEquals(AgentType.ESCALATION, decision.getTarget());
        assertEquals(0.7, decision.getConfidence());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Please escalate this", "I want to speak to someone", "Can a real person help?",
            "Open a ticket for me", "This is urgent"
    })
    void escalationPhrases(String message) {
        assertEquals(AgentType.ESCALATION, matcher.match(message).getTarget());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "What is your pricing?", "I want a cancellation", "My order was cancelled", "When is my renewal?",
            "I am upgrading soon", "Thinking about downgrading", "Who do I pay?", "I was charged twice",
            "Are you subscribed to updates?", "What are the fees?"
    })
    void inflectedBillingTermsRouteToOrder(String message) {
        assertEquals(AgentType.ORDER, matcher.match(message).getTarget());
    }

    @ParameterizedTest
    @ValueSource(strings = { "I keep complaining and nothing happens", "This is frustrating", "Urgently needed" })
    void inflectedEscalationTermsRouteToEscalation(String message) {
        assertEquals(AgentType.ESCALATION, matcher.match(message).getTarget());
    }

    @Test
    void defaultsToFaq() {
        RoutingDecision decision = matcher.match("How do I create a project?");

        assertEquals(AgentType.FAQ, decision.getTarget());
        assertEquals(0.6, decision.getConfidence());
    }

    @Test
    void matchesWholeWordsOnly() {
        assertEquals(AgentType.FAQ, matcher.match("Where can I leave feedback about the planner?").getTarget());
        assertEquals(AgentType.FAQ, matcher.match("How do I display my payload in the dashboard?").getTarget());
        assertEquals(AgentType.ORDER, matcher.match("Can I get refunds?").getTarget());
    }

    @Test
    void summaryIsTruncatedMessage() {
        String message = "a".repeat(150);

        assertEquals(100, matcher.match(message).getSummary().length());
    }

    @Test
    void nullMessageStillDecides() {
        RoutingDecision decision = matcher.match(null);

        assertEquals(AgentType.FAQ, decision.getTarget());
        assertEquals("", decision.getSummary());
    }
}
