package me.golemcore.support.routing;

import me.golemcore.support.domain.exception.MalformedModelOutputException;
import me.golemcore.support.domain.exception.ModelUnavailableException;
import me.golemcore.support.domain.model.AgentType;
import me.golemcore.support.domain.model.RoutingDecision;
import me.golemcore.support.domain.model.RoutingSource;
import me.golemcore.support.infrastructure.config.SupportProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class IntentRouterTest {

    private LlmIntentClassifier classifier;
    private IntentRouter router;

    @BeforeEach
    void setUp() {
        classifier = mock(LlmIntentClassifier.class);
        router = new IntentRouter(classifier, new KeywordIntentMatcher(), new SupportProperties());
    }

    @Test
    void route_usesConfidentModelDecision() {
        when(classifier.classify(anyString(), anyList())).thenReturn(decision(AgentType.ORDER, 0.9));

        RoutingDecision decision = router.route("What's my current subscription status?", List.of());

        assertEquals(AgentType.ORDER, decision.getTarget());
        assertEquals(RoutingSource.LLM, decision.getSource());
    }

    @Test
    void route_fallsBackOnMalformedOutput() {
        when(classifier.classify(anyString(), anyList()))
                .thenThrow(new MalformedModelOutputException("Routing response is not valid JSON"));

        RoutingDecision decision = router.route("Question about billing", List.of());

        assertEquals(AgentType.ORDER, decision.getTarget());
        assertEquals(RoutingSource.FALLBACK, decision.getSource());
    }

    @Test
    void route_fallsBackBelowThreshold() {
        when(classifier.classify(anyString(), anyList())).thenReturn(decision(AgentType.FAQ, 0.3));

        RoutingDecision decision = router.route("I need a human now", List.of());

        assertEquals(AgentType.ESCALATION, decision.getTarget());
        assertTrue(decision.isFallback());
    }

    @Test
    void route_acceptsConfidenceAtThreshold() {
        when(classifier.classify(anyString(), anyList())).thenReturn(decision(AgentType.FAQ, 0.5));

        assertEquals(RoutingSource.LLM, router.route("hello", List.of()).getSource());
    }

    @Test
    void route_fallsBackWhenModelUnavailable() {
        when(classifier.classify(anyString(), anyList()))
                .thenThrow(new ModelUnavailableException("down", "llm.rate_limit", null));

        RoutingDecision decision = router.route("How do I reset my password?", List.of());

        assertEquals(AgentType.FAQ, decision.getTarget());
        assertEquals(RoutingSource.FALLBACK, decision.getSource());
    }

    @Test
    void route_neverThrowsOnUnexpectedErrors() {
        when(classifier.classify(anyString(), anyList())).thenThrow(new IllegalStateException("bug"));

        assertNotNull(router.route("anything", List.of()));
    }

    private static RoutingDecision decision(AgentType target, double confidence) {
        return RoutingDecision.builder()
                .target(target)
                .confidence(confidence)
                .reasoning("model")
                .source(RoutingSource.LLM)
                .build();
    }
}
