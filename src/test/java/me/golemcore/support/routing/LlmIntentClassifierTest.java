package me.golemcore.support.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.support.domain.exception.MalformedModelOutputException;
import me.golemcore.support.domain.model.AgentType;
import me.golemcore.support.domain.model.LlmRequest;
import me.golemcore.support.domain.model.Message;
import me.golemcore.support.domain.model.RoutingDecision;
import me.golemcore.support.domain.model.RoutingSource;
import me.golemcore.support.domain.service.LlmCompletionService;
import me.golemcore.support.infrastructure.config.SupportProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LlmIntentClassifierTest {

    private LlmCompletionService completionService;
    private LlmIntentClassifier classifier;

    @BeforeEach
    void setUp() {
        completionService = mock(LlmCompletionService.class);
        classifier = new LlmIntentClassifier(completionService, new SupportProperties(), new ObjectMapper());
    }

    @Test
    void classify_parsesValidJsonResponse() {
        when(completionService.complete(any(LlmRequest.class))).thenReturn("""
                {"route": "order", "confidence": 0.9, "reasoning": "Subscription question", \
                "summary": "Customer asks about subscription"}
                """);

        RoutingDecision decision = classifier.classify("What's my current subscription status?", List.of());

        assertEquals(AgentType.ORDER, decision.getTarget());
        assertEquals(0.9, decision.getConfidence());
        assertEquals("Subscription question", decision.getReasoning());
        assertEquals("Customer asks about subscription", decision.getSummary());
        assertEquals(RoutingSource.LLM, decision.getSource());
    }

    @Test
    void classify_parsesJsonInMarkdownBlock() {
        when(completionService.complete(any(LlmRequest.class))).thenReturn("""
                Here is my decision:
                ```json
                {"route": "Escalation", "confidence": 0.8, "reasoning": "Complaint"}
                ```
                """);

        RoutingDecision decision = classifier.classify("This is unacceptable", List.of());

        assertEquals(AgentType.ESCALATION, decision.getTarget());
        assertEquals("This is unacceptable", decision.getSummary());
    }

    @Test
    void classify_extractsBareObjectFromProse() {
        when(completionService.complete(any(LlmRequest.class)))
                .thenReturn("Sure! {\"route\": \"faq\"} Hope that helps.");

        RoutingDecision decision = classifier.classify("How do I invite people?", List.of());

        assertEquals(AgentType.FAQ, decision.getTarget());
        assertEquals(LlmIntentClassifier.DEFAULT_CONFIDENCE, decision.getConfidence());
    }

    @Test
    void classify_clampsConfidence() {
        when(completionService.complete(any(LlmRequest.class))).thenReturn("{\"route\": \"faq\", \"confidence\": 7}");

        assertEquals(1.0, classifier.classify("hi", List.of()).getConfidence());
    }

    @Test
    void classify_rejectsOutputWithoutJson() {
        when(completionService.complete(any(LlmRequest.class))).thenReturn("Invalid response without JSON");

        assertThrows(MalformedModelOutputException.class, () -> classifier.classify("billing help", List.of()));
    }

    @Test
    void classify_rejectsUnknownRoute() {
        when(completionService.complete(any(LlmRequest.class)))
                .thenReturn("{\"route\": \"sales\", \"confidence\": 0.99}");

        assertThrows(MalformedModelOutputException.class, () -> classifier.classify("buy", List.of()));
    }

    @Test
    void classify_rejectsMissingRoute() {
        when(completionService.complete(any(LlmRequest.class))).thenReturn("{\"confidence\": 0.99}");

        assertThrows(MalformedModelOutputException.class, () -> classifier.classify("buy", List.of()));
    }

    @Test
    void classify_sendsOnlyRecentContext() {
        when(completionService.complete(any(LlmRequest.class))).thenReturn("{\"route\": \"faq\"}");
        List<Message> context = List.of(
                message("first question"), message("second question"),
                message("third question"), message("fourth question"));

        classifier.classify("current", context);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(completionService).complete(captor.capture());
        String prompt = captor.getValue().getMessages().get(0).getContent();
        assertFalse(prompt.contains("first question"));
        assertTrue(prompt.contains("second question"));
        assertTrue(prompt.contains("fourth question"));
        assertTrue(prompt.contains("## Current Customer Message:\ncurrent"));
        assertEquals(0.0, captor.getValue().getTemperature());
    }

    private static Message message(String content) {
        return Message.builder().role(Message.ROLE_USER).content(content).build();
    }
}
