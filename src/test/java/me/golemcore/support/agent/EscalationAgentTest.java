package me.golemcore.support.agent;

import me.golemcore.support.domain.component.ToolRequest;
import me.golemcore.support.domain.exception.ModelUnavailableException;
import me.golemcore.support.domain.model.AgentReply;
import me.golemcore.support.domain.model.AgentType;
import me.golemcore.support.domain.model.LlmRequest;
import me.golemcore.support.domain.model.Message;
import me.golemcore.support.domain.model.RoutingDecision;
import me.golemcore.support.domain.model.RoutingSource;
import me.golemcore.support.domain.model.TicketCategory;
import me.golemcore.support.domain.model.ToolResult;
import me.golemcore.support.domain.service.LlmCompletionService;
import me.golemcore.support.domain.service.ToolRegistry;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.tools.CreateTicketTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class EscalationAgentTest {

    private static final String TICKET_OUTPUT = "Support Ticket Created Successfully\n- Ticket ID: TKT-1";

    private LlmCompletionService completionService;
    private ToolRegistry toolRegistry;
    private EscalationAgent agent;

    @BeforeEach
    void setUp() {
        completionService = mock(LlmCompletionService.class);
        toolRegistry = mock(ToolRegistry.class);
        agent = new EscalationAgent(completionService, toolRegistry, new SupportProperties());
    }

    @Test
    void handle_createsTicketAndConfirms() {
        when(toolRegistry.invoke(any(ToolRequest.class))).thenReturn(ToolResult.success(TICKET_OUTPUT));
        when(completionService.complete(any(LlmRequest.class))).thenReturn("A specialist will contact you.");

        AgentReply reply = agent.handle(SpecialistRequest.builder()
                .conversationId("conv-1")
                .message("I was charged twice, I want a manager")
                .customerEmail("John.Smith@TechStartup.com")
                .routing(RoutingDecision.builder()
                        .target(AgentType.ESCALATION)
                        .confidence(0.9)
                        .reasoning("Customer demands a manager")
                        .summary("Double charge complaint")
                        .source(RoutingSource.LLM)
                        .build())
                .context(List.of())
                .build());

        assertEquals("A specialist will contact you.", reply.getContent());
        assertEquals(AgentType.ESCALATION, reply.getAgentType());
        assertTrue(reply.isTicketCreated());
        assertFalse(reply.isHandoffRequested());

        ArgumentCaptor<ToolRequest> captor = ArgumentCaptor.forClass(ToolRequest.class);
        verify(toolRegistry).invoke(captor.capture());
        CreateTicketTool.Request ticket = (CreateTicketTool.Request) captor.getValue();
        assertEquals("Double charge complaint", ticket.subject());
        assertEquals(TicketCategory.BILLING, ticket.category());
        assertEquals("conv-1", ticket.conversationId());
        assertEquals("john.smith@techstartup.com", ticket.email());
        assertTrue(ticket.description().contains("Routing reasoning: Customer demands a manager"));
    }

    @Test
    void handle_ticketFailureApologizesWithoutModelCall() {
        when(toolRegistry.invoke(any(ToolRequest.class))).thenReturn(ToolResult.failure("Failed to create support ticket"));

        AgentReply reply = agent.handle(request("Please escalate this"));

        assertEquals(EscalationAgent.TICKET_FAILED_REPLY, reply.getContent());
        assertFalse(reply.isTicketCreated());
        assertEquals(1, reply.getToolInvocations().size());
        verifyNoInteractions(completionService);
    }

    @Test
    void handle_modelUnavailableAfterTicketReturnsTicketSummary() {
        // Given the ticket is created but the model is down
        when(toolRegistry.invoke(any(ToolRequest.class))).thenReturn(ToolResult.success(TICKET_OUTPUT));
        when(completionService.complete(any(LlmRequest.class)))
                .thenThrow(new ModelUnavailableException("down", "rate_limit", null));

        // When
        AgentReply reply = agent.handle(request("I need a human"));

        // Then
        assertTrue(reply.isTicketCreated());
        assertTrue(reply.getContent().startsWith("I've escalated your issue to our support team."));
        assertTrue(reply.getContent().contains("TKT-1"));
    }

    @Test
    void handle_subjectFallsBackToMessageAndDescriptionIncludesRecentContext() {
        when(toolRegistry.invoke(any(ToolRequest.class))).thenReturn(ToolResult.success(TICKET_OUTPUT));
        when(completionService.complete(any(LlmRequest.class))).thenReturn("Done.");
        List<Message> context = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            context.add(Message.builder().role(Message.ROLE_USER).content("message " + i).build());
        }

        agent.handle(SpecialistRequest.builder()
                .conversationId("conv-2")
                .message("The sync is not working")
                .context(context)
                .build());

        ArgumentCaptor<ToolRequest> captor = ArgumentCaptor.forClass(ToolRequest.class);
        verify(toolRegistry).invoke(captor.capture());
        CreateTicketTool.Request ticket = (CreateTicketTool.Request) captor.getValue();
        assertEquals("The sync is not working", ticket.subject());
        assertNull(ticket.email());
        assertFalse(ticket.description().contains("message 2"));
        assertTrue(ticket.description().contains("message 3"));
        assertTrue(ticket.description().contains("message 7"));
    }

    @Test
    void inferCategory_mapsKeywordsToCategories() {
        assertEquals(TicketCategory.BILLING, EscalationAgent.inferCategory("Refund my last invoice"));
        assertEquals(TicketCategory.BUG_REPORT, EscalationAgent.inferCategory("The app shows an error"));
        assertEquals(TicketCategory.ACCOUNT, EscalationAgent.inferCategory("I forgot my password"));
        assertEquals(TicketCategory.FEATURE_REQUEST, EscalationAgent.inferCategory("Feature idea: dark mode"));
        assertEquals(TicketCategory.TECHNICAL, EscalationAgent.inferCategory("Everything is slow today"));
        assertEquals(TicketCategory.OTHER, EscalationAgent.inferCategory("Hello there"));
        assertEquals(TicketCategory.OTHER, EscalationAgent.inferCategory(null));
    }

    private static SpecialistRequest request(String message) {
        return SpecialistRequest.builder()
                .conversationId("conv-1")
                .message(message)
                .context(List.of())
                .build();
    }
}
