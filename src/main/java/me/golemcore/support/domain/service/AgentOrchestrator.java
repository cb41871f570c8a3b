/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.support.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.agent.SpecialistAgent;
import me.golemcore.support.agent.SpecialistAgentRegistry;
import me.golemcore.support.agent.SpecialistRequest;
import me.golemcore.support.domain.exception.ConversationBusyException;
import me.golemcore.support.domain.exception.ModelUnavailableException;
import me.golemcore.support.domain.exception.StorageUnavailableException;
import me.golemcore.support.domain.model.AgentReply;
import me.golemcore.support.domain.model.AgentType;
import me.golemcore.support.domain.model.ChatTurnRequest;
import me.golemcore.support.domain.model.Conversation;
import me.golemcore.support.domain.model.ConversationStatus;
import me.golemcore.support.domain.model.ConversationSummary;
import me.golemcore.support.domain.model.CustomerRecord;
import me.golemcore.support.domain.model.Message;
import me.golemcore.support.domain.model.RoutingDecision;
import me.golemcore.support.domain.model.ToolInvocation;
import me.golemcore.support.domain.model.TurnResult;
import me.golemcore.support.domain.model.TurnState;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.port.outbound.AccountStorePort;
import me.golemcore.support.port.outbound.ConversationLockPort;
import me.golemcore.support.port.outbound.ConversationLockPort.LockLease;
import me.golemcore.support.routing.IntentRouter;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one customer turn: lock, load, route, dispatch, persist.
 *
 * <p>
 * Turns on the same conversation are serialized through
 * {@link ConversationLockPort}. The turn budget ({@code timeout-ms}) starts
 * when the lock is granted and bounds routing and the specialist together,
 * both of which run on the dispatch pool. The lease is held for the budget
 * plus {@code persist-margin-ms}, so the appends that follow an exhausted
 * budget still happen under the lock.
 *
 * <p>
 * A successful turn appends exactly two messages (user, then assistant). A
 * failed turn appends only the user message and returns
 * {@link #GENERIC_FAILURE_REPLY}. Only model, storage and timeout failures end
 * a turn as {@link TurnState#FAILED}; tool failures are absorbed by the
 * specialists.
 */
@Service
@Slf4j
public class AgentOrchestrator {

    public static final String GENERIC_FAILURE_REPLY = "I'm sorry, I'm having trouble processing your request "
            + "right now. Please try again in a moment.";

    static final String MDC_CONVERSATION_ID = "conversationId";
    static final String MDC_CORRELATION_ID = "correlationId";
    static final String LOCK_KEY_PREFIX = "conversation:";

    private final ConversationMemoryService memory;
    private final IntentRouter router;
    private final SpecialistAgentRegistry specialists;
    private final ConversationLockPort lockPort;
    private final AccountStorePort accountStore;
    private final SupportProperties properties;
    private final ExecutorService dispatchExecutor;

    public AgentOrchestrator(ConversationMemoryService memory, IntentRouter router,
            SpecialistAgentRegistry specialists, ConversationLockPort lockPort, AccountStorePort accountStore,
            SupportProperties properties, @Qualifier("agentDispatchExecutor") ExecutorService dispatchExecutor) {
        this.memory = memory;
        this.router = router;
        this.specialists = specialists;
        this.lockPort = lockPort;
        this.accountStore = accountStore;
        this.properties = properties;
        this.dispatchExecutor = dispatchExecutor;
    }

    /**
     * Processes one inbound message.
     *
     * @throws IllegalArgumentException
     *             if the conversation id or message is invalid
     * @throws ConversationBusyException
     *             if another turn holds the conversation longer than the lock
     *             wait; nothing is persisted
     */
    public TurnResult handle(ChatTurnRequest request) {
        String conversationId = ConversationIdValidator.normalizeOrThrow(request.getConversationId());
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            throw new IllegalArgumentException("Message must not be blank");
        }
        String correlationId = request.getCorrelationId() != null && !request.getCorrelationId().isBlank()
                ? request.getCorrelationId()
                : UUID.randomUUID().toString();

        MDC.put(MDC_CONVERSATION_ID, conversationId);
        MDC.put(MDC_CORRELATION_ID, correlationId);
        try {
            SupportProperties.OrchestratorProperties settings = properties.getOrchestrator();
            Duration timeout = Duration.ofMillis(settings.getTimeoutMs());
            Duration hold = timeout.plusMillis(settings.getPersistMarginMs());
            Duration lockWait = Duration.ofMillis(settings.getLockWaitMs());
            Optional<LockLease> lease = lockPort.tryAcquire(LOCK_KEY_PREFIX + conversationId, hold, lockWait);
            if (lease.isEmpty()) {
                log.warn("[Orchestrator] Conversation {} is busy, gave up after {}ms", conversationId,
                        lockWait.toMillis());
                throw new ConversationBusyException(conversationId, lockWait);
            }
            try {
                return runTurn(conversationId, correlationId, request, timeout, System.nanoTime() + hold.toNanos());
            } finally {
                lockPort.release(lease.get());
            }
        } finally {
            MDC.remove(MDC_CONVERSATION_ID);
            MDC.remove(MDC_CORRELATION_ID);
        }
    }

    public Optional<ConversationSummary> getConversationSummary(String conversationId) {
        return memory.getSummary(conversationId);
    }

    public void closeConversation(String conversationId) {
        memory.closeConversation(conversationId);
        log.info("[Orchestrator] Conversation {} closed", conversationId);
    }

    private TurnResult runTurn(String conversationId, String correlationId, ChatTurnRequest request,
            Duration timeout, long leaseEndNanos) {
        long deadlineNanos = System.nanoTime() + timeout.toNanos();
        String message = request.getMessage();
        TurnState state = TurnState.RECEIVED;
        RoutingDecision routing = null;
        boolean userMessageStored = false;

        try {
            Conversation conversation = memory.getOrCreateConversation(conversationId);
            if (conversation.getStatus() == ConversationStatus.CLOSED) {
                log.info("[Orchestrator] Reopening closed conversation {}", conversationId);
                memory.updateStatus(conversationId, ConversationStatus.ACTIVE);
            }
            String customerEmail = linkCustomer(conversationId, request.getCustomerEmail());

            List<Message> context = memory.getContext(conversationId);
            routing = withinBudget(() -> router.route(message, context), deadlineNanos);
            state = state.transitionTo(TurnState.ROUTED);

            SpecialistRequest specialistRequest = SpecialistRequest.builder()
                    .conversationId(conversationId)
                    .correlationId(correlationId)
                    .message(message)
                    .context(context)
                    .routing(routing)
                    .customerEmail(customerEmail)
                    .build();

            state = state.transitionTo(TurnState.PROCESSING);
            AgentType target = routing.getTarget();
            AgentReply reply = withinBudget(() -> runSpecialists(specialistRequest, target), deadlineNanos);
            TurnState terminal = reply.getAgentType() == AgentType.ESCALATION
                    ? TurnState.ESCALATED
                    : TurnState.COMPLETED;

            warnIfLeaseLapsed(leaseEndNanos);
            memory.append(conversationId, Message.ROLE_USER, message, userMetadata(correlationId));
            userMessageStored = true;
            memory.append(conversationId, Message.ROLE_ASSISTANT, reply.getContent(),
                    assistantMetadata(correlationId, reply, routing, terminal));
            state = state.transitionTo(terminal);
            if (reply.isTicketCreated()) {
                markEscalated(conversationId);
            }

            log.info("[Orchestrator] Turn {} by {} agent, tools: {}", state, reply.getAgentType().getId(),
                    reply.getToolInvocations().stream().map(ToolInvocation::getName).toList());
            return TurnResult.builder()
                    .conversationId(conversationId)
                    .correlationId(correlationId)
                    .state(state)
                    .content(reply.getContent())
                    .agentType(reply.getAgentType())
                    .routing(routing)
                    .toolInvocations(reply.getToolInvocations())
                    .build();

        } catch (ModelUnavailableException e) {
            log.error("[Orchestrator] Model unavailable ({}) in state {}", e.getReasonCode(), state);
            return fail(conversationId, correlationId, state, routing, userMessageStored, message,
                    "model_unavailable:" + e.getReasonCode());
        } catch (StorageUnavailableException e) {
            log.error("[Orchestrator] Storage unavailable in state {}: {}", state, e.getMessage());
            return fail(conversationId, correlationId, state, routing, userMessageStored, message,
                    "storage_unavailable");
        } catch (TimeoutException e) {
            log.error("[Orchestrator] Turn budget of {}ms exhausted in state {}", timeout.toMillis(), state);
            return fail(conversationId, correlationId, state, routing, userMessageStored, message, "timeout");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(conversationId, correlationId, state, routing, userMessageStored, message, "interrupted");
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Unexpected failure in state {}", state, e);
            return fail(conversationId, correlationId, state, routing, userMessageStored, message,
                    "internal_error");
        }
    }

    /**
     * Runs a step on the dispatch pool and waits no longer than the turn
     * deadline. A step that overruns is cancelled but may keep running; it
     * never touches memory, so it cannot write after the lock is released.
     */
    private <T> T withinBudget(Callable<T> step, long deadlineNanos)
            throws TimeoutException, InterruptedException {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = dispatchExecutor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return step.call();
            } finally {
                MDC.clear();
            }
        });

        long remainingNanos = deadlineNanos - System.nanoTime();
        try {
            return future.get(Math.max(0, remainingNanos), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Turn step failed", cause);
        }
    }

    private void warnIfLeaseLapsed(long leaseEndNanos) {
        if (System.nanoTime() > leaseEndNanos) {
            log.warn("[Orchestrator] Conversation lease lapsed before persisting; raise persist-margin-ms");
        }
    }

    private AgentReply runSpecialists(SpecialistRequest request, AgentType target) {
        SpecialistAgent agent = specialists.get(target);
        log.debug("[Orchestrator] Dispatching to {} agent", target.getId());
        AgentReply reply = agent.handle(request);
        if (!reply.isHandoffRequested() || target == AgentType.ESCALATION) {
            return reply;
        }

        log.info("[Orchestrator] {} agent handed the turn to escalation", target.getId());
        AgentReply escalation = specialists.get(AgentType.ESCALATION).handle(request);
        List<ToolInvocation> invocations = new ArrayList<>(reply.getToolInvocations());
        invocations.addAll(escalation.getToolInvocations());
        escalation.setToolInvocations(invocations);
        if (!reply.getContent().isBlank()) {
            escalation.setContent(reply.getContent() + "\n\n" + escalation.getContent());
        }
        return escalation;
    }

    private void markEscalated(String conversationId) {
        try {
            memory.updateStatus(conversationId, ConversationStatus.ESCALATED);
        } catch (StorageUnavailableException e) {
            log.warn("[Orchestrator] Exchange stored but status update failed: {}", e.getMessage());
        }
    }

    private String linkCustomer(String conversationId, String rawEmail) {
        String email = EmailAddresses.normalize(rawEmail);
        if (email == null) {
            if (rawEmail != null && !rawEmail.isBlank()) {
                log.warn("[Orchestrator] Ignoring malformed customer email");
            }
            return null;
        }
        Optional<CustomerRecord> customer = accountStore.findCustomer(email);
        if (customer.isPresent()) {
            memory.linkCustomer(conversationId, customer.get().getId(), email);
        } else {
            log.warn("[Orchestrator] Customer not found: {}", email);
        }
        return email;
    }

    private TurnResult fail(String conversationId, String correlationId, TurnState state, RoutingDecision routing,
            boolean userMessageStored, String message, String reason) {
        if (!userMessageStored) {
            try {
                memory.append(conversationId, Message.ROLE_USER, message, userMetadata(correlationId));
            } catch (StorageUnavailableException e) {
                log.error("[Orchestrator] Could not record user message after failure: {}", e.getMessage());
            }
        }
        return TurnResult.builder()
                .conversationId(conversationId)
                .correlationId(correlationId)
                .state(state.transitionTo(TurnState.FAILED))
                .content(GENERIC_FAILURE_REPLY)
                .agentType(routing != null ? routing.getTarget() : null)
                .routing(routing)
                .toolInvocations(List.of())
                .failureReason(reason)
                .build();
    }

    private static Map<String, Object> userMetadata(String correlationId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(Message.META_CORRELATION_ID, correlationId);
        return metadata;
    }

    private static Map<String, Object> assistantMetadata(String correlationId, AgentReply reply,
            RoutingDecision routing, TurnState terminal) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(Message.META_CORRELATION_ID, correlationId);
        metadata.put(Message.META_AGENT_TYPE, reply.getAgentType().getId());
        metadata.put(Message.META_TOOL_INVOCATIONS, reply.getToolInvocations());
        metadata.put(Message.META_ROUTE, routing.getTarget().getId());
        metadata.put(Message.META_ROUTING_CONFIDENCE, routing.getConfidence());
        metadata.put(Message.META_ROUTING_SOURCE, routing.getSource().name().toLowerCase(Locale.ROOT));
        metadata.put(Message.META_TURN_STATE, terminal.name());
        return metadata;
    }
}
