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
import me.golemcore.support.domain.exception.SupportException;
import me.golemcore.support.domain.model.ChatTaskStatus;
import me.golemcore.support.domain.model.ChatTurnRequest;
import me.golemcore.support.domain.model.TurnResult;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.port.inbound.ChatTaskPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * In-process task runner for customer messages.
 *
 * <p>
 * A submitted task runs the orchestrator once on the chat task pool and keeps
 * its outcome for {@code support.tasks.result-ttl-minutes} after it finishes.
 * Work is never cancelled because a caller stops polling. A turn that ends in
 * {@code FAILED} is reported as {@link ChatTaskStatus.State#FAILURE} with the
 * turn result attached, so the apology text stays available.
 */
@Service
@Slf4j
public class ChatTaskService implements ChatTaskPort {

    static final String REASON_INTERNAL = "internal_error";

    private final AgentOrchestrator orchestrator;
    private final SupportProperties properties;
    private final Clock clock;
    private final ExecutorService taskExecutor;
    private final Map<String, ChatTaskStatus> tasks = new ConcurrentHashMap<>();

    public ChatTaskService(AgentOrchestrator orchestrator, SupportProperties properties, Clock clock,
            @Qualifier("chatTaskExecutor") ExecutorService taskExecutor) {
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.clock = clock;
        this.taskExecutor = taskExecutor;
    }

    /**
     * @throws IllegalArgumentException
     *             if the conversation id or message is invalid; nothing is
     *             submitted
     */
    @Override
    public String submit(ChatTurnRequest request) {
        ConversationIdValidator.normalizeOrThrow(request.getConversationId());
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            throw new IllegalArgumentException("Message must not be blank");
        }
        if (request.getCorrelationId() == null || request.getCorrelationId().isBlank()) {
            request.setCorrelationId(UUID.randomUUID().toString());
        }
        purgeExpired();

        String taskId = UUID.randomUUID().toString();
        tasks.put(taskId, ChatTaskStatus.pending(taskId, clock.instant()));
        taskExecutor.execute(() -> run(taskId, request));
        log.info("[Tasks] Submitted task {} for conversation {}", taskId, request.getConversationId());
        return taskId;
    }

    @Override
    public Optional<ChatTaskStatus> getStatus(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        purgeExpired();
        return Optional.ofNullable(tasks.get(taskId));
    }

    private void run(String taskId, ChatTurnRequest request) {
        ChatTaskStatus pending = tasks.get(taskId);
        Instant submittedAt = pending != null ? pending.getSubmittedAt() : null;
        ChatTaskStatus.ChatTaskStatusBuilder status = ChatTaskStatus.builder()
                .taskId(taskId)
                .submittedAt(submittedAt);
        try {
            TurnResult result = orchestrator.handle(request);
            if (result.isSuccessful()) {
                status.state(ChatTaskStatus.State.SUCCESS).result(result);
            } else {
                status.state(ChatTaskStatus.State.FAILURE).result(result).reason(result.getFailureReason());
            }
        } catch (SupportException e) {
            log.warn("[Tasks] Task {} failed: {}", taskId, e.getMessage());
            status.state(ChatTaskStatus.State.FAILURE).reason(e.getCode().name().toLowerCase(Locale.ROOT));
        } catch (RuntimeException e) {
            log.error("[Tasks] Task {} failed unexpectedly", taskId, e);
            status.state(ChatTaskStatus.State.FAILURE).reason(REASON_INTERNAL);
        }
        tasks.put(taskId, status.finishedAt(clock.instant()).build());
        log.debug("[Tasks] Task {} finished", taskId);
    }

    private void purgeExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(properties.getTasks().getResultTtlMinutes()));
        tasks.values().removeIf(status -> status.getFinishedAt() != null && status.getFinishedAt().isBefore(cutoff));
    }
}
