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
import me.golemcore.support.domain.component.ToolComponent;
import me.golemcore.support.domain.component.ToolRequest;
import me.golemcore.support.domain.exception.ToolArgumentException;
import me.golemcore.support.domain.model.ToolDefinition;
import me.golemcore.support.domain.model.ToolFailureKind;
import me.golemcore.support.domain.model.ToolResult;
import me.golemcore.support.infrastructure.config.SupportProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Registry and single entry point for tool execution.
 *
 * <p>
 * {@link #invoke} never throws: unknown or disabled tools, invalid arguments,
 * exceptions and timeouts all come back as a failed {@link ToolResult} with a
 * {@link ToolFailureKind}.
 *
 * <p>
 * Tools run on the {@code toolExecutor} pool. A tool that overruns
 * {@code support.tools.timeout-ms} has its worker interrupted.
 */
@Service
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent<?>> tools = new ConcurrentHashMap<>();
    private final SupportProperties properties;
    private final ExecutorService toolExecutor;

    public ToolRegistry(List<ToolComponent<?>> toolComponents, SupportProperties properties,
            @Qualifier("toolExecutor") ExecutorService toolExecutor) {
        this.properties = properties;
        this.toolExecutor = toolExecutor;
        for (ToolComponent<?> tool : toolComponents) {
            register(tool);
        }
        log.info("[Tools] Registered tools: {}", new TreeSet<>(tools.keySet()));
    }

    public void register(ToolComponent<?> tool) {
        ToolComponent<?> previous = tools.put(tool.getToolName(), tool);
        if (previous != null && previous != tool) {
            log.warn("[Tools] Tool {} replaced by {}", tool.getToolName(), tool.getClass().getSimpleName());
        }
    }

    public Set<String> getToolNames() {
        return Set.copyOf(tools.keySet());
    }

    public List<ToolDefinition> getDefinitions() {
        return tools.values().stream().map(ToolComponent::getDefinition).toList();
    }

    /**
     * Invokes a tool by name with loose arguments, validating them into the
     * tool's request type first.
     */
    public ToolResult invoke(String name, Map<String, Object> arguments) {
        ToolComponent<?> tool = resolve(name);
        if (tool == null) {
            return unknownTool(name);
        }
        return parseAndExecute(tool, arguments != null ? arguments : Map.of());
    }

    /**
     * Invokes the tool addressed by a typed request. The request is validated
     * exactly like the map form.
     */
    public ToolResult invoke(ToolRequest request) {
        if (request == null) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "Tool request must not be null");
        }
        ToolComponent<?> tool = resolve(request.toolName());
        if (tool == null) {
            return unknownTool(request.toolName());
        }
        return executeTyped(tool, request);
    }

    private ToolComponent<?> resolve(String name) {
        if (name == null) {
            return null;
        }
        Collection<String> disabled = properties.getTools().getDisabled();
        if (disabled != null && disabled.contains(name)) {
            log.debug("[Tools] Tool {} is disabled", name);
            return null;
        }
        return tools.get(name);
    }

    private <R extends ToolRequest> ToolResult parseAndExecute(ToolComponent<R> tool, Map<String, Object> arguments) {
        R request;
        try {
            request = tool.parseArguments(arguments);
        } catch (ToolArgumentException e) {
            log.warn("[Tools] Invalid arguments for {}: {}", tool.getToolName(), e.getMessage());
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("[Tools] Argument parsing failed for {}", tool.getToolName(), e);
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "Invalid arguments: " + safeCauseMessage(e));
        }
        return run(tool, request);
    }

    // Typed requests are re-read through the tool's parser so both entry points
    // share one set of bounds and required-field checks.
    private ToolResult executeTyped(ToolComponent<?> tool, ToolRequest request) {
        if (!tool.requestType().isInstance(request)) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "Tool " + tool.getToolName() + " expects " + tool.requestType().getSimpleName()
                            + " but got " + request.getClass().getSimpleName());
        }
        Map<String, Object> arguments;
        try {
            arguments = request.toArguments();
        } catch (RuntimeException e) {
            log.warn("[Tools] Unreadable request for {}", tool.getToolName(), e);
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "Invalid arguments: " + safeCauseMessage(e));
        }
        return parseAndExecute(tool, arguments != null ? arguments : Map.of());
    }

    private <R extends ToolRequest> ToolResult run(ToolComponent<R> tool, R request) {
        long timeoutMs = properties.getTools().getTimeoutMs();
        long startMs = System.currentTimeMillis();
        Future<ToolResult> future = null;
        try {
            future = toolExecutor.submit(() -> tool.execute(request).get());
            ToolResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                return ToolResult.failure("Tool " + tool.getToolName() + " returned no result");
            }
            log.debug("[Tools] {} finished in {}ms, success={}", tool.getToolName(),
                    System.currentTimeMillis() - startMs, result.isSuccess());
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Tools] {} timed out after {}ms", tool.getToolName(), timeoutMs);
            return ToolResult.failure("Tool " + tool.getToolName() + " timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure("Tool " + tool.getToolName() + " was interrupted");
        } catch (ExecutionException | RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", tool.getToolName(), e);
            return ToolResult.failure("Tool execution failed: " + safeCauseMessage(e));
        }
    }

    private ToolResult unknownTool(String name) {
        String available = String.join(", ", new TreeSet<>(tools.keySet()));
        return ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL,
                "Unknown tool: " + name + ". Available tools: " + available);
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
