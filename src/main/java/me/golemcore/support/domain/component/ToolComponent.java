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

package me.golemcore.support.domain.component;

import me.golemcore.support.domain.exception.ToolArgumentException;
import me.golemcore.support.domain.model.ToolDefinition;
import me.golemcore.support.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing a callable tool used by the specialist agents.
 *
 * <p>
 * A tool has a JSON Schema definition, a typed request, a parser that turns a
 * loose argument map into that request, and the execution itself. Execution
 * expresses expected failures (not found, store unavailable) as failed
 * {@link ToolResult}s; anything thrown is caught by the registry.
 *
 * @param <R>
 *            request type accepted by this tool
 */
public interface ToolComponent<R extends ToolRequest> {

    /**
     * Returns the tool definition with JSON Schema for its arguments.
     */
    ToolDefinition getDefinition();

    /**
     * Returns the request type this tool accepts.
     */
    Class<R> requestType();

    /**
     * Validates a loose argument map and builds the typed request.
     *
     * @throws ToolArgumentException
     *             if arguments are missing or malformed
     */
    R parseArguments(Map<String, Object> arguments);

    /**
     * Executes the tool with an already validated request. Called on the
     * registry's tool pool; blocking work should stay on the calling thread so
     * a timeout interrupt reaches it.
     */
    CompletableFuture<ToolResult> execute(R request);

    /**
     * Returns the unique name of this tool.
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
