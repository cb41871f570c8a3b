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

package me.golemcore.support.port.inbound;

import me.golemcore.support.domain.model.ChatTaskStatus;
import me.golemcore.support.domain.model.ChatTurnRequest;

import java.util.Optional;

/**
 * Task submission surface for inbound customer messages. Each submission runs
 * the orchestrator exactly once; callers poll for the outcome.
 */
public interface ChatTaskPort {

    /**
     * Accepts a message for processing and returns the task id immediately.
     */
    String submit(ChatTurnRequest request);

    /**
     * Returns the current status, or empty if the task id is unknown or its
     * result has expired.
     */
    Optional<ChatTaskStatus> getStatus(String taskId);
}
