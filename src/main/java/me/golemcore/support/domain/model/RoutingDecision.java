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

package me.golemcore.support.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Transient output of intent routing: the chosen specialist and how sure the
 * router was about it.
 */
@Data
@Builder
public class RoutingDecision {

    private AgentType target;
    private double confidence;
    private String reasoning;
    private String summary;
    private RoutingSource source;

    public boolean isFallback() {
        return source == RoutingSource.FALLBACK;
    }
}
