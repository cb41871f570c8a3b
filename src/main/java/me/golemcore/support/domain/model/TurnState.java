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

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a single orchestration turn.
 *
 * <pre>
 * RECEIVED → ROUTED → PROCESSING → COMPLETED
 *                   ↘            ↘ FAILED
 *                    ESCALATED ←─ (handoff)
 * </pre>
 *
 * <p>
 * {@code RECEIVED} and {@code ROUTED} may also go straight to {@code FAILED}
 * when the durable store is unreachable before dispatch.
 */
public enum TurnState {

    RECEIVED, ROUTED, PROCESSING, COMPLETED, ESCALATED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ESCALATED || this == FAILED;
    }

    public boolean canTransitionTo(TurnState next) {
        return allowedTransitions().contains(next);
    }

    /**
     * Returns {@code next} if the transition is legal.
     *
     * @throws IllegalStateException
     *             if the transition is not allowed
     */
    public TurnState transitionTo(TurnState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Illegal turn transition: " + this + " -> " + next);
        }
        return next;
    }

    private Set<TurnState> allowedTransitions() {
        return switch (this) {
        case RECEIVED -> EnumSet.of(ROUTED, FAILED);
        case ROUTED -> EnumSet.of(PROCESSING, ESCALATED, FAILED);
        case PROCESSING -> EnumSet.of(COMPLETED, ESCALATED, FAILED);
        case COMPLETED, ESCALATED, FAILED -> EnumSet.noneOf(TurnState.class);
        };
    }
}
