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

import java.time.Duration;
import java.util.Locale;

/**
 * Ticket priority with the response time promised to the customer.
 */
public enum TicketPriority {

    LOW(Duration.ofHours(48), "48 hours"),
    MEDIUM(Duration.ofHours(24), "24 hours"),
    HIGH(Duration.ofHours(4), "4 hours"),
    URGENT(Duration.ofHours(1), "1 hour");

    private final Duration responseTime;
    private final String responseTimeLabel;

    TicketPriority(Duration responseTime, String responseTimeLabel) {
        this.responseTime = responseTime;
        this.responseTimeLabel = responseTimeLabel;
    }

    public Duration getResponseTime() {
        return responseTime;
    }

    public String getResponseTimeLabel() {
        return responseTimeLabel;
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
