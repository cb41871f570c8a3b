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

import java.util.Locale;

/**
 * Support ticket category. Unknown values map to {@link #OTHER}.
 */
public enum TicketCategory {

    BILLING, TECHNICAL, ACCOUNT, FEATURE_REQUEST, BUG_REPORT, OTHER;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TicketCategory fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (TicketCategory category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        return OTHER;
    }
}
