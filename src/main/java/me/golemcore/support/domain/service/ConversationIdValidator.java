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

import java.util.regex.Pattern;

/**
 * Conversation id validation helpers.
 *
 * <p>
 * Contract: {@code ^[a-zA-Z0-9_-]{1,64}$}. Ids are used as storage path
 * segments and cache/lock key parts, so nothing outside this alphabet is
 * accepted.
 */
public final class ConversationIdValidator {

    private static final Pattern PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");

    private ConversationIdValidator() {
    }

    public static boolean isValid(String value) {
        String normalized = normalize(value);
        return normalized != null && PATTERN.matcher(normalized).matches();
    }

    public static String normalizeOrThrow(String value) {
        String normalized = normalize(value);
        if (normalized == null || !PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("conversationId must match ^[a-zA-Z0-9_-]{1,64}$");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String candidate = value.trim();
        return candidate.isEmpty() ? null : candidate;
    }
}
