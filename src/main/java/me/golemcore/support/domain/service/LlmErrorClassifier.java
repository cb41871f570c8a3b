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

import java.lang.reflect.InvocationTargetException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps language-model failures to stable reason codes ({@code llm.*}) and tells
 * which codes are transient.
 *
 * <p>
 * Provider exceptions are recognised by type name so the domain does not
 * depend on the client library. The cause chain is searched outermost first;
 * at each level the exception type wins over its message.
 */
public final class LlmErrorClassifier {

    public static final String REQUEST_ABORTED = "llm.request.aborted";
    public static final String REQUEST_TIMEOUT = "llm.request.timeout";
    public static final String CONNECTION_FAILED = "llm.connection.failed";
    public static final String CONTEXT_LENGTH_EXCEEDED = "llm.context.length_exceeded";
    public static final String RATE_LIMIT = "llm.rate_limit";
    public static final String PROVIDER_TIMEOUT = "llm.provider.timeout";
    public static final String AUTHENTICATION = "llm.authentication";
    public static final String INVALID_REQUEST = "llm.invalid_request";
    public static final String MODEL_NOT_FOUND = "llm.model_not_found";
    public static final String CONTENT_FILTERED = "llm.content_filtered";
    public static final String INTERNAL_SERVER = "llm.internal_server";
    public static final String RETRIABLE = "llm.retriable";
    public static final String NON_RETRIABLE = "llm.non_retriable";
    public static final String HTTP_ERROR = "llm.http_error";
    public static final String PROVIDER_ERROR = "llm.provider_error";
    public static final String NOT_CONFIGURED = "llm.not_configured";
    public static final String UNKNOWN = "llm.error.unknown";

    public static final String NOT_CONFIGURED_PREFIX = "Provider not configured";

    private static final String PROVIDER_PACKAGE = "dev.langchain4j.exception.";
    private static final String PROVIDER_HTTP_EXCEPTION = PROVIDER_PACKAGE + "HttpException";

    // Matched against the superclass chain, so a subclass wins over its parent.
    private static final Map<String, String> PROVIDER_TYPES = Map.ofEntries(
            Map.entry(PROVIDER_PACKAGE + "RateLimitException", RATE_LIMIT),
            Map.entry(PROVIDER_PACKAGE + "TimeoutException", PROVIDER_TIMEOUT),
            Map.entry(PROVIDER_PACKAGE + "AuthenticationException", AUTHENTICATION),
            Map.entry(PROVIDER_PACKAGE + "InvalidRequestException", INVALID_REQUEST),
            Map.entry(PROVIDER_PACKAGE + "ModelNotFoundException", MODEL_NOT_FOUND),
            Map.entry(PROVIDER_PACKAGE + "ContentFilteredException", CONTENT_FILTERED),
            Map.entry(PROVIDER_PACKAGE + "InternalServerException", INTERNAL_SERVER),
            Map.entry(PROVIDER_PACKAGE + "RetriableException", RETRIABLE),
            Map.entry(PROVIDER_PACKAGE + "NonRetriableException", NON_RETRIABLE),
            Map.entry(PROVIDER_PACKAGE + "LangChain4jException", PROVIDER_ERROR));

    private static final Set<String> TRANSIENT_CODES = Set.of(RATE_LIMIT, PROVIDER_TIMEOUT, INTERNAL_SERVER,
            REQUEST_TIMEOUT, CONNECTION_FAILED, RETRIABLE);

    private LlmErrorClassifier() {
    }

    public static String classify(Throwable throwable) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable level = throwable; level != null && seen.add(level); level = level.getCause()) {
            String message = level.getMessage();
            Optional<String> code = byType(level).or(() -> byMessage(message));
            if (code.isPresent()) {
                return code.get();
            }
        }
        return UNKNOWN;
    }

    /**
     * Timeouts, 5xx, rate limiting and dropped connections. Everything else,
     * malformed output included, is final.
     */
    public static boolean isTransientCode(String code) {
        return code != null && TRANSIENT_CODES.contains(code);
    }

    private static Optional<String> byType(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return Optional.of(REQUEST_ABORTED);
        }
        if (throwable instanceof TimeoutException || throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException) {
            return Optional.of(REQUEST_TIMEOUT);
        }
        if (throwable instanceof ConnectException) {
            return Optional.of(CONNECTION_FAILED);
        }
        if (throwable instanceof IllegalStateException && throwable.getMessage() != null
                && throwable.getMessage().startsWith(NOT_CONFIGURED_PREFIX)) {
            return Optional.of(NOT_CONFIGURED);
        }
        for (Class<?> type = throwable.getClass(); type != null; type = type.getSuperclass()) {
            if (PROVIDER_HTTP_EXCEPTION.equals(type.getName())) {
                return Optional.of(byStatus(statusOf(throwable)));
            }
            String code = PROVIDER_TYPES.get(type.getName());
            if (code != null) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }

    private static String byStatus(int status) {
        if (status == 429) {
            return RATE_LIMIT;
        }
        if (status == 401 || status == 403) {
            return AUTHENTICATION;
        }
        if (status == 408 || status == 504) {
            return PROVIDER_TIMEOUT;
        }
        if (status >= 500) {
            return INTERNAL_SERVER;
        }
        return status >= 400 ? INVALID_REQUEST : HTTP_ERROR;
    }

    private static int statusOf(Throwable throwable) {
        try {
            Object status = throwable.getClass().getMethod("statusCode").invoke(throwable);
            return status instanceof Integer value ? value : -1;
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException e) {
            return -1;
        }
    }

    private static Optional<String> byMessage(String message) {
        if (message == null) {
            return Optional.empty();
        }
        String text = message.toLowerCase(Locale.ROOT);
        if (text.contains("context length") || text.contains("context window")
                || text.contains("maximum context") || text.contains("prompt is too long")) {
            return Optional.of(CONTEXT_LENGTH_EXCEEDED);
        }
        if (text.contains("rate_limit") || text.contains("too many requests")) {
            return Optional.of(RATE_LIMIT);
        }
        return Optional.empty();
    }
}
