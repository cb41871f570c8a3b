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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.domain.exception.ModelUnavailableException;
import me.golemcore.support.domain.model.LlmRequest;
import me.golemcore.support.domain.model.LlmResponse;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Synchronous language-model completion with a per-attempt timeout and a
 * bounded retry policy.
 *
 * <p>
 * Only transient failures (see {@link LlmErrorClassifier#isTransientCode}) are
 * retried, with exponential backoff and jitter:
 * {@code min(initial * multiplier^(attempt-1), max) * (1 ± jitterRatio)}.
 * Anything else, or an exhausted budget, ends in
 * {@link ModelUnavailableException}. Output content is never inspected here,
 * so malformed output is never retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmCompletionService {

    private final LlmPort llmPort;
    private final SupportProperties properties;

    /**
     * Completes the request and returns the model's text (never {@code null}).
     *
     * @throws ModelUnavailableException
     *             when the call fails permanently or exhausts its retries
     */
    public String complete(LlmRequest request) {
        SupportProperties.RetryProperties retry = properties.getLlm().getRetry();
        int maxAttempts = Math.max(1, retry.getMaxAttempts());
        Duration timeout = request.getTimeout() != null
                ? request.getTimeout()
                : Duration.ofMillis(properties.getLlm().getTimeoutMs());

        for (int attempt = 1;; attempt++) {
            try {
                LlmResponse response = callOnce(request, timeout);
                String content = response != null ? response.getContent() : null;
                return content != null ? content : "";
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ModelUnavailableException("LLM call interrupted", LlmErrorClassifier.REQUEST_ABORTED, e);
            } catch (ExecutionException | TimeoutException | RuntimeException e) {
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                String code = LlmErrorClassifier.classify(cause);
                boolean transientFailure = LlmErrorClassifier.isTransientCode(code);

                if (!transientFailure) {
                    log.error("[LLM] Call failed with non-retryable error {}: {}", code, cause.getMessage());
                    throw new ModelUnavailableException("LLM call failed: " + code, code, cause);
                }
                if (attempt >= maxAttempts) {
                    log.error("[LLM] Giving up after {} attempts, last error {}: {}", attempt, code,
                            cause.getMessage());
                    throw new ModelUnavailableException("LLM retries exhausted: " + code, code, cause);
                }

                long backoffMs = computeBackoffMs(attempt, retry);
                log.warn("[LLM] Transient error {} (attempt {}/{}), retrying in {}ms", code, attempt, maxAttempts,
                        backoffMs);
                sleep(backoffMs);
            }
        }
    }

    private LlmResponse callOnce(LlmRequest request, Duration timeout)
            throws InterruptedException, ExecutionException, TimeoutException {
        CompletableFuture<LlmResponse> future = llmPort.chat(request);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        }
    }

    static long computeBackoffMs(int attempt, SupportProperties.RetryProperties retry) {
        double exponential = retry.getInitialBackoffMs() * Math.pow(retry.getMultiplier(), attempt - 1.0);
        double capped = Math.min(exponential, retry.getMaxBackoffMs());
        double ratio = Math.max(0, Math.min(1, retry.getJitterRatio()));
        double jitter = ratio == 0 ? 0 : ThreadLocalRandom.current().nextDouble(-ratio, ratio);
        return Math.max(0, Math.round(capped * (1 + jitter)));
    }

    private void sleep(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ModelUnavailableException("LLM retry backoff interrupted", LlmErrorClassifier.REQUEST_ABORTED,
                    ie);
        }
    }
}
