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

package me.golemcore.support.routing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.domain.exception.MalformedModelOutputException;
import me.golemcore.support.domain.exception.ModelUnavailableException;
import me.golemcore.support.domain.model.Message;
import me.golemcore.support.domain.model.RoutingDecision;
import me.golemcore.support.infrastructure.config.SupportProperties;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Confidence-gated routing: the model's decision is used when it parses and
 * meets the configured threshold, otherwise the keyword matcher decides.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntentRouter {

    private final LlmIntentClassifier classifier;
    private final KeywordIntentMatcher keywordMatcher;
    private final SupportProperties properties;

    public RoutingDecision route(String message, List<Message> context) {
        double threshold = properties.getRouter().getConfidenceThreshold();
        try {
            RoutingDecision decision = classifier.classify(message, context);
            if (decision.getConfidence() >= threshold) {
                log.info("[Router] Routed to {} (confidence: {}, source: llm)", decision.getTarget().getId(),
                        String.format("%.2f", decision.getConfidence()));
                return decision;
            }
            log.info("[Router] LLM confidence {} below threshold {}, using keywords",
                    String.format("%.2f", decision.getConfidence()), threshold);
        } catch (MalformedModelOutputException e) {
            log.warn("[Router] Malformed routing output, using keywords: {}", e.getMessage());
        } catch (ModelUnavailableException e) {
            log.warn("[Router] Model unavailable for routing ({}), using keywords", e.getReasonCode());
        } catch (RuntimeException e) {
            log.warn("[Router] Routing failed unexpectedly, using keywords", e);
        }
        RoutingDecision fallback = keywordMatcher.match(message);
        log.info("[Router] Routed to {} (confidence: {}, source: fallback)", fallback.getTarget().getId(),
                fallback.getConfidence());
        return fallback;
    }
}
