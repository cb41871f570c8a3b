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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.agent.SupportPrompts;
import me.golemcore.support.domain.exception.MalformedModelOutputException;
import me.golemcore.support.domain.model.AgentType;
import me.golemcore.support.domain.model.LlmRequest;
import me.golemcore.support.domain.model.Message;
import me.golemcore.support.domain.model.RoutingDecision;
import me.golemcore.support.domain.model.RoutingSource;
import me.golemcore.support.domain.service.LlmCompletionService;
import me.golemcore.support.infrastructure.config.SupportProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Model-based intent classification.
 *
 * <p>
 * Sends the routing prompt with the last few context messages and the current
 * message, then reads {@code route}, {@code confidence}, {@code reasoning} and
 * {@code summary} from the JSON object in the reply. The object is taken from
 * a fenced {@code json} block, else from the first to the last brace, else the
 * whole reply.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmIntentClassifier {

    static final double DEFAULT_CONFIDENCE = 0.8;

    private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```",
            Pattern.DOTALL);
    private static final int CONTEXT_MESSAGE_MAX_CHARS = 100;
    private static final int SUMMARY_MAX_CHARS = 100;

    private final LlmCompletionService completionService;
    private final SupportProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Classifies the message.
     *
     * @throws MalformedModelOutputException
     *             if the reply holds no usable JSON or names an unknown route
     * @throws me.golemcore.support.domain.exception.ModelUnavailableException
     *             if the model cannot be reached
     */
    public RoutingDecision classify(String message, List<Message> context) {
        SupportProperties.RouterProperties config = properties.getRouter();
        LlmRequest request = LlmRequest.builder()
                .systemPrompt(SupportPrompts.ROUTER)
                .messages(List.of(Message.builder()
                        .role(Message.ROLE_USER)
                        .content(buildPrompt(message, context, config))
                        .build()))
                .temperature(config.getTemperature())
                .build();

        long startMs = System.currentTimeMillis();
        String reply = completionService.complete(request);
        log.debug("[Router] LLM responded in {}ms: {}", System.currentTimeMillis() - startMs, reply);
        return parse(reply, message);
    }

    String buildPrompt(String message, List<Message> context, SupportProperties.RouterProperties config) {
        StringBuilder sb = new StringBuilder();
        if (context != null && !context.isEmpty()) {
            sb.append("## Conversation Context:\n");
            int start = Math.max(0, context.size() - config.getContextMessages());
            for (int i = start; i < context.size(); i++) {
                Message msg = context.get(i);
                sb.append("- ").append(msg.getRole()).append(": ")
                        .append(truncate(msg.getContent(), CONTEXT_MESSAGE_MAX_CHARS)).append('\n');
            }
            sb.append('\n');
        }
        sb.append("## Current Customer Message:\n");
        sb.append(truncate(message, config.getMaxMessageChars()));
        sb.append("\n\nRespond with the JSON routing decision only.");
        return sb.toString();
    }

    RoutingDecision parse(String reply, String message) {
        if (reply == null || reply.isBlank()) {
            throw new MalformedModelOutputException("Empty routing response");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(extractJson(reply));
        } catch (JsonProcessingException e) {
            throw new MalformedModelOutputException("Routing response is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedModelOutputException("Routing response is not a JSON object");
        }

        JsonNode routeNode = node.get("route");
        if (routeNode == null || !routeNode.isTextual()) {
            throw new MalformedModelOutputException("Routing response has no route");
        }
        AgentType target = AgentType.fromId(routeNode.asText())
                .orElseThrow(() -> new MalformedModelOutputException(
                        "Unknown route: " + routeNode.asText().toLowerCase(Locale.ROOT)));

        double confidence = DEFAULT_CONFIDENCE;
        JsonNode confidenceNode = node.get("confidence");
        if (confidenceNode != null && confidenceNode.isNumber()) {
            confidence = Math.max(0.0, Math.min(1.0, confidenceNode.asDouble()));
        }
        String reasoning = textOrDefault(node, "reasoning", "LLM classification");
        String summary = textOrDefault(node, "summary", truncate(message, SUMMARY_MAX_CHARS));

        return RoutingDecision.builder()
                .target(target)
                .confidence(confidence)
                .reasoning(reasoning)
                .summary(summary)
                .source(RoutingSource.LLM)
                .build();
    }

    private static String extractJson(String reply) {
        Matcher block = JSON_BLOCK_PATTERN.matcher(reply);
        if (block.find()) {
            return block.group(1);
        }
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return reply.substring(start, end + 1);
        }
        return reply.trim();
    }

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return defaultValue;
        }
        return value.asText();
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, maxLen) + "...";
    }
}
