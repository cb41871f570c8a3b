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

package me.golemcore.support.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.domain.model.LlmRequest;
import me.golemcore.support.domain.model.LlmResponse;
import me.golemcore.support.domain.model.Message;
import me.golemcore.support.domain.service.LlmErrorClassifier;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports OpenAI (and any OpenAI-compatible endpoint via {@code base-url})
 * and Anthropic. A model name may carry a provider prefix
 * ({@code anthropic/claude-3-5-haiku-latest}); otherwise
 * {@code support.llm.provider} decides.
 *
 * <p>
 * Each call is a single attempt: langchain4j's own retries are disabled and
 * exceptions are propagated unchanged so that
 * {@link me.golemcore.support.domain.service.LlmErrorClassifier} can see the
 * provider exception types.
 *
 * <p>
 * Configuration via {@code support.llm.providers.<name>.api-key} and
 * {@code support.llm.providers.<name>.base-url}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";

    private final SupportProperties properties;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    @Override
    public String getProviderId() {
        return properties.getLlm().getProvider();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = request.getModel() != null ? request.getModel() : getCurrentModel();
            ChatModel chatModel = models.computeIfAbsent(model, this::createModel);

            ChatRequest.Builder builder = ChatRequest.builder().messages(convertMessages(request));
            if (request.getTemperature() != null) {
                builder.temperature(request.getTemperature());
            }

            log.trace("[LLM] Calling {} with {} messages", model, request.getMessages() != null
                    ? request.getMessages().size()
                    : 0);
            ChatResponse response = chatModel.chat(builder.build());
            return convertResponse(response, model);
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        SupportProperties.ProviderProperties config = properties.getLlm().getProviders()
                .get(resolveProvider(getCurrentModel()));
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    private ChatModel createModel(String model) {
        String provider = resolveProvider(model);
        SupportProperties.ProviderProperties config = getProviderConfig(provider);
        String modelName = stripProviderPrefix(model);
        log.info("[LLM] Creating {} model: {}", provider, modelName);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            return createAnthropicModel(modelName, config);
        }
        return createOpenAiModel(modelName, config);
    }

    private ChatModel createAnthropicModel(String modelName, SupportProperties.ProviderProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .maxTokens(properties.getLlm().getMaxTokens())
                .temperature(properties.getLlm().getTemperature())
                .timeout(Duration.ofMillis(properties.getLlm().getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(String modelName, SupportProperties.ProviderProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .maxTokens(properties.getLlm().getMaxTokens())
                .temperature(properties.getLlm().getTemperature())
                .timeout(Duration.ofMillis(properties.getLlm().getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private SupportProperties.ProviderProperties getProviderConfig(String providerName) {
        SupportProperties.ProviderProperties config = properties.getLlm().getProviders().get(providerName);
        if (config == null) {
            throw new IllegalStateException(LlmErrorClassifier.NOT_CONFIGURED_PREFIX + ": " + providerName
                    + ". Add support.llm.providers." + providerName + ".api-key");
        }
        return config;
    }

    private String resolveProvider(String model) {
        if (model != null && model.contains("/")) {
            return model.substring(0, model.indexOf('/'));
        }
        String configured = properties.getLlm().getProvider();
        return configured != null ? configured : PROVIDER_OPENAI;
    }

    private String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        if (request.getMessages() == null) {
            return messages;
        }
        for (Message msg : request.getMessages()) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            String role = msg.getRole() != null ? msg.getRole() : Message.ROLE_USER;
            switch (role) {
            case Message.ROLE_ASSISTANT -> messages.add(AiMessage.from(content));
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(content));
            default -> messages.add(UserMessage.from(content));
            }
        }
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response, String model) {
        AiMessage aiMessage = response.aiMessage();
        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : null)
                .build();
    }
}
