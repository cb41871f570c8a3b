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

package me.golemcore.support.adapter.outbound.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Passage and query embeddings through langchain4j's OpenAI embedding model.
 *
 * <p>
 * The model is built lazily from {@code support.embedding.*} and the API key
 * of the matching {@code support.llm.providers.<name>} entry. Without a key
 * the adapter reports itself unavailable and every call fails, which the
 * knowledge search tool turns into a failed tool result.
 *
 * @see me.golemcore.support.adapter.outbound.knowledge.InMemoryKnowledgeIndex
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private static final String DEFAULT_MODEL = "text-embedding-3-small";

    private final SupportProperties properties;

    private volatile Optional<EmbeddingModel> embeddingModel;

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return embedBatch(List.of(text)).thenApply(vectors -> vectors.get(0));
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.supplyAsync(() -> {
            EmbeddingModel model = model()
                    .orElseThrow(() -> new IllegalStateException("Embedding model not available"));
            List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
            List<Embedding> embeddings = model.embedAll(segments).content();
            if (embeddings.size() != texts.size()) {
                throw new IllegalStateException("Expected " + texts.size() + " embeddings, got "
                        + embeddings.size());
            }
            log.trace("[Embedding] Embedded {} texts", texts.size());
            return embeddings.stream().map(Embedding::vector).toList();
        });
    }

    @Override
    public String getModel() {
        String model = properties.getEmbedding().getModel();
        return model != null && !model.isBlank() ? model : DEFAULT_MODEL;
    }

    @Override
    public boolean isAvailable() {
        return model().isPresent();
    }

    private Optional<EmbeddingModel> model() {
        Optional<EmbeddingModel> current = embeddingModel;
        if (current == null) {
            synchronized (this) {
                if (embeddingModel == null) {
                    embeddingModel = createModel();
                }
                current = embeddingModel;
            }
        }
        return current;
    }

    private Optional<EmbeddingModel> createModel() {
        String provider = properties.getEmbedding().getProvider();
        SupportProperties.ProviderProperties config = properties.getLlm().getProviders().get(provider);
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("[Embedding] No API key for provider {}, knowledge search disabled", provider);
            return Optional.empty();
        }

        var builder = OpenAiEmbeddingModel.builder()
                .apiKey(config.getApiKey())
                .modelName(getModel())
                .maxRetries(0)
                .timeout(Duration.ofMillis(properties.getEmbedding().getTimeoutMs()));
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        log.info("[Embedding] Using {} model {}", provider, getModel());
        return Optional.of(builder.build());
    }
}
