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

package me.golemcore.support.infrastructure.seed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.domain.model.KnowledgeChunk;
import me.golemcore.support.infrastructure.config.SupportProperties;
import me.golemcore.support.port.outbound.EmbeddingPort;
import me.golemcore.support.port.outbound.KnowledgeSearchPort;
import me.golemcore.support.port.outbound.StoragePort;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Loads knowledge documents from the workspace and indexes their embeddings.
 *
 * <p>
 * Runs once the application is ready. Documents are embedded as
 * {@code title + content} in one batch; if the batch fails each document is
 * retried on its own, and documents that still fail are left out of the index.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KnowledgeBaseLoader {

    private final StoragePort storagePort;
    private final EmbeddingPort embeddingPort;
    private final KnowledgeSearchPort knowledgeSearchPort;
    private final SupportProperties properties;
    private final ObjectMapper objectMapper;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getKnowledge().isIndexOnStartup()) {
            log.info("[Knowledge] Indexing on startup disabled");
            return;
        }
        if (!embeddingPort.isAvailable()) {
            log.warn("[Knowledge] Embedding service unavailable, knowledge base left empty");
            return;
        }
        try {
            loadAndIndex();
        } catch (RuntimeException e) {
            log.error("[Knowledge] Failed to load knowledge base", e);
        }
    }

    /**
     * Reads the documents file and indexes every document.
     *
     * @return number of indexed documents
     */
    public int loadAndIndex() {
        List<KnowledgeChunk> documents = readDocuments();
        if (documents.isEmpty()) {
            log.info("[Knowledge] No documents to index");
            return 0;
        }

        log.info("[Knowledge] Indexing {} documents...", documents.size());
        int indexed = 0;
        try {
            List<float[]> embeddings = embeddingPort.embedBatch(documents.stream().map(this::textOf).toList())
                    .join();
            for (int i = 0; i < documents.size(); i++) {
                KnowledgeChunk chunk = documents.get(i);
                chunk.setEmbedding(embeddings.get(i));
                knowledgeSearchPort.index(chunk);
                indexed++;
            }
        } catch (RuntimeException e) {
            log.warn("[Knowledge] Batch embedding failed, falling back to individual indexing: {}", e.getMessage());
            indexed = 0;
            for (KnowledgeChunk chunk : documents) {
                if (indexOne(chunk)) {
                    indexed++;
                }
            }
        }
        log.info("[Knowledge] Indexed {} of {} documents", indexed, documents.size());
        return indexed;
    }

    private boolean indexOne(KnowledgeChunk chunk) {
        try {
            chunk.setEmbedding(embeddingPort.embed(textOf(chunk)).join());
            knowledgeSearchPort.index(chunk);
            return true;
        } catch (RuntimeException e) {
            log.warn("[Knowledge] Failed to index document {}: {}", chunk.getId(), e.getMessage());
            return false;
        }
    }

    private List<KnowledgeChunk> readDocuments() {
        String directory = properties.getStorage().getDirectories().getKnowledge();
        String json = storagePort.getText(directory, properties.getKnowledge().getDocumentsFile()).join();
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<List<KnowledgeChunk>>() {
            });
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid knowledge documents file", e);
        }
    }

    private String textOf(KnowledgeChunk chunk) {
        String title = chunk.getTitle() != null ? chunk.getTitle() : "";
        return title + "\n\n" + chunk.getContent();
    }
}
