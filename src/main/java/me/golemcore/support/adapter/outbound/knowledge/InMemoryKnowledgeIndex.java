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

package me.golemcore.support.adapter.outbound.knowledge;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.domain.model.KnowledgeChunk;
import me.golemcore.support.domain.model.KnowledgeMatch;
import me.golemcore.support.port.outbound.EmbeddingPort;
import me.golemcore.support.port.outbound.KnowledgeSearchPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory vector index for knowledge passages.
 *
 * <p>
 * Similarity is cosine similarity (1 - cosine distance). Inactive passages and
 * passages with a mismatched embedding dimension are skipped by the search.
 *
 * <p>
 * Thread-safe implementation using {@link ConcurrentHashMap}.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryKnowledgeIndex implements KnowledgeSearchPort {

    private final EmbeddingPort embeddingPort;

    private final Map<String, KnowledgeChunk> chunks = new ConcurrentHashMap<>();

    @Override
    public void index(KnowledgeChunk chunk) {
        if (chunk == null || chunk.getId() == null || chunk.getEmbedding() == null) {
            throw new IllegalArgumentException("Knowledge chunk must have an id and an embedding");
        }
        chunks.put(chunk.getId(), chunk);
        log.debug("[Knowledge] Indexed passage: {}", chunk.getId());
    }

    @Override
    public List<KnowledgeMatch> search(float[] queryEmbedding, int topK, KnowledgeFilter filter) {
        if (queryEmbedding == null || topK <= 0) {
            return List.of();
        }
        log.debug("[Knowledge] Searching (topK={}, indexed={})", topK, chunks.size());

        List<KnowledgeMatch> candidates = new ArrayList<>();
        for (KnowledgeChunk chunk : chunks.values()) {
            if (!matches(chunk, filter)) {
                continue;
            }
            if (chunk.getEmbedding().length != queryEmbedding.length) {
                log.warn("[Knowledge] Skipping {}: embedding dimension {} != {}", chunk.getId(),
                        chunk.getEmbedding().length, queryEmbedding.length);
                continue;
            }
            double similarity = embeddingPort.cosineSimilarity(queryEmbedding, chunk.getEmbedding());
            candidates.add(new KnowledgeMatch(chunk, similarity));
        }

        List<KnowledgeMatch> result = candidates.stream()
                .sorted(Comparator.comparingDouble(KnowledgeMatch::score).reversed()
                        .thenComparing(m -> m.chunk().getId()))
                .limit(topK)
                .toList();

        for (KnowledgeMatch match : result) {
            log.debug("[Knowledge]   - {} (score: {})", match.chunk().getId(), String.format("%.3f", match.score()));
        }
        return result;
    }

    @Override
    public int size() {
        return chunks.size();
    }

    public void clear() {
        chunks.clear();
        log.info("[Knowledge] Index cleared");
    }

    private boolean matches(KnowledgeChunk chunk, KnowledgeFilter filter) {
        if (filter == null) {
            return true;
        }
        if (filter.activeOnly() && !chunk.isActive()) {
            return false;
        }
        return filter.category() == null || filter.category().equalsIgnoreCase(chunk.getCategory());
    }
}
