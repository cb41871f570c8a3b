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

package me.golemcore.support.port.outbound;

import me.golemcore.support.domain.model.KnowledgeChunk;
import me.golemcore.support.domain.model.KnowledgeMatch;

import java.util.List;

/**
 * Vector similarity search over knowledge passages.
 */
public interface KnowledgeSearchPort {

    /**
     * Returns up to {@code topK} passages ordered by similarity, highest first.
     */
    List<KnowledgeMatch> search(float[] queryEmbedding, int topK, KnowledgeFilter filter);

    /**
     * Adds or replaces an indexed passage. The chunk must carry its embedding.
     */
    void index(KnowledgeChunk chunk);

    int size();

    /**
     * Search filter. {@code category} is optional.
     */
    record KnowledgeFilter(boolean activeOnly, String category) {

        public static KnowledgeFilter onlyActive() {
            return new KnowledgeFilter(true, null);
        }

        public static KnowledgeFilter activeInCategory(String category) {
            return new KnowledgeFilter(true, category);
        }
    }
}
