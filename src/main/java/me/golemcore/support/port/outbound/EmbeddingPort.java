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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Dense text embeddings for knowledge retrieval. Vectors of one model share a
 * dimension; callers compare them with {@link #cosineSimilarity}.
 */
public interface EmbeddingPort {

    CompletableFuture<float[]> embed(String text);

    /**
     * Embed several texts in one provider call. The result is in input order
     * and has the same size as {@code texts}.
     */
    CompletableFuture<List<float[]>> embedBatch(List<String> texts);

    String getModel();

    /**
     * Whether a provider is configured. An unavailable port fails every embed
     * call.
     */
    boolean isAvailable();

    /**
     * Cosine of the angle between two vectors, in [-1, 1]. A zero vector scores
     * 0 against anything.
     *
     * @throws IllegalArgumentException
     *             when the dimensions differ
     */
    default double cosineSimilarity(float[] left, float[] right) {
        if (left.length != right.length) {
            throw new IllegalArgumentException(
                    "Embedding dimensions differ: " + left.length + " vs " + right.length);
        }
        double dot = 0;
        double leftSquares = 0;
        double rightSquares = 0;
        for (int i = 0; i < left.length; i++) {
            dot += (double) left[i] * right[i];
            leftSquares += (double) left[i] * left[i];
            rightSquares += (double) right[i] * right[i];
        }
        if (leftSquares == 0 || rightSquares == 0) {
            return 0;
        }
        return dot / Math.sqrt(leftSquares * rightSquares);
    }
}
