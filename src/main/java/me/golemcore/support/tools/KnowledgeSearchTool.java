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

package me.golemcore.support.tools;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.domain.component.ToolComponent;
import me.golemcore.support.domain.component.ToolRequest;
import me.golemcore.support.domain.model.KnowledgeChunk;
import me.golemcore.support.domain.model.KnowledgeMatch;
import me.golemcore.support.domain.model.ToolDefinition;
import me.golemcore.support.domain.model.ToolResult;
import me.golemcore.support.port.outbound.EmbeddingPort;
import me.golemcore.support.port.outbound.KnowledgeSearchPort;
import me.golemcore.support.port.outbound.KnowledgeSearchPort.KnowledgeFilter;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Tool for retrieving knowledge base passages by semantic similarity.
 *
 * <p>
 * The query is embedded and matched against active passages; results are
 * ordered by cosine similarity, highest first. An empty result is a success
 * with no passages, so callers can tell "nothing relevant" from "search
 * failed".
 *
 * <p>
 * Structured data: {@code List<KnowledgeMatch>}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KnowledgeSearchTool implements ToolComponent<KnowledgeSearchTool.Request> {

    public static final String NAME = "search_knowledge_base";
    public static final String NO_RESULTS = "No relevant information found in the knowledge base.";

    static final int DEFAULT_TOP_K = 3;
    static final int MAX_TOP_K = 10;

    private final EmbeddingPort embeddingPort;
    private final KnowledgeSearchPort knowledgeSearchPort;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Search the knowledge base for relevant documentation and FAQs about product "
                        + "features, how-to guides, policies and troubleshooting steps.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "query", Map.of(
                                        "type", "string",
                                        "description", "What information is needed"),
                                "top_k", Map.of(
                                        "type", "integer",
                                        "description", "Number of passages to return (1-10, default 3)"),
                                "category", Map.of(
                                        "type", "string",
                                        "description",
                                        "Optional category filter (faq, documentation, policy, troubleshooting)")),
                        "required", List.of("query")))
                .build();
    }

    @Override
    public Class<Request> requestType() {
        return Request.class;
    }

    @Override
    public Request parseArguments(Map<String, Object> arguments) {
        return new Request(
                ToolArguments.requireString(arguments, "query"),
                ToolArguments.optionalInt(arguments, "top_k", DEFAULT_TOP_K, 1, MAX_TOP_K),
                ToolArguments.optionalString(arguments, "category"));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Request request) {
        float[] queryEmbedding;
        try {
            queryEmbedding = embeddingPort.embed(request.query()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.failedFuture(e);
        } catch (ExecutionException e) {
            return CompletableFuture.failedFuture(e.getCause() != null ? e.getCause() : e);
        }
        KnowledgeFilter filter = request.category() != null
                ? KnowledgeFilter.activeInCategory(request.category())
                : KnowledgeFilter.onlyActive();
        List<KnowledgeMatch> matches = knowledgeSearchPort.search(queryEmbedding, request.topK(), filter);

        log.info("[Knowledge] Search returned {} passages for '{}'", matches.size(),
                abbreviate(request.query(), 50));
        if (matches.isEmpty()) {
            return CompletableFuture.completedFuture(ToolResult.success(NO_RESULTS, List.of()));
        }
        return CompletableFuture.completedFuture(ToolResult.success(format(matches), matches));
    }

    private static String format(List<KnowledgeMatch> matches) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < matches.size(); i++) {
            KnowledgeChunk chunk = matches.get(i).chunk();
            if (i > 0) {
                sb.append("\n---\n");
            }
            sb.append(String.format(Locale.ROOT, "Result %d (relevance: %.0f%%)%n", i + 1,
                    matches.get(i).score() * 100));
            sb.append("Title: ").append(chunk.getTitle()).append('\n');
            sb.append("Category: ").append(chunk.getCategory()).append('\n');
            sb.append("Content: ").append(chunk.getContent()).append('\n');
        }
        return sb.toString();
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }

    /**
     * @param query
     *            search text
     * @param topK
     *            number of passages to return
     * @param category
     *            optional category filter, {@code null} for all
     */
    public record Request(String query, int topK, String category) implements ToolRequest {

        @Override
        public String toolName() {
            return NAME;
        }

        @Override
        public Map<String, Object> toArguments() {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("query", query);
            args.put("top_k", topK);
            if (category != null) {
                args.put("category", category);
            }
            return args;
        }
    }
}
