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

package me.golemcore.support.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the support service, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code support.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - chat model provider, timeout and retry
 * policy</li>
 * <li>{@link MemoryProperties} - context window and cache TTL</li>
 * <li>{@link RouterProperties} - classification threshold and context</li>
 * <li>{@link OrchestratorProperties} - turn timeout and lock wait</li>
 * <li>{@link StorageProperties} - local workspace layout</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "support")
@Data
public class SupportProperties {

    private LlmProperties llm = new LlmProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private MemoryProperties memory = new MemoryProperties();
    private RouterProperties router = new RouterProperties();
    private AgentsProperties agents = new AgentsProperties();
    private OrchestratorProperties orchestrator = new OrchestratorProperties();
    private ToolsProperties tools = new ToolsProperties();
    private TasksProperties tasks = new TasksProperties();
    private CacheProperties cache = new CacheProperties();
    private LockProperties lock = new LockProperties();
    private StorageProperties storage = new StorageProperties();
    private KnowledgeProperties knowledge = new KnowledgeProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "openai";
        private String model = "gpt-4o-mini";
        private double temperature = 0.3;
        private int maxTokens = 1024;
        private long timeoutMs = 30000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
        private RetryProperties retry = new RetryProperties();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class RetryProperties {
        private int maxAttempts = 3;
        private long initialBackoffMs = 1000;
        private double multiplier = 2.0;
        private long maxBackoffMs = 10000;
        private double jitterRatio = 0.2;
    }

    @Data
    public static class EmbeddingProperties {
        private String provider = "openai";
        private String model = "text-embedding-3-small";
        private long timeoutMs = 15000;
    }

    // ==================== MEMORY ====================

    @Data
    public static class MemoryProperties {
        private int windowSize = 15;
        private long cacheTtlSeconds = 300;
        private String cacheKeyPrefix = "support:conversation:";
    }

    // ==================== ROUTING ====================

    @Data
    public static class RouterProperties {
        private double confidenceThreshold = 0.5;
        private int contextMessages = 3;
        private double temperature = 0.0;
        private int maxMessageChars = 500;
    }

    // ==================== AGENTS ====================

    @Data
    public static class AgentsProperties {
        private double temperature = 0.3;
        private FaqAgentProperties faq = new FaqAgentProperties();
        private OrderAgentProperties order = new OrderAgentProperties();
        private EscalationAgentProperties escalation = new EscalationAgentProperties();
    }

    @Data
    public static class FaqAgentProperties {
        private int topK = 3;
    }

    @Data
    public static class OrderAgentProperties {
        private int subscriptionLimit = 3;
        private int invoiceLimit = 5;
    }

    @Data
    public static class EscalationAgentProperties {
        private int contextMessages = 5;
    }

    // ==================== ORCHESTRATION ====================

    @Data
    public static class OrchestratorProperties {
        private long timeoutMs = 60000;
        private long persistMarginMs = 10000;
        private long lockWaitMs = 10000;
        private int dispatchThreads = 8;
    }

    @Data
    public static class ToolsProperties {
        private long timeoutMs = 15000;
        private int threads = 8;
        private List<String> disabled = new ArrayList<>();
    }

    @Data
    public static class TasksProperties {
        private int threads = 4;
        private long resultTtlMinutes = 60;
    }

    // ==================== INFRASTRUCTURE ====================

    @Data
    public static class CacheProperties {
        private String provider = "local";
    }

    @Data
    public static class LockProperties {
        private String provider = "local";
        private String keyPrefix = "support:lock:";
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/support";
    }

    @Data
    public static class DirectoriesProperties {
        private String conversations = "conversations";
        private String accounts = "accounts";
        private String tickets = "tickets";
        private String knowledge = "knowledge";
    }

    @Data
    public static class KnowledgeProperties {
        private boolean seedOnStartup = true;
        private boolean indexOnStartup = true;
        private String documentsFile = "documents.json";
    }
}
