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

package me.golemcore.orchestrator.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the orchestrator, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code orchestrator.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - adapter and provider selection, credentials</li>
 * <li>{@link AgentProperties} - iteration budget and system prompt</li>
 * <li>{@link ToolCallingProperties} - the tool-call synthesis model</li>
 * <li>{@link McpProperties} - tool server process settings</li>
 * <li>{@code tools} / {@code tools-file} - tool servers registered at
 * startup</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "orchestrator")
@Data
public class OrchestratorProperties {

    private LlmProperties llm = new LlmProperties();
    private AgentProperties agent = new AgentProperties();
    private ToolCallingProperties toolCalling = new ToolCallingProperties();
    private McpProperties mcp = new McpProperties();
    private HttpProperties http = new HttpProperties();

    /**
     * Tool servers to register at startup: {@code name -> artifact path}.
     */
    private Map<String, String> tools = new LinkedHashMap<>();

    /**
     * Optional JSON file shaped {@code {"tools": {name: path}}}.
     */
    private String toolsFile;

    @Data
    public static class LlmProperties {
        /**
         * Adapter id: langchain4j, http or none.
         */
        private String adapter = "langchain4j";
        /**
         * Provider used by the reasoning model.
         */
        private String provider = "deepseek";
        private Map<String, ProviderProperties> providers = new HashMap<>();
        private long timeoutMs = 300_000;
        private Double temperature;
        private Integer maxTokens;

        /**
         * Provider settings with built-in defaults filled in for anything not
         * configured.
         */
        public ProviderProperties resolveProvider(String name) {
            ProviderProperties defaults = ProviderProperties.defaultsFor(name);
            ProviderProperties configured = providers.get(name);
            if (configured == null) {
                return defaults;
            }
            ProviderProperties merged = new ProviderProperties();
            merged.setApiKey(configured.getApiKey());
            merged.setBaseUrl(configured.getBaseUrl() != null ? configured.getBaseUrl() : defaults.getBaseUrl());
            merged.setModel(configured.getModel() != null ? configured.getModel() : defaults.getModel());
            return merged;
        }
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
        private String model;

        static ProviderProperties defaultsFor(String name) {
            ProviderProperties p = new ProviderProperties();
            switch (name != null ? name : "") {
            case "deepseek" -> {
                p.setBaseUrl("https://api.deepseek.com");
                p.setModel("deepseek-reasoner");
            }
            case "qwen" -> {
                p.setBaseUrl("https://dashscope.aliyuncs.com/compatible-mode/v1");
                p.setModel("qwen-plus");
            }
            case "openrouter" -> {
                p.setBaseUrl("https://openrouter.ai/api/v1");
                p.setModel("openai/gpt-4o");
            }
            case "openai" -> {
                p.setBaseUrl("https://api.openai.com/v1");
                p.setModel("gpt-4o");
            }
            default -> {
                // anthropic and unknown providers have no default model
            }
            }
            return p;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class AgentProperties {
        private int maxIterations = 10;
        private String customSystemPrompt = "You are an intelligent assistant. "
                + "When users need specific information, you should use available tools to obtain it.";
    }

    @Data
    public static class ToolCallingProperties {
        private String provider = "deepseek";
        private String model = "deepseek-chat";
        private int maxRetries = 5;
        private long timeoutMs = 60_000;
        private Double temperature = 0.0;
    }

    @Data
    public static class McpProperties {
        private String pythonCommand = "python3";
        private int startupTimeoutSeconds = 30;
        private int requestTimeoutSeconds = 60;
        private int shutdownTimeoutSeconds = 5;
        private Map<String, String> env = new HashMap<>();
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 300000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
