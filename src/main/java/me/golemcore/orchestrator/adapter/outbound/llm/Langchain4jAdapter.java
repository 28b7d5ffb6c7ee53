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

package me.golemcore.orchestrator.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.LlmUsage;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
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
 * DeepSeek, Qwen, OpenRouter and OpenAI are reached through
 * {@link OpenAiChatModel} pointed at the provider's base URL; Anthropic through
 * {@link AnthropicChatModel}. Models are built lazily and cached per
 * provider, model name, JSON mode and temperature.
 *
 * <p>
 * Rate-limit errors are retried with exponential backoff; every other error
 * fails the returned future.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * @see LlmProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF_MS = 5_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final int ANTHROPIC_DEFAULT_MAX_TOKENS = 4096;

    private final OrchestratorProperties properties;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String provider = request.getProvider() != null ? request.getProvider()
                    : properties.getLlm().getProvider();
            OrchestratorProperties.ProviderProperties config = properties.getLlm().resolveProvider(provider);
            String modelName = request.getModel() != null ? request.getModel() : config.getModel();
            if (modelName == null || modelName.isBlank()) {
                throw new IllegalStateException("No model configured for provider: " + provider
                        + ". Set orchestrator.llm.providers." + provider + ".model");
            }

            Double temperature = request.getTemperature() != null ? request.getTemperature()
                    : properties.getLlm().getTemperature();
            Integer maxTokens = request.getMaxTokens() != null ? request.getMaxTokens()
                    : properties.getLlm().getMaxTokens();
            ChatModel model = getModel(provider, config, modelName, temperature, maxTokens);

            ChatRequest.Builder chatRequest = ChatRequest.builder().messages(convertMessages(request));
            if (request.isJsonMode() && !PROVIDER_ANTHROPIC.equals(provider)) {
                chatRequest.responseFormat(ResponseFormat.JSON);
            }
            ChatRequest built = chatRequest.build();

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    ChatResponse response = model.chat(built);
                    return convertResponse(response, modelName);
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                                attempt + 1, MAX_RETRIES, backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.error("[LLM] {} chat failed: {}", provider, e.getMessage());
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    @Override
    public String getCurrentModel() {
        String provider = properties.getLlm().getProvider();
        return properties.getLlm().resolveProvider(provider).getModel();
    }

    @Override
    public boolean isAvailable() {
        return properties.getLlm().resolveProvider(properties.getLlm().getProvider()).hasApiKey();
    }

    private ChatModel getModel(String provider, OrchestratorProperties.ProviderProperties config,
            String modelName, Double temperature, Integer maxTokens) {
        String key = provider + "|" + modelName + "|" + temperature + "|" + maxTokens;
        return models.computeIfAbsent(key, k -> {
            log.debug("[LLM] Creating model {} for provider {}", modelName, provider);
            return PROVIDER_ANTHROPIC.equals(provider)
                    ? createAnthropicModel(modelName, config, temperature, maxTokens)
                    : createOpenAiModel(modelName, config, temperature, maxTokens);
        });
    }

    private ChatModel createAnthropicModel(String modelName, OrchestratorProperties.ProviderProperties config,
            Double temperature, Integer maxTokens) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(maxTokens != null ? maxTokens : ANTHROPIC_DEFAULT_MAX_TOKENS)
                .timeout(Duration.ofMillis(properties.getLlm().getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (temperature != null) {
            builder.temperature(temperature);
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(String modelName, OrchestratorProperties.ProviderProperties config,
            Double temperature, Integer maxTokens) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .timeout(Duration.ofMillis(properties.getLlm().getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (temperature != null) {
            builder.temperature(temperature);
        }
        if (maxTokens != null) {
            builder.maxTokens(maxTokens);
        }
        return builder.build();
    }

    /**
     * The request's system prompt goes first; blank messages are dropped since
     * langchain4j rejects empty text content.
     */
    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            String content = msg.getContent();
            if (content == null || content.isBlank()) {
                log.trace("Skipping blank {} message", msg.getRole());
                continue;
            }
            switch (msg.getRole()) {
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(content));
            case Message.ROLE_ASSISTANT -> messages.add(AiMessage.from(content));
            case Message.ROLE_USER -> messages.add(UserMessage.from(content));
            default -> {
                log.warn("Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(content));
            }
            }
        }
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response, String modelName) {
        AiMessage aiMessage = response != null ? response.aiMessage() : null;
        if (aiMessage == null) {
            return LlmResponse.builder()
                    .model(modelName)
                    .finishReason("error")
                    .choices(0)
                    .build();
        }

        LlmUsage usage = null;
        if (response.tokenUsage() != null) {
            usage = LlmUsage.builder()
                    .inputTokens(nullToZero(response.tokenUsage().inputTokenCount()))
                    .outputTokens(nullToZero(response.tokenUsage().outputTokenCount()))
                    .totalTokens(nullToZero(response.tokenUsage().totalTokenCount()))
                    .build();
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .usage(usage)
                .model(modelName)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    private static int nullToZero(Integer value) {
        return value != null ? value : 0;
    }
}
