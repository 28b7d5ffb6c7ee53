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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.LlmUsage;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.infrastructure.http.FeignClientFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LLM adapter for OpenAI-compatible {@code /chat/completions} endpoints using
 * Feign + OkHttp.
 *
 * <p>
 * Unlike the langchain4j adapter this one reads {@code reasoning_content}
 * (DeepSeek reasoner) and reports it as the response's reasoning text. JSON
 * mode is sent as {@code response_format: {"type": "json_object"}}.
 *
 * <p>
 * Provider ID: {@code "http"}
 *
 * @see FeignClientFactory
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAiCompatibleHttpAdapter implements LlmProviderAdapter {

    private final OrchestratorProperties properties;
    private final FeignClientFactory feignClientFactory;

    private final Map<String, ChatCompletionsApi> clients = new ConcurrentHashMap<>();

    @Override
    public String getProviderId() {
        return "http";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String provider = request.getProvider() != null ? request.getProvider()
                    : properties.getLlm().getProvider();
            OrchestratorProperties.ProviderProperties config = properties.getLlm().resolveProvider(provider);
            if (config.getBaseUrl() == null || config.getBaseUrl().isBlank()) {
                throw new IllegalStateException("No base URL configured for provider: " + provider);
            }
            ChatCompletionsApi client = clients.computeIfAbsent(config.getBaseUrl(),
                    url -> feignClientFactory.create(ChatCompletionsApi.class, url));
            try {
                ChatCompletionRequest apiRequest = buildRequest(request, config);
                ChatCompletionResponse apiResponse = client.chatCompletion(config.getApiKey(), apiRequest);
                return convertResponse(apiResponse);
            } catch (RuntimeException e) {
                log.error("[LLM] {} chat failed: {}", provider, e.getMessage());
                throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().resolveProvider(properties.getLlm().getProvider()).getModel();
    }

    @Override
    public boolean isAvailable() {
        return properties.getLlm().resolveProvider(properties.getLlm().getProvider()).hasApiKey();
    }

    ChatCompletionRequest buildRequest(LlmRequest request, OrchestratorProperties.ProviderProperties config) {
        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setModel(request.getModel() != null ? request.getModel() : config.getModel());
        apiRequest.setTemperature(request.getTemperature() != null ? request.getTemperature()
                : properties.getLlm().getTemperature());
        apiRequest.setMaxTokens(request.getMaxTokens() != null ? request.getMaxTokens()
                : properties.getLlm().getMaxTokens());
        if (request.isJsonMode()) {
            apiRequest.setResponseFormat(Map.of("type", "json_object"));
        }

        List<ApiMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(new ApiMessage(Message.ROLE_SYSTEM, request.getSystemPrompt()));
        }
        for (Message msg : request.getMessages()) {
            String role = Message.ROLE_TOOL.equals(msg.getRole()) ? Message.ROLE_USER : msg.getRole();
            messages.add(new ApiMessage(role, msg.getContent() != null ? msg.getContent() : ""));
        }
        apiRequest.setMessages(messages);
        return apiRequest;
    }

    LlmResponse convertResponse(ChatCompletionResponse apiResponse) {
        if (apiResponse == null || apiResponse.getChoices() == null || apiResponse.getChoices().isEmpty()) {
            return LlmResponse.builder()
                    .content("")
                    .model(apiResponse != null ? apiResponse.getModel() : null)
                    .finishReason("error")
                    .choices(0)
                    .build();
        }

        ChatChoice choice = apiResponse.getChoices().get(0);
        ApiMessage message = choice.getMessage() != null ? choice.getMessage() : new ApiMessage();

        LlmUsage usage = null;
        if (apiResponse.getUsage() != null) {
            ApiUsage apiUsage = apiResponse.getUsage();
            usage = LlmUsage.builder()
                    .inputTokens(apiUsage.getPromptTokens())
                    .outputTokens(apiUsage.getCompletionTokens())
                    .totalTokens(apiUsage.getTotalTokens())
                    .build();
        }

        return LlmResponse.builder()
                .content(message.getContent())
                .reasoningContent(message.getReasoningContent())
                .usage(usage)
                .model(apiResponse.getModel())
                .finishReason(choice.getFinishReason())
                .choices(apiResponse.getChoices().size())
                .build();
    }

    // Feign API interface
    public interface ChatCompletionsApi {
        @RequestLine("POST /chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        ChatCompletionResponse chatCompletion(@Param("apiKey") String apiKey, ChatCompletionRequest request);
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private Double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
        @JsonProperty("response_format")
        private Map<String, String> responseFormat;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
        private ApiUsage usage;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiMessage {
        private String role;
        private String content;
        @JsonProperty("reasoning_content")
        private String reasoningContent;

        public ApiMessage() {
        }

        public ApiMessage(String role, String content) {
            this.role = role;
            this.content = content;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiUsage {
        @JsonProperty("prompt_tokens")
        private int promptTokens;
        @JsonProperty("completion_tokens")
        private int completionTokens;
        @JsonProperty("total_tokens")
        private int totalTokens;
    }
}
