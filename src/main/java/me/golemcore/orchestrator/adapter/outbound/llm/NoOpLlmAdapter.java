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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.LlmUsage;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * No-op LLM adapter used when no provider is configured. Always answers with a
 * placeholder without calling any external API.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    static final String PLACEHOLDER = "[No LLM configured]";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("NoOpLlmAdapter: chat() called - no LLM configured");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content(PLACEHOLDER)
                .model("none")
                .finishReason("stop")
                .usage(LlmUsage.builder()
                        .inputTokens(0)
                        .outputTokens(0)
                        .totalTokens(0)
                        .build())
                .build());
    }

    @Override
    public String getCurrentModel() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
