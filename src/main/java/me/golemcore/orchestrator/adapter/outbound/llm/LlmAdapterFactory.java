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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.LlmPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the active LLM adapter from {@code orchestrator.llm.adapter}:
 * <ul>
 * <li>langchain4j - OpenAI-compatible providers and Anthropic via langchain4j
 * <li>http - raw OpenAI-compatible chat completions via Feign, exposes
 * reasoning text
 * <li>none - No-op adapter
 * </ul>
 *
 * <p>
 * All adapters are Spring beans; selection happens in {@link #init()}. An
 * unknown id falls back to {@code none}, then to the first adapter found.
 *
 * @see LlmProviderAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private static final String PROVIDER_NONE = "none";

    private final OrchestratorProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private final Map<String, LlmProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (LlmProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered LLM adapter: {}", adapter.getProviderId());
        }

        String adapterId = properties.getLlm().getAdapter();
        activeAdapter = adaptersByProvider.get(adapterId);

        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(PROVIDER_NONE);
            if (activeAdapter == null && !adapters.isEmpty()) {
                activeAdapter = adapters.get(0);
            }
            log.warn("LLM adapter '{}' not found, using: {}",
                    adapterId, activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE);
        } else {
            activeAdapter.initialize();
            log.info("Active LLM adapter: {} (provider: {})", adapterId, properties.getLlm().getProvider());
        }
    }

    public LlmPort getActiveAdapter() {
        return activeAdapter;
    }

    public LlmPort getAdapter(String providerId) {
        return adaptersByProvider.get(providerId);
    }

    public boolean isProviderAvailable(String providerId) {
        LlmProviderAdapter adapter = adaptersByProvider.get(providerId);
        return adapter != null && adapter.isAvailable();
    }

    // ==================== LlmPort delegation ====================

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No LLM adapter available"));
        }
        return activeAdapter.chat(request);
    }

    @Override
    public String getCurrentModel() {
        return activeAdapter != null ? activeAdapter.getCurrentModel() : PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
