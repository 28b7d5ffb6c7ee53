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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.conversation.MessageStore;
import me.golemcore.orchestrator.domain.conversation.TranscriptViewBuilder;
import me.golemcore.orchestrator.domain.service.Agent;
import me.golemcore.orchestrator.domain.service.Orchestrator;
import me.golemcore.orchestrator.domain.service.QueryProcessor;
import me.golemcore.orchestrator.domain.service.ReasoningModelService;
import me.golemcore.orchestrator.domain.service.ToolCallSynthesizer;
import me.golemcore.orchestrator.domain.service.ToolCallValidator;
import me.golemcore.orchestrator.domain.service.ToolExecutor;
import me.golemcore.orchestrator.domain.service.ToolRequestExtractor;
import me.golemcore.orchestrator.port.outbound.LlmPort;
import me.golemcore.orchestrator.port.outbound.ToolLauncherPort;
import me.golemcore.orchestrator.port.outbound.ToolSessionPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Wires the domain services, which are plain classes, to the adapters.
 */
@Configuration
@Slf4j
public class OrchestratorConfiguration {

    // Tool calls wait a little longer than the session's own request timeout
    private static final int TOOL_CALL_GRACE_SECONDS = 5;

    @Bean
    public TranscriptViewBuilder transcriptViewBuilder() {
        return new TranscriptViewBuilder();
    }

    @Bean
    public ToolRequestExtractor toolRequestExtractor() {
        return new ToolRequestExtractor();
    }

    @Bean
    public ToolCallValidator toolCallValidator(ObjectMapper objectMapper) {
        return new ToolCallValidator(objectMapper);
    }

    @Bean
    public ReasoningModelService reasoningModelService(LlmPort llmPort, TranscriptViewBuilder viewBuilder,
            ToolRequestExtractor extractor, OrchestratorProperties properties) {
        return new ReasoningModelService(llmPort, viewBuilder, extractor,
                properties.getLlm().getProvider(), properties.getLlm().getTimeoutMs());
    }

    @Bean
    public MessageStore messageStore(OrchestratorProperties properties) {
        return new MessageStore(ReasoningModelService.buildSystemPrompt(
                properties.getAgent().getCustomSystemPrompt()));
    }

    @Bean(destroyMethod = "shutdown")
    public Orchestrator orchestrator(ReasoningModelService model, ToolLauncherPort launcher,
            ToolSessionPort sessions, MessageStore messageStore, OrchestratorProperties properties) {
        Orchestrator orchestrator = new Orchestrator(model, launcher, sessions, messageStore);
        orchestrator.registerToolsFromConfig(properties.getTools());
        String toolsFile = properties.getToolsFile();
        if (toolsFile != null && !toolsFile.isBlank()) {
            orchestrator.registerToolsFromFile(Path.of(toolsFile));
        }
        log.info("Orchestrator configured (adapter: {}, provider: {})",
                properties.getLlm().getAdapter(), properties.getLlm().getProvider());
        return orchestrator;
    }

    @Bean
    public ToolCallSynthesizer toolCallSynthesizer(LlmPort llmPort, ToolCallValidator validator,
            ObjectMapper objectMapper, OrchestratorProperties properties) {
        return new ToolCallSynthesizer(llmPort, validator, objectMapper, properties.getToolCalling());
    }

    @Bean
    public ToolExecutor toolExecutor(ToolSessionPort sessions, OrchestratorProperties properties) {
        return new ToolExecutor(sessions,
                Duration.ofSeconds(properties.getMcp().getRequestTimeoutSeconds() + TOOL_CALL_GRACE_SECONDS));
    }

    @Bean
    public QueryProcessor queryProcessor(Orchestrator orchestrator, ToolCallSynthesizer synthesizer,
            ToolExecutor toolExecutor, OrchestratorProperties properties) {
        return new QueryProcessor(orchestrator, synthesizer, toolExecutor,
                properties.getAgent().getMaxIterations());
    }

    @Bean
    public Agent agent(Orchestrator orchestrator, QueryProcessor queryProcessor) {
        return new Agent(orchestrator, queryProcessor);
    }
}
