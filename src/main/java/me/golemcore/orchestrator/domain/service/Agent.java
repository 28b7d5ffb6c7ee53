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


package me.golemcore.orchestrator.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Message;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for embedding the orchestrator: register tool servers, ask
 * questions, shut down.
 *
 * <pre>{@code
 * agent.addTool("tools/weather/server.py");
 * String answer = agent.processQuery("What's the weather in Paris?");
 * agent.shutdown();
 * }</pre>
 */
@Slf4j
public class Agent {

    private final Orchestrator orchestrator;
    private final QueryProcessor queryProcessor;

    public Agent(Orchestrator orchestrator, QueryProcessor queryProcessor) {
        this.orchestrator = orchestrator;
        this.queryProcessor = queryProcessor;
    }

    /**
     * Registers a tool server named after the directory that contains it.
     */
    public void addTool(String path) {
        addTool(path, null);
    }

    /**
     * @throws IllegalArgumentException
     *             if the artifact does not exist
     */
    public void addTool(String path, String name) {
        Path artifact = Path.of(path).toAbsolutePath().normalize();
        if (!Files.exists(artifact)) {
            throw new IllegalArgumentException("Tool artifact not found: " + path);
        }
        String toolName = name;
        if (toolName == null || toolName.isBlank()) {
            Path parent = artifact.getParent();
            toolName = parent != null && parent.getFileName() != null
                    ? parent.getFileName().toString()
                    : artifact.getFileName().toString();
        }
        orchestrator.registerToolProvider(toolName, artifact.toString());
        log.info("Added tool {} from {}", toolName, artifact);
    }

    public void initialize() {
        orchestrator.start();
    }

    /**
     * Answers a query, starting the orchestrator first if needed. A failed
     * start is reported in the returned text.
     */
    public String processQuery(String query) {
        if (!orchestrator.isStarted()) {
            try {
                initialize();
            } catch (RuntimeException e) {
                log.error("Could not start orchestrator for query '{}': {}", query, e.getMessage(), e);
                return QueryProcessor.TECHNICAL_PROBLEM_PREFIX + e.getMessage();
            }
        }
        return queryProcessor.processQuery(query);
    }

    public void shutdown() {
        orchestrator.shutdown();
    }

    public List<Message> getHistory() {
        return orchestrator.getHistory();
    }
}
