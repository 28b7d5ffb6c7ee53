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


package me.golemcore.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for golemcore-orchestrator.
 *
 * <p>
 * A reason-then-act agent core: a reasoning model answers directly or asks
 * for tools in plain language, a JSON-mode model turns each request into
 * validated tool calls, and the calls run on out-of-process MCP tool servers
 * spoken to over stdio.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        - QueryCommandLineRunner
 * Domain Layer       - QueryProcessor, Orchestrator, ToolCallSynthesizer, MessageStore
 * Infrastructure     - LLM adapters (langchain4j, Feign), MCP launcher and sessions
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code orchestrator.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
