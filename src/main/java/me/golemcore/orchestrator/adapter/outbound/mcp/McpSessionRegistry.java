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


package me.golemcore.orchestrator.adapter.outbound.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.model.ToolSchema;
import me.golemcore.orchestrator.port.outbound.ToolSessionPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

/**
 * Live tool sessions and the tool name routing table.
 *
 * <p>
 * The routing table is rebuilt as a new immutable map whenever sessions are
 * registered or tools rediscovered, so lookups never lock. When two sessions
 * expose the same tool name, the session registered first owns it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class McpSessionRegistry implements ToolSessionPort {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    private final List<McpClient> sessions = new CopyOnWriteArrayList<>();
    private volatile Map<String, McpClient> toolOwners = Map.of();

    public void register(McpClient session) {
        sessions.add(session);
        Map<String, List<ToolSchema>> known = new LinkedHashMap<>();
        for (McpClient s : sessions) {
            known.put(s.getName(), s.getCachedTools());
        }
        rebuildRoutes(known);
        log.debug("[MCP:{}] Registered session with {} tools", session.getName(), session.getCachedTools().size());
    }

    @Override
    public Map<String, List<ToolSchema>> discoverTools() {
        Map<String, List<ToolSchema>> discovered = new LinkedHashMap<>();
        for (McpClient session : sessions) {
            try {
                discovered.put(session.getName(), session.listTools());
            } catch (IOException | McpClient.McpException | TimeoutException e) {
                log.warn("[MCP:{}] Tool discovery failed: {}", session.getName(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[MCP:{}] Tool discovery interrupted", session.getName());
                break;
            }
        }
        rebuildRoutes(discovered);
        return Collections.unmodifiableMap(discovered);
    }

    @Override
    public CompletableFuture<ToolResult> call(String toolName, String argumentsJson) {
        McpClient owner = toolOwners.get(toolName);
        if (owner == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("Unknown tool: " + toolName));
        }

        Map<String, Object> arguments;
        try {
            arguments = argumentsJson == null || argumentsJson.isBlank()
                    ? Map.of()
                    : objectMapper.readValue(argumentsJson, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure("Invalid arguments for tool " + toolName + ": " + e.getOriginalMessage()));
        }
        return owner.callTool(toolName, arguments);
    }

    @Override
    public void closeAll() {
        for (McpClient session : sessions) {
            try {
                session.close();
            } catch (RuntimeException e) {
                log.warn("[MCP:{}] Close failed: {}", session.getName(), e.getMessage());
            }
        }
        clear();
    }

    /**
     * Forgets every session without closing it.
     */
    public void clear() {
        sessions.clear();
        toolOwners = Map.of();
    }

    public List<McpClient> getSessions() {
        return List.copyOf(sessions);
    }

    /**
     * Owning session of a tool name, or {@code null}.
     */
    public McpClient ownerOf(String toolName) {
        return toolOwners.get(toolName);
    }

    private void rebuildRoutes(Map<String, List<ToolSchema>> toolsBySession) {
        Map<String, McpClient> byName = new LinkedHashMap<>();
        for (McpClient session : sessions) {
            List<ToolSchema> tools = toolsBySession.get(session.getName());
            if (tools == null) {
                // discovery failed: keep routing what the session announced before
                tools = session.getCachedTools();
            }
            for (ToolSchema tool : tools) {
                McpClient existing = byName.putIfAbsent(tool.getName(), session);
                if (existing != null && existing != session) {
                    log.warn("[MCP:{}] Tool '{}' already provided by {}, ignoring duplicate",
                            session.getName(), tool.getName(), existing.getName());
                }
            }
        }
        toolOwners = Map.copyOf(byName);
    }
}
