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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.model.McpServerConfig;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.model.ToolSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 session with one tool server process over stdio.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Start the server process from its command line
 * <li>Send initialize request (JSON-RPC handshake) and the initialized
 * notification
 * <li>Fetch available tools (tools/list)
 * <li>Call tools (tools/call)
 * <li>Close the process
 * </ol>
 *
 * <p>
 * Requests are written one JSON object per line to stdin; a reader thread
 * matches stdout responses to pending requests by id and a second thread
 * drains stderr to DEBUG.
 *
 * <p>
 * MCP protocol version: 2024-11-05
 *
 * <p>
 * Not a Spring bean; created per server by {@link McpLauncher}.
 */
public class McpClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);
    private static final String JSONRPC_VERSION = "2.0";
    static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final String name;
    private final McpServerConfig config;
    private final ObjectMapper objectMapper;

    private Process process;
    private BufferedWriter writer;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile boolean running;
    private volatile List<ToolSchema> cachedTools = List.of();

    public McpClient(String name, McpServerConfig config, ObjectMapper objectMapper) {
        this.name = name;
        this.config = config;
        this.objectMapper = objectMapper;
    }

    /**
     * Starts the process, performs the handshake and fetches the tool list.
     * On any failure the process is closed before the exception propagates.
     */
    public List<ToolSchema> start() throws IOException, McpException, TimeoutException, InterruptedException {
        log.info("[MCP:{}] Starting server: {}", name, config.getCommand());

        ProcessBuilder pb = new ProcessBuilder(config.getCommand());
        pb.redirectErrorStream(false);
        if (config.getEnv() != null) {
            pb.environment().putAll(config.getEnv());
        }

        process = pb.start();
        running = true;
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        Thread readerThread = new Thread(this::readLoop, "mcp-reader-" + name);
        readerThread.setDaemon(true);
        readerThread.start();

        Thread stderrThread = new Thread(this::stderrDrain, "mcp-stderr-" + name);
        stderrThread.setDaemon(true);
        stderrThread.start();

        try {
            int timeoutSeconds = config.getStartupTimeoutSeconds();
            JsonNode initResult = await(sendRequest("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of(
                            "name", "golemcore-orchestrator",
                            "version", "1.0.0"))),
                    timeoutSeconds);
            log.info("[MCP:{}] Initialized: {}", name, initResult);

            sendNotification("notifications/initialized", Map.of());

            cachedTools = parseToolSchemas(await(sendRequest("tools/list", Map.of()), timeoutSeconds));
            log.info("[MCP:{}] Available tools: {}", name, cachedTools.stream().map(ToolSchema::getName).toList());
            return cachedTools;
        } catch (IOException | McpException | TimeoutException | InterruptedException | RuntimeException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", name, e.getMessage());
            close();
            throw e;
        }
    }

    /**
     * Re-reads the tool list from the server.
     */
    public List<ToolSchema> listTools() throws IOException, McpException, TimeoutException, InterruptedException {
        cachedTools = parseToolSchemas(await(sendRequest("tools/list", Map.of()),
                config.getRequestTimeoutSeconds()));
        return cachedTools;
    }

    /**
     * Calls a tool. The future completes with a failure result when the server
     * flags {@code isError}, and exceptionally on transport errors, JSON-RPC
     * errors ({@link McpException}) or timeout.
     */
    public CompletableFuture<ToolResult> callTool(String toolName, Map<String, Object> arguments) {
        return sendRequest("tools/call", Map.of(
                "name", toolName,
                "arguments", arguments != null ? arguments : Map.of()))
                .thenApply(result -> parseToolCallResult(toolName, result));
    }

    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params) {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        if (!running) {
            future.completeExceptionally(new IOException("MCP session " + name + " is not running"));
            return future;
        }
        pendingRequests.put(id, future);
        future.orTimeout(config.getRequestTimeoutSeconds(), TimeUnit.SECONDS)
                .whenComplete((result, ex) -> pendingRequests.remove(id));

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        try {
            write(objectMapper.writeValueAsString(request));
        } catch (IOException e) {
            pendingRequests.remove(id);
            future.completeExceptionally(e);
        }
        return future;
    }

    void sendNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        if (params != null && !params.isEmpty()) {
            notification.put("params", params);
        }

        try {
            write(objectMapper.writeValueAsString(notification));
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to send notification: {}", name, e.getMessage());
        }
    }

    private void write(String json) throws IOException {
        log.debug("[MCP:{}] -> {}", name, json);
        synchronized (writer) {
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    /**
     * Routes one stdout line: a response completes the pending request with
     * the same id, anything else is logged and ignored.
     */
    void handleLine(String line) {
        try {
            JsonNode message = objectMapper.readTree(line);
            JsonNode idNode = message.get("id");
            if (idNode == null || !idNode.canConvertToInt()) {
                String method = message.has("method") ? message.get("method").asText() : "unknown";
                log.debug("[MCP:{}] Server notification: {}", name, method);
                return;
            }
            int id = idNode.asInt();
            CompletableFuture<JsonNode> pending = pendingRequests.remove(id);
            if (pending == null) {
                log.warn("[MCP:{}] Received response for unknown id: {}", name, id);
                return;
            }
            JsonNode error = message.get("error");
            if (error != null && !error.isNull()) {
                pending.completeExceptionally(new McpException(
                        error.has("code") ? error.get("code").asInt() : -1,
                        error.has("message") ? error.get("message").asText() : "Unknown MCP error"));
            } else {
                pending.complete(message.get("result"));
            }
        } catch (JsonProcessingException e) {
            log.warn("[MCP:{}] Failed to parse response: {}", name, e.getMessage());
        }
    }

    private void readLoop() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty()) {
                    log.debug("[MCP:{}] <- {}", name, line);
                    handleLine(line);
                }
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP:{}] Reader thread error: {}", name, e.getMessage());
            }
        } finally {
            running = false;
            failPending("MCP process closed");
        }
    }

    private void stderrDrain() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", name, line);
            }
        } catch (IOException e) {
            log.debug("[MCP:{}] Stderr drain ended: {}", name, e.getMessage());
        }
    }

    List<ToolSchema> parseToolSchemas(JsonNode result) {
        if (result == null) {
            return List.of();
        }
        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            return List.of();
        }

        List<ToolSchema> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            if (!toolNode.hasNonNull("name")) {
                continue;
            }
            String toolName = toolNode.get("name").asText();
            String description = toolNode.has("description") ? toolNode.get("description").asText() : "";

            Map<String, Object> inputSchema = Map.of("type", "object", "properties", Map.of());
            if (toolNode.has("inputSchema")) {
                try {
                    inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
                } catch (IllegalArgumentException e) {
                    log.warn("[MCP:{}] Failed to parse inputSchema for tool '{}': {}", name, toolName,
                            e.getMessage());
                }
            }

            tools.add(ToolSchema.builder()
                    .name(toolName)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build());
        }
        return List.copyOf(tools);
    }

    ToolResult parseToolCallResult(String toolName, JsonNode result) {
        if (result == null || result.isNull()) {
            return ToolResult.failure("No result from tool: " + toolName);
        }

        boolean isError = result.has("isError") && result.get("isError").asBoolean(false);

        StringBuilder output = new StringBuilder();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String type = item.has("type") ? item.get("type").asText() : "text";
                if ("text".equals(type) && item.has("text")) {
                    if (output.length() > 0) {
                        output.append('\n');
                    }
                    output.append(item.get("text").asText());
                }
            }
        }

        if (isError) {
            return ToolResult.failure(output.length() == 0 ? "Tool error" : output.toString());
        }
        return ToolResult.success(output.length() == 0 ? "(no output)" : output.toString());
    }

    public List<ToolSchema> getCachedTools() {
        return cachedTools;
    }

    public boolean isRunning() {
        return running && process != null && process.isAlive();
    }

    public String getName() {
        return name;
    }

    /**
     * Fails pending requests, closes stdin, then stops the process: a polite
     * {@code destroy()}, and {@code destroyForcibly()} if it is still alive
     * after the shutdown timeout. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("[MCP:{}] Closing session", name);
        running = false;
        failPending("MCP session closing");

        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[MCP:{}] Error closing writer: {}", name, e.getMessage());
            }
        }

        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(config.getShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                    log.warn("[MCP:{}] Process did not exit in {}s, killing", name,
                            config.getShutdownTimeoutSeconds());
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }

    private void failPending(String reason) {
        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(new IOException(reason));
        }
        pendingRequests.clear();
    }

    private JsonNode await(CompletableFuture<JsonNode> future, int timeoutSeconds)
            throws IOException, McpException, TimeoutException, InterruptedException {
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof McpException mcp) {
                throw mcp;
            }
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof TimeoutException timeout) {
                throw timeout;
            }
            throw new IOException("MCP request failed: " + (cause != null ? cause.getMessage() : e.getMessage()),
                    cause);
        }
    }

    /**
     * Exception for MCP JSON-RPC errors.
     */
    public static class McpException extends Exception {
        private static final long serialVersionUID = 1L;
        private final int code;

        public McpException(int code, String message) {
            super(message);
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }
}
