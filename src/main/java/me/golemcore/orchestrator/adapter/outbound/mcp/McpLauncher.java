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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.ConfigurationException;
import me.golemcore.orchestrator.domain.exception.ToolExecutionException;
import me.golemcore.orchestrator.domain.model.McpServerConfig;
import me.golemcore.orchestrator.domain.model.ToolSchema;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.ToolLauncherPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Registers tool server artifacts and launches one {@link McpClient} per
 * server.
 *
 * <p>
 * The command line is derived from the artifact: {@code .py} runs under the
 * configured Python interpreter, {@code .jar} under {@code java -jar}, anything
 * else is executed directly.
 */
@Component
@Slf4j
public class McpLauncher implements ToolLauncherPort {

    private final McpSessionRegistry registry;
    private final OrchestratorProperties.McpProperties settings;
    private final ObjectMapper objectMapper;

    private final Map<String, Path> registered = new LinkedHashMap<>();
    private final Map<String, McpClient> launched = new LinkedHashMap<>();
    private boolean shutDown;

    public McpLauncher(McpSessionRegistry registry, OrchestratorProperties properties, ObjectMapper objectMapper) {
        this.registry = registry;
        this.settings = properties.getMcp();
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void registerServer(String name, String path) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool server name must not be blank");
        }
        if (registered.containsKey(name)) {
            throw new IllegalArgumentException("Tool server already registered: " + name);
        }
        if (path == null || !Files.exists(Path.of(path))) {
            throw new IllegalArgumentException("Tool server artifact not found: " + path);
        }
        registered.put(name, Path.of(path).toAbsolutePath().normalize());
        log.info("[Launcher] Registered {} -> {}", name, path);
    }

    @Override
    public synchronized void registerFromConfig(Map<String, String> tools) {
        for (Map.Entry<String, String> entry : tools.entrySet()) {
            String path = entry.getValue();
            if (path == null || !Files.exists(Path.of(path))) {
                log.warn("[Launcher] Skipping tool {}: {} not found", entry.getKey(), path);
                continue;
            }
            registerServer(entry.getKey(), path);
        }
    }

    /**
     * Relative paths in the file are resolved against the file's directory.
     */
    @Override
    public synchronized void registerFromFile(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            log.warn("[Launcher] Tools file not found: {}", file);
            return;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            log.error("[Launcher] Failed to read tools file {}: {}", file, e.getMessage());
            return;
        }
        JsonNode toolsNode = root != null ? root.get("tools") : null;
        if (toolsNode == null || !toolsNode.isObject()) {
            log.error("[Launcher] Tools file {} has no \"tools\" object", file);
            return;
        }

        Path baseDir = file.toAbsolutePath().getParent();
        Map<String, String> tools = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = toolsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Path path = Path.of(field.getValue().asText());
            if (!path.isAbsolute() && baseDir != null) {
                path = baseDir.resolve(path);
            }
            tools.put(field.getKey(), path.toString());
        }
        registerFromConfig(tools);
    }

    /**
     * Launches every registered server that is not running yet. A server that
     * fails is logged and skipped; once all were tried, the failures are
     * reported together.
     */
    @Override
    public synchronized void launchAll() {
        if (shutDown) {
            throw new ConfigurationException("Launcher has been shut down");
        }
        List<String> failures = new ArrayList<>();
        for (Map.Entry<String, Path> entry : registered.entrySet()) {
            String name = entry.getKey();
            if (launched.containsKey(name)) {
                continue;
            }
            McpClient client = createClient(name, serverConfig(entry.getValue()));
            try {
                List<ToolSchema> tools = client.start();
                registry.register(client);
                launched.put(name, client);
                log.info("[Launcher] {} started with {} tools", name, tools.size());
            } catch (IOException | McpClient.McpException | TimeoutException
                    | RuntimeException e) {
                log.error("[Launcher] Failed to launch {}: {}", name, e.getMessage());
                failures.add(name + ": " + e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.add(name + ": interrupted");
                break;
            }
        }
        if (!failures.isEmpty()) {
            throw new ToolExecutionException("Failed to launch tool servers", failures);
        }
    }

    /**
     * Closes every launched server. Continues past failures and reports them
     * together. A second call does nothing.
     */
    @Override
    public synchronized void shutdown() {
        if (shutDown) {
            return;
        }
        shutDown = true;
        List<String> failures = new ArrayList<>();
        for (Map.Entry<String, McpClient> entry : launched.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                log.warn("[Launcher] Failed to stop {}: {}", entry.getKey(), e.getMessage());
                failures.add(entry.getKey() + ": " + e.getMessage());
            }
        }
        launched.clear();
        registry.clear();
        log.info("[Launcher] All tool servers stopped");
        if (!failures.isEmpty()) {
            throw new ToolExecutionException("Failed to stop tool servers", failures);
        }
    }

    public synchronized List<String> getRegisteredNames() {
        return List.copyOf(registered.keySet());
    }

    public synchronized boolean isLaunched(String name) {
        return launched.containsKey(name);
    }

    McpServerConfig serverConfig(Path artifact) {
        return McpServerConfig.builder()
                .command(buildCommand(artifact))
                .env(new LinkedHashMap<>(settings.getEnv()))
                .startupTimeoutSeconds(settings.getStartupTimeoutSeconds())
                .requestTimeoutSeconds(settings.getRequestTimeoutSeconds())
                .shutdownTimeoutSeconds(settings.getShutdownTimeoutSeconds())
                .build();
    }

    List<String> buildCommand(Path artifact) {
        String file = artifact.getFileName().toString().toLowerCase(Locale.ROOT);
        if (file.endsWith(".py")) {
            return List.of(settings.getPythonCommand(), artifact.toString());
        }
        if (file.endsWith(".jar")) {
            return List.of("java", "-jar", artifact.toString());
        }
        return List.of(artifact.toString());
    }

    McpClient createClient(String name, McpServerConfig config) {
        return new McpClient(name, config, objectMapper);
    }
}
