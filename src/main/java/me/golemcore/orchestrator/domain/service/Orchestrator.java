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
import me.golemcore.orchestrator.domain.conversation.MessageStore;
import me.golemcore.orchestrator.domain.exception.ConfigurationException;
import me.golemcore.orchestrator.domain.exception.ToolExecutionException;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ToolSchema;
import me.golemcore.orchestrator.port.outbound.ToolLauncherPort;
import me.golemcore.orchestrator.port.outbound.ToolSessionPort;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the pieces of one agent: the reasoning model, the tool server launcher,
 * the live sessions and the conversation transcript.
 *
 * <p>
 * Lifecycle: register tool providers, {@link #start()}, run queries,
 * {@link #shutdown()}. Providers registered through
 * {@link #registerToolProvider(String, String)} before start are buffered and
 * handed to the launcher on start; later ones are launched immediately.
 */
@Slf4j
public class Orchestrator {

    private final ReasoningModelService model;
    private final ToolLauncherPort launcher;
    private final ToolSessionPort sessions;
    private final MessageStore messageStore;

    private final Map<String, String> pendingProviders = new LinkedHashMap<>();
    private boolean started;
    private boolean stopped;

    public Orchestrator(ReasoningModelService model, ToolLauncherPort launcher, ToolSessionPort sessions,
            MessageStore messageStore) {
        this.model = model;
        this.launcher = launcher;
        this.sessions = sessions;
        this.messageStore = messageStore;
    }

    /**
     * Before {@link #start()} the server is buffered; afterwards it is handed
     * to the launcher and launched right away.
     *
     * @throws IllegalArgumentException
     *             if a provider with that name is already registered
     * @throws ConfigurationException
     *             after {@link #shutdown()}
     */
    public synchronized void registerToolProvider(String name, String path) {
        if (stopped) {
            throw new ConfigurationException("Orchestrator has been shut down");
        }
        if (started) {
            launcher.registerServer(name, path);
            launchRegistered();
            log.info("Registered tool provider {} after start", name);
            return;
        }
        if (pendingProviders.containsKey(name)) {
            throw new IllegalArgumentException("Tool provider already registered: " + name);
        }
        pendingProviders.put(name, path);
        log.debug("Buffered tool provider {} -> {}", name, path);
    }

    public synchronized void registerToolsFromConfig(Map<String, String> tools) {
        if (tools != null && !tools.isEmpty()) {
            launcher.registerFromConfig(tools);
        }
    }

    public synchronized void registerToolsFromFile(Path file) {
        launcher.registerFromFile(file);
    }

    /**
     * Registers the buffered providers and launches every tool server. Servers
     * that fail to launch are logged and left out; the others stay usable.
     *
     * @throws ConfigurationException
     *             after {@link #shutdown()}
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        if (stopped) {
            throw new ConfigurationException("Orchestrator has been shut down");
        }
        for (Map.Entry<String, String> entry : pendingProviders.entrySet()) {
            launcher.registerServer(entry.getKey(), entry.getValue());
        }
        pendingProviders.clear();

        launchRegistered();
        started = true;
        log.info("Orchestrator started with model {}", model.getCurrentModel());
    }

    /**
     * Stops every tool server. Safe to call more than once.
     */
    public synchronized void shutdown() {
        if (stopped) {
            return;
        }
        stopped = true;
        try {
            launcher.shutdown();
        } catch (ToolExecutionException e) {
            log.warn("Tool servers did not shut down cleanly: {}", e.getFailures());
        }
        started = false;
        log.info("Orchestrator stopped");
    }

    /**
     * Tools of every live session, flattened. A name exposed by several
     * sessions is listed once.
     *
     * @throws ConfigurationException
     *             before {@link #start()}
     */
    public List<ToolSchema> getAvailableTools() {
        if (!isStarted()) {
            throw new ConfigurationException("Orchestrator not started: call start() first");
        }
        Map<String, ToolSchema> byName = new LinkedHashMap<>();
        for (List<ToolSchema> sessionTools : sessions.discoverTools().values()) {
            for (ToolSchema tool : sessionTools) {
                byName.putIfAbsent(tool.getName(), tool);
            }
        }
        return new ArrayList<>(byName.values());
    }

    private void launchRegistered() {
        try {
            launcher.launchAll();
        } catch (ToolExecutionException e) {
            log.error("Some tool servers failed to launch: {}", e.getFailures());
        }
    }

    public ReasoningModelService getModel() {
        return model;
    }

    public List<Message> getHistory() {
        return messageStore.snapshot();
    }

    public MessageStore getMessageStore() {
        return messageStore;
    }

    public synchronized boolean isStarted() {
        return started;
    }
}
