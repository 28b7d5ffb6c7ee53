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

package me.golemcore.orchestrator.domain.conversation;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Message;
import org.slf4j.event.Level;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only, ordered transcript of one conversation.
 *
 * <p>
 * Every {@code add*} method builds a new immutable {@link Message} and appends
 * it; nothing is ever edited in place. {@link #clear()} is the only removal and
 * keeps the leading system message(s).
 *
 * <p>
 * Single writer: one query loop owns a store at a time, so no locking is done.
 */
@Slf4j
public class MessageStore {

    private static final int PREVIEW_LENGTH = 50;

    private final Clock clock;
    private final List<Message> messages = new ArrayList<>();

    public MessageStore() {
        this(null, Clock.systemUTC());
    }

    public MessageStore(String systemPrompt) {
        this(systemPrompt, Clock.systemUTC());
    }

    public MessageStore(String systemPrompt, Clock clock) {
        this.clock = clock;
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            addSystem(systemPrompt);
        }
    }

    public void addSystem(String content) {
        append(base(Message.ROLE_SYSTEM, content).build());
    }

    public void addUser(String content) {
        append(base(Message.ROLE_USER, content).build());
    }

    public void addAssistant(String content) {
        append(base(Message.ROLE_ASSISTANT, content).build());
    }

    public void addAssistant(String content, List<Message.ToolCall> toolCalls) {
        append(base(Message.ROLE_ASSISTANT, content)
                .toolCalls(toolCalls != null && !toolCalls.isEmpty() ? List.copyOf(toolCalls) : null)
                .build());
    }

    /**
     * Appends an assistant message annotated with metadata (e.g. the
     * max-iterations marker).
     */
    public void addAssistant(String content, Map<String, Object> metadata) {
        append(base(Message.ROLE_ASSISTANT, content)
                .metadata(metadata != null ? Map.copyOf(metadata) : null)
                .build());
    }

    /**
     * Appends an assistant message together with the raw tool requests it
     * contained, before any synthesis.
     */
    public void addAssistantWithRequests(String content, List<String> toolRequests) {
        append(base(Message.ROLE_ASSISTANT, content)
                .toolRequests(toolRequests != null && !toolRequests.isEmpty() ? List.copyOf(toolRequests) : null)
                .build());
    }

    public void addToolResult(String toolName, String result, String toolCallId) {
        append(base(Message.ROLE_TOOL, result)
                .toolName(toolName)
                .toolCallId(toolCallId)
                .build());
    }

    /**
     * Ordered, unmodifiable copy of the transcript.
     */
    public List<Message> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(messages));
    }

    public int size() {
        return messages.size();
    }

    public Message lastMessage() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }

    /**
     * Removes everything except the leading system message(s).
     */
    public void clear() {
        int keep = 0;
        while (keep < messages.size() && messages.get(keep).isSystemMessage()) {
            keep++;
        }
        messages.subList(keep, messages.size()).clear();
    }

    /**
     * One line per message: {@code [index] ROLE: preview}.
     */
    public String formatDebugOutput() {
        StringBuilder sb = new StringBuilder("=== CONVERSATION HISTORY DEBUG OUTPUT ===\n");
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            String preview = preview(message.getContent());
            sb.append('[').append(i).append("] ");
            switch (message.getRole()) {
            case Message.ROLE_SYSTEM -> sb.append("SYSTEM: ").append(preview);
            case Message.ROLE_USER -> sb.append("USER: ").append(preview);
            case Message.ROLE_ASSISTANT -> {
                sb.append("ASSISTANT");
                if (message.hasToolCalls()) {
                    sb.append(" [TOOLS: ").append(String.join(", ", message.getToolCalls().stream()
                            .map(Message.ToolCall::getName)
                            .toList())).append(']');
                }
                if (message.hasToolRequests()) {
                    sb.append(" [REQUESTS: ").append(message.getToolRequests().size()).append(']');
                }
                sb.append(": ").append(preview);
            }
            case Message.ROLE_TOOL -> sb.append("TOOL [")
                    .append(message.getToolName() != null ? message.getToolName() : "unknown")
                    .append("]: ").append(preview);
            default -> sb.append("UNKNOWN: ").append(preview);
            }
            sb.append('\n');
        }
        sb.append("========================================");
        return sb.toString();
    }

    /**
     * Writes {@link #formatDebugOutput()} to the log at the given level.
     */
    public void logHistory(Level level, String label) {
        String dump = formatDebugOutput();
        switch (level) {
        case ERROR -> log.error("[History] {}\n{}", label, dump);
        case WARN -> log.warn("[History] {}\n{}", label, dump);
        case INFO -> log.info("[History] {}\n{}", label, dump);
        default -> log.debug("[History] {}\n{}", label, dump);
        }
    }

    private Message.MessageBuilder base(String role, String content) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(role)
                .content(content)
                .timestamp(clock.instant());
    }

    private void append(Message message) {
        messages.add(message);
    }

    private static String preview(String content) {
        if (content == null) {
            return "";
        }
        String flat = content.replace('\n', ' ');
        return flat.length() > PREVIEW_LENGTH ? flat.substring(0, PREVIEW_LENGTH - 3) + "..." : flat;
    }
}
