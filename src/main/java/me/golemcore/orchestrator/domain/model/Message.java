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

package me.golemcore.orchestrator.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A single transcript entry. Supports the roles system, user, assistant and
 * tool (a tool result fed back to the model).
 *
 * <p>
 * Messages are immutable: once appended to a
 * {@link me.golemcore.orchestrator.domain.conversation.MessageStore} they are
 * never changed.
 */
@Value
@Builder
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    String id;
    String role;
    String content;

    List<ToolCall> toolCalls;
    List<String> toolRequests; // raw requests extracted from assistant output
    String toolCallId; // For tool result messages
    String toolName; // Tool name for tool result messages

    Map<String, Object> metadata;
    Instant timestamp;

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message carries structured tool calls.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Checks if this message carries raw tool requests from the reasoning model.
     */
    public boolean hasToolRequests() {
        return toolRequests != null && !toolRequests.isEmpty();
    }

    /**
     * A structured, schema-validated tool invocation. {@code arguments} is the
     * serialized JSON object exactly as produced by the synthesis model.
     */
    @Value
    @Builder
    public static class ToolCall {
        public static final String TYPE_FUNCTION = "function";

        String id;
        String name;
        String arguments;
    }
}
