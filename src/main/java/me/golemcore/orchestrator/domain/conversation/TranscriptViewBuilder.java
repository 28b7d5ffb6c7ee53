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

import me.golemcore.orchestrator.domain.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the message list actually sent to a provider from the raw transcript.
 *
 * <p>
 * The reasoning model never produces structured tool calls, so providers would
 * reject bare {@code tool} role messages. Tool results are therefore rendered
 * as user text, structured tool calls are flattened into the assistant text,
 * and consecutive messages with the same role are merged so that providers
 * requiring strict user/assistant alternation accept the view.
 */
public class TranscriptViewBuilder {

    private static final int MAX_ARGS_LENGTH = 200;

    public TranscriptView build(List<Message> transcript) {
        List<String> diagnostics = new ArrayList<>();
        List<Message> result = new ArrayList<>();
        if (transcript == null || transcript.isEmpty()) {
            return new TranscriptView(result, diagnostics);
        }

        for (Message message : transcript) {
            if (message == null) {
                continue;
            }
            Message rendered = render(message, diagnostics);
            Message previous = result.isEmpty() ? null : result.get(result.size() - 1);
            if (previous != null && previous.getRole().equals(rendered.getRole())) {
                result.set(result.size() - 1, merge(previous, rendered));
                diagnostics.add("merge: consecutive " + rendered.getRole() + " messages");
            } else {
                result.add(rendered);
            }
        }
        return new TranscriptView(result, diagnostics);
    }

    private Message render(Message message, List<String> diagnostics) {
        if (message.isToolMessage()) {
            diagnostics.add("flatten: tool message -> user text");
            String toolName = message.getToolName() != null ? message.getToolName() : "tool";
            String content = message.getContent() != null ? message.getContent() : "";
            return Message.builder()
                    .role(Message.ROLE_USER)
                    .content("[Tool result: " + toolName + "]\n" + content)
                    .build();
        }

        if (message.isAssistantMessage() && message.hasToolCalls()) {
            diagnostics.add("flatten: assistant tool_calls -> assistant text");
            StringBuilder sb = new StringBuilder(message.getContent() != null ? message.getContent() : "");
            for (Message.ToolCall call : message.getToolCalls()) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append("[Tool: ").append(call.getName())
                        .append(" | Args: ").append(truncate(call.getArguments(), MAX_ARGS_LENGTH))
                        .append(']');
            }
            return Message.builder()
                    .role(Message.ROLE_ASSISTANT)
                    .content(sb.toString())
                    .build();
        }

        return Message.builder()
                .role(message.getRole())
                .content(message.getContent() != null ? message.getContent() : "")
                .build();
    }

    private Message merge(Message first, Message second) {
        return Message.builder()
                .role(first.getRole())
                .content(first.getContent() + "\n\n" + second.getContent())
                .build();
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "{}";
        }
        return text.length() <= maxLen ? text : text.substring(0, maxLen) + "...";
    }
}
