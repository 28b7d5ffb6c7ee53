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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.model.Message;

import java.util.Set;

/**
 * Gate every synthesized tool call must pass before it is executed. A call is
 * accepted when it is an object with {@code type == "function"}, its
 * {@code function.name} is a live tool name, and its
 * {@code function.arguments} is a string holding a JSON object.
 */
public class ToolCallValidator {

    private final ObjectMapper objectMapper;

    public ToolCallValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public boolean isValid(JsonNode call, Set<String> toolNames) {
        return rejectionReason(call, toolNames) == null;
    }

    /**
     * Why the call is rejected, or {@code null} when it is valid.
     */
    public String rejectionReason(JsonNode call, Set<String> toolNames) {
        if (call == null || !call.isObject()) {
            return "tool call is not an object";
        }
        JsonNode type = call.get("type");
        if (type == null || !Message.ToolCall.TYPE_FUNCTION.equals(type.asText(null))) {
            return "tool call type is not 'function'";
        }
        JsonNode function = call.get("function");
        if (function == null || !function.isObject()) {
            return "missing 'function' object";
        }
        JsonNode name = function.get("name");
        if (name == null || !name.isTextual()) {
            return "missing function name";
        }
        if (!toolNames.contains(name.asText())) {
            return "unknown tool '" + name.asText() + "'";
        }
        JsonNode arguments = function.get("arguments");
        if (arguments == null || !arguments.isTextual()) {
            return "arguments of '" + name.asText() + "' are not a JSON string";
        }
        try {
            JsonNode parsed = objectMapper.readTree(arguments.asText());
            if (parsed == null || !parsed.isObject()) {
                return "arguments of '" + name.asText() + "' are not a JSON object";
            }
        } catch (JsonProcessingException e) {
            return "arguments of '" + name.asText() + "' are not valid JSON: " + e.getOriginalMessage();
        }
        return null;
    }
}
