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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A tool exposed by a tool server, discovered when its session opens. Contains
 * the tool name, description, and JSON Schema for input parameters.
 */
@Value
@Builder
public class ToolSchema {

    String name;
    String description;
    Map<String, Object> inputSchema; // JSON Schema

    /**
     * Creates a schema without input parameters.
     */
    public static ToolSchema simple(String name, String description) {
        return ToolSchema.builder()
                .name(name)
                .description(description)
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .build();
    }

    /**
     * Parameter names declared under {@code properties}, in declaration order.
     */
    public List<String> parameterNames() {
        if (inputSchema == null) {
            return List.of();
        }
        Object properties = inputSchema.get("properties");
        if (properties instanceof Map<?, ?> map) {
            List<String> names = new ArrayList<>();
            for (Object key : map.keySet()) {
                names.add(String.valueOf(key));
            }
            return names;
        }
        return List.of();
    }

    /**
     * Wire shape: {@code {type: "function", function: {name, description,
     * parameters}}}.
     */
    public Map<String, Object> toFunctionSpec() {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", name);
        function.put("description", description != null ? description : "");
        function.put("parameters", inputSchema != null ? inputSchema : Map.of("type", "object"));

        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("type", "function");
        spec.put("function", function);
        return spec;
    }
}
