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
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Launch settings for one tool server process: the command line, extra
 * environment variables and timeout settings.
 */
@Data
@Builder
public class McpServerConfig {

    @Builder.Default
    private List<String> command = new ArrayList<>();

    @Builder.Default
    private Map<String, String> env = new HashMap<>();

    @Builder.Default
    private int startupTimeoutSeconds = 30;

    @Builder.Default
    private int requestTimeoutSeconds = 60;

    @Builder.Default
    private int shutdownTimeoutSeconds = 5;
}
