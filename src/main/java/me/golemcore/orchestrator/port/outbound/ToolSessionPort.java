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

package me.golemcore.orchestrator.port.outbound;

import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.model.ToolSchema;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Live tool sessions as seen from the domain: tool discovery and name-based
 * dispatch.
 */
public interface ToolSessionPort {

    /**
     * Lists the tools of every live session, keyed by session name. A session
     * that fails to answer is logged and left out.
     */
    Map<String, List<ToolSchema>> discoverTools();

    /**
     * Routes a call to the session owning {@code toolName}. Unknown names and
     * unparseable arguments complete with a failure result.
     */
    CompletableFuture<ToolResult> call(String toolName, String argumentsJson);

    /**
     * Closes every session, best effort.
     */
    void closeAll();
}
