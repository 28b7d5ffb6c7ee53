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

import java.nio.file.Path;
import java.util.Map;

/**
 * Registers tool server artifacts and owns the lifecycle of their processes.
 */
public interface ToolLauncherPort {

    /**
     * Registers a server under a unique name.
     *
     * @throws IllegalArgumentException
     *             if the name is taken or the artifact does not exist
     */
    void registerServer(String name, String path);

    /**
     * Registers every {@code name -> path} entry; missing artifacts are skipped
     * with a warning.
     */
    void registerFromConfig(Map<String, String> tools);

    /**
     * Registers the entries of a JSON file shaped {@code {"tools": {name: path}}}.
     * A missing or malformed file is logged, not thrown.
     */
    void registerFromFile(Path file);

    /**
     * Launches every registered server not yet running.
     *
     * @throws me.golemcore.orchestrator.domain.exception.ToolExecutionException
     *             naming the servers that failed, after the others were launched
     */
    void launchAll();

    /**
     * Stops every launched server. Idempotent.
     */
    void shutdown();
}
