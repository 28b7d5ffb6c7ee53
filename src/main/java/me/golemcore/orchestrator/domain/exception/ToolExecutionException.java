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

package me.golemcore.orchestrator.domain.exception;

import java.util.List;

/**
 * A resolved tool call failed at the transport or remote-execution level, or a
 * best-effort launch/shutdown pass collected one or more failures.
 */
public class ToolExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> failures;

    public ToolExecutionException(String message) {
        super(message);
        this.failures = List.of();
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.failures = List.of();
    }

    public ToolExecutionException(String message, List<String> failures) {
        super(message + ": " + String.join("; ", failures));
        this.failures = List.copyOf(failures);
    }

    public List<String> getFailures() {
        return failures;
    }
}
