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
import me.golemcore.orchestrator.domain.exception.ToolExecutionException;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.port.outbound.ToolSessionPort;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one validated tool call against the live sessions and waits for its
 * result.
 */
@Slf4j
public class ToolExecutor {

    private final ToolSessionPort sessions;
    private final Duration timeout;

    public ToolExecutor(ToolSessionPort sessions, Duration timeout) {
        this.sessions = sessions;
        this.timeout = timeout;
    }

    /**
     * @throws ToolExecutionException
     *             if the transport fails, the server reports a protocol error,
     *             or no answer arrives in time
     */
    public ToolResult execute(Message.ToolCall call) {
        log.debug("Executing tool {} ({})", call.getName(), call.getId());
        CompletableFuture<ToolResult> future = sessions.call(call.getName(), call.getArguments());
        try {
            ToolResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : ToolResult.failure("No result from tool: " + call.getName());
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ToolExecutionException("Tool " + call.getName() + " timed out after "
                    + timeout.toSeconds() + " s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolExecutionException("Tool " + call.getName() + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ToolExecutionException(cause.getMessage(), cause);
        }
    }
}
