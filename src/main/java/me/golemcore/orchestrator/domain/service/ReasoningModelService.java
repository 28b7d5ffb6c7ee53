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
import me.golemcore.orchestrator.domain.conversation.TranscriptView;
import me.golemcore.orchestrator.domain.conversation.TranscriptViewBuilder;
import me.golemcore.orchestrator.domain.exception.ModelException;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ModelTurn;
import me.golemcore.orchestrator.domain.model.ToolSchema;
import me.golemcore.orchestrator.port.outbound.LlmPort;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The reasoning model: sends the transcript to the configured provider once
 * and returns its answer together with the tool requests found in it.
 *
 * <p>
 * The model never sees structured tool specs. Available tools are described in
 * a text catalog passed as the request's system prompt, and the model asks for
 * a tool by writing a {@code TOOL_INSTRUCTION ... END_INSTRUCTION} span.
 */
@Slf4j
public class ReasoningModelService {

    public static final String TOOL_REQUEST_INSTRUCTIONS = """
            Your response should follow one of these formats:

            1. If tools are needed:
            TOOL_INSTRUCTION
            <describe the tool and parameters you need here>
            END_INSTRUCTION
            <your other explanations or responses>

            2. If no tools are needed:
            Provide answer or explanation directly

            You may include several TOOL_INSTRUCTION blocks when several tool calls are needed.
            Remember: Only use tools when specific information is truly needed. If you can answer directly, do so.""";

    private final LlmPort llmPort;
    private final TranscriptViewBuilder viewBuilder;
    private final ToolRequestExtractor extractor;
    private final String provider;
    private final long timeoutMs;

    public ReasoningModelService(LlmPort llmPort, TranscriptViewBuilder viewBuilder, ToolRequestExtractor extractor,
            String provider, long timeoutMs) {
        this.llmPort = llmPort;
        this.viewBuilder = viewBuilder;
        this.extractor = extractor;
        this.provider = provider;
        this.timeoutMs = timeoutMs;
    }

    /**
     * System prompt stored at the head of a conversation: the personality
     * followed by the tool request convention.
     */
    public static String buildSystemPrompt(String customSystemPrompt) {
        if (customSystemPrompt == null || customSystemPrompt.isBlank()) {
            return TOOL_REQUEST_INSTRUCTIONS;
        }
        return customSystemPrompt.strip() + "\n\n" + TOOL_REQUEST_INSTRUCTIONS;
    }

    /**
     * Lists tool names, descriptions and parameter names, one tool per entry.
     */
    public static String buildToolCatalog(List<ToolSchema> tools) {
        StringBuilder sb = new StringBuilder("AVAILABLE TOOLS:\n");
        for (ToolSchema tool : tools) {
            List<String> params = tool.parameterNames();
            sb.append("- ").append(tool.getName()).append(": ")
                    .append(tool.getDescription() != null && !tool.getDescription().isBlank()
                            ? tool.getDescription()
                            : "No description available")
                    .append("\n  Parameters: ")
                    .append(params.isEmpty() ? "No parameters" : String.join(", ", params))
                    .append('\n');
        }
        sb.append("\nTo use a tool, describe the call inside a ")
                .append(ToolRequestExtractor.START_MARKER).append(" block.");
        return sb.toString();
    }

    /**
     * One model call over the given transcript.
     *
     * @throws ModelException
     *             on failure, timeout, interruption or an empty response
     */
    public ModelTurn execute(List<Message> transcript, List<ToolSchema> tools) {
        TranscriptView view = viewBuilder.build(transcript);
        if (!view.diagnostics().isEmpty()) {
            log.trace("Transcript view: {}", view.diagnostics());
        }

        LlmRequest request = LlmRequest.builder()
                .provider(provider)
                .systemPrompt(tools != null && !tools.isEmpty() ? buildToolCatalog(tools) : null)
                .messages(new ArrayList<>(view.messages()))
                .build();

        LlmResponse response = await(llmPort.chat(request));
        if (response == null || !response.hasChoices()) {
            throw new ModelException("Model returned no choices");
        }

        String text = response.getContent();
        List<String> requests = extractor.extract(text);
        log.debug("Model answered ({} chars, {} tool requests)", text != null ? text.length() : 0, requests.size());
        return new ModelTurn(text, response.getReasoningContent(), requests);
    }

    public String getCurrentModel() {
        return llmPort.getCurrentModel();
    }

    private LlmResponse await(CompletableFuture<LlmResponse> future) {
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ModelException("Model call timed out after " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelException("Model call interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ModelException("Model call failed: " + cause.getMessage(), cause);
        }
    }
}
