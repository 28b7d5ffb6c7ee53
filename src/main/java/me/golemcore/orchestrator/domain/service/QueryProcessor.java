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
import me.golemcore.orchestrator.domain.conversation.MessageStore;
import me.golemcore.orchestrator.domain.exception.ToolExecutionException;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ModelTurn;
import me.golemcore.orchestrator.domain.model.SynthesisResult;
import me.golemcore.orchestrator.domain.model.SynthesisStats;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.model.ToolSchema;
import org.slf4j.event.Level;

import java.util.List;
import java.util.Map;

/**
 * Drives one user query through the reason-then-act loop:
 *
 * <ol>
 * <li>append the user message and fetch the tool list once
 * <li>ask the reasoning model; an answer without tool requests is final
 * <li>otherwise record the answer with its raw requests, synthesize each
 * request into tool calls and append every tool result
 * <li>repeat until a final answer or the iteration budget runs out
 * </ol>
 *
 * <p>
 * Nothing escapes {@link #processQuery(String)}: failures are turned into an
 * apology text returned to the caller.
 */
@Slf4j
public class QueryProcessor {

    static final String NOT_UNDERSTOOD = "Sorry, I couldn't understand your request.";
    static final String MAX_ITERATIONS_PREFIX = "I spent too much time processing your request. "
            + "Here's what I've gathered so far: ";
    static final String TECHNICAL_PROBLEM_PREFIX = "Sorry, there was a technical problem processing your request. "
            + "Error: ";
    public static final String METADATA_MAX_ITERATIONS = "maxIterationsReached";

    private static final int REASONING_PREVIEW_LENGTH = 500;
    private static final int RESULT_PREVIEW_LENGTH = 200;

    private final Orchestrator orchestrator;
    private final ToolCallSynthesizer synthesizer;
    private final ToolExecutor toolExecutor;
    private final int maxIterations;

    public QueryProcessor(Orchestrator orchestrator, ToolCallSynthesizer synthesizer, ToolExecutor toolExecutor,
            int maxIterations) {
        this.orchestrator = orchestrator;
        this.synthesizer = synthesizer;
        this.toolExecutor = toolExecutor;
        this.maxIterations = maxIterations;
    }

    public String processQuery(String query) {
        MessageStore store = orchestrator.getMessageStore();
        try {
            store.addUser(query);
            List<ToolSchema> tools = orchestrator.getAvailableTools();
            log.info("[QueryProcessor] Processing query with {} tools available", tools.size());

            String lastContent = "";
            for (int iteration = 0; iteration < maxIterations; iteration++) {
                log.debug("[QueryProcessor] Iteration {}/{}", iteration + 1, maxIterations);
                ModelTurn turn = orchestrator.getModel().execute(store.snapshot(), tools);

                String content = turn.text() != null ? turn.text() : NOT_UNDERSTOOD;
                lastContent = content;
                if (turn.reasoningText() != null && !turn.reasoningText().isBlank()) {
                    log.info("[QueryProcessor] Reasoning: {}", truncate(turn.reasoningText(),
                            REASONING_PREVIEW_LENGTH));
                }

                if (!turn.hasToolRequests()) {
                    store.addAssistant(content);
                    store.logHistory(Level.DEBUG, "Final answer after " + (iteration + 1) + " iteration(s)");
                    return content;
                }

                store.addAssistantWithRequests(content, turn.toolRequests());
                for (String request : turn.toolRequests()) {
                    runToolRequest(store, request, tools);
                }
            }

            log.warn("[QueryProcessor] Reached max iterations ({})", maxIterations);
            store.logHistory(Level.WARN, "Reached max iterations");
            String fallback = MAX_ITERATIONS_PREFIX + lastContent;
            store.addAssistant(fallback, Map.of(METADATA_MAX_ITERATIONS, true));
            return fallback;
        } catch (RuntimeException e) {
            log.error("[QueryProcessor] Error processing query '{}': {}", query, e.getMessage(), e);
            store.logHistory(Level.ERROR, "History at failure");
            return TECHNICAL_PROBLEM_PREFIX + e.getMessage();
        }
    }

    private void runToolRequest(MessageStore store, String request, List<ToolSchema> tools) {
        SynthesisResult synthesis = synthesizer.synthesize(request, tools);
        SynthesisStats stats = synthesis.stats();
        log.info("[QueryProcessor] Synthesized {} valid / {} invalid tool calls in {} attempt(s)",
                stats.getValidCalls(), stats.getInvalidCalls(), stats.getAttempts());
        if (synthesis.isEmpty()) {
            log.warn("[QueryProcessor] No executable tool call for request: {}", truncate(request,
                    RESULT_PREVIEW_LENGTH));
        }

        for (Message.ToolCall call : synthesis.toolCalls()) {
            String resultText;
            try {
                ToolResult result = toolExecutor.execute(call);
                resultText = result.asText();
            } catch (ToolExecutionException e) {
                log.warn("[QueryProcessor] Tool {} failed: {}", call.getName(), e.getMessage());
                resultText = "Error calling tool " + call.getName() + ": " + e.getMessage();
            } catch (RuntimeException e) {
                log.error("[QueryProcessor] Unexpected error from tool {}: {}", call.getName(), e.getMessage(), e);
                resultText = "Error calling tool " + call.getName() + ": " + e.getMessage();
            }
            log.info("[QueryProcessor] Tool {} -> {}", call.getName(), truncate(resultText, RESULT_PREVIEW_LENGTH));
            store.addToolResult(call.getName(), resultText, call.getId());
        }
    }

    private static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
    }
}
